package com.collegeportal.backend.modules.catalog.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.collegeportal.backend.modules.catalog.domain.AcademicDepartment;
import com.collegeportal.backend.modules.catalog.domain.Syllabus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SyllabusRepository extends JpaRepository<Syllabus, UUID> {

    Optional<Syllabus> findBySubjectId(UUID subjectId);

    List<Syllabus> findAllBySubjectIdIn(Collection<UUID> subjectIds);

    @Query("""
            select sy from Syllabus sy join fetch sy.subject s
            where (:department is null or s.department = :department)
              and (:semester is null or s.semester = :semester)
            order by s.department, s.semester, s.name
            """)
    List<Syllabus> search(
            @Param("department") AcademicDepartment department,
            @Param("semester") Integer semester
    );

    @Query("select sy from Syllabus sy join fetch sy.subject where sy.id = :id")
    Optional<Syllabus> findWithSubjectById(@Param("id") UUID id);

    @Modifying
    @Query("delete from Syllabus sy where sy.subject.id = :subjectId")
    int deleteBySubjectId(@Param("subjectId") UUID subjectId);
}
