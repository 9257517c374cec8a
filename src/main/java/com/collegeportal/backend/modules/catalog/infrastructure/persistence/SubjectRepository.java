package com.collegeportal.backend.modules.catalog.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.collegeportal.backend.modules.catalog.domain.AcademicDepartment;
import com.collegeportal.backend.modules.catalog.domain.Subject;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SubjectRepository extends JpaRepository<Subject, UUID> {

    /**
     * Highest codes starting with {@code prefix}, whatever department and semester the subject has
     * now. Longer codes sort above shorter ones so that a sequence of 100 ranks above 99.
     */
    @Query("""
            select s.subjectCode from Subject s
            where s.subjectCode like concat(:prefix, '%')
            order by length(s.subjectCode) desc, s.subjectCode desc
            """)
    List<String> findHighestCodesWithPrefix(@Param("prefix") String prefix, Pageable pageable);

    boolean existsByNameIgnoreCaseAndDepartmentAndSemester(String name, AcademicDepartment department, int semester);

    boolean existsByNameIgnoreCaseAndDepartmentAndSemesterAndIdNot(
            String name, AcademicDepartment department, int semester, UUID id);

    @Query("""
            select s from Subject s
            where (:department is null or s.department = :department)
              and (:semester is null or s.semester = :semester)
            order by s.department, s.semester, s.name
            """)
    List<Subject> search(
            @Param("department") AcademicDepartment department,
            @Param("semester") Integer semester
    );
}
