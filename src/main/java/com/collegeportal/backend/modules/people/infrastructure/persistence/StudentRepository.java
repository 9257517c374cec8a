package com.collegeportal.backend.modules.people.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.collegeportal.backend.modules.people.domain.Student;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StudentRepository extends JpaRepository<Student, UUID> {

    @Query("select s from Student s join fetch s.user where s.studentId = :studentId")
    Optional<Student> findByStudentId(@Param("studentId") String studentId);

    boolean existsByStudentId(String studentId);

    boolean existsByStudentIdAndUserIdNot(String studentId, UUID userId);

    @Query("select s from Student s join fetch s.user u order by u.createdAt desc")
    List<Student> findAllNewestFirst();
}
