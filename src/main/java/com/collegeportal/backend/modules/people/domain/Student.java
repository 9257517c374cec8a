package com.collegeportal.backend.modules.people.domain;

import java.time.LocalDate;

import com.collegeportal.backend.modules.auth.domain.PortalUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

@Entity
@Table(name = "student")
public class Student extends PersonProfile {

    @Column(name = "student_id", nullable = false, unique = true, length = 50)
    private String studentId;

    @Column(name = "enrollment_date", nullable = false, updatable = false)
    private LocalDate enrollmentDate;

    protected Student() {
    }

    public Student(PortalUser user, String studentId, LocalDate enrollmentDate) {
        super(user);
        this.studentId = studentId;
        this.enrollmentDate = enrollmentDate;
    }

    public String getStudentId() {
        return studentId;
    }

    public void setStudentId(String studentId) {
        this.studentId = studentId;
    }

    public LocalDate getEnrollmentDate() {
        return enrollmentDate;
    }
}
