package com.collegeportal.backend.modules.catalog.domain;

import java.util.UUID;

import com.collegeportal.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(
        name = "subject",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_subject_name_department_semester",
                columnNames = {"name", "department", "semester"}
        )
)
public class Subject extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 150)
    private String name;

    @Column(name = "subject_code", nullable = false, unique = true, updatable = false, length = 20)
    private String subjectCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "department", nullable = false, length = 10)
    private AcademicDepartment department;

    @Column(name = "semester", nullable = false)
    private int semester;

    protected Subject() {
    }

    public Subject(String name, AcademicDepartment department, int semester, String subjectCode) {
        if (!Semester.isValid(semester)) {
            throw new IllegalArgumentException("semester must be between 1 and 8");
        }
        this.name = name;
        this.department = department;
        this.semester = semester;
        this.subjectCode = subjectCode;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void rename(String name) {
        this.name = name;
    }

    /** The code is assigned once; moving a subject keeps it. */
    public String getSubjectCode() {
        return subjectCode;
    }

    public AcademicDepartment getDepartment() {
        return department;
    }

    public int getSemester() {
        return semester;
    }

    public void moveTo(AcademicDepartment department, int semester) {
        if (!Semester.isValid(semester)) {
            throw new IllegalArgumentException("semester must be between 1 and 8");
        }
        this.department = department;
        this.semester = semester;
    }
}
