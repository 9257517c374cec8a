package com.collegeportal.backend.modules.hod.domain;

import com.collegeportal.backend.global.jpa.AbstractTimestampedEntity;
import com.collegeportal.backend.modules.people.domain.Department;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * One row per department. Every change to a department's appointments first locks this row,
 * which serializes concurrent appointments, and it numbers the terms.
 */
@Entity
@Table(name = "department_succession")
public class DepartmentSuccession extends AbstractTimestampedEntity {

    @Id
    @Column(name = "department", nullable = false, updatable = false, length = 50)
    private String department;

    @Column(name = "appointment_count", nullable = false)
    private int appointmentCount;

    protected DepartmentSuccession() {
    }

    public DepartmentSuccession(Department department) {
        this.department = department.name();
    }

    public Department getDepartment() {
        return Department.valueOf(department);
    }

    public int getAppointmentCount() {
        return appointmentCount;
    }

    /** Reserves the next term number for a new appointment. */
    public int nextTerm() {
        appointmentCount += 1;
        return appointmentCount;
    }
}
