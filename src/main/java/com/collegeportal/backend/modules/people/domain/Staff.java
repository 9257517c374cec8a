package com.collegeportal.backend.modules.people.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.collegeportal.backend.modules.auth.domain.PortalUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

@Entity
@Table(name = "staff")
public class Staff extends PersonProfile {

    @Column(name = "staff_id", nullable = false, unique = true, length = 50)
    private String staffId;

    @Column(name = "designation", length = 100)
    private String designation;

    @Column(name = "qualification", length = 200)
    private String qualification;

    @Column(name = "salary", precision = 10, scale = 2)
    private BigDecimal salary;

    @Column(name = "joining_date", nullable = false, updatable = false)
    private LocalDate joiningDate;

    protected Staff() {
    }

    public Staff(PortalUser user, String staffId, LocalDate joiningDate) {
        super(user);
        this.staffId = staffId;
        this.joiningDate = joiningDate;
    }

    public String getStaffId() {
        return staffId;
    }

    public void setStaffId(String staffId) {
        this.staffId = staffId;
    }

    public String getDesignation() {
        return designation;
    }

    public void setDesignation(String designation) {
        this.designation = designation;
    }

    public String getQualification() {
        return qualification;
    }

    public void setQualification(String qualification) {
        this.qualification = qualification;
    }

    public BigDecimal getSalary() {
        return salary;
    }

    public void setSalary(BigDecimal salary) {
        this.salary = salary;
    }

    public LocalDate getJoiningDate() {
        return joiningDate;
    }
}
