package com.collegeportal.backend.modules.hod.domain;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

import com.collegeportal.backend.global.jpa.AbstractTimestampedEntity;
import com.collegeportal.backend.modules.people.domain.Department;
import com.collegeportal.backend.modules.people.domain.Staff;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One appointment of a staff member as head of a department. A department's history is the sequence
 * of its appointments ordered by start date; at most one of them is {@link HodStatus#ACTIVE}.
 *
 * <p>Status and end date change together through {@link #retire(LocalDate)}, so a retired row always
 * carries an end date. The department is fixed for the life of the row: moving a head to another
 * department retires this row and starts a new one.
 */
@Entity
@Table(name = "head_of_department")
public class HeadOfDepartment extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "staff_user_id")
    private Staff staff;

    @Column(name = "staff_code", nullable = false, length = 50)
    private String staffCode;

    @Column(name = "staff_name", nullable = false, length = 61)
    private String staffName;

    @Enumerated(EnumType.STRING)
    @Column(name = "department", nullable = false, updatable = false, length = 50)
    private Department department;

    @Column(name = "term_number", nullable = false, updatable = false)
    private int termNumber;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private HodStatus status;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    protected HeadOfDepartment() {
    }

    public static HeadOfDepartment appoint(
            Staff staff,
            Department department,
            int termNumber,
            LocalDate startDate,
            String notes
    ) {
        Objects.requireNonNull(staff, "staff is required");
        Objects.requireNonNull(department, "department is required");
        Objects.requireNonNull(startDate, "startDate is required");
        HeadOfDepartment appointment = new HeadOfDepartment();
        appointment.staff = staff;
        appointment.staffCode = staff.getStaffId();
        appointment.staffName = staff.getUser().getFullName();
        appointment.department = department;
        appointment.termNumber = termNumber;
        appointment.startDate = startDate;
        appointment.status = HodStatus.ACTIVE;
        appointment.notes = notes;
        return appointment;
    }

    /**
     * Ends the appointment on {@code endDate}. Retiring an already retired appointment changes nothing.
     *
     * @return {@code true} when the status changed
     */
    public boolean retire(LocalDate endDate) {
        Objects.requireNonNull(endDate, "endDate is required");
        if (status == HodStatus.RETIRED) {
            return false;
        }
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }
        this.status = HodStatus.RETIRED;
        this.endDate = endDate;
        return true;
    }

    public void changeStartDate(LocalDate startDate) {
        Objects.requireNonNull(startDate, "startDate is required");
        if (endDate != null && endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("startDate must not be after endDate");
        }
        this.startDate = startDate;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    /** Drops the link to a staff record that is being deleted. The snapshot columns stay. */
    public void detachStaff() {
        this.staff = null;
    }

    public long durationDays(LocalDate today) {
        LocalDate end = endDate != null ? endDate : today;
        return ChronoUnit.DAYS.between(startDate, end);
    }

    public boolean isActive() {
        return status == HodStatus.ACTIVE;
    }

    public UUID getId() {
        return id;
    }

    public Staff getStaff() {
        return staff;
    }

    public String getStaffCode() {
        return staffCode;
    }

    public String getStaffName() {
        return staffName;
    }

    public Department getDepartment() {
        return department;
    }

    public int getTermNumber() {
        return termNumber;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public HodStatus getStatus() {
        return status;
    }

    public String getNotes() {
        return notes;
    }
}
