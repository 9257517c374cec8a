package com.collegeportal.backend.modules.hod.domain;

/**
 * What happens to a staff member's active appointment when the staff record is deleted.
 */
public enum StaffRemovalPolicy {
    /** Refuse the deletion while the staff member heads a department. */
    BLOCK,
    /** Retire the appointment, then delete. Appointment history keeps a snapshot of the staff member. */
    CASCADE_RETIRE
}
