package com.collegeportal.backend.modules.hod.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

import com.collegeportal.backend.global.error.ProblemException;
import com.collegeportal.backend.global.error.ValidationProblemException;
import com.collegeportal.backend.modules.access.domain.Actor;
import com.collegeportal.backend.modules.access.domain.PortalAction;
import com.collegeportal.backend.modules.access.domain.ResourceKind;
import com.collegeportal.backend.modules.access.domain.RolePolicy;
import com.collegeportal.backend.modules.auth.application.ProfileRoleInvariant;
import com.collegeportal.backend.modules.auth.domain.PortalRole;
import com.collegeportal.backend.modules.hod.domain.DepartmentSuccession;
import com.collegeportal.backend.modules.hod.domain.HeadOfDepartment;
import com.collegeportal.backend.modules.hod.domain.HodStatus;
import com.collegeportal.backend.modules.hod.domain.StaffRemovalPolicy;
import com.collegeportal.backend.modules.hod.infrastructure.persistence.DepartmentSuccessionRepository;
import com.collegeportal.backend.modules.hod.infrastructure.persistence.HeadOfDepartmentRepository;
import com.collegeportal.backend.modules.hod.presentation.dto.HeadOfDepartmentResponse;
import com.collegeportal.backend.modules.people.domain.Department;
import com.collegeportal.backend.modules.people.domain.Staff;
import com.collegeportal.backend.modules.people.infrastructure.persistence.StaffRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appoints, moves and retires department heads.
 *
 * <p>Every write locks the affected department's {@link DepartmentSuccession} row before it loads
 * any appointment it may change, so concurrent writes to one department run one after the other
 * and never act on a state read before the lock. The
 * partial unique indexes on active rows remain the final guard; a violation surfaces as 409.
 * A retired incumbent is flushed before the successor is inserted because Hibernate would
 * otherwise order the insert first.
 */
@Service
@Transactional
public class HodSuccessionService {

    private static final Logger log = LoggerFactory.getLogger(HodSuccessionService.class);

    static final String ACTIVE_DEPARTMENT_CONSTRAINT = "uq_hod_active_department";
    static final String ACTIVE_STAFF_CONSTRAINT = "uq_hod_active_staff";

    private final HeadOfDepartmentRepository headOfDepartmentRepository;
    private final DepartmentSuccessionRepository departmentSuccessionRepository;
    private final StaffRepository staffRepository;
    private final ProfileRoleInvariant profileRoleInvariant;
    private final Clock clock;

    public HodSuccessionService(
            HeadOfDepartmentRepository headOfDepartmentRepository,
            DepartmentSuccessionRepository departmentSuccessionRepository,
            StaffRepository staffRepository,
            ProfileRoleInvariant profileRoleInvariant,
            Clock clock
    ) {
        this.headOfDepartmentRepository = headOfDepartmentRepository;
        this.departmentSuccessionRepository = departmentSuccessionRepository;
        this.staffRepository = staffRepository;
        this.profileRoleInvariant = profileRoleInvariant;
        this.clock = clock;
    }

    public HeadOfDepartmentResponse appoint(Actor actor, AppointCommand command) {
        RolePolicy.require(actor, PortalAction.CREATE, ResourceKind.HOD);

        Staff staff = staffRepository.findByStaffId(command.staffId())
                .orElseThrow(() -> ProblemException.notFound("hod.staff_not_found",
                        "Staff member " + command.staffId() + " not found."));
        ensureEligible(staff);

        DepartmentSuccession succession = lockDepartment(command.department());
        ensureNotHeadingElsewhere(staff);

        HeadOfDepartment incumbent = headOfDepartmentRepository.findActiveByDepartment(command.department())
                .orElse(null);
        LocalDate today = LocalDate.now(clock);
        if (incumbent != null) {
            if (!command.replaceIncumbent()) {
                throw ProblemException.conflict("hod.department_occupied",
                        incumbent.getStaffName() + " is already the HOD of "
                                + incumbent.getDepartment().getDisplayName() + " department.");
            }
            retireAndFlush(incumbent, today);
        }

        LocalDate startDate = command.startDate() != null ? command.startDate() : today;
        HeadOfDepartment appointed = insert(staff, succession, startDate, command.notes());
        return toResponse(appointed);
    }

    public HeadOfDepartmentResponse update(Actor actor, UUID id, UpdateCommand command) {
        RolePolicy.require(actor, PortalAction.UPDATE, ResourceKind.HOD);

        Department department = findAppointmentDepartment(id);
        Department target = command.department();
        boolean moving = target != null && target != department;

        if (moving) {
            return moveToDepartment(id, department, target, command);
        }

        lockDepartment(department);
        HeadOfDepartment current = findAppointment(id);
        LocalDate today = LocalDate.now(clock);

        if (Boolean.TRUE.equals(command.active()) && !current.isActive()) {
            throw ValidationProblemException.field("active",
                    "A retired appointment cannot be reactivated; appoint the staff member again.");
        }
        if (command.endDate() != null && !current.isActive() && !command.endDate().equals(current.getEndDate())) {
            throw ValidationProblemException.field("endDate", "The end date of a retired appointment cannot be changed.");
        }
        if (command.endDate() != null && current.isActive() && !Boolean.FALSE.equals(command.active())) {
            throw ValidationProblemException.field("endDate", "endDate can only be set when retiring the appointment.");
        }

        if (command.startDate() != null && !command.startDate().equals(current.getStartDate())) {
            try {
                current.changeStartDate(command.startDate());
            } catch (IllegalArgumentException ex) {
                throw ValidationProblemException.field("startDate", ex.getMessage());
            }
        }
        if (command.replaceNotes() || command.notes() != null) {
            current.setNotes(command.notes());
        }
        if (Boolean.FALSE.equals(command.active()) && current.isActive()) {
            LocalDate endDate = command.endDate() != null ? command.endDate() : today;
            try {
                current.retire(endDate);
            } catch (IllegalArgumentException ex) {
                throw ValidationProblemException.field("endDate", ex.getMessage());
            }
            log.info("Retired HOD {} of {} on {}", current.getStaffCode(), current.getDepartment(), endDate);
        }
        return toResponse(headOfDepartmentRepository.save(current));
    }

    public HeadOfDepartmentResponse retire(Actor actor, UUID id) {
        RolePolicy.require(actor, PortalAction.DELETE, ResourceKind.HOD);

        lockDepartment(findAppointmentDepartment(id));
        HeadOfDepartment appointment = findAppointment(id);
        if (appointment.isActive()) {
            retireAndFlush(appointment, LocalDate.now(clock));
        }
        return toResponse(appointment);
    }

    @Transactional(readOnly = true)
    public HeadOfDepartmentResponse currentHod(Actor actor, Department department) {
        RolePolicy.require(actor, PortalAction.READ, ResourceKind.DEPARTMENT_HOD);
        return headOfDepartmentRepository.findActiveByDepartment(department)
                .map(this::toResponse)
                .orElseThrow(() -> ProblemException.notFound("hod.not_found",
                        "No active HOD found for " + department.name() + " department"));
    }

    @Transactional(readOnly = true)
    public HeadOfDepartmentResponse get(Actor actor, UUID id) {
        RolePolicy.require(actor, PortalAction.READ, ResourceKind.HOD);
        return toResponse(findAppointment(id));
    }

    @Transactional(readOnly = true)
    public List<HeadOfDepartmentResponse> list(Actor actor, Department department, Boolean active) {
        RolePolicy.require(actor, PortalAction.LIST, ResourceKind.HOD);
        HodStatus status = active == null ? null : (active ? HodStatus.ACTIVE : HodStatus.RETIRED);
        return headOfDepartmentRepository.search(department, status).stream()
                .map(this::toResponse)
                .toList();
    }

    /**
     * Prepares a staff record for deletion: applies the removal policy to an active appointment and
     * unlinks all of the staff member's appointments, which keep their snapshot columns.
     */
    public void releaseStaff(Staff staff, StaffRemovalPolicy policy) {
        Department department = headOfDepartmentRepository.findActiveDepartmentByStaffUserId(staff.getUserId())
                .orElse(null);
        if (department != null && policy == StaffRemovalPolicy.BLOCK) {
            throw ProblemException.conflict("staff.active_hod",
                    staff.getUser().getFullName() + " is the active HOD of " + department.getDisplayName()
                            + " department; retire the appointment first.");
        }
        // a concurrent move can shift the active row to another department while we wait for the lock
        while (department != null) {
            lockDepartment(department);
            Department locked = department;
            department = headOfDepartmentRepository.findActiveDepartmentByStaffUserId(staff.getUserId())
                    .orElse(null);
            if (department == locked) {
                HeadOfDepartment active = headOfDepartmentRepository.findActiveByStaffUserId(staff.getUserId())
                        .orElseThrow(() -> new IllegalStateException("Active appointment vanished under lock"));
                retireAndFlush(active, LocalDate.now(clock));
                department = null;
            }
        }
        List<HeadOfDepartment> history = headOfDepartmentRepository.findAllByStaffUserId(staff.getUserId());
        history.forEach(HeadOfDepartment::detachStaff);
        headOfDepartmentRepository.saveAllAndFlush(history);
    }

    private HeadOfDepartmentResponse moveToDepartment(
            UUID id,
            Department source,
            Department target,
            UpdateCommand command
    ) {
        // lock both departments in a fixed order so opposite moves cannot deadlock
        List<Department> lockOrder = Stream.of(source, target)
                .sorted(Comparator.comparing(Department::name))
                .toList();
        DepartmentSuccession targetSuccession = null;
        for (Department department : lockOrder) {
            DepartmentSuccession succession = lockDepartment(department);
            if (department == target) {
                targetSuccession = succession;
            }
        }

        HeadOfDepartment current = findAppointment(id);
        if (!current.isActive()) {
            throw ValidationProblemException.field("department",
                    "A retired appointment cannot be moved to another department.");
        }
        if (Boolean.FALSE.equals(command.active())) {
            throw ValidationProblemException.field("active",
                    "Moving an appointment and retiring it in one request is not supported.");
        }
        Staff staff = current.getStaff();
        if (staff == null) {
            throw ValidationProblemException.field("department", "The appointed staff member no longer exists.");
        }

        headOfDepartmentRepository.findActiveByDepartment(target).ifPresent(occupant -> {
            throw ProblemException.conflict("hod.department_occupied",
                    occupant.getStaffName() + " is already the HOD of " + target.getDisplayName() + " department.");
        });

        LocalDate today = LocalDate.now(clock);
        retireAndFlush(current, today);
        String notes = (command.replaceNotes() || command.notes() != null) ? command.notes() : current.getNotes();
        HeadOfDepartment moved = insert(staff, targetSuccession, today, notes);
        log.info("Moved HOD {} from {} to {}", staff.getStaffId(), current.getDepartment(), target);
        return toResponse(moved);
    }

    private HeadOfDepartment insert(Staff staff, DepartmentSuccession succession, LocalDate startDate, String notes) {
        profileRoleInvariant.enforce(staff.getUser(), PortalRole.STAFF);
        HeadOfDepartment appointment = HeadOfDepartment.appoint(
                staff,
                succession.getDepartment(),
                succession.nextTerm(),
                startDate,
                notes
        );
        try {
            HeadOfDepartment saved = headOfDepartmentRepository.saveAndFlush(appointment);
            log.info("Appointed {} as HOD of {} (term {})",
                    staff.getStaffId(), saved.getDepartment(), saved.getTermNumber());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            throw translateIntegrityViolation(ex, succession.getDepartment());
        }
    }

    /**
     * Retires with today's date, or with the start date when the appointment has not started yet.
     */
    private void retireAndFlush(HeadOfDepartment appointment, LocalDate endDate) {
        LocalDate effectiveEnd = endDate.isBefore(appointment.getStartDate()) ? appointment.getStartDate() : endDate;
        appointment.retire(effectiveEnd);
        headOfDepartmentRepository.saveAndFlush(appointment);
        log.info("Retired HOD {} of {} on {}", appointment.getStaffCode(), appointment.getDepartment(), effectiveEnd);
    }

    private void ensureEligible(Staff staff) {
        if (!staff.getUser().isActive()) {
            throw ValidationProblemException.field("staffId", "Cannot assign an inactive staff member as HOD.");
        }
    }

    private void ensureNotHeadingElsewhere(Staff staff) {
        headOfDepartmentRepository.findActiveByStaffUserId(staff.getUserId()).ifPresent(existing -> {
            throw ProblemException.conflict("hod.staff_already_active",
                    "This staff member is already the HOD of "
                            + existing.getDepartment().getDisplayName() + " department.");
        });
    }

    private DepartmentSuccession lockDepartment(Department department) {
        return departmentSuccessionRepository.findByIdForUpdate(department.name())
                .orElseThrow(() -> new IllegalStateException("No succession row for department " + department));
    }

    /**
     * Department of an appointment, read without loading the entity so that the entity is first
     * loaded after the department lock is held.
     */
    private Department findAppointmentDepartment(UUID id) {
        return headOfDepartmentRepository.findDepartmentById(id)
                .orElseThrow(HodSuccessionService::appointmentNotFound);
    }

    private HeadOfDepartment findAppointment(UUID id) {
        return headOfDepartmentRepository.findById(id).orElseThrow(HodSuccessionService::appointmentNotFound);
    }

    private static ProblemException appointmentNotFound() {
        return ProblemException.notFound("hod.appointment_not_found", "HOD appointment not found.");
    }

    private ProblemException translateIntegrityViolation(DataIntegrityViolationException ex, Department department) {
        String message = NestedExceptionUtils.getMostSpecificCause(ex).getMessage();
        if (message != null && message.contains(ACTIVE_STAFF_CONSTRAINT)) {
            return new ProblemException(HttpStatus.CONFLICT, "hod.staff_already_active",
                    "This staff member is already the HOD of another department.", ex);
        }
        if (message != null && message.contains(ACTIVE_DEPARTMENT_CONSTRAINT)) {
            return new ProblemException(HttpStatus.CONFLICT, "hod.department_occupied",
                    department.getDisplayName() + " department already has an active HOD.", ex);
        }
        throw ex;
    }

    HeadOfDepartmentResponse toResponse(HeadOfDepartment appointment) {
        Staff staff = appointment.getStaff();
        return new HeadOfDepartmentResponse(
                appointment.getId(),
                staff != null ? staff.getUserId() : null,
                appointment.getStaffCode(),
                appointment.getStaffName(),
                appointment.getDepartment().name(),
                appointment.getDepartment().getDisplayName(),
                appointment.getTermNumber(),
                appointment.getStartDate(),
                appointment.getEndDate(),
                appointment.isActive(),
                appointment.getStatus(),
                appointment.getNotes(),
                appointment.durationDays(LocalDate.now(clock)),
                appointment.getCreatedAt(),
                appointment.getUpdatedAt()
        );
    }

    public record AppointCommand(
            String staffId,
            Department department,
            LocalDate startDate,
            String notes,
            boolean replaceIncumbent
    ) {
    }

    /**
     * Changes to an appointment. Null fields are left alone unless {@code replaceNotes} asks for the
     * notes to be overwritten (full replacement).
     */
    public record UpdateCommand(
            Department department,
            LocalDate startDate,
            LocalDate endDate,
            Boolean active,
            String notes,
            boolean replaceNotes
    ) {
    }
}
