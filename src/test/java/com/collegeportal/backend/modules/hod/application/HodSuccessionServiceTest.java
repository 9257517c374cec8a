package com.collegeportal.backend.modules.hod.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.collegeportal.backend.global.error.ProblemException;
import com.collegeportal.backend.global.error.ValidationProblemException;
import com.collegeportal.backend.modules.access.domain.Actor;
import com.collegeportal.backend.modules.auth.application.ProfileRoleInvariant;
import com.collegeportal.backend.modules.auth.domain.PortalRole;
import com.collegeportal.backend.modules.hod.application.HodSuccessionService.AppointCommand;
import com.collegeportal.backend.modules.hod.application.HodSuccessionService.UpdateCommand;
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
import com.collegeportal.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class HodSuccessionServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 1, 1);
    private static final Actor ADMIN = new Actor(UUID.randomUUID(), PortalRole.ADMIN, true);
    private static final Actor STAFF = new Actor(UUID.randomUUID(), PortalRole.STAFF, true);

    @Mock
    private HeadOfDepartmentRepository headOfDepartmentRepository;

    @Mock
    private DepartmentSuccessionRepository departmentSuccessionRepository;

    @Mock
    private StaffRepository staffRepository;

    private HodSuccessionService service;

    private Staff alice;
    private Staff bob;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        service = new HodSuccessionService(headOfDepartmentRepository, departmentSuccessionRepository,
                staffRepository, new ProfileRoleInvariant(), clock);
        alice = TestEntities.staff(UUID.randomUUID(), "STF001", "Alice", "Smith");
        bob = TestEntities.staff(UUID.randomUUID(), "STF002", "Bob", "Jones");
    }

    @Test
    @DisplayName("appoint inserts an active row starting today")
    void appointDefaultsStartDate() {
        when(staffRepository.findByStaffId("STF001")).thenReturn(Optional.of(alice));
        stubSuccession(Department.CS);
        when(headOfDepartmentRepository.findActiveByStaffUserId(alice.getUserId())).thenReturn(Optional.empty());
        when(headOfDepartmentRepository.findActiveByDepartment(Department.CS)).thenReturn(Optional.empty());
        stubSave();

        HeadOfDepartmentResponse response = service.appoint(ADMIN,
                new AppointCommand("STF001", Department.CS, null, "first head", false));

        assertThat(response.active()).isTrue();
        assertThat(response.startDate()).isEqualTo(TODAY);
        assertThat(response.termNumber()).isEqualTo(1);
        assertThat(response.staffId()).isEqualTo("STF001");
    }

    @Test
    @DisplayName("appoint reports the incumbent when the department is occupied")
    void appointRejectsOccupiedDepartment() {
        HeadOfDepartment incumbent = HeadOfDepartment.appoint(bob, Department.CS, 1, TODAY.minusYears(1), null);
        when(staffRepository.findByStaffId("STF001")).thenReturn(Optional.of(alice));
        stubSuccession(Department.CS);
        when(headOfDepartmentRepository.findActiveByStaffUserId(alice.getUserId())).thenReturn(Optional.empty());
        when(headOfDepartmentRepository.findActiveByDepartment(Department.CS)).thenReturn(Optional.of(incumbent));

        assertThatThrownBy(() -> service.appoint(ADMIN,
                new AppointCommand("STF001", Department.CS, null, null, false)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("hod.department_occupied");
                    assertThat(ex.getDetailMessage()).contains("Bob Jones");
                });
        assertThat(incumbent.isActive()).isTrue();
        verify(headOfDepartmentRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("replacing the incumbent retires it before the successor is inserted")
    void appointReplacesIncumbent() {
        HeadOfDepartment incumbent = HeadOfDepartment.appoint(bob, Department.CS, 1, TODAY.minusYears(1), null);
        when(staffRepository.findByStaffId("STF001")).thenReturn(Optional.of(alice));
        stubSuccession(Department.CS);
        when(headOfDepartmentRepository.findActiveByStaffUserId(alice.getUserId())).thenReturn(Optional.empty());
        when(headOfDepartmentRepository.findActiveByDepartment(Department.CS)).thenReturn(Optional.of(incumbent));
        stubSave();

        HeadOfDepartmentResponse response = service.appoint(ADMIN,
                new AppointCommand("STF001", Department.CS, null, null, true));

        assertThat(incumbent.getStatus()).isEqualTo(HodStatus.RETIRED);
        assertThat(incumbent.getEndDate()).isEqualTo(TODAY);
        assertThat(response.active()).isTrue();

        InOrder order = inOrder(headOfDepartmentRepository);
        order.verify(headOfDepartmentRepository).saveAndFlush(incumbent);
        order.verify(headOfDepartmentRepository).saveAndFlush(any(HeadOfDepartment.class));
    }

    @Test
    @DisplayName("a staff member cannot head two departments at once")
    void appointRejectsStaffHeadingElsewhere() {
        HeadOfDepartment existing = HeadOfDepartment.appoint(alice, Department.CS, 1, TODAY.minusMonths(3), null);
        when(staffRepository.findByStaffId("STF001")).thenReturn(Optional.of(alice));
        stubSuccession(Department.EE);
        when(headOfDepartmentRepository.findActiveByStaffUserId(alice.getUserId())).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> service.appoint(ADMIN,
                new AppointCommand("STF001", Department.EE, null, null, true)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("hod.staff_already_active"));
    }

    @Test
    @DisplayName("inactive staff cannot be appointed")
    void appointRejectsInactiveStaff() {
        alice.getUser().setActive(false);
        when(staffRepository.findByStaffId("STF001")).thenReturn(Optional.of(alice));

        assertThatThrownBy(() -> service.appoint(ADMIN,
                new AppointCommand("STF001", Department.CS, null, null, false)))
                .isInstanceOfSatisfying(ValidationProblemException.class,
                        ex -> assertThat(ex.getFieldErrors()).containsKey("staffId"));
    }

    @Test
    @DisplayName("unknown staff id is not found")
    void appointRejectsUnknownStaff() {
        when(staffRepository.findByStaffId("NOPE")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.appoint(ADMIN,
                new AppointCommand("NOPE", Department.CS, null, null, false)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    @DisplayName("only admins manage appointments")
    void appointRequiresAdmin() {
        assertThatThrownBy(() -> service.appoint(STAFF,
                new AppointCommand("STF001", Department.CS, null, null, false)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN));
    }

    @Test
    @DisplayName("retire keeps the row and sets the end date")
    void retireIsSoft() {
        UUID id = UUID.randomUUID();
        HeadOfDepartment hod = HeadOfDepartment.appoint(alice, Department.CS, 1, TODAY.minusDays(30), null);
        TestEntities.setId(hod, id);
        when(headOfDepartmentRepository.findDepartmentById(id)).thenReturn(Optional.of(Department.CS));
        when(headOfDepartmentRepository.findById(id)).thenReturn(Optional.of(hod));
        stubSuccession(Department.CS);

        HeadOfDepartmentResponse response = service.retire(ADMIN, id);

        assertThat(response.active()).isFalse();
        assertThat(response.endDate()).isEqualTo(TODAY);
        verify(headOfDepartmentRepository, never()).delete(any());
        InOrder order = inOrder(departmentSuccessionRepository, headOfDepartmentRepository);
        order.verify(departmentSuccessionRepository).findByIdForUpdate("CS");
        order.verify(headOfDepartmentRepository).findById(id);
    }

    @Test
    @DisplayName("retire acts on the appointment as read under the department lock")
    void retireOfAlreadyRetiredAppointmentKeepsEndDate() {
        UUID id = UUID.randomUUID();
        HeadOfDepartment hod = HeadOfDepartment.appoint(alice, Department.CS, 1, TODAY.minusDays(30), null);
        hod.retire(TODAY.minusDays(3));
        TestEntities.setId(hod, id);
        when(headOfDepartmentRepository.findDepartmentById(id)).thenReturn(Optional.of(Department.CS));
        when(headOfDepartmentRepository.findById(id)).thenReturn(Optional.of(hod));
        stubSuccession(Department.CS);

        HeadOfDepartmentResponse response = service.retire(ADMIN, id);

        assertThat(response.endDate()).isEqualTo(TODAY.minusDays(3));
        verify(headOfDepartmentRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("a move loads the appointment only after both departments are locked")
    void moveOfAppointmentRetiredMeanwhileIsRejected() {
        UUID id = UUID.randomUUID();
        HeadOfDepartment hod = HeadOfDepartment.appoint(alice, Department.CS, 1, TODAY.minusDays(30), null);
        hod.retire(TODAY);
        TestEntities.setId(hod, id);
        when(headOfDepartmentRepository.findDepartmentById(id)).thenReturn(Optional.of(Department.CS));
        when(headOfDepartmentRepository.findById(id)).thenReturn(Optional.of(hod));
        stubSuccession(Department.CS);
        stubSuccession(Department.EE);

        assertThatThrownBy(() -> service.update(ADMIN, id, new UpdateCommand(Department.EE, null, null, null, null, false)))
                .isInstanceOfSatisfying(ValidationProblemException.class,
                        ex -> assertThat(ex.getFieldErrors()).containsKey("department"));

        InOrder order = inOrder(departmentSuccessionRepository, headOfDepartmentRepository);
        order.verify(departmentSuccessionRepository).findByIdForUpdate("CS");
        order.verify(departmentSuccessionRepository).findByIdForUpdate("EE");
        order.verify(headOfDepartmentRepository).findById(id);
        verify(headOfDepartmentRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("the end date of a retired appointment cannot be changed")
    void updateRejectsEndDateChangeOnRetired() {
        UUID id = UUID.randomUUID();
        HeadOfDepartment hod = HeadOfDepartment.appoint(alice, Department.CS, 1, TODAY.minusDays(30), null);
        hod.retire(TODAY.minusDays(5));
        TestEntities.setId(hod, id);
        when(headOfDepartmentRepository.findDepartmentById(id)).thenReturn(Optional.of(Department.CS));
        when(headOfDepartmentRepository.findById(id)).thenReturn(Optional.of(hod));
        stubSuccession(Department.CS);

        assertThatThrownBy(() -> service.update(ADMIN, id,
                new UpdateCommand(null, null, TODAY.minusDays(1), null, null, false)))
                .isInstanceOfSatisfying(ValidationProblemException.class,
                        ex -> assertThat(ex.getFieldErrors()).containsKey("endDate"));
        assertThat(hod.getEndDate()).isEqualTo(TODAY.minusDays(5));
    }

    @Test
    @DisplayName("replacing a retired appointment with its own end date is accepted")
    void replaceRetiredWithSameEndDate() {
        UUID id = UUID.randomUUID();
        HeadOfDepartment hod = HeadOfDepartment.appoint(alice, Department.CS, 1, TODAY.minusDays(30), null);
        hod.retire(TODAY.minusDays(5));
        TestEntities.setId(hod, id);
        when(headOfDepartmentRepository.findDepartmentById(id)).thenReturn(Optional.of(Department.CS));
        when(headOfDepartmentRepository.findById(id)).thenReturn(Optional.of(hod));
        stubSuccession(Department.CS);
        when(headOfDepartmentRepository.save(hod)).thenReturn(hod);

        HeadOfDepartmentResponse response = service.update(ADMIN, id,
                new UpdateCommand(null, null, TODAY.minusDays(5), false, "archived", true));

        assertThat(response.endDate()).isEqualTo(TODAY.minusDays(5));
        assertThat(response.notes()).isEqualTo("archived");
    }

    @Test
    @DisplayName("deactivating through update defaults the end date to today")
    void updateDeactivationSetsEndDate() {
        UUID id = UUID.randomUUID();
        HeadOfDepartment hod = HeadOfDepartment.appoint(alice, Department.CS, 1, TODAY.minusDays(30), null);
        TestEntities.setId(hod, id);
        when(headOfDepartmentRepository.findDepartmentById(id)).thenReturn(Optional.of(Department.CS));
        when(headOfDepartmentRepository.findById(id)).thenReturn(Optional.of(hod));
        stubSuccession(Department.CS);
        when(headOfDepartmentRepository.save(hod)).thenReturn(hod);

        HeadOfDepartmentResponse response = service.update(ADMIN, id,
                new UpdateCommand(null, null, null, false, null, false));

        assertThat(response.active()).isFalse();
        assertThat(response.endDate()).isEqualTo(TODAY);
    }

    @Test
    @DisplayName("a retired appointment cannot be reactivated")
    void updateRejectsReactivation() {
        UUID id = UUID.randomUUID();
        HeadOfDepartment hod = HeadOfDepartment.appoint(alice, Department.CS, 1, TODAY.minusDays(30), null);
        hod.retire(TODAY.minusDays(1));
        TestEntities.setId(hod, id);
        when(headOfDepartmentRepository.findDepartmentById(id)).thenReturn(Optional.of(Department.CS));
        when(headOfDepartmentRepository.findById(id)).thenReturn(Optional.of(hod));
        stubSuccession(Department.CS);

        assertThatThrownBy(() -> service.update(ADMIN, id, new UpdateCommand(null, null, null, true, null, false)))
                .isInstanceOf(ValidationProblemException.class);
    }

    @Test
    @DisplayName("changing the department ends the appointment and starts a new one")
    void updateDepartmentCreatesNewAppointment() {
        UUID id = UUID.randomUUID();
        HeadOfDepartment hod = HeadOfDepartment.appoint(alice, Department.CS, 1, TODAY.minusDays(30), "notes");
        TestEntities.setId(hod, id);
        when(headOfDepartmentRepository.findDepartmentById(id)).thenReturn(Optional.of(Department.CS));
        when(headOfDepartmentRepository.findById(id)).thenReturn(Optional.of(hod));
        stubSuccession(Department.CS);
        stubSuccession(Department.EE);
        when(headOfDepartmentRepository.findActiveByDepartment(Department.EE)).thenReturn(Optional.empty());
        stubSave();

        HeadOfDepartmentResponse response = service.update(ADMIN, id,
                new UpdateCommand(Department.EE, null, null, null, null, false));

        assertThat(hod.isActive()).isFalse();
        assertThat(hod.getDepartment()).isEqualTo(Department.CS);
        assertThat(response.department()).isEqualTo("EE");
        assertThat(response.active()).isTrue();
        assertThat(response.notes()).isEqualTo("notes");
    }

    @Test
    @DisplayName("current HOD of an empty department is not found")
    void currentHodNotFound() {
        when(headOfDepartmentRepository.findActiveByDepartment(Department.ME)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.currentHod(STAFF, Department.ME))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("hod.not_found"));
    }

    @Test
    @DisplayName("the block policy refuses to release an active head")
    void releaseStaffBlocks() {
        when(headOfDepartmentRepository.findActiveDepartmentByStaffUserId(alice.getUserId()))
                .thenReturn(Optional.of(Department.CS));

        assertThatThrownBy(() -> service.releaseStaff(alice, StaffRemovalPolicy.BLOCK))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("staff.active_hod");
                    assertThat(ex.getDetailMessage()).contains("Alice Smith").contains("Computer Science");
                });
        verifyNoInteractions(departmentSuccessionRepository);
        verify(headOfDepartmentRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("the cascade policy retires and unlinks the appointment")
    void releaseStaffCascades() {
        HeadOfDepartment hod = HeadOfDepartment.appoint(alice, Department.CS, 1, TODAY.minusDays(30), null);
        when(headOfDepartmentRepository.findActiveDepartmentByStaffUserId(alice.getUserId()))
                .thenReturn(Optional.of(Department.CS));
        when(headOfDepartmentRepository.findActiveByStaffUserId(alice.getUserId())).thenReturn(Optional.of(hod));
        stubSuccession(Department.CS);
        when(headOfDepartmentRepository.findAllByStaffUserId(alice.getUserId())).thenReturn(List.of(hod));

        service.releaseStaff(alice, StaffRemovalPolicy.CASCADE_RETIRE);

        assertThat(hod.isActive()).isFalse();
        assertThat(hod.getStaff()).isNull();
        assertThat(hod.getStaffName()).isEqualTo("Alice Smith");
        InOrder order = inOrder(departmentSuccessionRepository, headOfDepartmentRepository);
        order.verify(departmentSuccessionRepository).findByIdForUpdate("CS");
        order.verify(headOfDepartmentRepository).findActiveByStaffUserId(alice.getUserId());
    }

    @Test
    @DisplayName("the cascade policy follows an appointment that moved while waiting for the lock")
    void releaseStaffFollowsConcurrentMove() {
        HeadOfDepartment moved = HeadOfDepartment.appoint(alice, Department.EE, 2, TODAY, null);
        when(headOfDepartmentRepository.findActiveDepartmentByStaffUserId(alice.getUserId()))
                .thenReturn(Optional.of(Department.CS), Optional.of(Department.EE), Optional.of(Department.EE));
        when(headOfDepartmentRepository.findActiveByStaffUserId(alice.getUserId())).thenReturn(Optional.of(moved));
        stubSuccession(Department.CS);
        stubSuccession(Department.EE);
        when(headOfDepartmentRepository.findAllByStaffUserId(alice.getUserId())).thenReturn(List.of(moved));

        service.releaseStaff(alice, StaffRemovalPolicy.CASCADE_RETIRE);

        assertThat(moved.isActive()).isFalse();
        assertThat(moved.getEndDate()).isEqualTo(TODAY);
        verify(departmentSuccessionRepository).findByIdForUpdate("EE");
    }

    private void stubSuccession(Department department) {
        when(departmentSuccessionRepository.findByIdForUpdate(department.name()))
                .thenReturn(Optional.of(new DepartmentSuccession(department)));
    }

    private void stubSave() {
        when(headOfDepartmentRepository.saveAndFlush(any(HeadOfDepartment.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }
}
