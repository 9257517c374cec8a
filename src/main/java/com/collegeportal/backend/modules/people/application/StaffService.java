package com.collegeportal.backend.modules.people.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.collegeportal.backend.global.error.ProblemException;
import com.collegeportal.backend.global.error.ValidationProblemException;
import com.collegeportal.backend.modules.access.domain.Actor;
import com.collegeportal.backend.modules.access.domain.PortalAction;
import com.collegeportal.backend.modules.access.domain.ResourceKind;
import com.collegeportal.backend.modules.access.domain.RolePolicy;
import com.collegeportal.backend.modules.auth.domain.PortalRole;
import com.collegeportal.backend.modules.auth.domain.PortalUser;
import com.collegeportal.backend.modules.hod.application.HodSuccessionService;
import com.collegeportal.backend.modules.hod.domain.StaffRemovalPolicy;
import com.collegeportal.backend.modules.people.application.PersonAccountSupport.Demographics;
import com.collegeportal.backend.modules.people.application.PersonAccountSupport.NewAccount;
import com.collegeportal.backend.modules.people.domain.Staff;
import com.collegeportal.backend.modules.people.infrastructure.persistence.StaffRepository;
import com.collegeportal.backend.modules.people.presentation.dto.CreateStaffRequest;
import com.collegeportal.backend.modules.people.presentation.dto.PeopleDtoMapper;
import com.collegeportal.backend.modules.people.presentation.dto.StaffResponse;
import com.collegeportal.backend.modules.people.presentation.dto.UpdateStaffRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Staff records. Deleting a staff member first hands any head-of-department appointments to
 * {@link HodSuccessionService#releaseStaff} under the configured {@link StaffRemovalPolicy}.
 */
@Service
@Transactional
public class StaffService {

    private static final Logger log = LoggerFactory.getLogger(StaffService.class);

    static final String DUPLICATE_STAFF_ID_MESSAGE = "A staff member with this ID already exists.";

    private final StaffRepository staffRepository;
    private final PersonAccountSupport accountSupport;
    private final HodSuccessionService hodSuccessionService;
    private final StaffRemovalPolicy removalPolicy;
    private final Clock clock;

    public StaffService(
            StaffRepository staffRepository,
            PersonAccountSupport accountSupport,
            HodSuccessionService hodSuccessionService,
            @Value("${app.hod.staff-removal-policy:CASCADE_RETIRE}") StaffRemovalPolicy removalPolicy,
            Clock clock
    ) {
        this.staffRepository = staffRepository;
        this.accountSupport = accountSupport;
        this.hodSuccessionService = hodSuccessionService;
        this.removalPolicy = removalPolicy;
        this.clock = clock;
    }

    public StaffResponse addStaff(Actor actor, CreateStaffRequest request) {
        RolePolicy.require(actor, PortalAction.CREATE, ResourceKind.STAFF);

        Map<String, String> profileErrors = new LinkedHashMap<>();
        String staffId = request.staffId().trim();
        if (staffRepository.existsByStaffId(staffId)) {
            profileErrors.put("staffId", DUPLICATE_STAFF_ID_MESSAGE);
        }
        PortalUser user = accountSupport.createAccount(
                new NewAccount(request.email(), request.firstName(), request.lastName(),
                        request.password(), request.passwordConfirm()),
                PortalRole.STAFF,
                profileErrors
        );

        Staff staff = new Staff(user, staffId, LocalDate.now(clock));
        accountSupport.applyDemographics(staff, new Demographics(
                request.dateOfBirth(), request.gender(), request.phone(), request.address(), request.department()), false);
        staff.setDesignation(PersonAccountSupport.blankToNull(request.designation()));
        staff.setQualification(PersonAccountSupport.blankToNull(request.qualification()));
        staff.setSalary(request.salary());
        Staff saved = staffRepository.saveAndFlush(staff);
        log.info("Added staff {} ({})", saved.getStaffId(), user.getId());
        return PeopleDtoMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<StaffResponse> listStaff(Actor actor) {
        RolePolicy.require(actor, PortalAction.LIST, ResourceKind.STAFF);
        return staffRepository.findAllNewestFirst().stream()
                .map(PeopleDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public StaffResponse getStaff(Actor actor, String staffId) {
        RolePolicy.require(actor, PortalAction.READ, ResourceKind.STAFF);
        return PeopleDtoMapper.toResponse(findStaff(staffId));
    }

    public StaffResponse updateStaff(Actor actor, String staffId, UpdateStaffRequest request, boolean replace) {
        RolePolicy.require(actor, PortalAction.UPDATE, ResourceKind.STAFF);
        Staff staff = findStaff(staffId);

        Map<String, String> errors = new LinkedHashMap<>();
        accountSupport.applyUserChanges(staff.getUser(), request.email(), request.firstName(), request.lastName(),
                replace, errors);
        if (replace) {
            PersonAccountSupport.requirePresent("staffId", request.staffId(), errors);
        }
        String newStaffId = PersonAccountSupport.blankToNull(request.staffId());
        if (newStaffId != null && !newStaffId.equals(staff.getStaffId())) {
            if (staffRepository.existsByStaffIdAndUserIdNot(newStaffId, staff.getUserId())) {
                errors.put("staffId", DUPLICATE_STAFF_ID_MESSAGE);
            } else {
                staff.setStaffId(newStaffId);
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationProblemException("Request could not be validated.", errors);
        }

        accountSupport.applyDemographics(staff, new Demographics(
                request.dateOfBirth(), request.gender(), request.phone(), request.address(), request.department()), replace);
        if (replace || request.designation() != null) {
            staff.setDesignation(PersonAccountSupport.blankToNull(request.designation()));
        }
        if (replace || request.qualification() != null) {
            staff.setQualification(PersonAccountSupport.blankToNull(request.qualification()));
        }
        if (replace || request.salary() != null) {
            staff.setSalary(request.salary());
        }
        accountSupport.enforceRole(staff.getUser(), PortalRole.STAFF);
        return PeopleDtoMapper.toResponse(staffRepository.saveAndFlush(staff));
    }

    public void deleteStaff(Actor actor, String staffId) {
        RolePolicy.require(actor, PortalAction.DELETE, ResourceKind.STAFF);
        Staff staff = findStaff(staffId);
        hodSuccessionService.releaseStaff(staff, removalPolicy);

        PortalUser user = staff.getUser();
        staffRepository.delete(staff);
        staffRepository.flush();
        accountSupport.deleteAccount(user);
        log.info("Deleted staff {} and account {} (removal policy {})", staffId, user.getId(), removalPolicy);
    }

    private Staff findStaff(String staffId) {
        return staffRepository.findByStaffId(staffId)
                .orElseThrow(() -> ProblemException.notFound("staff.not_found", "Staff member " + staffId + " not found."));
    }
}
