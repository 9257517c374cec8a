package com.collegeportal.backend.modules.people.application;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import com.collegeportal.backend.global.error.ValidationProblemException;
import com.collegeportal.backend.modules.auth.application.ProfileRoleInvariant;
import com.collegeportal.backend.modules.auth.domain.PortalRole;
import com.collegeportal.backend.modules.auth.domain.PortalUser;
import com.collegeportal.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.collegeportal.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.collegeportal.backend.modules.people.domain.Department;
import com.collegeportal.backend.modules.people.domain.Gender;
import com.collegeportal.backend.modules.people.domain.PersonProfile;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Account handling shared by the student and staff flows: creating the login behind a profile,
 * applying changes to the user fields and removing the account together with its sessions.
 */
@Component
class PersonAccountSupport {

    static final String DUPLICATE_EMAIL_MESSAGE = "A user with this email already exists.";
    static final String PASSWORD_MISMATCH_MESSAGE = "Password fields didn't match.";

    private final PortalUserRepository portalUserRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final ProfileRoleInvariant profileRoleInvariant;

    PersonAccountSupport(
            PortalUserRepository portalUserRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            ProfileRoleInvariant profileRoleInvariant
    ) {
        this.portalUserRepository = portalUserRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.profileRoleInvariant = profileRoleInvariant;
    }

    /**
     * Validates and saves a new account. {@code extraErrors} carries profile-level problems found by
     * the caller so that all field errors are reported together.
     */
    PortalUser createAccount(NewAccount account, PortalRole role, Map<String, String> extraErrors) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (!account.password().equals(account.passwordConfirm())) {
            errors.put("password", PASSWORD_MISMATCH_MESSAGE);
        }
        String email = PortalUser.normalizeEmail(account.email());
        if (portalUserRepository.existsByEmailIgnoreCase(email)) {
            errors.put("email", DUPLICATE_EMAIL_MESSAGE);
        }
        errors.putAll(extraErrors);
        if (!errors.isEmpty()) {
            throw new ValidationProblemException("Request could not be validated.", errors);
        }

        PortalUser user = new PortalUser();
        user.setEmail(email);
        user.setFirstName(account.firstName().trim());
        user.setLastName(account.lastName().trim());
        user.setPasswordHash(passwordEncoder.encode(account.password()));
        user.setInitialRole(role);
        user.setActive(true);
        user.setStaff(role != PortalRole.STUDENT);
        return portalUserRepository.save(user);
    }

    /**
     * Applies user-level changes. With {@code replace} every field is required; otherwise only the
     * fields present are changed.
     */
    void applyUserChanges(PortalUser user, String email, String firstName, String lastName, boolean replace,
                          Map<String, String> errors) {
        if (replace) {
            requirePresent("email", email, errors);
            requirePresent("firstName", firstName, errors);
            requirePresent("lastName", lastName, errors);
        }
        if (email != null && !email.isBlank()) {
            String normalized = PortalUser.normalizeEmail(email);
            if (!normalized.equals(user.getEmail())
                    && portalUserRepository.existsByEmailIgnoreCaseAndIdNot(normalized, user.getId())) {
                errors.put("email", DUPLICATE_EMAIL_MESSAGE);
            } else {
                user.setEmail(normalized);
            }
        }
        if (firstName != null && !firstName.isBlank()) {
            user.setFirstName(firstName.trim());
        }
        if (lastName != null && !lastName.isBlank()) {
            user.setLastName(lastName.trim());
        }
    }

    void applyDemographics(PersonProfile profile, Demographics changes, boolean replace) {
        if (replace || changes.dateOfBirth() != null) {
            profile.setDateOfBirth(changes.dateOfBirth());
        }
        if (replace || changes.gender() != null) {
            profile.setGender(changes.gender());
        }
        if (replace || changes.phone() != null) {
            profile.setPhone(blankToNull(changes.phone()));
        }
        if (replace || changes.address() != null) {
            profile.setAddress(blankToNull(changes.address()));
        }
        if (replace || changes.department() != null) {
            profile.setDepartment(changes.department());
        }
    }

    void enforceRole(PortalUser user, PortalRole expected) {
        profileRoleInvariant.enforce(user, expected);
    }

    /**
     * Deletes the account behind a profile that has already been removed.
     */
    void deleteAccount(PortalUser user) {
        userSessionRepository.deleteByUserId(user.getId());
        portalUserRepository.delete(user);
        portalUserRepository.flush();
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    static void requirePresent(String field, String value, Map<String, String> errors) {
        if (value == null || value.isBlank()) {
            errors.put(field, "This field is required.");
        }
    }

    record NewAccount(String email, String firstName, String lastName, String password, String passwordConfirm) {
    }

    record Demographics(LocalDate dateOfBirth, Gender gender, String phone, String address, Department department) {
    }
}
