package com.collegeportal.backend.modules.access.domain;

import java.util.Objects;
import java.util.UUID;

import com.collegeportal.backend.modules.auth.domain.PortalRole;

/**
 * Authenticated caller reduced to what authorization decisions need.
 *
 * @param userId caller id
 * @param role role tag of the caller
 * @param staffFlag the user's staff flag, independent of the role tag
 */
public record Actor(UUID userId, PortalRole role, boolean staffFlag) {

    public Actor {
        Objects.requireNonNull(role, "role is required");
    }

    public boolean isAdmin() {
        return role == PortalRole.ADMIN;
    }

    public boolean isStudent() {
        return role == PortalRole.STUDENT;
    }

    /** Admins always have staff privilege; everyone else needs the flag. */
    public boolean hasStaffPrivilege() {
        return isAdmin() || staffFlag;
    }
}
