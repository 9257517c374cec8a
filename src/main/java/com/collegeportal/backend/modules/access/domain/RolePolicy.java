package com.collegeportal.backend.modules.access.domain;

import java.util.Objects;

import com.collegeportal.backend.global.error.ProblemException;
import com.collegeportal.backend.modules.auth.domain.PortalRole;

/**
 * Decides whether a caller may perform an action on a kind of resource. Has no side effects and
 * no dependencies; services call {@link #require} before every mutation.
 *
 * <p>Reads of notices are allowed for everyone here. Students are further limited to notices
 * addressed to all users, which the notice service applies to both listing and single fetch.
 */
public final class RolePolicy {

    public static final String FORBIDDEN_CODE = "policy.forbidden";

    private RolePolicy() {
    }

    public static boolean authorize(Actor actor, PortalAction action, ResourceKind resource) {
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(resource, "resource is required");
        if (actor == null) {
            return false;
        }
        PortalRole role = actor.role();
        return switch (resource) {
            case NOTICE -> switch (action) {
                case CREATE -> role == PortalRole.ADMIN || role == PortalRole.STAFF;
                case UPDATE, DELETE -> actor.isAdmin();
                case READ, LIST -> true;
            };
            case STUDENT -> switch (action) {
                case CREATE -> role == PortalRole.ADMIN || role == PortalRole.STAFF;
                case READ, LIST, UPDATE, DELETE -> actor.isAdmin();
            };
            case STAFF, HOD -> actor.isAdmin();
            case SUBJECT, SYLLABUS -> switch (action) {
                case READ, LIST -> true;
                case CREATE, UPDATE, DELETE -> actor.hasStaffPrivilege();
            };
            case DEPARTMENT_HOD -> action == PortalAction.READ;
        };
    }

    public static void require(Actor actor, PortalAction action, ResourceKind resource) {
        if (!authorize(actor, action, resource)) {
            throw ProblemException.forbidden(FORBIDDEN_CODE, "You do not have permission to perform this action.");
        }
    }

    /** Whether the caller may see notices that are not addressed to all users. */
    public static boolean seesRestrictedNotices(Actor actor) {
        return actor != null && (actor.role() == PortalRole.ADMIN || actor.role() == PortalRole.STAFF);
    }
}
