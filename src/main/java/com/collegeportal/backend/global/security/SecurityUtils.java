package com.collegeportal.backend.global.security;

import java.util.UUID;

import com.collegeportal.backend.modules.access.domain.Actor;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.server.ResponseStatusException;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "unauthorized");
        }
        return principal;
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    /**
     * Caller as seen by {@link com.collegeportal.backend.modules.access.domain.RolePolicy}.
     */
    public static Actor currentActor() {
        JwtAuthenticationPrincipal principal = getCurrentPrincipal();
        return new Actor(principal.userId(), principal.role(), principal.staff());
    }
}
