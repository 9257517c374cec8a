package com.collegeportal.backend.global.security;

import java.util.UUID;

import com.collegeportal.backend.modules.auth.domain.PortalRole;

public record JwtAuthenticationPrincipal(UUID userId, String email, PortalRole role, boolean staff) {
}
