package com.collegeportal.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.collegeportal.backend.modules.auth.domain.PortalRole;

public record UserProfileResponse(
        UUID userId,
        String email,
        String firstName,
        String lastName,
        String fullName,
        PortalRole role,
        boolean active,
        boolean staff,
        String studentId,
        String staffId,
        String department,
        OffsetDateTime dateJoined
) {
}
