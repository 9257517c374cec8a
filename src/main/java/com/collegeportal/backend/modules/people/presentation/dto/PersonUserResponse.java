package com.collegeportal.backend.modules.people.presentation.dto;

import java.util.UUID;

import com.collegeportal.backend.modules.auth.domain.PortalRole;

public record PersonUserResponse(
        UUID id,
        String email,
        String firstName,
        String lastName,
        String fullName,
        PortalRole role,
        boolean active
) {
}
