package com.collegeportal.backend.modules.auth.presentation.dto;

import com.collegeportal.backend.modules.auth.domain.PortalRole;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be a valid address") String email,
        @NotBlank(message = "password is required") @Size(min = 8, max = 128, message = "password must be 8-128 characters") String password,
        @NotBlank(message = "passwordConfirm is required") String passwordConfirm,
        @NotBlank(message = "firstName is required") @Size(max = 30) String firstName,
        @NotBlank(message = "lastName is required") @Size(max = 30) String lastName,
        PortalRole role
) {
}
