package com.collegeportal.backend.modules.people.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.collegeportal.backend.modules.people.domain.Gender;

public record StudentResponse(
        PersonUserResponse user,
        String studentId,
        LocalDate dateOfBirth,
        Gender gender,
        String phone,
        String address,
        String department,
        String departmentName,
        LocalDate enrollmentDate,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
