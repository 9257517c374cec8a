package com.collegeportal.backend.modules.people.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.collegeportal.backend.modules.people.domain.Gender;

public record StaffResponse(
        PersonUserResponse user,
        String staffId,
        LocalDate dateOfBirth,
        Gender gender,
        String phone,
        String address,
        String department,
        String departmentName,
        String designation,
        String qualification,
        BigDecimal salary,
        LocalDate joiningDate,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
