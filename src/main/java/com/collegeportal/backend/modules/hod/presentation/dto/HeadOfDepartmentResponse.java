package com.collegeportal.backend.modules.hod.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.collegeportal.backend.modules.hod.domain.HodStatus;

public record HeadOfDepartmentResponse(
        UUID id,
        UUID staffUserId,
        String staffId,
        String staffName,
        String department,
        String departmentName,
        int termNumber,
        LocalDate startDate,
        LocalDate endDate,
        boolean active,
        HodStatus status,
        String notes,
        long durationDays,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
