package com.collegeportal.backend.modules.hod.presentation.dto;

import java.time.LocalDate;

import com.collegeportal.backend.modules.people.domain.Department;

import jakarta.validation.constraints.Size;

public record UpdateHodRequest(
        Department department,
        LocalDate startDate,
        LocalDate endDate,
        Boolean active,
        @Size(max = 2000, message = "notes must be at most 2000 characters") String notes
) {
}
