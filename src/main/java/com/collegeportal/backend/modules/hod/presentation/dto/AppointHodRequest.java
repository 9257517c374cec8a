package com.collegeportal.backend.modules.hod.presentation.dto;

import java.time.LocalDate;

import com.collegeportal.backend.modules.people.domain.Department;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AppointHodRequest(
        @NotBlank(message = "staffId is required") String staffId,
        @NotNull(message = "department is required") Department department,
        LocalDate startDate,
        @Size(max = 2000, message = "notes must be at most 2000 characters") String notes,
        Boolean replaceIncumbent
) {
}
