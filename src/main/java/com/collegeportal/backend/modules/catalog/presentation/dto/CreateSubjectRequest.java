package com.collegeportal.backend.modules.catalog.presentation.dto;

import com.collegeportal.backend.modules.catalog.domain.AcademicDepartment;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import org.hibernate.validator.constraints.URL;

public record CreateSubjectRequest(
        @NotBlank(message = "name is required") @Size(max = 150) String name,
        @NotNull(message = "department is required") AcademicDepartment department,
        @NotNull(message = "semester is required")
        @Min(value = 1, message = "Semester must be a number between 1 and 8")
        @Max(value = 8, message = "Semester must be a number between 1 and 8")
        Integer semester,
        @URL(message = "pdfUrl must be a valid URL") @Size(max = 500) String pdfUrl
) {
}
