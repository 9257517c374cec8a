package com.collegeportal.backend.modules.catalog.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import org.hibernate.validator.constraints.URL;

public record UpdateSyllabusRequest(
        @NotBlank(message = "pdfUrl is required") @URL(message = "pdfUrl must be a valid URL") @Size(max = 500) String pdfUrl
) {
}
