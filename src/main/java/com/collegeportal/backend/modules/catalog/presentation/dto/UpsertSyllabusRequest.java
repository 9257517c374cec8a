package com.collegeportal.backend.modules.catalog.presentation.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.Size;

import org.hibernate.validator.constraints.URL;

public record UpsertSyllabusRequest(
        @JsonAlias("subjectId") UUID subject,
        @URL(message = "pdfUrl must be a valid URL") @Size(max = 500) String pdfUrl
) {
}
