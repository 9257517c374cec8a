package com.collegeportal.backend.modules.catalog.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SyllabusResponse(
        UUID id,
        UUID subject,
        String subjectName,
        String subjectCode,
        String department,
        int semester,
        String pdfUrl,
        OffsetDateTime uploadedAt
) {
}
