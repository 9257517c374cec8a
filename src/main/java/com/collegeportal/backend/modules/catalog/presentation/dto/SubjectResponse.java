package com.collegeportal.backend.modules.catalog.presentation.dto;

import java.util.UUID;

public record SubjectResponse(
        UUID id,
        String name,
        String subjectCode,
        String department,
        String departmentName,
        int semester,
        SyllabusResponse syllabus
) {
}
