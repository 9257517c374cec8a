package com.collegeportal.backend.modules.catalog.presentation.dto;

import com.collegeportal.backend.modules.catalog.domain.Subject;
import com.collegeportal.backend.modules.catalog.domain.Syllabus;

public final class CatalogDtoMapper {

    private CatalogDtoMapper() {
    }

    public static SubjectResponse toResponse(Subject subject, Syllabus syllabus) {
        return new SubjectResponse(
                subject.getId(),
                subject.getName(),
                subject.getSubjectCode(),
                subject.getDepartment().name(),
                subject.getDepartment().getDisplayName(),
                subject.getSemester(),
                syllabus != null ? toResponse(syllabus) : null
        );
    }

    public static SyllabusResponse toResponse(Syllabus syllabus) {
        Subject subject = syllabus.getSubject();
        return new SyllabusResponse(
                syllabus.getId(),
                subject.getId(),
                subject.getName(),
                subject.getSubjectCode(),
                subject.getDepartment().name(),
                subject.getSemester(),
                syllabus.getPdfUrl(),
                syllabus.getUploadedAt()
        );
    }
}
