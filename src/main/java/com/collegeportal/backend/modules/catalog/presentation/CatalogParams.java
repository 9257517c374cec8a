package com.collegeportal.backend.modules.catalog.presentation;

import com.collegeportal.backend.global.error.ValidationProblemException;
import com.collegeportal.backend.modules.catalog.domain.AcademicDepartment;
import com.collegeportal.backend.modules.catalog.domain.Semester;

final class CatalogParams {

    private static final String SEMESTER_MESSAGE = "Semester must be a number between 1 and 8";

    private CatalogParams() {
    }

    static AcademicDepartment department(String raw) {
        return AcademicDepartment.fromCode(raw).orElseThrow(() -> ValidationProblemException.field(
                "department",
                "Invalid department code. Must be one of: " + AcademicDepartment.validCodes()
        ));
    }

    static AcademicDepartment optionalDepartment(String raw) {
        return raw == null || raw.isBlank() ? null : department(raw);
    }

    static Integer optionalSemester(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        int semester;
        try {
            semester = Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw ValidationProblemException.field("semester", SEMESTER_MESSAGE);
        }
        if (!Semester.isValid(semester)) {
            throw ValidationProblemException.field("semester", SEMESTER_MESSAGE);
        }
        return semester;
    }
}
