package com.collegeportal.backend.modules.hod.presentation;

import com.collegeportal.backend.global.error.ValidationProblemException;
import com.collegeportal.backend.modules.people.domain.Department;

final class DepartmentParam {

    private DepartmentParam() {
    }

    static Department parse(String raw) {
        return Department.fromCode(raw).orElseThrow(() -> ValidationProblemException.field(
                "department",
                "\"" + raw + "\" is not a valid department. Must be one of: " + Department.validCodes()
        ));
    }

    static Department parseOptional(String raw) {
        return raw == null || raw.isBlank() ? null : parse(raw);
    }
}
