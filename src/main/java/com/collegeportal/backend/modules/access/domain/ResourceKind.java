package com.collegeportal.backend.modules.access.domain;

public enum ResourceKind {
    NOTICE,
    STUDENT,
    STAFF,
    SUBJECT,
    SYLLABUS,
    HOD,
    /** The current head of one department, looked up by department. */
    DEPARTMENT_HOD
}
