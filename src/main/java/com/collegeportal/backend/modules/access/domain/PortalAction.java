package com.collegeportal.backend.modules.access.domain;

public enum PortalAction {
    CREATE,
    READ,
    LIST,
    UPDATE,
    DELETE
}
