package com.collegeportal.backend.modules.auth.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PortalRole {
    ADMIN,
    STAFF,
    STUDENT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PortalRole fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        return PortalRole.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
