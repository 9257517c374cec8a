package com.collegeportal.backend.modules.notice.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NoticePriority {
    NORMAL,
    IMPORTANT,
    URGENT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NoticePriority fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return NoticePriority.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
