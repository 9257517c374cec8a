package com.collegeportal.backend.modules.notice.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NoticeAudience {
    STAFF,
    ALL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Blank input means "derive from the category". */
    @JsonCreator
    public static NoticeAudience fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return NoticeAudience.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
