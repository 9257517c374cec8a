package com.collegeportal.backend.modules.people.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum Gender {
    M,
    F,
    O;

    /** Blank input reads as "not given". */
    @JsonCreator
    public static Gender fromJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return Gender.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
