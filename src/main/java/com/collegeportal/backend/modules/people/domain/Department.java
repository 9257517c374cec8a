package com.collegeportal.backend.modules.people.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Organisational department of staff, students and department heads.
 */
public enum Department {
    IT("Information Technology"),
    CS("Computer Science"),
    EE("Electrical Engineering"),
    ME("Mechanical Engineering"),
    CE("Civil Engineering"),
    ADMIN("Administration"),
    ACCOUNTS("Accounts"),
    LIBRARY("Library"),
    OTHER("Other");

    private final String displayName;

    Department(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Case-insensitive lookup by code. */
    public static Optional<Department> fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(department -> department.name().equals(normalized))
                .findFirst();
    }

    /** Blank input reads as "no department". */
    @JsonCreator
    public static Department fromJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return fromCode(raw).orElseThrow(() -> new IllegalArgumentException(
                "\"" + raw + "\" is not a valid department. Must be one of: " + validCodes()));
    }

    public static String validCodes() {
        return Arrays.toString(values());
    }
}
