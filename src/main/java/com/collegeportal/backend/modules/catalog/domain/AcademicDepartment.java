package com.collegeportal.backend.modules.catalog.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Teaching departments that own subjects. Separate from the staffing departments used for people.
 */
public enum AcademicDepartment {
    CS("Computer Science & Engineering"),
    ECE("Electronics & Communication Engineering"),
    EE("Electrical & Electronics Engineering"),
    MECH("Mechanical Engineering"),
    CIVIL("Civil Engineering"),
    IT("Information Technology");

    private final String displayName;

    AcademicDepartment(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<AcademicDepartment> fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(department -> department.name().equals(normalized))
                .findFirst();
    }

    @JsonCreator
    public static AcademicDepartment fromJson(String raw) {
        return fromCode(raw).orElseThrow(() -> new IllegalArgumentException(
                "Invalid department code. Must be one of: " + validCodes()));
    }

    public static String validCodes() {
        return Arrays.toString(values());
    }
}
