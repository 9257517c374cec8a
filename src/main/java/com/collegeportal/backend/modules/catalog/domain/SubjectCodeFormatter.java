package com.collegeportal.backend.modules.catalog.domain;

import java.util.OptionalInt;

/**
 * Subject codes are {@code {DEPARTMENT}{SEMESTER}{SEQUENCE}} with the sequence zero-padded to two
 * digits, for example {@code CS101}. Sequences above 99 widen the code ({@code CS1100}).
 */
public final class SubjectCodeFormatter {

    private SubjectCodeFormatter() {
    }

    public static String format(AcademicDepartment department, int semester, int sequence) {
        if (!Semester.isValid(semester)) {
            throw new IllegalArgumentException("semester must be between 1 and 8");
        }
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive");
        }
        return prefix(department, semester) + String.format("%02d", sequence);
    }

    /**
     * Reads the sequence from a code of the given department and semester. Never throws: anything
     * that does not look like such a code yields an empty result.
     */
    public static OptionalInt parseSequence(String code, AcademicDepartment department, int semester) {
        if (code == null || department == null) {
            return OptionalInt.empty();
        }
        String prefix = prefix(department, semester);
        if (!code.startsWith(prefix) || code.length() == prefix.length()) {
            return OptionalInt.empty();
        }
        String suffix = code.substring(prefix.length());
        for (int i = 0; i < suffix.length(); i++) {
            if (!Character.isDigit(suffix.charAt(i))) {
                return OptionalInt.empty();
            }
        }
        try {
            return OptionalInt.of(Integer.parseInt(suffix));
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }

    /**
     * Sequence that follows {@code lastCode}; 1 when there is no previous code or it cannot be read.
     */
    public static int nextSequence(String lastCode, AcademicDepartment department, int semester) {
        OptionalInt last = parseSequence(lastCode, department, semester);
        if (last.isEmpty() || last.getAsInt() == Integer.MAX_VALUE) {
            return 1;
        }
        return last.getAsInt() + 1;
    }

    public static String prefix(AcademicDepartment department, int semester) {
        return department.name() + semester;
    }
}
