package com.collegeportal.backend.modules.catalog.domain;

public final class Semester {

    public static final int FIRST = 1;
    public static final int LAST = 8;

    private Semester() {
    }

    public static boolean isValid(int semester) {
        return semester >= FIRST && semester <= LAST;
    }
}
