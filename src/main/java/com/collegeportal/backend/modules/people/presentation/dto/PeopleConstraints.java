package com.collegeportal.backend.modules.people.presentation.dto;

final class PeopleConstraints {

    static final String CODE_PATTERN = "^[A-Z0-9]+$";
    static final String PHONE_PATTERN = "^(\\+?1?\\d{9,15})?$";
    static final String PHONE_MESSAGE =
            "Phone number must be entered in the format: \"+999999999\". Up to 15 digits allowed.";

    private PeopleConstraints() {
    }
}
