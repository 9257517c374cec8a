package com.collegeportal.backend.modules.hod.domain;

/**
 * Lifecycle of one appointment. {@code RETIRED} is terminal.
 */
public enum HodStatus {
    ACTIVE,
    RETIRED
}
