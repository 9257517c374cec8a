package com.collegeportal.backend.modules.notice.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Notice categories. JSON uses the display label; the constant name is accepted on input too.
 */
public enum NoticeCategory {
    STAFF_MEETING("Staff Meeting"),
    INVIGILATION_DUTY("Invigilation Duty"),
    INTERNAL_CIRCULAR("Internal Circular"),
    TIMETABLE_WORK("Timetable Work"),
    LEAVE_POLICY_UPDATE("Leave / Policy Update"),
    FACULTY_TRAINING("Faculty Training"),
    RESEARCH_OPPORTUNITIES("Research Opportunities"),
    STAFF_ACHIEVEMENTS("Staff Achievements"),
    MAINTENANCE_NOTICES("Maintenance Notices"),
    IT_SYSTEM_UPDATES("IT & System Updates"),
    HOLIDAY_ANNOUNCEMENT("Holiday Announcement"),
    EXAM_TIMETABLE("Exam Timetable"),
    EVENTS("Events"),
    RESULTS("Results"),
    FEE_NOTICES("Fee Notices"),
    EMERGENCY_ALERTS("Emergency Alerts"),
    WORKSHOPS_SEMINARS("Workshops / Seminars"),
    SCHOLARSHIP_GRANTS("Scholarship / Grants"),
    CAMPUS_NEWS("Campus News"),
    SPORTS_CULTURAL_UPDATES("Sports / Cultural Updates");

    private final String label;

    NoticeCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /** Matches the label (case-insensitive) or the constant name. */
    public static Optional<NoticeCategory> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        return Arrays.stream(values())
                .filter(category -> category.label.equalsIgnoreCase(trimmed)
                        || category.name().equals(trimmed.toUpperCase(Locale.ROOT)))
                .findFirst();
    }

    @JsonCreator
    public static NoticeCategory fromJson(String raw) {
        return fromValue(raw).orElseThrow(() -> new IllegalArgumentException(
                "\"" + raw + "\" is not a valid notice category."));
    }
}
