package com.collegeportal.backend.modules.notice.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Category to audience mapping used whenever a notice is saved without an explicit audience.
 * Immutable; a category in neither set has no derived audience.
 */
public final class NoticeAudienceTable {

    private final Map<NoticeCategory, NoticeAudience> audiences;

    public NoticeAudienceTable(Set<NoticeCategory> staffCategories, Set<NoticeCategory> allCategories) {
        Set<NoticeCategory> overlap = staffCategories.isEmpty()
                ? EnumSet.noneOf(NoticeCategory.class)
                : EnumSet.copyOf(staffCategories);
        overlap.retainAll(allCategories);
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException("Categories mapped to both audiences: " + overlap);
        }
        Map<NoticeCategory, NoticeAudience> mapping = new EnumMap<>(NoticeCategory.class);
        staffCategories.forEach(category -> mapping.put(category, NoticeAudience.STAFF));
        allCategories.forEach(category -> mapping.put(category, NoticeAudience.ALL));
        this.audiences = Collections.unmodifiableMap(mapping);
    }

    public static NoticeAudienceTable defaults() {
        return new NoticeAudienceTable(defaultStaffCategories(), defaultAllCategories());
    }

    public static Set<NoticeCategory> defaultStaffCategories() {
        return EnumSet.range(NoticeCategory.STAFF_MEETING, NoticeCategory.IT_SYSTEM_UPDATES);
    }

    public static Set<NoticeCategory> defaultAllCategories() {
        return EnumSet.range(NoticeCategory.HOLIDAY_ANNOUNCEMENT, NoticeCategory.SPORTS_CULTURAL_UPDATES);
    }

    public Optional<NoticeAudience> audienceFor(NoticeCategory category) {
        return Optional.ofNullable(category == null ? null : audiences.get(category));
    }

    /**
     * Audience to store: the explicit one when given, otherwise the one derived from the category,
     * otherwise none.
     */
    public NoticeAudience resolve(NoticeCategory category, NoticeAudience explicit) {
        return explicit != null ? explicit : audienceFor(category).orElse(null);
    }
}
