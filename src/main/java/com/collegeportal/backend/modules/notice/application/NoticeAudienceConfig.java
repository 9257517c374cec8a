package com.collegeportal.backend.modules.notice.application;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.collegeportal.backend.modules.notice.domain.NoticeAudienceTable;
import com.collegeportal.backend.modules.notice.domain.NoticeCategory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the single {@link NoticeAudienceTable}. Either list may be overridden with a comma
 * separated list of category labels or constant names; an empty property keeps the default set.
 */
@Configuration
public class NoticeAudienceConfig {

    private static final Logger log = LoggerFactory.getLogger(NoticeAudienceConfig.class);

    @Bean
    public NoticeAudienceTable noticeAudienceTable(
            @Value("${app.notice.audience.staff-categories:}") List<String> staffCategories,
            @Value("${app.notice.audience.all-categories:}") List<String> allCategories
    ) {
        Set<NoticeCategory> staff = staffCategories.isEmpty()
                ? NoticeAudienceTable.defaultStaffCategories()
                : parse("app.notice.audience.staff-categories", staffCategories);
        Set<NoticeCategory> all = allCategories.isEmpty()
                ? NoticeAudienceTable.defaultAllCategories()
                : parse("app.notice.audience.all-categories", allCategories);
        NoticeAudienceTable table = new NoticeAudienceTable(staff, all);
        log.info("Notice audience table: {} staff categories, {} all-user categories", staff.size(), all.size());
        return table;
    }

    static Set<NoticeCategory> parse(String property, List<String> values) {
        Set<NoticeCategory> categories = EnumSet.noneOf(NoticeCategory.class);
        for (String value : values) {
            if (value == null || value.isBlank()) {
                continue;
            }
            categories.add(NoticeCategory.fromValue(value).orElseThrow(() -> new IllegalStateException(
                    property + " contains an unknown notice category: " + value)));
        }
        return categories;
    }
}
