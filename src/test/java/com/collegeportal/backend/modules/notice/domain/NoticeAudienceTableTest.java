package com.collegeportal.backend.modules.notice.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumSet;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NoticeAudienceTableTest {

    private final NoticeAudienceTable table = NoticeAudienceTable.defaults();

    @Test
    @DisplayName("staff categories resolve to the staff audience")
    void staffMeetingIsStaffOnly() {
        assertThat(table.resolve(NoticeCategory.STAFF_MEETING, null)).isEqualTo(NoticeAudience.STAFF);
        assertThat(table.resolve(NoticeCategory.IT_SYSTEM_UPDATES, null)).isEqualTo(NoticeAudience.STAFF);
    }

    @Test
    @DisplayName("public categories resolve to everyone")
    void eventsAreForAll() {
        assertThat(table.resolve(NoticeCategory.EVENTS, null)).isEqualTo(NoticeAudience.ALL);
        assertThat(table.resolve(NoticeCategory.HOLIDAY_ANNOUNCEMENT, null)).isEqualTo(NoticeAudience.ALL);
    }

    @Test
    @DisplayName("the default table covers every category exactly once")
    void defaultsArePartition() {
        for (NoticeCategory category : NoticeCategory.values()) {
            assertThat(table.audienceFor(category)).as(category.name()).isPresent();
        }
    }

    @Test
    @DisplayName("an explicit audience wins over the derived one")
    void explicitAudienceWins() {
        assertThat(table.resolve(NoticeCategory.STAFF_MEETING, NoticeAudience.ALL)).isEqualTo(NoticeAudience.ALL);
    }

    @Test
    @DisplayName("an unmapped category stays unset on every resolution")
    void unmappedCategoryStaysUnset() {
        NoticeAudienceTable partial = new NoticeAudienceTable(
                EnumSet.of(NoticeCategory.STAFF_MEETING), EnumSet.of(NoticeCategory.EVENTS));

        assertThat(partial.resolve(NoticeCategory.RESULTS, null)).isNull();
        assertThat(partial.resolve(NoticeCategory.RESULTS, null)).isNull();
        assertThat(partial.audienceFor(null)).isEmpty();
    }

    @Test
    @DisplayName("a category cannot be mapped to both audiences")
    void overlapRejected() {
        assertThatThrownBy(() -> new NoticeAudienceTable(
                EnumSet.of(NoticeCategory.EVENTS), Set.of(NoticeCategory.EVENTS, NoticeCategory.RESULTS)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("EVENTS");
    }

    @Test
    @DisplayName("categories are read from their label or constant name")
    void categoryParsing() {
        assertThat(NoticeCategory.fromValue("staff meeting")).contains(NoticeCategory.STAFF_MEETING);
        assertThat(NoticeCategory.fromValue("IT & System Updates")).contains(NoticeCategory.IT_SYSTEM_UPDATES);
        assertThat(NoticeCategory.fromValue("exam_timetable")).contains(NoticeCategory.EXAM_TIMETABLE);
        assertThat(NoticeCategory.fromValue("Gossip")).isEmpty();
    }
}
