package com.collegeportal.backend.modules.notice.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.collegeportal.backend.modules.notice.domain.NoticeAudience;
import com.collegeportal.backend.modules.notice.domain.NoticeCategory;
import com.collegeportal.backend.modules.notice.domain.NoticePriority;
import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.Size;

/**
 * Body of notice create, replace and partial update requests. Leaving {@code audience} out lets it
 * be derived from the category.
 */
public record NoticeRequest(
        NoticeCategory category,
        NoticeAudience audience,
        @Size(max = 200) String title,
        String content,
        LocalDate date,
        OffsetDateTime datetime,
        NoticePriority priority,
        @JsonAlias("expiry_date") OffsetDateTime expiryDate
) {
}
