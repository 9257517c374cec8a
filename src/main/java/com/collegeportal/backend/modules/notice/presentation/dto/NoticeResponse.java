package com.collegeportal.backend.modules.notice.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.collegeportal.backend.modules.notice.domain.NoticeAudience;
import com.collegeportal.backend.modules.notice.domain.NoticeCategory;
import com.collegeportal.backend.modules.notice.domain.NoticePriority;

public record NoticeResponse(
        UUID id,
        NoticeCategory category,
        NoticeAudience audience,
        String title,
        String content,
        LocalDate date,
        OffsetDateTime datetime,
        NoticePriority priority,
        OffsetDateTime expiryDate,
        UUID postedBy,
        String postedByName,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
