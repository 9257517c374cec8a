package com.collegeportal.backend.modules.notice.presentation.dto;

import java.util.List;

public record NoticeListResponse(int count, List<NoticeResponse> notices) {

    public static NoticeListResponse of(List<NoticeResponse> notices) {
        return new NoticeListResponse(notices.size(), notices);
    }
}
