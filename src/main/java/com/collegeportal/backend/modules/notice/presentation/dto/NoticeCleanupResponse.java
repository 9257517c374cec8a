package com.collegeportal.backend.modules.notice.presentation.dto;

public record NoticeCleanupResponse(int deleted) {
}
