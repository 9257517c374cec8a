package com.collegeportal.backend.modules.notice.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class NoticeCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(NoticeCleanupScheduler.class);

    private final NoticeService noticeService;

    public NoticeCleanupScheduler(NoticeService noticeService) {
        this.noticeService = noticeService;
    }

    @Scheduled(fixedDelayString = "${app.notice.cleanup-interval:PT1H}")
    public void purgeStaleNotices() {
        int deleted = noticeService.purgeStale();
        if (deleted > 0) {
            log.info("Deleted {} stale notices", deleted);
        }
    }
}
