package com.collegeportal.backend.modules.notice.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.collegeportal.backend.global.error.ProblemException;
import com.collegeportal.backend.global.error.ValidationProblemException;
import com.collegeportal.backend.modules.access.domain.Actor;
import com.collegeportal.backend.modules.access.domain.PortalAction;
import com.collegeportal.backend.modules.access.domain.ResourceKind;
import com.collegeportal.backend.modules.access.domain.RolePolicy;
import com.collegeportal.backend.modules.auth.domain.PortalUser;
import com.collegeportal.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.collegeportal.backend.modules.notice.domain.Notice;
import com.collegeportal.backend.modules.notice.domain.NoticeAudience;
import com.collegeportal.backend.modules.notice.domain.NoticeAudienceTable;
import com.collegeportal.backend.modules.notice.domain.NoticeCategory;
import com.collegeportal.backend.modules.notice.infrastructure.persistence.NoticeRepository;
import com.collegeportal.backend.modules.notice.presentation.dto.NoticeRequest;
import com.collegeportal.backend.modules.notice.presentation.dto.NoticeResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Notice board. Audience is derived from the category through {@link NoticeAudienceTable}
 * whenever a save leaves it unset. Students only ever see unexpired notices addressed to all users.
 */
@Service
@Transactional
public class NoticeService {

    private static final Logger log = LoggerFactory.getLogger(NoticeService.class);

    static final String MISSING_BODY_MESSAGE = "Either title or content must be provided.";

    private final NoticeRepository noticeRepository;
    private final PortalUserRepository portalUserRepository;
    private final NoticeAudienceTable audienceTable;
    private final Duration retention;
    private final Clock clock;

    public NoticeService(
            NoticeRepository noticeRepository,
            PortalUserRepository portalUserRepository,
            NoticeAudienceTable audienceTable,
            @Value("${app.notice.retention:P30D}") Duration retention,
            Clock clock
    ) {
        this.noticeRepository = noticeRepository;
        this.portalUserRepository = portalUserRepository;
        this.audienceTable = audienceTable;
        this.retention = retention;
        this.clock = clock;
    }

    public NoticeResponse create(Actor actor, NoticeRequest request) {
        RolePolicy.require(actor, PortalAction.CREATE, ResourceKind.NOTICE);
        if (request.category() == null) {
            throw ValidationProblemException.field("category", "This field is required.");
        }
        PortalUser author = portalUserRepository.findById(actor.userId())
                .orElseThrow(() -> ProblemException.notFound("notice.author_not_found", "User not found."));

        Notice notice = new Notice(request.category(), author);
        apply(notice, request, true);
        Notice saved = noticeRepository.save(notice);
        log.info("Notice {} created in {} for audience {}", saved.getId(), saved.getCategory(), saved.getAudience());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<NoticeResponse> list(Actor actor) {
        RolePolicy.require(actor, PortalAction.LIST, ResourceKind.NOTICE);
        List<Notice> notices = RolePolicy.seesRestrictedNotices(actor)
                ? noticeRepository.findAllNewestFirst()
                : noticeRepository.findVisibleNewestFirst(NoticeAudience.ALL, OffsetDateTime.now(clock));
        return notices.stream().map(this::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public NoticeResponse get(Actor actor, UUID id) {
        RolePolicy.require(actor, PortalAction.READ, ResourceKind.NOTICE);
        Notice notice = findNotice(id);
        if (!RolePolicy.seesRestrictedNotices(actor)) {
            if (notice.getAudience() != NoticeAudience.ALL) {
                throw ProblemException.forbidden("notice.forbidden", "You do not have permission to view this notice.");
            }
            if (notice.isExpiredAt(OffsetDateTime.now(clock))) {
                throw noticeNotFound();
            }
        }
        return toResponse(notice);
    }

    /**
     * @param replace {@code true} for a full replacement (PUT), {@code false} for a partial update
     */
    public NoticeResponse update(Actor actor, UUID id, NoticeRequest request, boolean replace) {
        RolePolicy.require(actor, PortalAction.UPDATE, ResourceKind.NOTICE);
        Notice notice = findNotice(id);
        if (replace && request.category() == null) {
            throw ValidationProblemException.field("category", "This field is required.");
        }
        apply(notice, request, replace);
        return toResponse(noticeRepository.save(notice));
    }

    public void delete(Actor actor, UUID id) {
        RolePolicy.require(actor, PortalAction.DELETE, ResourceKind.NOTICE);
        noticeRepository.delete(findNotice(id));
    }

    public int purgeStale(Actor actor) {
        RolePolicy.require(actor, PortalAction.DELETE, ResourceKind.NOTICE);
        return purgeStale();
    }

    /**
     * Deletes notices older than the retention period and notices past their expiry date.
     * Safe to run repeatedly and alongside regular traffic.
     */
    public int purgeStale() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return noticeRepository.deleteStale(now.minus(retention), now);
    }

    /**
     * Copies request fields onto the notice. With {@code replace} absent fields are cleared;
     * otherwise only present fields change. Blank strings clear a field in both modes.
     */
    private void apply(Notice notice, NoticeRequest request, boolean replace) {
        NoticeCategory previousCategory = notice.getCategory();
        if (request.category() != null) {
            notice.setCategory(request.category());
        }
        if (replace || request.title() != null) {
            notice.setTitle(blankToNull(request.title()));
        }
        if (replace || request.content() != null) {
            notice.setContent(blankToNull(request.content()));
        }
        if (replace || request.date() != null) {
            notice.setDate(request.date());
        }
        if (replace || request.datetime() != null) {
            notice.setDateTime(request.datetime());
        }
        if (replace || request.priority() != null) {
            notice.setPriority(request.priority());
        }
        if (replace || request.expiryDate() != null) {
            notice.setExpiryDate(request.expiryDate());
        }
        if (!notice.hasBody()) {
            throw new ValidationProblemException(MISSING_BODY_MESSAGE, Map.of("title", MISSING_BODY_MESSAGE));
        }

        boolean categoryChanged = notice.getCategory() != previousCategory;
        if (replace || request.audience() != null || categoryChanged) {
            notice.setAudience(audienceTable.resolve(notice.getCategory(), request.audience()));
        }
    }

    private Notice findNotice(UUID id) {
        return noticeRepository.findWithAuthorById(id).orElseThrow(NoticeService::noticeNotFound);
    }

    private static ProblemException noticeNotFound() {
        return ProblemException.notFound("notice.not_found", "Notice not found.");
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    NoticeResponse toResponse(Notice notice) {
        PortalUser author = notice.getPostedBy();
        return new NoticeResponse(
                notice.getId(),
                notice.getCategory(),
                notice.getAudience(),
                notice.getTitle(),
                notice.getContent(),
                notice.getDate(),
                notice.getDateTime(),
                notice.getPriority(),
                notice.getExpiryDate(),
                author != null ? author.getId() : null,
                author != null ? author.getFullName() : null,
                notice.getCreatedAt(),
                notice.getUpdatedAt()
        );
    }
}
