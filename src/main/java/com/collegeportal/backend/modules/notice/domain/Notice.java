package com.collegeportal.backend.modules.notice.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.collegeportal.backend.global.jpa.AbstractTimestampedEntity;
import com.collegeportal.backend.modules.auth.domain.PortalUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Notice board entry. {@code posted_by} is set to null by the database when the author's account
 * is deleted.
 */
@Entity
@Table(name = "notice")
public class Notice extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 50)
    private NoticeCategory category;

    @Enumerated(EnumType.STRING)
    @Column(name = "audience", length = 10)
    private NoticeAudience audience;

    @Column(name = "title", length = 200)
    private String title;

    @Column(name = "content", columnDefinition = "text")
    private String content;

    @Column(name = "notice_date")
    private LocalDate date;

    @Column(name = "notice_datetime")
    private OffsetDateTime dateTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 10)
    private NoticePriority priority = NoticePriority.NORMAL;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "posted_by")
    private PortalUser postedBy;

    @Column(name = "expiry_date")
    private OffsetDateTime expiryDate;

    protected Notice() {
    }

    public Notice(NoticeCategory category, PortalUser postedBy) {
        this.category = category;
        this.postedBy = postedBy;
    }

    public boolean hasBody() {
        return (title != null && !title.isBlank()) || (content != null && !content.isBlank());
    }

    public boolean isExpiredAt(OffsetDateTime now) {
        return expiryDate != null && expiryDate.isBefore(now);
    }

    public UUID getId() {
        return id;
    }

    public NoticeCategory getCategory() {
        return category;
    }

    public void setCategory(NoticeCategory category) {
        this.category = category;
    }

    public NoticeAudience getAudience() {
        return audience;
    }

    public void setAudience(NoticeAudience audience) {
        this.audience = audience;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }

    public OffsetDateTime getDateTime() {
        return dateTime;
    }

    public void setDateTime(OffsetDateTime dateTime) {
        this.dateTime = dateTime;
    }

    public NoticePriority getPriority() {
        return priority;
    }

    public void setPriority(NoticePriority priority) {
        this.priority = priority == null ? NoticePriority.NORMAL : priority;
    }

    public PortalUser getPostedBy() {
        return postedBy;
    }

    public OffsetDateTime getExpiryDate() {
        return expiryDate;
    }

    public void setExpiryDate(OffsetDateTime expiryDate) {
        this.expiryDate = expiryDate;
    }
}
