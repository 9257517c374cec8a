package com.collegeportal.backend.modules.notice.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.collegeportal.backend.modules.notice.domain.Notice;
import com.collegeportal.backend.modules.notice.domain.NoticeAudience;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NoticeRepository extends JpaRepository<Notice, UUID> {

    @Query("select n from Notice n left join fetch n.postedBy order by n.createdAt desc")
    List<Notice> findAllNewestFirst();

    @Query("""
            select n from Notice n left join fetch n.postedBy
            where n.audience = :audience
              and (n.expiryDate is null or n.expiryDate >= :now)
            order by n.createdAt desc
            """)
    List<Notice> findVisibleNewestFirst(
            @Param("audience") NoticeAudience audience,
            @Param("now") OffsetDateTime now
    );

    @Query("select n from Notice n left join fetch n.postedBy where n.id = :id")
    Optional<Notice> findWithAuthorById(@Param("id") UUID id);

    @Modifying(clearAutomatically = true)
    @Query("""
            delete from Notice n
            where n.createdAt < :createdBefore
               or (n.expiryDate is not null and n.expiryDate < :now)
            """)
    int deleteStale(@Param("createdBefore") OffsetDateTime createdBefore, @Param("now") OffsetDateTime now);
}
