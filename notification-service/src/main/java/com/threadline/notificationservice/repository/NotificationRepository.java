package com.threadline.notificationservice.repository;

import com.threadline.notificationservice.model.Notification;
import com.threadline.notificationservice.model.NotificationCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for managing notification persistence.
 * Every finder is scoped by owner; tenant scoping is added wherever the
 * caller supplies a tenant.
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID>, NotificationQueryRepository {

    Optional<Notification> findByIdAndUserId(UUID id, UUID userId);

    long countByUserIdAndTenantIdAndIsReadFalse(UUID userId, UUID tenantId);

    long countByUserIdAndTenantIdAndCategoryAndIsReadFalse(UUID userId, UUID tenantId, NotificationCategory category);

    List<Notification> findByUserIdAndTenantIdAndIsReadFalseOrderByCreatedAtDesc(UUID userId, UUID tenantId);

    List<Notification> findByUserIdAndTenantIdAndCategoryAndIsReadFalseOrderByCreatedAtDesc(
            UUID userId, UUID tenantId, NotificationCategory category);

    /**
     * Unread counts grouped by category. Each row is [NotificationCategory, Long].
     */
    @Query("""
            SELECT n.category, COUNT(n) FROM Notification n
            WHERE n.userId = :userId
              AND n.tenantId = :tenantId
              AND n.isRead = false
            GROUP BY n.category
            """)
    List<Object[]> countUnreadByCategory(@Param("userId") UUID userId, @Param("tenantId") UUID tenantId);

    /**
     * Deletes notifications past their own expiry or created before the
     * retention cutoff.
     */
    @Transactional
    @Modifying
    @Query("""
            DELETE FROM Notification n
            WHERE (n.expiresAt IS NOT NULL AND n.expiresAt < :now)
               OR n.createdAt < :cutoff
            """)
    int deleteExpired(@Param("now") Instant now, @Param("cutoff") Instant cutoff);
}
