package com.threadline.notificationservice.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Per-recipient inbox entry. Belongs to exactly one tenant and one user.
 * Read state only changes through {@link #markAsRead(Instant)}, which keeps
 * readAt non-null exactly when isRead is true.
 */
@Entity
@Table(name = "notifications", indexes = {
        @Index(name = "idx_notif_tenant_user_created", columnList = "tenant_id,user_id,created_at"),
        @Index(name = "idx_notif_tenant_user_read", columnList = "tenant_id,user_id,is_read"),
        @Index(name = "idx_notif_expires", columnList = "expires_at")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    @ToString.Include
    private UUID tenantId;

    @Column(name = "user_id", nullable = false, updatable = false)
    @ToString.Include
    private UUID userId; // Recipient user

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    @ToString.Include
    private NotificationType type;

    @Column(nullable = false, length = 255)
    private String title;

    @Column(nullable = false, length = 1000)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private NotificationCategory category = NotificationCategory.GENERAL;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private NotificationPriority priority = NotificationPriority.NORMAL;

    @Column(name = "action_url", length = 500)
    private String actionUrl;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> data;

    @Column(name = "is_read", nullable = false)
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private Boolean isRead = false;

    @Column(name = "read_at")
    @Setter(AccessLevel.NONE)
    private Instant readAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Marks the notification read. Already-read notifications keep their
     * original readAt.
     *
     * @return true if the read state changed
     */
    public boolean markAsRead(Instant now) {
        if (Boolean.TRUE.equals(isRead)) {
            return false;
        }
        this.isRead = true;
        this.readAt = now;
        return true;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (isRead == null) {
            isRead = false;
        }
    }
}
