package com.threadline.notificationservice.model;

import com.threadline.common.model.EntityType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only record of a domain event. The only column written after insert
 * is processed_at, and only once (see RealtimeEventRepository#markProcessed).
 */
@Entity
@Table(name = "realtime_events", indexes = {
        @Index(name = "idx_event_tenant_created", columnList = "tenant_id,created_at"),
        @Index(name = "idx_event_unprocessed", columnList = "processed_at")
})
@Getter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    @ToString.Include
    private UUID tenantId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 100)
    @ToString.Include
    private String eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, updatable = false, length = 30)
    @ToString.Include
    private EntityType entityType;

    @Column(name = "entity_id", nullable = false, updatable = false)
    @ToString.Include
    private UUID entityId;

    @Column(name = "actor_user_id", updatable = false)
    private UUID actorUserId; // null for system-generated events

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", updatable = false)
    private Map<String, Object> payload;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "broadcast_to_users", columnDefinition = "jsonb", updatable = false)
    private List<UUID> broadcastToUsers;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "broadcast_to_roles", columnDefinition = "jsonb", updatable = false)
    private List<String> broadcastToRoles;

    @Column(name = "is_broadcast", nullable = false, updatable = false)
    private boolean broadcast;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean hasExplicitRecipients() {
        return broadcastToUsers != null && !broadcastToUsers.isEmpty();
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
