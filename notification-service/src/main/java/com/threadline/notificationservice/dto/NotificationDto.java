package com.threadline.notificationservice.dto;

import com.threadline.notificationservice.model.NotificationCategory;
import com.threadline.notificationservice.model.NotificationPriority;
import com.threadline.notificationservice.model.NotificationType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * DTO for notification responses (REST and WebSocket).
 */
@Data
@Builder
public class NotificationDto {
    private UUID id;
    private UUID tenantId;
    private UUID userId;
    private NotificationType type;
    private String title;
    private String message;
    private NotificationCategory category;
    private NotificationPriority priority;
    private String actionUrl;
    private Map<String, Object> data;
    private Boolean isRead;
    private Instant readAt;
    private Instant expiresAt;
    private Map<String, Object> metadata;
    private Instant createdAt;
}
