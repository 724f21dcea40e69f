package com.threadline.notificationservice.dto;

import com.threadline.notificationservice.model.NotificationCategory;
import com.threadline.notificationservice.model.NotificationPriority;
import com.threadline.notificationservice.model.NotificationType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Input for a single notification, from the admin API or from event fan-out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateNotificationRequest {

    @NotNull
    private UUID tenantId;

    @NotNull
    private UUID userId;

    @NotNull
    private NotificationType type;

    @NotBlank
    @Size(max = 255)
    private String title;

    @NotBlank
    @Size(max = 1000)
    private String message;

    @Builder.Default
    private NotificationCategory category = NotificationCategory.GENERAL;

    @Builder.Default
    private NotificationPriority priority = NotificationPriority.NORMAL;

    @Size(max = 500)
    private String actionUrl;

    private Map<String, Object> data;
    private Instant expiresAt;
    private Map<String, Object> metadata;
}
