package com.threadline.notificationservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retention sweep settings.
 */
@Data
@ConfigurationProperties(prefix = "notification.retention")
public class NotificationRetentionProperties {

    private boolean enabled = true;

    /**
     * Notifications older than this are deleted regardless of expiresAt.
     */
    private int retentionDays = 30;

    private String cron = "0 0 3 * * *";
}
