package com.threadline.notificationservice.dto;

import com.threadline.notificationservice.model.NotificationCategory;
import com.threadline.notificationservice.model.NotificationPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbox query options. Null filters are not applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationFilter {

    public static final int DEFAULT_LIMIT = 50;

    @Builder.Default
    private int limit = DEFAULT_LIMIT;

    @Builder.Default
    private int offset = 0;

    private NotificationCategory category;
    private Boolean isRead;
    private NotificationPriority priority;
}
