package com.threadline.notificationservice.repository;

import com.threadline.notificationservice.dto.NotificationFilter;
import com.threadline.notificationservice.model.Notification;

import java.util.List;
import java.util.UUID;

/**
 * Filtered, offset-based inbox queries that derived finders can't express.
 */
public interface NotificationQueryRepository {

    List<Notification> findInbox(UUID userId, UUID tenantId, NotificationFilter filter);

    long countInbox(UUID userId, UUID tenantId, NotificationFilter filter);
}
