package com.threadline.notificationservice.service;

import com.threadline.common.exception.ResourceNotFoundException;
import com.threadline.notificationservice.config.InboxProperties;
import com.threadline.notificationservice.dto.CreateNotificationRequest;
import com.threadline.notificationservice.dto.NotificationDto;
import com.threadline.notificationservice.dto.NotificationFilter;
import com.threadline.notificationservice.dto.NotificationPage;
import com.threadline.notificationservice.dto.RealtimeMessage;
import com.threadline.notificationservice.dto.UnreadStats;
import com.threadline.notificationservice.exception.PersistenceFailureException;
import com.threadline.notificationservice.model.MessageType;
import com.threadline.notificationservice.model.Notification;
import com.threadline.notificationservice.model.NotificationCategory;
import com.threadline.notificationservice.model.NotificationPriority;
import com.threadline.notificationservice.repository.NotificationRepository;
import com.threadline.notificationservice.transport.RealtimeTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for managing notifications.
 *
 * Every read is scoped to the owning user, and to the tenant wherever the
 * caller supplies one. A notification owned by someone else is reported as
 * not found, never as forbidden.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private static final String NOTIFICATION = "Notification";

    private final NotificationRepository notificationRepository;
    private final RealtimeTransport realtimeTransport;
    private final InboxProperties inboxProperties;
    private final Clock clock;

    /**
     * Persists one notification and pushes it to the owner's live sessions.
     *
     * @throws PersistenceFailureException if the row could not be written
     */
    public NotificationDto createNotification(CreateNotificationRequest request) {
        Notification notification = Notification.builder()
                .tenantId(request.getTenantId())
                .userId(request.getUserId())
                .type(request.getType())
                .title(request.getTitle())
                .message(request.getMessage())
                .category(request.getCategory() != null ? request.getCategory() : NotificationCategory.GENERAL)
                .priority(request.getPriority() != null ? request.getPriority() : NotificationPriority.NORMAL)
                .actionUrl(request.getActionUrl())
                .data(request.getData())
                .expiresAt(request.getExpiresAt())
                .metadata(request.getMetadata())
                .createdAt(clock.instant())
                .build();

        Notification saved;
        try {
            saved = notificationRepository.save(notification);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to save notification: tenantId={}, userId={}, type={}, error={}",
                    request.getTenantId(), request.getUserId(), request.getType(), e.getMessage());
            throw new PersistenceFailureException("Failed to save notification", e);
        }
        log.info("Notification created: id={}, tenantId={}, userId={}, type={}",
                saved.getId(), saved.getTenantId(), saved.getUserId(), saved.getType());

        NotificationDto dto = toDto(saved);
        pushToOwner(dto);
        return dto;
    }

    /**
     * Newest first, ties broken by id. Page size falls back to the configured
     * default when unset and is capped at the configured maximum.
     */
    @Transactional(readOnly = true)
    public NotificationPage listNotifications(UUID userId, UUID tenantId, NotificationFilter filter) {
        NotificationFilter effective = normalize(filter);

        List<NotificationDto> items = notificationRepository.findInbox(userId, tenantId, effective).stream()
                .map(this::toDto)
                .collect(Collectors.toList());
        long totalCount = notificationRepository.countInbox(userId, tenantId, effective);

        return NotificationPage.builder()
                .items(items)
                .totalCount(totalCount)
                .limit(effective.getLimit())
                .offset(effective.getOffset())
                .build();
    }

    /**
     * @param category optional, null counts every category
     */
    @Transactional(readOnly = true)
    public long getUnreadCount(UUID userId, UUID tenantId, NotificationCategory category) {
        if (category == null) {
            return notificationRepository.countByUserIdAndTenantIdAndIsReadFalse(userId, tenantId);
        }
        return notificationRepository.countByUserIdAndTenantIdAndCategoryAndIsReadFalse(userId, tenantId, category);
    }

    @Transactional(readOnly = true)
    public UnreadStats getStats(UUID userId, UUID tenantId) {
        Map<String, Long> byCategory = new LinkedHashMap<>();
        for (NotificationCategory category : NotificationCategory.values()) {
            byCategory.put(category.getValue(), 0L);
        }

        long total = 0;
        for (Object[] row : notificationRepository.countUnreadByCategory(userId, tenantId)) {
            NotificationCategory category = (NotificationCategory) row[0];
            long count = ((Number) row[1]).longValue();
            byCategory.put(category.getValue(), count);
            total += count;
        }

        return UnreadStats.builder()
                .total(total)
                .byCategory(byCategory)
                .build();
    }

    /**
     * Marks one notification read. Reading an already-read notification
     * returns it unchanged.
     *
     * @throws ResourceNotFoundException if no notification with this id belongs to the user
     */
    @Transactional
    public NotificationDto markAsRead(UUID notificationId, UUID userId) {
        Notification notification = notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> new ResourceNotFoundException(NOTIFICATION, notificationId));

        if (notification.markAsRead(clock.instant())) {
            notificationRepository.save(notification);
            log.info("Notification marked as read: id={}, userId={}", notificationId, userId);
        }

        return toDto(notification);
    }

    /**
     * Marks every unread notification of the user in the tenant as read,
     * optionally limited to one category.
     *
     * @return the notifications that changed
     */
    @Transactional
    public List<NotificationDto> markAllAsRead(UUID userId, UUID tenantId, NotificationCategory category) {
        List<Notification> unread = category == null
                ? notificationRepository.findByUserIdAndTenantIdAndIsReadFalseOrderByCreatedAtDesc(userId, tenantId)
                : notificationRepository.findByUserIdAndTenantIdAndCategoryAndIsReadFalseOrderByCreatedAtDesc(
                        userId, tenantId, category);

        if (unread.isEmpty()) {
            return List.of();
        }

        Instant now = clock.instant();
        unread.forEach(notification -> notification.markAsRead(now));
        notificationRepository.saveAll(unread);

        log.info("Notifications marked as read: userId={}, tenantId={}, category={}, count={}",
                userId, tenantId, category, unread.size());

        return unread.stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    /**
     * @throws ResourceNotFoundException if no notification with this id belongs to the user
     */
    @Transactional
    public void deleteNotification(UUID notificationId, UUID userId) {
        Notification notification = notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> new ResourceNotFoundException(NOTIFICATION, notificationId));

        notificationRepository.delete(notification);
        log.info("Notification deleted: id={}, userId={}", notificationId, userId);
    }

    private void pushToOwner(NotificationDto dto) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("notification", dto);
        payload.put("action", "created");

        RealtimeMessage message = RealtimeMessage.builder()
                .type(MessageType.NOTIFICATION)
                .payload(payload)
                .timestamp(clock.instant())
                .tenantId(dto.getTenantId())
                .userId(dto.getUserId())
                .build();

        try {
            realtimeTransport.sendToUser(dto.getUserId(), dto.getTenantId(), message);
        } catch (RuntimeException e) {
            // The row is already stored; the owner sees it on the next inbox fetch
            log.warn("Live push of notification failed: id={}, userId={}, error={}",
                    dto.getId(), dto.getUserId(), e.getMessage());
        }
    }

    private NotificationFilter normalize(NotificationFilter filter) {
        NotificationFilter source = filter != null ? filter : NotificationFilter.builder().build();

        if (source.getOffset() < 0) {
            throw new IllegalArgumentException("Offset must not be less than zero");
        }

        int limit = source.getLimit() > 0 ? source.getLimit() : inboxProperties.getDefaultPageSize();
        limit = Math.min(limit, inboxProperties.getMaxPageSize());

        return NotificationFilter.builder()
                .limit(limit)
                .offset(source.getOffset())
                .category(source.getCategory())
                .isRead(source.getIsRead())
                .priority(source.getPriority())
                .build();
    }

    /**
     * Converts Notification entity to DTO.
     */
    NotificationDto toDto(Notification notification) {
        return NotificationDto.builder()
                .id(notification.getId())
                .tenantId(notification.getTenantId())
                .userId(notification.getUserId())
                .type(notification.getType())
                .title(notification.getTitle())
                .message(notification.getMessage())
                .category(notification.getCategory())
                .priority(notification.getPriority())
                .actionUrl(notification.getActionUrl())
                .data(notification.getData())
                .isRead(notification.getIsRead())
                .readAt(notification.getReadAt())
                .expiresAt(notification.getExpiresAt())
                .metadata(notification.getMetadata())
                .createdAt(notification.getCreatedAt())
                .build();
    }
}
