package com.threadline.notificationservice.controller;

import com.threadline.common.exception.AccessDeniedException;
import com.threadline.notificationservice.config.InboxProperties;
import com.threadline.notificationservice.config.JwtClaims;
import com.threadline.notificationservice.dto.CountResponse;
import com.threadline.notificationservice.dto.CreateNotificationRequest;
import com.threadline.notificationservice.dto.MarkAllReadRequest;
import com.threadline.notificationservice.dto.NotificationDto;
import com.threadline.notificationservice.dto.NotificationFilter;
import com.threadline.notificationservice.dto.NotificationPage;
import com.threadline.notificationservice.dto.UnreadStats;
import com.threadline.notificationservice.model.NotificationCategory;
import com.threadline.notificationservice.model.NotificationPriority;
import com.threadline.notificationservice.service.NotificationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API over the notification inbox.
 *
 * The caller's user id comes from the JWT subject and the tenant from the
 * org_id claim; neither is ever taken from the request.
 */
@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
@Slf4j
public class NotificationController {

    private final NotificationService notificationService;
    private final InboxProperties inboxProperties;

    /**
     * GET /api/v1/notifications?page=0&size=50&category=order&isRead=false&priority=high
     *
     * size is capped at the configured maximum before the offset is derived,
     * so consecutive pages never skip rows.
     */
    @GetMapping
    public ResponseEntity<NotificationPage> listNotifications(
            @AuthenticationPrincipal Jwt jwt,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "" + NotificationFilter.DEFAULT_LIMIT) int size,
            @RequestParam(required = false) NotificationCategory category,
            @RequestParam(required = false) Boolean isRead,
            @RequestParam(required = false) NotificationPriority priority) {

        if (page < 0) {
            throw new IllegalArgumentException("Page number must not be less than zero");
        }
        if (size < 1) {
            throw new IllegalArgumentException("Page size must not be less than one");
        }

        int pageSize = Math.min(size, inboxProperties.getMaxPageSize());
        long offset = (long) page * pageSize;
        if (offset > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Page number is out of range");
        }

        UUID userId = JwtClaims.userId(jwt);
        UUID tenantId = JwtClaims.tenantId(jwt);
        log.debug("Listing notifications: userId={}, tenantId={}, page={}, size={}", userId, tenantId, page, pageSize);

        NotificationFilter filter = NotificationFilter.builder()
                .limit(pageSize)
                .offset((int) offset)
                .category(category)
                .isRead(isRead)
                .priority(priority)
                .build();

        return ResponseEntity.ok(notificationService.listNotifications(userId, tenantId, filter));
    }

    @GetMapping("/unread-count")
    public ResponseEntity<CountResponse> getUnreadCount(
            @AuthenticationPrincipal Jwt jwt,
            @RequestParam(required = false) NotificationCategory category) {

        long count = notificationService.getUnreadCount(JwtClaims.userId(jwt), JwtClaims.tenantId(jwt), category);
        return ResponseEntity.ok(new CountResponse(count));
    }

    @GetMapping("/stats")
    public ResponseEntity<UnreadStats> getStats(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(notificationService.getStats(JwtClaims.userId(jwt), JwtClaims.tenantId(jwt)));
    }

    @PatchMapping("/{id}/read")
    public ResponseEntity<NotificationDto> markAsRead(@PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
        UUID userId = JwtClaims.userId(jwt);
        log.info("Marking notification as read: notificationId={}, userId={}", id, userId);

        return ResponseEntity.ok(notificationService.markAsRead(id, userId));
    }

    /**
     * Body is optional; {"category": "order"} limits the update to one category.
     */
    @PatchMapping("/mark-all-read")
    public ResponseEntity<CountResponse> markAllAsRead(
            @AuthenticationPrincipal Jwt jwt,
            @RequestBody(required = false) MarkAllReadRequest request) {

        NotificationCategory category = request != null ? request.getCategory() : null;
        List<NotificationDto> updated = notificationService.markAllAsRead(
                JwtClaims.userId(jwt), JwtClaims.tenantId(jwt), category);

        return ResponseEntity.ok(new CountResponse(updated.size()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteNotification(@PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
        UUID userId = JwtClaims.userId(jwt);
        log.info("Deleting notification: notificationId={}, userId={}", id, userId);

        notificationService.deleteNotification(id, userId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Sends a notification to one member of the caller's tenant.
     */
    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<NotificationDto> createNotification(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody CreateNotificationRequest request) {

        UUID callerId = JwtClaims.userId(jwt);
        UUID callerTenantId = JwtClaims.tenantId(jwt);

        if (!callerTenantId.equals(request.getTenantId())) {
            log.warn("Cross-tenant notification rejected: callerId={}, callerTenantId={}, requestTenantId={}",
                    callerId, callerTenantId, request.getTenantId());
            throw new AccessDeniedException("Cannot create notifications for another tenant");
        }

        NotificationDto created = notificationService.createNotification(request);

        log.info("AUDIT: notification created by admin: actorId={}, tenantId={}, recipientId={}, notificationId={}, type={}",
                callerId, callerTenantId, request.getUserId(), created.getId(), created.getType());

        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }
}
