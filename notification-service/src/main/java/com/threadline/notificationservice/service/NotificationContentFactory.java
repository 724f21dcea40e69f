package com.threadline.notificationservice.service;

import com.threadline.common.model.EntityType;
import com.threadline.notificationservice.dto.CreateNotificationRequest;
import com.threadline.notificationservice.model.NotificationCategory;
import com.threadline.notificationservice.model.NotificationPriority;
import com.threadline.notificationservice.model.NotificationType;
import com.threadline.notificationservice.model.RealtimeEvent;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Derives notification content from an event. Output depends only on the
 * event and the recipient.
 */
@Component
public class NotificationContentFactory {

    static final String DASHBOARD_URL = "/dashboard";

    public CreateNotificationRequest forRecipient(RealtimeEvent event, UUID userId) {
        return CreateNotificationRequest.builder()
                .tenantId(event.getTenantId())
                .userId(userId)
                .type(NotificationType.fromEventType(event.getEventType()))
                .category(NotificationCategory.forEntity(event.getEntityType()))
                .priority(NotificationPriority.fromEventType(event.getEventType()))
                .title(title(event.getEventType(), event.getEntityType()))
                .message(message(event.getEventType(), event.getEntityType(), event.getEntityId()))
                .actionUrl(actionUrl(event.getEntityType(), event.getEntityId(), event.getPayload()))
                .data(data(event))
                .build();
    }

    static String title(String eventType, EntityType entityType) {
        String label = label(entityType);
        String code = eventType == null ? "" : eventType.toLowerCase();

        if (code.contains("created")) {
            return "New " + label + " created";
        }
        if (code.contains("updated")) {
            return label + " updated";
        }
        if (code.contains("assigned")) {
            return label + " assigned";
        }
        return label + " notification";
    }

    static String message(String eventType, EntityType entityType, UUID entityId) {
        String action = eventType == null ? "event" : eventType.replace('_', ' ');
        return action + " for " + label(entityType) + " " + entityId;
    }

    static String actionUrl(EntityType entityType, UUID entityId, Map<String, Object> payload) {
        if (entityType == null) {
            return DASHBOARD_URL;
        }
        String orderId = orderId(payload);

        return switch (entityType) {
            case ORDER -> "/orders/" + entityId;
            case ORDER_ITEM -> orderId != null ? "/orders/" + orderId : "/orders";
            case DESIGN_JOB -> orderId != null
                    ? "/orders/" + orderId + "/design-jobs/" + entityId
                    : "/design-jobs";
            case WORK_ORDER -> orderId != null
                    ? "/orders/" + orderId + "/manufacturing/" + entityId
                    : "/manufacturing";
            case PURCHASE_ORDER -> "/purchase-orders/" + entityId;
            default -> DASHBOARD_URL;
        };
    }

    // Blank ids count as absent
    private static String orderId(Map<String, Object> payload) {
        Object value = payload != null ? payload.get("orderId") : null;
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        return value.toString();
    }

    private static Map<String, Object> data(RealtimeEvent event) {
        Map<String, Object> data = new HashMap<>();
        if (event.getPayload() != null) {
            data.putAll(event.getPayload());
        }
        data.putIfAbsent("eventId", event.getId());
        data.putIfAbsent("entityType", event.getEntityType() != null ? event.getEntityType().getValue() : null);
        data.putIfAbsent("entityId", event.getEntityId());
        return data;
    }

    private static String label(EntityType entityType) {
        return entityType != null ? entityType.getLabel() : "item";
    }
}
