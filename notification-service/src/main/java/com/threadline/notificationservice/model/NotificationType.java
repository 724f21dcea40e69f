package com.threadline.notificationservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic kind of a notification.
 */
public enum NotificationType {
    INFO("info"),
    SUCCESS("success"),
    WARNING("warning"),
    ERROR("error"),
    ORDER_UPDATE("order_update"),
    DESIGN_UPDATE("design_update"),
    MANUFACTURING_UPDATE("manufacturing_update"),
    FULFILLMENT_UPDATE("fulfillment_update");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Keyword match on a free-form event type code. First match wins, in the
     * order order, design, manufacturing, fulfillment; anything else is INFO.
     */
    public static NotificationType fromEventType(String eventType) {
        if (eventType == null) {
            return INFO;
        }
        String code = eventType.toLowerCase();
        if (code.contains("order")) {
            return ORDER_UPDATE;
        }
        if (code.contains("design")) {
            return DESIGN_UPDATE;
        }
        if (code.contains("manufacturing")) {
            return MANUFACTURING_UPDATE;
        }
        if (code.contains("fulfillment")) {
            return FULFILLMENT_UPDATE;
        }
        return INFO;
    }

    @JsonCreator
    public static NotificationType fromValue(String value) {
        for (NotificationType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown notification type: " + value);
    }
}
