package com.threadline.notificationservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationPriority {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high"),
    URGENT("urgent");

    private final String value;

    NotificationPriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * "urgent" or "error" in the event type is URGENT, "warning" or "delay" is HIGH.
     */
    public static NotificationPriority fromEventType(String eventType) {
        if (eventType == null) {
            return NORMAL;
        }
        String code = eventType.toLowerCase();
        if (code.contains("urgent") || code.contains("error")) {
            return URGENT;
        }
        if (code.contains("warning") || code.contains("delay")) {
            return HIGH;
        }
        return NORMAL;
    }

    @JsonCreator
    public static NotificationPriority fromValue(String value) {
        for (NotificationPriority priority : values()) {
            if (priority.value.equalsIgnoreCase(value) || priority.name().equalsIgnoreCase(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown notification priority: " + value);
    }
}
