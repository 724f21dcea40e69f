package com.threadline.notificationservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.threadline.common.model.EntityType;

/**
 * Inbox grouping of a notification.
 */
public enum NotificationCategory {
    GENERAL("general"),
    ORDER("order"),
    DESIGN("design"),
    MANUFACTURING("manufacturing"),
    FULFILLMENT("fulfillment"),
    SYSTEM("system");

    private final String value;

    NotificationCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static NotificationCategory forEntity(EntityType entityType) {
        if (entityType == null) {
            return GENERAL;
        }
        return switch (entityType) {
            case ORDER, ORDER_ITEM -> ORDER;
            case DESIGN_JOB -> DESIGN;
            case WORK_ORDER -> MANUFACTURING;
            case PURCHASE_ORDER, FULFILLMENT -> FULFILLMENT;
        };
    }

    @JsonCreator
    public static NotificationCategory fromValue(String value) {
        for (NotificationCategory category : values()) {
            if (category.value.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown notification category: " + value);
    }
}
