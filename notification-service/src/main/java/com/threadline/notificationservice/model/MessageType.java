package com.threadline.notificationservice.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.threadline.common.model.EntityType;

/**
 * Type field of the envelope pushed to live WebSocket sessions.
 */
public enum MessageType {
    NOTIFICATION("notification"),
    ORDER_UPDATE("order_update"),
    ORDER_ITEM_UPDATE("order_item_update"),
    DESIGN_JOB_UPDATE("design_job_update"),
    WORK_ORDER_UPDATE("work_order_update"),
    PURCHASE_ORDER_UPDATE("purchase_order_update"),
    FULFILLMENT_UPDATE("fulfillment_update");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static MessageType forEntity(EntityType entityType) {
        if (entityType == null) {
            return NOTIFICATION;
        }
        return switch (entityType) {
            case ORDER -> ORDER_UPDATE;
            case ORDER_ITEM -> ORDER_ITEM_UPDATE;
            case DESIGN_JOB -> DESIGN_JOB_UPDATE;
            case WORK_ORDER -> WORK_ORDER_UPDATE;
            case PURCHASE_ORDER -> PURCHASE_ORDER_UPDATE;
            case FULFILLMENT -> FULFILLMENT_UPDATE;
        };
    }
}
