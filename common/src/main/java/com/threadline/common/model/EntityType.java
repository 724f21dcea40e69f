package com.threadline.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Business entities whose state changes are published as realtime events.
 * The wire value is the snake_case name used by producers and clients.
 */
public enum EntityType {
    ORDER("order", "order"),
    ORDER_ITEM("order_item", "order item"),
    DESIGN_JOB("design_job", "design job"),
    WORK_ORDER("work_order", "work order"),
    PURCHASE_ORDER("purchase_order", "purchase order"),
    FULFILLMENT("fulfillment", "fulfillment");

    private final String value;
    private final String label;

    EntityType(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Human-readable name used in notification titles and messages.
     */
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static EntityType fromValue(String value) {
        for (EntityType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + value);
    }
}
