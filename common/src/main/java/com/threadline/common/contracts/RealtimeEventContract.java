package com.threadline.common.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.threadline.common.model.EntityType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Contract for domain events published by the order, design, manufacturing
 * and fulfillment services.
 *
 * Published to realtime_events_exchange with routing key
 * realtime.{entity_type}.{event_type}, e.g. realtime.order.order_updated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeEventContract {
    private UUID tenantId;
    private String eventType;          // free-form code, e.g. order_updated
    private EntityType entityType;
    private UUID entityId;
    private UUID actorUserId;          // null for system-generated events
    private Map<String, Object> payload;
    private List<UUID> broadcastToUsers;
    private List<String> broadcastToRoles;

    @JsonProperty("isBroadcast")
    @Builder.Default
    private boolean broadcast = true;

    @Builder.Default
    private boolean createNotifications = true;

    /**
     * Routing key producers should use when publishing this contract.
     */
    public String routingKey() {
        String entity = entityType != null ? entityType.getValue() : "unknown";
        return "realtime." + entity + "." + eventType;
    }
}
