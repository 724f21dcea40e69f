package com.threadline.notificationservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.threadline.notificationservice.model.MessageType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Envelope pushed to WebSocket sessions.
 *
 * Event messages carry payload {event, entityType, entityId, data, actorUserId, timestamp};
 * notification messages carry payload {notification, action}.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RealtimeMessage {
    private MessageType type;
    private Map<String, Object> payload;
    private Instant timestamp;
    private UUID tenantId;
    private UUID userId; // set only for messages addressed to one user
}
