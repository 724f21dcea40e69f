package com.threadline.notificationservice.service;

import com.threadline.notificationservice.dto.RealtimeMessage;
import com.threadline.notificationservice.model.MessageType;
import com.threadline.notificationservice.model.RealtimeEvent;
import com.threadline.notificationservice.transport.RealtimeTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Live delivery of stored events.
 *
 * Delivery is at-most-once. Nothing is retried and sessions that connect
 * later do not receive earlier messages. The event is marked processed
 * after the attempt whatever its outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BroadcastRouter {

    private final RealtimeTransport realtimeTransport;
    private final EventStore eventStore;
    private final Clock clock;

    /**
     * @param event a stored event, i.e. one with a generated id
     */
    public void broadcastEvent(RealtimeEvent event) {
        if (event.getId() == null) {
            throw new IllegalArgumentException("Event must be recorded before it is broadcast");
        }

        try {
            if (!event.isBroadcast()) {
                log.debug("Live delivery disabled for event: id={}", event.getId());
                return;
            }

            RealtimeMessage message = toMessage(event);

            if (event.hasExplicitRecipients()) {
                deliverToUsers(event, message);
            } else {
                deliverToTenant(event, message);
            }
        } finally {
            eventStore.markProcessed(event.getId());
        }
    }

    RealtimeMessage toMessage(RealtimeEvent event) {
        Instant now = clock.instant();

        Map<String, Object> payload = new HashMap<>();
        payload.put("event", event.getEventType());
        payload.put("entityType", event.getEntityType() != null ? event.getEntityType().getValue() : null);
        payload.put("entityId", event.getEntityId());
        payload.put("data", event.getPayload());
        payload.put("actorUserId", event.getActorUserId());
        payload.put("timestamp", now);

        return RealtimeMessage.builder()
                .type(MessageType.forEntity(event.getEntityType()))
                .payload(payload)
                .timestamp(now)
                .tenantId(event.getTenantId())
                .build();
    }

    private void deliverToUsers(RealtimeEvent event, RealtimeMessage message) {
        int failed = 0;
        for (UUID userId : event.getBroadcastToUsers()) {
            try {
                realtimeTransport.sendToUser(userId, event.getTenantId(), message);
            } catch (RuntimeException e) {
                failed++;
                log.warn("Live delivery to user failed: eventId={}, userId={}, error={}",
                        event.getId(), userId, e.getMessage());
            }
        }
        log.info("Event broadcast to users: id={}, type={}, recipients={}, failed={}",
                event.getId(), message.getType(), event.getBroadcastToUsers().size(), failed);
    }

    private void deliverToTenant(RealtimeEvent event, RealtimeMessage message) {
        try {
            realtimeTransport.sendToTenant(event.getTenantId(), message);
            log.info("Event broadcast to tenant: id={}, tenantId={}, type={}",
                    event.getId(), event.getTenantId(), message.getType());
        } catch (RuntimeException e) {
            log.warn("Live delivery to tenant failed: eventId={}, tenantId={}, error={}",
                    event.getId(), event.getTenantId(), e.getMessage());
        }
    }
}
