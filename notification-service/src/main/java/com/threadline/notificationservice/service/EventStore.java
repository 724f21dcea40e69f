package com.threadline.notificationservice.service;

import com.threadline.common.contracts.RealtimeEventContract;
import com.threadline.notificationservice.exception.PersistenceFailureException;
import com.threadline.notificationservice.model.RealtimeEvent;
import com.threadline.notificationservice.repository.RealtimeEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Durable, append-only record of realtime events.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventStore {

    private final RealtimeEventRepository realtimeEventRepository;
    private final Clock clock;

    /**
     * Persists the event with processedAt unset. Delivery must not be
     * attempted when this throws.
     *
     * @throws PersistenceFailureException if the store rejects the write
     */
    public RealtimeEvent recordEvent(RealtimeEventContract contract) {
        RealtimeEvent event = RealtimeEvent.builder()
                .tenantId(contract.getTenantId())
                .eventType(contract.getEventType())
                .entityType(contract.getEntityType())
                .entityId(contract.getEntityId())
                .actorUserId(contract.getActorUserId())
                .payload(contract.getPayload())
                .broadcastToUsers(copyOrNull(contract.getBroadcastToUsers()))
                .broadcastToRoles(copyOrNull(contract.getBroadcastToRoles()))
                .broadcast(contract.isBroadcast())
                .createdAt(clock.instant())
                .build();

        try {
            RealtimeEvent saved = realtimeEventRepository.saveAndFlush(event);
            log.info("Realtime event recorded: id={}, tenantId={}, eventType={}, entity={}:{}",
                    saved.getId(), saved.getTenantId(), saved.getEventType(),
                    saved.getEntityType(), saved.getEntityId());
            return saved;
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to record realtime event: tenantId={}, eventType={}, error={}",
                    contract.getTenantId(), contract.getEventType(), e.getMessage(), e);
            throw new PersistenceFailureException("Failed to record realtime event", e);
        }
    }

    /**
     * Sets processedAt once. Later calls leave the first timestamp in place.
     * A failed write is logged only; it never undoes or retries delivery.
     */
    public void markProcessed(UUID eventId) {
        try {
            int updated = realtimeEventRepository.markProcessed(eventId, clock.instant());
            if (updated == 0) {
                log.debug("Realtime event already processed or missing: id={}", eventId);
            } else {
                log.debug("Realtime event marked processed: id={}", eventId);
            }
        } catch (RuntimeException e) {
            log.error("Failed to mark realtime event processed: id={}, error={}", eventId, e.getMessage(), e);
        }
    }

    private static <T> List<T> copyOrNull(List<T> values) {
        return values == null ? null : List.copyOf(values);
    }
}
