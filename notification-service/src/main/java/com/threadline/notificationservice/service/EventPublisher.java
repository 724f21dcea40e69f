package com.threadline.notificationservice.service;

import com.threadline.common.contracts.RealtimeEventContract;
import com.threadline.notificationservice.model.RealtimeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the event pipeline: record, broadcast, then fan out.
 *
 * Only a failed record propagates. Broadcast and fan-out problems are
 * logged inside their components and never reach the producer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventPublisher {

    private final EventStore eventStore;
    private final BroadcastRouter broadcastRouter;
    private final NotificationFanOut notificationFanOut;

    /**
     * @throws com.threadline.notificationservice.exception.PersistenceFailureException
     *         if the event could not be recorded; nothing is delivered in that case
     */
    public RealtimeEvent publish(RealtimeEventContract contract) {
        validate(contract);

        RealtimeEvent event = eventStore.recordEvent(contract);
        broadcastRouter.broadcastEvent(event);

        if (contract.isCreateNotifications()) {
            notificationFanOut.fanOut(event);
        }

        return event;
    }

    private void validate(RealtimeEventContract contract) {
        if (contract.getTenantId() == null) {
            throw new IllegalArgumentException("tenantId is required");
        }
        if (contract.getEventType() == null || contract.getEventType().isBlank()) {
            throw new IllegalArgumentException("eventType is required");
        }
        if (contract.getEntityType() == null) {
            throw new IllegalArgumentException("entityType is required");
        }
        if (contract.getEntityId() == null) {
            throw new IllegalArgumentException("entityId is required");
        }
    }
}
