package com.threadline.notificationservice.subscriber;

import com.threadline.common.contracts.RealtimeEventContract;
import com.threadline.notificationservice.config.AmqpConfig;
import com.threadline.notificationservice.exception.PersistenceFailureException;
import com.threadline.notificationservice.service.EventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.amqp.support.AmqpHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

/**
 * Consumes realtime events published by the business services and runs them
 * through the event pipeline.
 *
 * Events that cannot be recorded, or that are malformed, are rejected without
 * requeue and end up in the dead letter queue.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RealtimeEventSubscriber {

    private final EventPublisher eventPublisher;

    @RabbitListener(queues = AmqpConfig.Q_REALTIME_EVENTS)
    public void handleRealtimeEvent(RealtimeEventContract contract,
                                    @Header(AmqpHeaders.RECEIVED_ROUTING_KEY) String routingKey) {
        log.info("Received realtime event: routingKey={}, tenantId={}, eventType={}, entityId={}",
                routingKey, contract.getTenantId(), contract.getEventType(), contract.getEntityId());

        try {
            eventPublisher.publish(contract);
        } catch (PersistenceFailureException e) {
            log.error("Realtime event could not be recorded, rejecting: routingKey={}, error={}",
                    routingKey, e.getMessage());
            throw new AmqpRejectAndDontRequeueException("Failed to record realtime event", e);
        } catch (IllegalArgumentException e) {
            log.error("Malformed realtime event, rejecting: routingKey={}, error={}", routingKey, e.getMessage());
            throw new AmqpRejectAndDontRequeueException("Malformed realtime event", e);
        }
    }
}
