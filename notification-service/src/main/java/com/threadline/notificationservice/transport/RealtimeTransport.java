package com.threadline.notificationservice.transport;

import com.threadline.notificationservice.dto.RealtimeMessage;

import java.util.UUID;

/**
 * Live-connection transport. Fire-and-forget: no delivery acknowledgment is
 * observed and nothing is queued for sessions that are not connected.
 */
public interface RealtimeTransport {

    /**
     * Delivers to every live session of the user under the tenant.
     * No-op if the user has no live session.
     *
     * @throws com.threadline.notificationservice.exception.DeliveryFailureException
     *         if the message could not be handed to the broker
     */
    void sendToUser(UUID userId, UUID tenantId, RealtimeMessage message);

    /**
     * Delivers to every live session under the tenant.
     *
     * @throws com.threadline.notificationservice.exception.DeliveryFailureException
     *         if the message could not be handed to the broker
     */
    void sendToTenant(UUID tenantId, RealtimeMessage message);
}
