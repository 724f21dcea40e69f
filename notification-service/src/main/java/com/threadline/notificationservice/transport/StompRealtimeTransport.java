package com.threadline.notificationservice.transport;

import com.threadline.notificationservice.dto.RealtimeMessage;
import com.threadline.notificationservice.exception.DeliveryFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.user.SimpUserRegistry;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * {@link RealtimeTransport} over the STOMP simple broker.
 *
 * Users receive on /user/queue/events; tenant-wide messages go to
 * /topic/tenants/{tenantId}/events.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StompRealtimeTransport implements RealtimeTransport {

    public static final String USER_QUEUE = "/queue/events";
    public static final String TENANT_TOPIC_PREFIX = "/topic/tenants/";
    public static final String TENANT_TOPIC_SUFFIX = "/events";

    private final SimpMessagingTemplate messagingTemplate;
    private final SimpUserRegistry userRegistry;

    public static String tenantDestination(UUID tenantId) {
        return TENANT_TOPIC_PREFIX + tenantId + TENANT_TOPIC_SUFFIX;
    }

    @Override
    public void sendToUser(UUID userId, UUID tenantId, RealtimeMessage message) {
        String principalName = StompPrincipal.nameFor(tenantId, userId);

        if (userRegistry.getUser(principalName) == null) {
            log.debug("No live session, skipping: userId={}, tenantId={}, type={}",
                    userId, tenantId, message.getType());
            return;
        }

        try {
            messagingTemplate.convertAndSendToUser(principalName, USER_QUEUE, message);
            log.debug("Message sent to user: userId={}, tenantId={}, type={}", userId, tenantId, message.getType());
        } catch (MessagingException e) {
            throw new DeliveryFailureException("Failed to deliver to user " + userId, e);
        }
    }

    @Override
    public void sendToTenant(UUID tenantId, RealtimeMessage message) {
        try {
            messagingTemplate.convertAndSend(tenantDestination(tenantId), message);
            log.debug("Message sent to tenant: tenantId={}, type={}", tenantId, message.getType());
        } catch (MessagingException e) {
            throw new DeliveryFailureException("Failed to deliver to tenant " + tenantId, e);
        }
    }
}
