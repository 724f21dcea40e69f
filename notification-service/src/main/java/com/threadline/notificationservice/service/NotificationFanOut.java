package com.threadline.notificationservice.service;

import com.threadline.notificationservice.dto.NotificationDto;
import com.threadline.notificationservice.model.RealtimeEvent;
import com.threadline.notificationservice.service.FanOutResult.RecipientOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

/**
 * Turns one event into per-user inbox notifications.
 *
 * Each recipient is attempted independently: a failed write is recorded in
 * the result and the remaining recipients are still processed. Nothing is
 * thrown to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationFanOut {

    private final AudienceResolver audienceResolver;
    private final NotificationContentFactory contentFactory;
    private final NotificationService notificationService;

    public FanOutResult fanOut(RealtimeEvent event) {
        List<UUID> audience = resolve(event);
        if (audience.isEmpty()) {
            log.debug("No recipients for event: id={}, eventType={}", event.getId(), event.getEventType());
            return FanOutResult.empty();
        }

        List<RecipientOutcome> outcomes = new ArrayList<>(audience.size());
        for (UUID userId : audience) {
            try {
                NotificationDto created = notificationService.createNotification(
                        contentFactory.forRecipient(event, userId));
                outcomes.add(RecipientOutcome.created(userId, created.getId()));
            } catch (RuntimeException e) {
                log.warn("Notification for recipient failed: eventId={}, userId={}, error={}",
                        event.getId(), userId, e.getMessage());
                outcomes.add(RecipientOutcome.failed(userId, e.getMessage() != null
                        ? e.getMessage()
                        : e.getClass().getSimpleName()));
            }
        }

        FanOutResult result = new FanOutResult(List.copyOf(outcomes));
        log.info("Fan-out finished: eventId={}, tenantId={}, created={}, failed={}",
                event.getId(), event.getTenantId(), result.getCreated(), result.getFailed());
        return result;
    }

    private List<UUID> resolve(RealtimeEvent event) {
        try {
            List<UUID> resolved = audienceResolver.resolveAudience(event);
            if (resolved == null) {
                return List.of();
            }
            // One notification per user even if the policy lists someone twice
            LinkedHashSet<UUID> unique = new LinkedHashSet<>(resolved);
            unique.remove(null);
            return new ArrayList<>(unique);
        } catch (RuntimeException e) {
            log.warn("Audience resolution failed, treating as no recipients: eventId={}, error={}",
                    event.getId(), e.getMessage(), e);
            return List.of();
        }
    }
}
