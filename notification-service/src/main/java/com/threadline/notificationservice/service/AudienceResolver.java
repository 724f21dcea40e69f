package com.threadline.notificationservice.service;

import com.threadline.notificationservice.model.RealtimeEvent;

import java.util.List;
import java.util.UUID;

/**
 * Policy deciding which users get an inbox notification for an event.
 * Implementations must not have side effects. Exceptions are treated by the
 * caller as "no recipients".
 */
public interface AudienceResolver {

    List<UUID> resolveAudience(RealtimeEvent event);
}
