package com.threadline.notificationservice.service;

import com.threadline.notificationservice.model.RealtimeEvent;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Explicit recipients plus members of the listed roles, without the actor.
 */
@RequiredArgsConstructor
public class DefaultAudienceResolver implements AudienceResolver {

    private final RoleDirectory roleDirectory;

    @Override
    public List<UUID> resolveAudience(RealtimeEvent event) {
        Set<UUID> audience = new LinkedHashSet<>();

        if (event.getBroadcastToUsers() != null) {
            audience.addAll(event.getBroadcastToUsers());
        }
        if (event.getBroadcastToRoles() != null && !event.getBroadcastToRoles().isEmpty()) {
            audience.addAll(roleDirectory.findUserIds(event.getTenantId(), event.getBroadcastToRoles()));
        }
        if (event.getActorUserId() != null) {
            audience.remove(event.getActorUserId());
        }
        audience.remove(null);

        return new ArrayList<>(audience);
    }
}
