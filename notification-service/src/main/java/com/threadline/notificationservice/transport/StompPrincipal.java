package com.threadline.notificationservice.transport;

import java.security.Principal;
import java.util.Objects;
import java.util.UUID;

/**
 * Principal of an authenticated STOMP session. The name combines tenant and
 * user so user destinations only reach sessions opened under that tenant.
 */
public final class StompPrincipal implements Principal {

    private final UUID userId;
    private final UUID tenantId;

    public StompPrincipal(UUID userId, UUID tenantId) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
    }

    public static String nameFor(UUID tenantId, UUID userId) {
        return tenantId + ":" + userId;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getTenantId() {
        return tenantId;
    }

    @Override
    public String getName() {
        return nameFor(tenantId, userId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StompPrincipal other)) {
            return false;
        }
        return userId.equals(other.userId) && tenantId.equals(other.tenantId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, tenantId);
    }

    @Override
    public String toString() {
        return getName();
    }
}
