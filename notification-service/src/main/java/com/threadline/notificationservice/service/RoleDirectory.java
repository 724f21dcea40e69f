package com.threadline.notificationservice.service;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Lookup of tenant members by role. Membership data lives in the
 * organization service; this service ships with an empty directory.
 */
public interface RoleDirectory {

    List<UUID> findUserIds(UUID tenantId, Collection<String> roles);
}
