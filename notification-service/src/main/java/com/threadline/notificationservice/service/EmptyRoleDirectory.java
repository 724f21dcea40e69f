package com.threadline.notificationservice.service;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Directory with no members. Role-targeted events reach only their explicit
 * recipients until a real directory bean is provided.
 */
@Slf4j
public class EmptyRoleDirectory implements RoleDirectory {

    @Override
    public List<UUID> findUserIds(UUID tenantId, Collection<String> roles) {
        log.debug("No role directory configured, roles resolve to nobody: tenantId={}, roles={}", tenantId, roles);
        return List.of();
    }
}
