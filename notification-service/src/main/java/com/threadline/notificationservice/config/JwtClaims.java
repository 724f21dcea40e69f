package com.threadline.notificationservice.config;

import org.springframework.security.oauth2.jwt.Jwt;

import java.util.UUID;

/**
 * Claim names issued by the identity provider and helpers to read them.
 * The subject is the user id and org_id is the tenant the token was issued for.
 */
public final class JwtClaims {

    public static final String TENANT_ID = "org_id";
    public static final String ROLES = "roles";

    private JwtClaims() {
    }

    public static UUID userId(Jwt jwt) {
        return parse(jwt.getSubject(), "sub");
    }

    public static UUID tenantId(Jwt jwt) {
        return parse(jwt.getClaimAsString(TENANT_ID), TENANT_ID);
    }

    private static UUID parse(String value, String claim) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Token is missing the " + claim + " claim");
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Token claim " + claim + " is not a valid id");
        }
    }
}
