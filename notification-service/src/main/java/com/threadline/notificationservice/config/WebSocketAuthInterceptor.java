package com.threadline.notificationservice.config;

import com.threadline.notificationservice.transport.StompPrincipal;
import com.threadline.notificationservice.transport.StompRealtimeTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

import java.security.Principal;
import java.util.Collections;
import java.util.List;

/**
 * Authenticates STOMP sessions and guards subscriptions.
 *
 * CONNECT must carry "Authorization: Bearer {jwt}" as a STOMP header (never a
 * query parameter). The session principal is bound to the token's user and
 * tenant. SUBSCRIBE is allowed for the caller's own user destinations and the
 * topic of the caller's own tenant.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketAuthInterceptor implements ChannelInterceptor {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String USER_DESTINATION_PREFIX = "/user/";

    private final JwtDecoder jwtDecoder;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null) {
            return message;
        }

        if (StompCommand.CONNECT.equals(accessor.getCommand())) {
            authenticate(accessor);
        } else if (StompCommand.SUBSCRIBE.equals(accessor.getCommand())) {
            authorizeSubscription(accessor);
        }

        return message;
    }

    private void authenticate(StompHeaderAccessor accessor) {
        List<String> authorizationHeaders = accessor.getNativeHeader("Authorization");

        if (authorizationHeaders == null || authorizationHeaders.isEmpty()) {
            log.warn("WebSocket connection attempt without Authorization header");
            throw new IllegalArgumentException("Missing Authorization header");
        }

        String authHeader = authorizationHeaders.get(0);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            log.warn("WebSocket connection attempt without Bearer token");
            throw new IllegalArgumentException("Authorization header must start with 'Bearer '");
        }

        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(authHeader.substring(BEARER_PREFIX.length()));
        } catch (JwtException e) {
            log.error("WebSocket JWT validation failed: {}", e.getMessage());
            throw new IllegalArgumentException("Invalid JWT token");
        }

        StompPrincipal principal = new StompPrincipal(JwtClaims.userId(jwt), JwtClaims.tenantId(jwt));

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                principal,
                null,
                Collections.singletonList(new SimpleGrantedAuthority("ROLE_USER")));
        accessor.setUser(authentication);

        log.info("WebSocket authentication successful: userId={}, tenantId={}",
                principal.getUserId(), principal.getTenantId());
    }

    private void authorizeSubscription(StompHeaderAccessor accessor) {
        StompPrincipal principal = resolvePrincipal(accessor.getUser());
        if (principal == null) {
            log.warn("WebSocket subscription attempt without authentication");
            throw new IllegalArgumentException("Not authenticated");
        }

        String destination = accessor.getDestination();
        if (destination == null) {
            throw new IllegalArgumentException("Missing destination");
        }

        // User destinations resolve to the subscriber's own session only
        if (destination.startsWith(USER_DESTINATION_PREFIX)) {
            return;
        }
        if (destination.equals(StompRealtimeTransport.tenantDestination(principal.getTenantId()))) {
            return;
        }

        log.warn("WebSocket subscription denied: userId={}, tenantId={}, destination={}",
                principal.getUserId(), principal.getTenantId(), destination);
        throw new IllegalArgumentException("Subscription not allowed: " + destination);
    }

    private StompPrincipal resolvePrincipal(Principal user) {
        if (user instanceof StompPrincipal stompPrincipal) {
            return stompPrincipal;
        }
        if (user instanceof Authentication authentication
                && authentication.getPrincipal() instanceof StompPrincipal stompPrincipal) {
            return stompPrincipal;
        }
        return null;
    }
}
