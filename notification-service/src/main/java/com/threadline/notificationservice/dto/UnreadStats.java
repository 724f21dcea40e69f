package com.threadline.notificationservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Unread totals for one user in one tenant. Every category is present,
 * zero when it has no unread notifications.
 */
@Data
@Builder
public class UnreadStats {
    private long total;
    private Map<String, Long> byCategory; // keyed by category wire value
}
