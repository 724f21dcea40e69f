package com.threadline.notificationservice.job;

import com.threadline.notificationservice.config.NotificationRetentionProperties;
import com.threadline.notificationservice.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes notifications past their expiry or older than the retention window.
 * Safe to run repeatedly; a run with nothing eligible deletes nothing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetentionSweeper {

    private final NotificationRepository notificationRepository;
    private final NotificationRetentionProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${notification.retention.cron:0 0 3 * * *}")
    public void scheduledCleanup() {
        if (!properties.isEnabled()) {
            log.debug("Retention sweep disabled, skipping");
            return;
        }
        try {
            cleanupExpired();
        } catch (RuntimeException e) {
            // Next scheduled run picks up whatever this one missed
            log.error("Retention sweep failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of notifications deleted
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofDays(properties.getRetentionDays()));

        int deleted = notificationRepository.deleteExpired(now, cutoff);

        if (deleted > 0) {
            log.info("Retention sweep deleted notifications: count={}, cutoff={}", deleted, cutoff);
        } else {
            log.debug("Retention sweep found nothing to delete: cutoff={}", cutoff);
        }
        return deleted;
    }
}
