package com.threadline.notificationservice.service;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Per-recipient outcomes of one fan-out run.
 */
@Value
public class FanOutResult {

    List<RecipientOutcome> outcomes;

    public static FanOutResult empty() {
        return new FanOutResult(List.of());
    }

    public int getCreated() {
        return (int) outcomes.stream().filter(RecipientOutcome::isSucceeded).count();
    }

    public int getFailed() {
        return outcomes.size() - getCreated();
    }

    @Value
    public static class RecipientOutcome {
        UUID userId;
        UUID notificationId; // null when failed
        String error;        // null when succeeded

        public static RecipientOutcome created(UUID userId, UUID notificationId) {
            return new RecipientOutcome(userId, notificationId, null);
        }

        public static RecipientOutcome failed(UUID userId, String error) {
            return new RecipientOutcome(userId, null, error);
        }

        public boolean isSucceeded() {
            return error == null;
        }
    }
}
