package io.taskrelay.message;

import java.time.Instant;
import java.util.Objects;

/**
 * Written by the publisher on every publish attempt; {@code messageId} is fresh per attempt.
 */
public record BrokerMetadata(String messageId, Instant publishedAt, String queue) {

    public BrokerMetadata {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(publishedAt, "publishedAt");
        Objects.requireNonNull(queue, "queue");
    }
}
