package io.taskrelay.sync;

import java.util.Objects;

/**
 * Identifies the consumer a message is processed for: the agent that owns the queue and the
 * queue itself.
 */
public record HandlerContext(String agentId, String queueName) {

    public HandlerContext {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(queueName, "queueName");
    }
}
