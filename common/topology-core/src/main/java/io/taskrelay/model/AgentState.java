package io.taskrelay.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Current status of one agent. {@code lastHeartbeat} is refreshed by the heartbeat writer and is
 * {@code null} until the first beat.
 */
public record AgentState(
    String agentId,
    AgentStatus status,
    String currentTaskId,
    Instant lastHeartbeat,
    Map<String, Object> metadata,
    Instant updatedAt
) {

    public AgentState {
        Objects.requireNonNull(agentId, "agentId");
        if (agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        status = Objects.requireNonNull(status, "status");
        metadata = Maps.freeze(metadata);
        updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public AgentState withStatus(AgentStatus newStatus, String taskId, Map<String, Object> extraMetadata, Instant at) {
        return new AgentState(agentId, newStatus, taskId, lastHeartbeat, Maps.merge(metadata, extraMetadata), at);
    }

    public AgentState withHeartbeat(Instant at) {
        return new AgentState(agentId, status, currentTaskId, at, metadata, updatedAt);
    }
}
