package io.taskrelay.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A request for work raised by one role towards the other.
 */
public record WorkRequest(
    String requestId,
    AgentRole fromRole,
    String type,
    Map<String, Object> details,
    WorkRequestStatus status,
    Instant createdAt,
    Instant updatedAt
) {

    public WorkRequest {
        Objects.requireNonNull(requestId, "requestId");
        if (requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be blank");
        }
        type = type == null || type.isBlank() ? "general" : type.trim();
        details = Maps.freeze(details);
        status = status == null ? WorkRequestStatus.PENDING : status;
        Objects.requireNonNull(createdAt, "createdAt");
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    public WorkRequest withStatus(WorkRequestStatus newStatus, Instant at) {
        return new WorkRequest(requestId, fromRole, type, details, newStatus, createdAt, at);
    }
}
