package io.taskrelay.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record ActivityLogEntry(
    long id,
    String agentId,
    String activityType,
    Map<String, Object> details,
    Instant loggedAt
) {

    public ActivityLogEntry {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(activityType, "activityType");
        details = Maps.freeze(details);
        Objects.requireNonNull(loggedAt, "loggedAt");
    }
}
