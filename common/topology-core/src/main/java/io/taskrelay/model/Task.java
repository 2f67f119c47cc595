package io.taskrelay.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical task record as held by the state store.
 */
public record Task(
    String taskId,
    TaskStatus status,
    String assignedTo,
    TaskPriority priority,
    List<String> requirements,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant updatedAt
) {

    public Task {
        taskId = requireNonBlank("taskId", taskId);
        status = Objects.requireNonNull(status, "status");
        assignedTo = trimToNull(assignedTo);
        priority = priority == null ? TaskPriority.MEDIUM : priority;
        requirements = Maps.freezeList(requirements);
        metadata = Maps.freeze(metadata);
        createdAt = Objects.requireNonNull(createdAt, "createdAt");
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    /**
     * A new task in {@link TaskStatus#PENDING}, stamped with {@code pending_at}.
     */
    public static Task pending(String taskId,
                               String assignedTo,
                               TaskPriority priority,
                               List<String> requirements,
                               Map<String, Object> metadata,
                               Instant createdAt) {
        Map<String, Object> stamped = Maps.merge(metadata,
            Map.of(TaskStatus.PENDING.timestampKey(), createdAt.toString()));
        return new Task(taskId, TaskStatus.PENDING, assignedTo, priority, requirements, stamped, createdAt, createdAt);
    }

    public Task withStatus(TaskStatus newStatus, Map<String, Object> extraMetadata, Instant at) {
        return new Task(taskId, newStatus, assignedTo, priority, requirements,
            Maps.merge(metadata, extraMetadata), createdAt, at);
    }

    private static String requireNonBlank(String field, String value) {
        Objects.requireNonNull(value, field);
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
