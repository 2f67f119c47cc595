package io.taskrelay.message;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of message kinds carried by a {@link RelayMessage}, each bound to exactly one
 * payload type.
 */
public enum MessageType {
    TASK_ASSIGNMENT("task_assignment", TaskAssignmentPayload.class, true, false),
    TASK_COMPLETION("task_completion", TaskCompletionPayload.class, true, false),
    TASK_UPDATE("task_update", TaskUpdatePayload.class, true, false),
    WORK_REQUEST("work_request", WorkRequestPayload.class, false, true),
    STATUS_UPDATE("status_update", StatusUpdatePayload.class, false, false),
    RESOURCE_ALLOCATION("resource_allocation", ResourceAllocationPayload.class, false, false);

    private final String wire;
    private final Class<? extends MessagePayload> payloadType;
    private final boolean requiresTaskId;
    private final boolean requiresRequestId;

    MessageType(String wire,
                Class<? extends MessagePayload> payloadType,
                boolean requiresTaskId,
                boolean requiresRequestId) {
        this.wire = wire;
        this.payloadType = payloadType;
        this.requiresTaskId = requiresTaskId;
        this.requiresRequestId = requiresRequestId;
    }

    public String wire() {
        return wire;
    }

    public Class<? extends MessagePayload> payloadType() {
        return payloadType;
    }

    public boolean requiresTaskId() {
        return requiresTaskId;
    }

    public boolean requiresRequestId() {
        return requiresRequestId;
    }

    public static Optional<MessageType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MessageType type : values()) {
            if (type.wire.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
