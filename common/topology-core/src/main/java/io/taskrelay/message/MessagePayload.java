package io.taskrelay.message;

/**
 * Marker for the per-type payload carried by a {@link RelayMessage}.
 */
public sealed interface MessagePayload
    permits TaskAssignmentPayload,
            TaskCompletionPayload,
            TaskUpdatePayload,
            WorkRequestPayload,
            StatusUpdatePayload,
            ResourceAllocationPayload {
}
