package io.taskrelay.message;

import io.taskrelay.model.AgentRole;
import java.time.Instant;
import java.util.Objects;

/**
 * The message envelope exchanged between coordinator and worker. The payload type is fixed by
 * {@link #type()}; {@code brokerMetadata} is {@code null} until the message is published.
 */
public record RelayMessage(
    MessageType type,
    String taskId,
    String requestId,
    AgentRole fromRole,
    AgentRole toRole,
    Instant timestamp,
    MessagePayload payload,
    BrokerMetadata brokerMetadata
) {

    public RelayMessage {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        if (!type.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("payload %s does not match message type %s"
                .formatted(payload.getClass().getSimpleName(), type.wire()));
        }
        taskId = trimToNull(taskId);
        requestId = trimToNull(requestId);
        if (type.requiresTaskId() && taskId == null) {
            throw new IllegalArgumentException(type.wire() + " requires task_id");
        }
        if (type.requiresRequestId() && requestId == null) {
            throw new IllegalArgumentException(type.wire() + " requires request_id");
        }
    }

    public static RelayMessage taskAssignment(String taskId, AgentRole from, AgentRole to,
                                              TaskAssignmentPayload payload, Instant timestamp) {
        return new RelayMessage(MessageType.TASK_ASSIGNMENT, taskId, null, from, to, timestamp, payload, null);
    }

    public static RelayMessage taskCompletion(String taskId, AgentRole from, AgentRole to,
                                              TaskCompletionPayload payload, Instant timestamp) {
        return new RelayMessage(MessageType.TASK_COMPLETION, taskId, null, from, to, timestamp, payload, null);
    }

    public static RelayMessage taskUpdate(String taskId, AgentRole from, AgentRole to,
                                          TaskUpdatePayload payload, Instant timestamp) {
        return new RelayMessage(MessageType.TASK_UPDATE, taskId, null, from, to, timestamp, payload, null);
    }

    public static RelayMessage workRequest(String requestId, AgentRole from, AgentRole to,
                                           WorkRequestPayload payload, Instant timestamp) {
        return new RelayMessage(MessageType.WORK_REQUEST, null, requestId, from, to, timestamp, payload, null);
    }

    public static RelayMessage statusUpdate(AgentRole from, AgentRole to,
                                            StatusUpdatePayload payload, Instant timestamp) {
        return new RelayMessage(MessageType.STATUS_UPDATE, null, null, from, to, timestamp, payload, null);
    }

    public static RelayMessage resourceAllocation(String taskId, AgentRole from, AgentRole to,
                                                  ResourceAllocationPayload payload, Instant timestamp) {
        return new RelayMessage(MessageType.RESOURCE_ALLOCATION, taskId, null, from, to, timestamp, payload, null);
    }

    public RelayMessage withBrokerMetadata(BrokerMetadata metadata) {
        return new RelayMessage(type, taskId, requestId, fromRole, toRole, timestamp, payload,
            Objects.requireNonNull(metadata, "metadata"));
    }

    @SuppressWarnings("unchecked")
    public <P extends MessagePayload> P payloadAs(Class<P> expected) {
        if (!expected.isInstance(payload)) {
            throw new IllegalStateException("expected %s payload for %s but found %s"
                .formatted(expected.getSimpleName(), type.wire(), payload.getClass().getSimpleName()));
        }
        return (P) payload;
    }

    /**
     * The identifier that ties this message to a stored entity: the task id, else the request id.
     */
    public String correlationId() {
        return taskId != null ? taskId : requestId;
    }

    public String messageId() {
        return brokerMetadata == null ? null : brokerMetadata.messageId();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
