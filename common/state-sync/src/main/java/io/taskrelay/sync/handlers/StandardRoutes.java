package io.taskrelay.sync.handlers;

import io.taskrelay.message.MessageType;
import io.taskrelay.message.RelayMessageCodec;
import io.taskrelay.sync.MessageTypeDispatcher;
import java.time.Clock;

/**
 * The message routing of each inbox.
 *
 * <pre>
 * worker-inbox        task_assignment, status_update, resource_allocation
 * coordinator-inbox   task_completion, task_update, status_update
 * requirements-inbox  resource_allocation, status_update
 * work-request-inbox  work_request
 * </pre>
 */
public final class StandardRoutes {

    private StandardRoutes() {
    }

    public static MessageTypeDispatcher workerInbox(Clock clock, RelayMessageCodec codec) {
        return MessageTypeDispatcher.builder()
            .route(MessageType.TASK_ASSIGNMENT, new TaskAssignmentHandler(clock, codec))
            .route(MessageType.STATUS_UPDATE, new ActivityLogHandler(ActivityTypes.STATUS_UPDATE_RECEIVED, codec))
            .route(MessageType.RESOURCE_ALLOCATION, new ActivityLogHandler(ActivityTypes.RESOURCE_ALLOCATED, codec))
            .build();
    }

    public static MessageTypeDispatcher coordinatorInbox(Clock clock, RelayMessageCodec codec) {
        return MessageTypeDispatcher.builder()
            .route(MessageType.TASK_COMPLETION, new TaskCompletionHandler(clock))
            .route(MessageType.TASK_UPDATE, new TaskUpdateHandler(clock))
            .route(MessageType.STATUS_UPDATE, new ActivityLogHandler(ActivityTypes.STATUS_UPDATE_RECEIVED, codec))
            .build();
    }

    public static MessageTypeDispatcher requirementsInbox(RelayMessageCodec codec) {
        return MessageTypeDispatcher.builder()
            .route(MessageType.RESOURCE_ALLOCATION, new ActivityLogHandler(ActivityTypes.RESOURCE_REQUESTED, codec))
            .route(MessageType.STATUS_UPDATE, new ActivityLogHandler(ActivityTypes.STATUS_UPDATE_RECEIVED, codec))
            .build();
    }

    public static MessageTypeDispatcher workRequestInbox(Clock clock) {
        return MessageTypeDispatcher.builder()
            .route(MessageType.WORK_REQUEST, new WorkRequestHandler(clock))
            .build();
    }
}
