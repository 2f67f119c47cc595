package io.taskrelay.sync.handlers;

import io.taskrelay.message.RelayMessage;
import io.taskrelay.message.RelayMessageCodec;
import io.taskrelay.message.TaskAssignmentPayload;
import io.taskrelay.model.AgentStatus;
import io.taskrelay.model.Task;
import io.taskrelay.model.TaskStatus;
import io.taskrelay.store.StateStore;
import io.taskrelay.sync.HandlerContext;
import io.taskrelay.sync.HandlerResult;
import io.taskrelay.sync.StateChangeHandler;
import io.taskrelay.sync.TaskStateMachine;
import io.taskrelay.sync.TaskTransition;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code task_assignment} on the worker side.
 * <p>
 * The task is created if it does not exist yet (the coordinator normally created it already) and
 * moved to {@code assigned}. The assignee is set to {@code working} on the task, and the receipt
 * plus the raw envelope go to the activity log. A redelivered assignment for a task that has
 * already moved past {@code assigned} leaves the task and the agent untouched.
 */
public class TaskAssignmentHandler implements StateChangeHandler {

    private static final Logger log = LoggerFactory.getLogger(TaskAssignmentHandler.class);

    private final Clock clock;
    private final RelayMessageCodec codec;

    public TaskAssignmentHandler(Clock clock, RelayMessageCodec codec) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public HandlerResult handle(RelayMessage message, HandlerContext context, StateStore store) {
        TaskAssignmentPayload payload = message.payloadAs(TaskAssignmentPayload.class);
        String taskId = message.taskId();
        String assignee = assignee(message, payload, context);
        Instant now = clock.instant();

        store.createTaskIfAbsent(Task.pending(taskId, assignee, payload.priority(), payload.requirements(),
            Details.of("title", payload.title())
                .with("description", payload.description())
                .with("created_via", message.type().wire())
                .build(), now));
        Task current = store.getTask(taskId)
            .orElseThrow(() -> new IllegalStateException("Task '" + taskId + "' vanished after create"));

        TaskTransition transition = TaskStateMachine.evaluate(current.status(), TaskStatus.ASSIGNED);
        if (transition.applies()) {
            store.updateTaskStatus(taskId, TaskStatus.ASSIGNED, Details.of(TaskStatus.ASSIGNED.timestampKey(), now.toString())
                .with("assigned_to", assignee)
                .build());
        }
        boolean stale = current.status().rank() > TaskStatus.ASSIGNED.rank();
        if (stale) {
            log.info("Assignment for task '{}' redelivered after it reached '{}'; leaving task and agent as they are",
                taskId, current.status().wire());
        } else {
            store.updateAgentState(assignee, AgentStatus.WORKING, taskId, Details.of("last_activity", now.toString())
                .with("assigned_by", message.fromRole() == null ? null : message.fromRole().wire())
                .build());
        }

        store.logActivity(context.agentId(), ActivityTypes.TASK_RECEIVED, Details.of("task_id", taskId)
            .with("assigned_to", assignee)
            .with("assigned_by", message.fromRole() == null ? null : message.fromRole().wire())
            .with("assigned_at", message.timestamp() == null ? null : message.timestamp().toString())
            .with("priority", payload.priority().wire())
            .with("description", payload.description())
            .with("duplicate", stale || !transition.applies())
            .build());
        store.logActivity(context.agentId(), ActivityTypes.TASK_ASSIGNMENT_ARCHIVED, Details.of("task_id", taskId)
            .with("archived_at", now.toString())
            .with("assignment_details", codec.toMap(message))
            .build());
        return HandlerResult.committed("task '" + taskId + "' " + transition.label() + " for " + assignee);
    }

    private static String assignee(RelayMessage message, TaskAssignmentPayload payload, HandlerContext context) {
        if (payload.assignedTo() != null && !payload.assignedTo().isBlank()) {
            return payload.assignedTo().trim();
        }
        if (message.toRole() != null) {
            return message.toRole().defaultAgentId();
        }
        return context.agentId();
    }
}
