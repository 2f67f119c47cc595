package io.taskrelay.sync.handlers;

import io.taskrelay.message.RelayMessage;
import io.taskrelay.message.TaskUpdatePayload;
import io.taskrelay.model.Task;
import io.taskrelay.store.StateStore;
import io.taskrelay.sync.HandlerContext;
import io.taskrelay.sync.HandlerResult;
import io.taskrelay.sync.StateChangeHandler;
import io.taskrelay.sync.TaskStateMachine;
import io.taskrelay.sync.TaskTransition;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Handles {@code task_update}: a progress report that moves the task forward.
 */
public class TaskUpdateHandler implements StateChangeHandler {

    private final Clock clock;

    public TaskUpdateHandler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public HandlerResult handle(RelayMessage message, HandlerContext context, StateStore store) {
        TaskUpdatePayload payload = message.payloadAs(TaskUpdatePayload.class);
        String taskId = message.taskId();
        Instant now = clock.instant();

        Optional<Task> existing = store.getTask(taskId);
        if (existing.isEmpty()) {
            store.logActivity(context.agentId(), ActivityTypes.TASK_UPDATE_ORPHANED, Details.of("task_id", taskId)
                .with("status", payload.status().wire())
                .build());
            return HandlerResult.committed("orphaned update for '" + taskId + "'");
        }
        Task task = existing.get();
        TaskTransition transition = TaskStateMachine.evaluate(task.status(), payload.status());
        if (transition.applies()) {
            store.updateTaskStatus(taskId, payload.status(), Details.of(payload.status().timestampKey(), now.toString())
                .withIfPresent("last_note", payload.note())
                .build());
        }
        store.logActivity(context.agentId(), ActivityTypes.TASK_UPDATED, Details.of("task_id", taskId)
            .with("from_status", task.status().wire())
            .with("requested_status", payload.status().wire())
            .with("transition", transition.label())
            .with("note", payload.note())
            .with("agent_id", payload.agentId())
            .build());
        return HandlerResult.committed("task '" + taskId + "' " + transition.label());
    }
}
