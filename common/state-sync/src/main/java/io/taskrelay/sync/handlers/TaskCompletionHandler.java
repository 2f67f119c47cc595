package io.taskrelay.sync.handlers;

import io.taskrelay.message.RelayMessage;
import io.taskrelay.message.TaskCompletionPayload;
import io.taskrelay.model.AgentState;
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
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code task_completion}: moves the task to its terminal outcome and releases the agent
 * that did the work back to {@code idle}. Completions for unknown tasks are logged and
 * acknowledged, since redelivering them cannot make the task appear.
 */
public class TaskCompletionHandler implements StateChangeHandler {

    private static final Logger log = LoggerFactory.getLogger(TaskCompletionHandler.class);

    private final Clock clock;

    public TaskCompletionHandler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public HandlerResult handle(RelayMessage message, HandlerContext context, StateStore store) {
        TaskCompletionPayload payload = message.payloadAs(TaskCompletionPayload.class);
        String taskId = message.taskId();
        Instant now = clock.instant();

        Optional<Task> existing = store.getTask(taskId);
        if (existing.isEmpty()) {
            log.info("Completion for unknown task '{}' from {}", taskId,
                message.fromRole() == null ? "n/a" : message.fromRole().wire());
            store.logActivity(context.agentId(), ActivityTypes.TASK_COMPLETION_ORPHANED, Details.of("task_id", taskId)
                .with("outcome", payload.outcome().wire())
                .with("completed_by", payload.completedBy())
                .build());
            return HandlerResult.committed("orphaned completion for '" + taskId + "'");
        }
        Task task = existing.get();
        TaskStatus outcome = payload.outcome();
        TaskTransition transition = TaskStateMachine.evaluate(task.status(), outcome);

        String agentId = completingAgent(message, payload, task);
        if (transition.applies()) {
            store.updateTaskStatus(taskId, outcome, Details.of(outcome.timestampKey(), now.toString())
                .withIfPresent("completed_by", agentId)
                .withIfPresent("summary", payload.summary())
                .withIfPresent("deliverables", payload.deliverables().isEmpty() ? null : payload.deliverables())
                .withIfPresent("error", payload.error())
                .build());
            if (agentId != null) {
                releaseAgent(store, agentId, taskId, now);
            }
        }

        String activityType = !transition.applies()
            ? ActivityTypes.TASK_COMPLETION_DUPLICATE
            : outcome == TaskStatus.FAILED ? ActivityTypes.TASK_FAILED : ActivityTypes.TASK_COMPLETED;
        store.logActivity(context.agentId(), activityType, Details.of("task_id", taskId)
            .with("outcome", outcome.wire())
            .with("previous_status", task.status().wire())
            .with("completed_by", agentId)
            .with("summary", payload.summary())
            .with("error", payload.error())
            .with("completed_at", now.toString())
            .build());
        return HandlerResult.committed("task '" + taskId + "' " + transition.label() + " -> " + outcome.wire());
    }

    /**
     * Releases the agent only while it still points at this task (or at nothing), so a late
     * completion cannot knock an agent off newer work.
     */
    private static void releaseAgent(StateStore store, String agentId, String taskId, Instant now) {
        Optional<AgentState> agent = store.getAgentState(agentId);
        String current = agent.map(AgentState::currentTaskId).orElse(null);
        if (current != null && !current.equals(taskId)) {
            log.debug("Agent '{}' already moved on to '{}'; not releasing for '{}'", agentId, current, taskId);
            return;
        }
        store.updateAgentState(agentId, AgentStatus.IDLE, null, Details.of("last_completed_task", taskId)
            .with("last_activity", now.toString())
            .build());
    }

    private static String completingAgent(RelayMessage message, TaskCompletionPayload payload, Task task) {
        if (payload.completedBy() != null && !payload.completedBy().isBlank()) {
            return payload.completedBy().trim();
        }
        if (task.assignedTo() != null) {
            return task.assignedTo();
        }
        return message.fromRole() == null ? null : message.fromRole().defaultAgentId();
    }
}
