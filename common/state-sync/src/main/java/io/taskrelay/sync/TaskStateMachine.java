package io.taskrelay.sync;

import io.taskrelay.model.TaskStatus;
import java.util.Objects;

/**
 * Task lifecycle: {@code pending -> assigned -> in_progress -> completed | failed}. Moves go
 * forward only, and may skip states. Repeating the current state, moving backward, or leaving a
 * terminal state is a no-op rather than an error.
 */
public final class TaskStateMachine {

    private TaskStateMachine() {
    }

    public static TaskTransition evaluate(TaskStatus current, TaskStatus target) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(target, "target");
        if (current == target) {
            return TaskTransition.ALREADY_IN_STATE;
        }
        if (current.isTerminal()) {
            return TaskTransition.FROM_TERMINAL;
        }
        if (target.rank() <= current.rank()) {
            return TaskTransition.BACKWARD;
        }
        return TaskTransition.APPLY;
    }
}
