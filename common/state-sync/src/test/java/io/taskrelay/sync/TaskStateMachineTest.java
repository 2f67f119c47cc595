package io.taskrelay.sync;

import static org.assertj.core.api.Assertions.assertThat;

import io.taskrelay.model.TaskStatus;
import org.junit.jupiter.api.Test;

class TaskStateMachineTest {

    @Test
    void forwardMovesApplyIncludingSkips() {
        assertThat(TaskStateMachine.evaluate(TaskStatus.PENDING, TaskStatus.ASSIGNED)).isEqualTo(TaskTransition.APPLY);
        assertThat(TaskStateMachine.evaluate(TaskStatus.ASSIGNED, TaskStatus.IN_PROGRESS)).isEqualTo(TaskTransition.APPLY);
        assertThat(TaskStateMachine.evaluate(TaskStatus.IN_PROGRESS, TaskStatus.COMPLETED)).isEqualTo(TaskTransition.APPLY);
        assertThat(TaskStateMachine.evaluate(TaskStatus.ASSIGNED, TaskStatus.FAILED)).isEqualTo(TaskTransition.APPLY);
        assertThat(TaskStateMachine.evaluate(TaskStatus.PENDING, TaskStatus.COMPLETED)).isEqualTo(TaskTransition.APPLY);
    }

    @Test
    void repeatsAndBackwardMovesAreNoOps() {
        assertThat(TaskStateMachine.evaluate(TaskStatus.ASSIGNED, TaskStatus.ASSIGNED))
            .isEqualTo(TaskTransition.ALREADY_IN_STATE);
        assertThat(TaskStateMachine.evaluate(TaskStatus.IN_PROGRESS, TaskStatus.ASSIGNED))
            .isEqualTo(TaskTransition.BACKWARD);
        assertThat(TaskStateMachine.evaluate(TaskStatus.IN_PROGRESS, TaskStatus.PENDING).applies()).isFalse();
    }

    @Test
    void terminalStatesNeverMove() {
        assertThat(TaskStateMachine.evaluate(TaskStatus.COMPLETED, TaskStatus.ASSIGNED))
            .isEqualTo(TaskTransition.FROM_TERMINAL);
        assertThat(TaskStateMachine.evaluate(TaskStatus.COMPLETED, TaskStatus.FAILED))
            .isEqualTo(TaskTransition.FROM_TERMINAL);
        assertThat(TaskStateMachine.evaluate(TaskStatus.FAILED, TaskStatus.FAILED))
            .isEqualTo(TaskTransition.ALREADY_IN_STATE);
    }
}
