package io.taskrelay.sync;

import java.util.Locale;

/**
 * Verdict of {@link TaskStateMachine#evaluate}. Only {@link #APPLY} changes anything; the others
 * are successful no-ops.
 */
public enum TaskTransition {
    APPLY,
    ALREADY_IN_STATE,
    BACKWARD,
    FROM_TERMINAL;

    public boolean applies() {
        return this == APPLY;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
