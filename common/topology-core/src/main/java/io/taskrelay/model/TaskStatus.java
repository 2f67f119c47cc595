package io.taskrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Task lifecycle states. {@link #rank()} orders the lifecycle; both terminal states share the
 * highest rank.
 */
public enum TaskStatus {
    PENDING(0),
    ASSIGNED(1),
    IN_PROGRESS(2),
    COMPLETED(3),
    FAILED(3);

    private final int rank;

    TaskStatus(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Metadata key holding the time a task entered this status, e.g. {@code assigned_at}.
     */
    public String timestampKey() {
        return wire() + "_at";
    }

    @JsonCreator
    public static TaskStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("task status must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
