package io.taskrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a wire value; {@code null} or blank means {@link #MEDIUM}.
     */
    @JsonCreator
    public static TaskPriority fromWire(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
