package io.taskrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AgentStatus {
    IDLE,
    WORKING,
    LISTENING,
    ERROR,
    STOPPED;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AgentStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("agent status must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
