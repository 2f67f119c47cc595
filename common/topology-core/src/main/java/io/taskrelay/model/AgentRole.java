package io.taskrelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Logical role of a participant. Each role runs a single agent whose id defaults to the role name.
 */
public enum AgentRole {
    COORDINATOR("coordinator"),
    WORKER("worker");

    private final String wire;

    AgentRole(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public String defaultAgentId() {
        return wire;
    }

    @JsonCreator
    public static AgentRole fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AgentRole role : values()) {
            if (role.wire.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown agent role '" + value + "'");
    }
}
