package io.taskrelay.spring;

import io.taskrelay.model.AgentRole;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the local agent and its background duties ({@code taskrelay.agent.*}).
 */
@Validated
@ConfigurationProperties(prefix = "taskrelay.agent")
public class RelayAgentProperties {

    @NotNull
    private AgentRole role;
    private String agentId;
    private Duration heartbeatInterval = Duration.ofSeconds(30);
    private boolean heartbeatEnabled = true;
    private boolean autoStartup = true;

    public AgentRole getRole() {
        return role;
    }

    public void setRole(AgentRole role) {
        this.role = role;
    }

    public String getAgentId() {
        return agentId;
    }

    public void setAgentId(String agentId) {
        this.agentId = agentId;
    }

    /**
     * The configured agent id, or the role's default id when none is set.
     */
    public String resolveAgentId() {
        if (agentId != null && !agentId.isBlank()) {
            return agentId.trim();
        }
        return Objects.requireNonNull(role, "taskrelay.agent.role must be set").defaultAgentId();
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
    }

    public boolean isHeartbeatEnabled() {
        return heartbeatEnabled;
    }

    public void setHeartbeatEnabled(boolean heartbeatEnabled) {
        this.heartbeatEnabled = heartbeatEnabled;
    }

    /**
     * Whether queue consumers start with the application context.
     */
    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }
}
