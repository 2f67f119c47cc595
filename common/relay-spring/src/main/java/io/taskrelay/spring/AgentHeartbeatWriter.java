package io.taskrelay.spring;

import io.taskrelay.store.StateStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically refreshes {@code last_heartbeat} of the local agent, independent of message
 * processing.
 */
public class AgentHeartbeatWriter {

    private static final Logger log = LoggerFactory.getLogger(AgentHeartbeatWriter.class);

    private final StateStore store;
    private final String agentId;
    private final Clock clock;

    public AgentHeartbeatWriter(StateStore store, String agentId, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Scheduled(fixedRateString = "#{@relayAgentProperties.heartbeatInterval.toMillis()}")
    public void beat() {
        Instant now = clock.instant();
        store.recordHeartbeat(agentId, now);
        if (log.isTraceEnabled()) {
            log.trace("Heartbeat for agent '{}' at {}", agentId, now);
        }
    }
}
