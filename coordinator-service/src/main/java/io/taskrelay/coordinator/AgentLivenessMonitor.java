package io.taskrelay.coordinator;

import io.taskrelay.model.AgentState;
import io.taskrelay.store.StateStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Reports agents whose heartbeat is missing or older than the liveness timeout. Read-only: agent
 * state is never changed here.
 */
public class AgentLivenessMonitor {

  private static final Logger log = LoggerFactory.getLogger(AgentLivenessMonitor.class);

  private final StateStore store;
  private final Duration timeout;
  private final Clock clock;

  public AgentLivenessMonitor(StateStore store, Duration timeout, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public List<AgentState> findUnresponsiveAgents() {
    Instant cutoff = clock.instant().minus(timeout);
    return store.listAgentStates().stream()
        .filter(agent -> agent.lastHeartbeat() == null || agent.lastHeartbeat().isBefore(cutoff))
        .toList();
  }

  @Scheduled(fixedDelayString = "#{@coordinatorProperties.livenessCheckInterval.toMillis()}",
      initialDelayString = "#{@coordinatorProperties.livenessCheckInterval.toMillis()}")
  public void check() {
    for (AgentState agent : findUnresponsiveAgents()) {
      log.warn("Agent '{}' is unresponsive: status={}, task={}, last heartbeat={}", agent.agentId(),
          agent.status().wire(), agent.currentTaskId() == null ? "n/a" : agent.currentTaskId(),
          agent.lastHeartbeat() == null ? "never" : agent.lastHeartbeat());
    }
  }
}
