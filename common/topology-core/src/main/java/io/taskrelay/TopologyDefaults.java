package io.taskrelay;

/**
 * Compile-time constants for the default TaskRelay topology. {@link RelayTopology#defaults()}
 * is built from these values; deployments override them through configuration.
 */
public final class TopologyDefaults {

  private TopologyDefaults() {
  }

  public static final String EXCHANGE = "agent-network";

  public static final String COORDINATOR_INBOX = "coordinator-inbox";

  public static final String WORKER_INBOX = "worker-inbox";

  public static final String REQUIREMENTS_INBOX = "requirements-inbox";

  public static final String WORK_REQUEST_INBOX = "work-request-inbox";
}
