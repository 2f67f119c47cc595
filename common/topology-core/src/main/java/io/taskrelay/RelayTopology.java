package io.taskrelay;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The fixed broker topology: one durable direct exchange and the durable queues bound to it,
 * each with a routing key equal to its own name.
 */
public record RelayTopology(
    String exchange,
    String coordinatorInbox,
    String workerInbox,
    String requirementsInbox,
    String workRequestInbox
) {

  public RelayTopology {
    exchange = requireNonBlank("exchange", exchange);
    coordinatorInbox = requireNonBlank("coordinatorInbox", coordinatorInbox);
    workerInbox = requireNonBlank("workerInbox", workerInbox);
    requirementsInbox = requireNonBlank("requirementsInbox", requirementsInbox);
    workRequestInbox = requireNonBlank("workRequestInbox", workRequestInbox);
    Set<String> distinct = new LinkedHashSet<>(
        List.of(coordinatorInbox, workerInbox, requirementsInbox, workRequestInbox));
    if (distinct.size() != 4) {
      throw new IllegalArgumentException("queue names must be distinct: " + distinct);
    }
  }

  public static RelayTopology defaults() {
    return new RelayTopology(
        TopologyDefaults.EXCHANGE,
        TopologyDefaults.COORDINATOR_INBOX,
        TopologyDefaults.WORKER_INBOX,
        TopologyDefaults.REQUIREMENTS_INBOX,
        TopologyDefaults.WORK_REQUEST_INBOX);
  }

  /**
   * All declared queues in declaration order.
   */
  public List<String> queues() {
    return List.of(coordinatorInbox, workerInbox, requirementsInbox, workRequestInbox);
  }

  public boolean declares(String queueName) {
    return queueName != null && queues().contains(queueName);
  }

  public String requireQueue(String queueName) {
    if (!declares(queueName)) {
      throw new IllegalArgumentException(
          "Queue '%s' is not part of the declared topology %s".formatted(queueName, queues()));
    }
    return queueName;
  }

  private static String requireNonBlank(String field, String value) {
    Objects.requireNonNull(value, field);
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
    return trimmed;
  }
}
