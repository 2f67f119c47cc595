package io.taskrelay.worker;

import io.taskrelay.RelayTopology;
import io.taskrelay.message.RelayMessage;
import io.taskrelay.message.ResourceAllocationPayload;
import io.taskrelay.message.StatusUpdatePayload;
import io.taskrelay.message.TaskCompletionPayload;
import io.taskrelay.message.TaskUpdatePayload;
import io.taskrelay.message.WorkRequestPayload;
import io.taskrelay.messaging.publish.PublishResult;
import io.taskrelay.messaging.publish.RelayPublisher;
import io.taskrelay.model.AgentRole;
import io.taskrelay.model.TaskStatus;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends the worker's reports to the coordinator: task outcomes and progress to the coordinator
 * inbox, resource needs to the requirements inbox, and new work requests to the work-request inbox.
 * Each call returns the publish result unchanged; nothing is written to the state store here.
 */
public class WorkerTaskReporter {

  private static final Logger log = LoggerFactory.getLogger(WorkerTaskReporter.class);

  private final RelayPublisher publisher;
  private final RelayTopology topology;
  private final String agentId;
  private final Clock clock;

  public WorkerTaskReporter(RelayPublisher publisher, String agentId, Clock clock) {
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.topology = publisher.topology();
    this.agentId = Objects.requireNonNull(agentId, "agentId");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public PublishResult reportCompletion(String taskId, String summary, List<String> deliverables) {
    return send(topology.coordinatorInbox(), RelayMessage.taskCompletion(taskId, AgentRole.WORKER,
        AgentRole.COORDINATOR, TaskCompletionPayload.completed(agentId, summary, deliverables), clock.instant()));
  }

  public PublishResult reportFailure(String taskId, String error) {
    return send(topology.coordinatorInbox(), RelayMessage.taskCompletion(taskId, AgentRole.WORKER,
        AgentRole.COORDINATOR, TaskCompletionPayload.failed(agentId, error), clock.instant()));
  }

  public PublishResult reportProgress(String taskId, TaskStatus status, String note) {
    return send(topology.coordinatorInbox(), RelayMessage.taskUpdate(taskId, AgentRole.WORKER,
        AgentRole.COORDINATOR, new TaskUpdatePayload(status, note, agentId), clock.instant()));
  }

  public PublishResult reportStatus(String status, Map<String, Object> details) {
    return send(topology.coordinatorInbox(), RelayMessage.statusUpdate(AgentRole.WORKER, AgentRole.COORDINATOR,
        new StatusUpdatePayload(agentId, status, details), clock.instant()));
  }

  public PublishResult requestResources(String taskId, String resource, Double amount, Map<String, Object> details) {
    return send(topology.requirementsInbox(), RelayMessage.resourceAllocation(taskId, AgentRole.WORKER,
        AgentRole.COORDINATOR, new ResourceAllocationPayload(resource, amount, details), clock.instant()));
  }

  public PublishResult requestWork(String requestId, String type, Map<String, Object> details) {
    return send(topology.workRequestInbox(), RelayMessage.workRequest(requestId, AgentRole.WORKER,
        AgentRole.COORDINATOR, new WorkRequestPayload(type, details), clock.instant()));
  }

  private PublishResult send(String queue, RelayMessage message) {
    PublishResult result = publisher.publish(queue, message);
    if (result.confirmed()) {
      log.info("Reported {} for '{}' to {}", message.type().wire(), safe(message.correlationId()), queue);
    } else {
      log.info("Report {} for '{}' to {} was not confirmed: {}", message.type().wire(),
          safe(message.correlationId()), queue, result.failureReason());
    }
    return result;
  }

  private static String safe(String value) {
    return value == null || value.isBlank() ? "n/a" : value;
  }
}
