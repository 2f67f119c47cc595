package io.taskrelay.coordinator;

import io.taskrelay.message.RelayMessage;
import io.taskrelay.message.TaskAssignmentPayload;
import io.taskrelay.messaging.publish.PublishResult;
import io.taskrelay.messaging.publish.RelayPublisher;
import io.taskrelay.model.AgentRole;
import io.taskrelay.model.Task;
import io.taskrelay.model.TaskStatus;
import io.taskrelay.model.WorkRequestStatus;
import io.taskrelay.store.StateStore;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Creates tasks and hands them to the worker inbox.
 * <p>
 * Creating the task record and notifying the worker are separate steps. A notification that the
 * broker did not confirm never undoes the task record: the task stays {@code pending} and is
 * flagged with {@code notification_pending} until {@link #resendPendingNotifications()} gets a
 * confirmed delivery through.
 */
public class TaskDispatchService {

  private static final Logger log = LoggerFactory.getLogger(TaskDispatchService.class);

  static final String NOTIFICATION_PENDING = "notification_pending";
  static final String NOTIFICATION_ERROR = "notification_error";
  static final String NOTIFICATION_FAILED_AT = "notification_failed_at";
  static final String NOTIFIED_AT = "notified_at";
  static final String TITLE = "title";
  static final String DESCRIPTION = "description";
  static final String WORK_REQUEST_ID = "work_request_id";

  private static final Set<String> BOOKKEEPING_KEYS = Set.of(NOTIFICATION_PENDING, NOTIFICATION_ERROR,
      NOTIFICATION_FAILED_AT, NOTIFIED_AT, TITLE, DESCRIPTION, TaskStatus.PENDING.timestampKey());

  private final RelayPublisher publisher;
  private final StateStore store;
  private final String agentId;
  private final Clock clock;

  public TaskDispatchService(RelayPublisher publisher, StateStore store, String agentId, Clock clock) {
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.store = Objects.requireNonNull(store, "store");
    this.agentId = Objects.requireNonNull(agentId, "agentId");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Records {@code newTask} as pending and publishes its assignment to the worker inbox.
   *
   * @return the publish result of the assignment
   * @throws IllegalStateException if a task with the same id already left {@code pending}
   */
  public PublishResult dispatch(NewTask newTask) {
    Objects.requireNonNull(newTask, "newTask");
    Instant now = clock.instant();
    Map<String, Object> metadata = new LinkedHashMap<>(newTask.metadata());
    putIfPresent(metadata, TITLE, newTask.title());
    putIfPresent(metadata, DESCRIPTION, newTask.description());
    putIfPresent(metadata, WORK_REQUEST_ID, newTask.workRequestId());
    metadata.put("dispatched_by", agentId);

    String taskId = store.createTaskIfAbsent(Task.pending(newTask.taskId(), newTask.assignedTo(),
        newTask.priority(), newTask.requirements(), metadata, now));
    Task stored = requireTask(taskId);
    if (stored.status() != TaskStatus.PENDING) {
      throw new IllegalStateException(
          "Task '%s' was already dispatched and is '%s'".formatted(taskId, stored.status().wire()));
    }

    if (newTask.workRequestId() != null
        && !store.updateWorkRequestStatus(newTask.workRequestId(), WorkRequestStatus.IN_PROGRESS)) {
      log.info("Task '{}' refers to unknown work request '{}'", taskId, newTask.workRequestId());
    }

    TaskAssignmentPayload payload = new TaskAssignmentPayload(newTask.title(), newTask.description(),
        newTask.priority(), newTask.requirements(), newTask.assignedTo(), newTask.metadata());
    return notifyWorker(taskId, payload);
  }

  /**
   * Republishes the assignment of every pending task whose notification was not confirmed.
   *
   * @return the number of notifications confirmed by this pass
   */
  @Scheduled(fixedDelayString = "#{@coordinatorProperties.resendInterval.toMillis()}",
      initialDelayString = "#{@coordinatorProperties.resendInterval.toMillis()}")
  public int resendPendingNotifications() {
    List<Task> flagged = store.findTasksByStatus(TaskStatus.PENDING).stream()
        .filter(task -> Boolean.TRUE.equals(task.metadata().get(NOTIFICATION_PENDING)))
        .toList();
    if (flagged.isEmpty()) {
      return 0;
    }
    int confirmed = 0;
    for (Task task : flagged) {
      if (notifyWorker(task.taskId(), assignmentFor(task)).confirmed()) {
        confirmed++;
      }
    }
    log.info("Resent {} of {} pending task notifications", confirmed, flagged.size());
    return confirmed;
  }

  private PublishResult notifyWorker(String taskId, TaskAssignmentPayload payload) {
    Instant now = clock.instant();
    RelayMessage assignment = RelayMessage.taskAssignment(taskId, AgentRole.COORDINATOR, AgentRole.WORKER,
        payload, now);
    PublishResult result = publisher.publish(publisher.topology().workerInbox(), assignment);

    Map<String, Object> flags = new LinkedHashMap<>();
    if (result.confirmed()) {
      flags.put(NOTIFICATION_PENDING, false);
      flags.put(NOTIFIED_AT, now.toString());
      log.info("Task '{}' sent to {} as {}", taskId, result.queue(), result.messageId());
    } else {
      flags.put(NOTIFICATION_PENDING, true);
      flags.put(NOTIFICATION_ERROR, result.failureReason());
      flags.put(NOTIFICATION_FAILED_AT, now.toString());
      log.info("Task '{}' recorded but its assignment was not confirmed: {}", taskId, result.failureReason());
    }
    if (!store.updateTaskMetadata(taskId, flags)) {
      log.info("Task '{}' disappeared before its notification state could be recorded", taskId);
    }
    return result;
  }

  private static TaskAssignmentPayload assignmentFor(Task task) {
    Map<String, Object> metadata = new LinkedHashMap<>(task.metadata());
    metadata.keySet().removeAll(BOOKKEEPING_KEYS);
    return new TaskAssignmentPayload(text(task.metadata().get(TITLE)), text(task.metadata().get(DESCRIPTION)),
        task.priority(), task.requirements(), task.assignedTo(), metadata);
  }

  private Task requireTask(String taskId) {
    return store.getTask(taskId)
        .orElseThrow(() -> new IllegalStateException("Task '" + taskId + "' is missing from the store"));
  }

  private static void putIfPresent(Map<String, Object> target, String key, String value) {
    if (value != null && !value.isBlank()) {
      target.put(key, value);
    }
  }

  private static String text(Object value) {
    return value == null ? null : value.toString();
  }
}
