package io.taskrelay.coordinator;

import io.taskrelay.model.Maps;
import io.taskrelay.model.TaskPriority;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A task the coordinator is about to hand to a worker. {@code workRequestId} links the task to
 * the work request it answers and may be {@code null}.
 */
public record NewTask(
    String taskId,
    String title,
    String description,
    TaskPriority priority,
    List<String> requirements,
    String assignedTo,
    Map<String, Object> metadata,
    String workRequestId
) {

  public NewTask {
    Objects.requireNonNull(taskId, "taskId");
    if (taskId.isBlank()) {
      throw new IllegalArgumentException("taskId must not be blank");
    }
    taskId = taskId.trim();
    priority = priority == null ? TaskPriority.MEDIUM : priority;
    requirements = Maps.freezeList(requirements);
    metadata = Maps.freeze(metadata);
    workRequestId = workRequestId == null || workRequestId.isBlank() ? null : workRequestId.trim();
  }

  public static NewTask of(String taskId, String title, String description, String assignedTo) {
    return new NewTask(taskId, title, description, TaskPriority.MEDIUM, List.of(), assignedTo, Map.of(), null);
  }
}
