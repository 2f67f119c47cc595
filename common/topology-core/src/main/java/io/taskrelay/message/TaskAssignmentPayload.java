package io.taskrelay.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.taskrelay.model.Maps;
import io.taskrelay.model.TaskPriority;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskAssignmentPayload(
    String title,
    String description,
    TaskPriority priority,
    List<String> requirements,
    @JsonProperty("assigned_to") String assignedTo,
    Map<String, Object> metadata
) implements MessagePayload {

    public TaskAssignmentPayload {
        priority = priority == null ? TaskPriority.MEDIUM : priority;
        requirements = Maps.freezeList(requirements);
        metadata = Maps.freeze(metadata);
    }

    public static TaskAssignmentPayload of(String title, String description) {
        return new TaskAssignmentPayload(title, description, TaskPriority.MEDIUM, List.of(), null, Map.of());
    }
}
