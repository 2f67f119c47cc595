package io.taskrelay.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.taskrelay.model.TaskStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskUpdatePayload(
    TaskStatus status,
    String note,
    @JsonProperty("agent_id") String agentId
) implements MessagePayload {

    public TaskUpdatePayload {
        if (status == null) {
            throw new IllegalArgumentException("task_update requires a target status");
        }
    }
}
