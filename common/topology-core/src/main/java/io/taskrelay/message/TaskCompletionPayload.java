package io.taskrelay.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.taskrelay.model.Maps;
import io.taskrelay.model.TaskStatus;
import java.util.List;

/**
 * Outcome report for a task. {@code outcome} is terminal and defaults to
 * {@link TaskStatus#COMPLETED}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskCompletionPayload(
    TaskStatus outcome,
    String summary,
    List<String> deliverables,
    @JsonProperty("completed_by") String completedBy,
    String error
) implements MessagePayload {

    public TaskCompletionPayload {
        outcome = outcome == null ? TaskStatus.COMPLETED : outcome;
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("completion outcome must be terminal, got " + outcome.wire());
        }
        deliverables = Maps.freezeList(deliverables);
    }

    public static TaskCompletionPayload completed(String completedBy, String summary, List<String> deliverables) {
        return new TaskCompletionPayload(TaskStatus.COMPLETED, summary, deliverables, completedBy, null);
    }

    public static TaskCompletionPayload failed(String completedBy, String error) {
        return new TaskCompletionPayload(TaskStatus.FAILED, null, List.of(), completedBy, error);
    }
}
