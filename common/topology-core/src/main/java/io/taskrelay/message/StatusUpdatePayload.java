package io.taskrelay.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.taskrelay.model.Maps;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusUpdatePayload(
    @JsonProperty("agent_id") String agentId,
    String status,
    Map<String, Object> details
) implements MessagePayload {

    public StatusUpdatePayload {
        details = Maps.freeze(details);
    }
}
