package io.taskrelay.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.taskrelay.model.Maps;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceAllocationPayload(
    String resource,
    Double amount,
    Map<String, Object> details
) implements MessagePayload {

    public ResourceAllocationPayload {
        details = Maps.freeze(details);
    }
}
