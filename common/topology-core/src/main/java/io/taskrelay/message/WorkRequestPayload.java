package io.taskrelay.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.taskrelay.model.Maps;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkRequestPayload(
    String type,
    Map<String, Object> details
) implements MessagePayload {

    public WorkRequestPayload {
        details = Maps.freeze(details);
    }
}
