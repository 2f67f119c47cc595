package io.taskrelay.sync.handlers;

import io.taskrelay.message.RelayMessage;
import io.taskrelay.message.RelayMessageCodec;
import io.taskrelay.store.StateStore;
import io.taskrelay.sync.HandlerContext;
import io.taskrelay.sync.HandlerResult;
import io.taskrelay.sync.StateChangeHandler;
import java.util.Map;
import java.util.Objects;

/**
 * Records the message in the activity log and does nothing else. Used for informational
 * message types such as {@code status_update} and {@code resource_allocation}.
 */
public class ActivityLogHandler implements StateChangeHandler {

    private final String activityType;
    private final RelayMessageCodec codec;

    public ActivityLogHandler(String activityType, RelayMessageCodec codec) {
        this.activityType = Objects.requireNonNull(activityType, "activityType");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public HandlerResult handle(RelayMessage message, HandlerContext context, StateStore store) {
        Map<String, Object> wire = codec.toMap(message);
        store.logActivity(context.agentId(), activityType, Details.of("message_type", message.type().wire())
            .with("task_id", message.taskId())
            .with("from_role", message.fromRole() == null ? null : message.fromRole().wire())
            .with("payload", wire.get("payload"))
            .build());
        return HandlerResult.committed(activityType);
    }
}
