package io.taskrelay.sync.handlers;

import io.taskrelay.message.RelayMessage;
import io.taskrelay.message.WorkRequestPayload;
import io.taskrelay.model.WorkRequest;
import io.taskrelay.model.WorkRequestStatus;
import io.taskrelay.store.StateStore;
import io.taskrelay.sync.HandlerContext;
import io.taskrelay.sync.HandlerResult;
import io.taskrelay.sync.StateChangeHandler;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Handles {@code work_request}: records the request (once) and logs its receipt.
 */
public class WorkRequestHandler implements StateChangeHandler {

    private final Clock clock;

    public WorkRequestHandler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public HandlerResult handle(RelayMessage message, HandlerContext context, StateStore store) {
        WorkRequestPayload payload = message.payloadAs(WorkRequestPayload.class);
        String requestId = message.requestId();
        Instant now = clock.instant();

        boolean duplicate = store.getWorkRequest(requestId).isPresent();
        if (!duplicate) {
            store.createWorkRequest(new WorkRequest(requestId, message.fromRole(), payload.type(), payload.details(),
                WorkRequestStatus.PENDING, now, now));
        }
        store.logActivity(context.agentId(), ActivityTypes.WORK_REQUEST_RECEIVED, Details.of("request_id", requestId)
            .with("type", payload.type())
            .with("from_role", message.fromRole() == null ? null : message.fromRole().wire())
            .with("duplicate", duplicate)
            .build());
        return HandlerResult.committed((duplicate ? "duplicate " : "") + "work request '" + requestId + "'");
    }
}
