package io.taskrelay.sync;

import io.taskrelay.message.DeliveryOutcome;
import io.taskrelay.message.DeliveryProcessor;
import io.taskrelay.message.RelayMessage;
import io.taskrelay.model.AgentState;
import io.taskrelay.store.StateStore;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link StateChangeHandler} as a unit against the {@link StateStore}.
 * <p>
 * The handler writes through a {@link RecordingStateStore}, so every write is captured in a
 * per-message {@link ChangeLedger} before it lands. When the handler commits, the ledger is
 * discarded and the delivery is acknowledged. When it fails, rejects or throws, the ledger is
 * replayed in reverse, leaving the store as it was before the message arrived. Failures are
 * redelivered and rejections are dropped.
 */
public class TransactionalStateUpdater {

    private static final Logger log = LoggerFactory.getLogger(TransactionalStateUpdater.class);

    private final StateStore store;

    public TransactionalStateUpdater(StateStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public DeliveryProcessor bind(HandlerContext context, StateChangeHandler handler) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(handler, "handler");
        return message -> apply(message, context, handler);
    }

    public DeliveryOutcome apply(RelayMessage message, HandlerContext context, StateChangeHandler handler) {
        Objects.requireNonNull(message, "message");
        ChangeLedger ledger;
        try {
            AgentState agentAtEntry = store.getAgentState(context.agentId()).orElse(null);
            ledger = new ChangeLedger(context.agentId(), agentAtEntry);
        } catch (RuntimeException e) {
            log.info("State store unavailable before processing {} '{}': {}",
                message.type().wire(), safe(message.correlationId()), e.getMessage());
            return DeliveryOutcome.REQUEUE;
        }

        HandlerResult result;
        try {
            result = handler.handle(message, context, new RecordingStateStore(store, ledger));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            rollback(ledger, message, "interrupted");
            return DeliveryOutcome.REQUEUE;
        } catch (Exception e) {
            log.info("Handler for {} '{}' threw {}: {}", message.type().wire(), safe(message.correlationId()),
                e.getClass().getSimpleName(), e.getMessage(), e);
            rollback(ledger, message, e.getClass().getSimpleName());
            return DeliveryOutcome.REQUEUE;
        }

        if (result instanceof HandlerResult.Committed committed) {
            if (log.isDebugEnabled()) {
                log.debug("Committed {} '{}' with {} write(s): {}", message.type().wire(),
                    safe(message.correlationId()), ledger.size(), committed.detail());
            }
            ledger.clear();
            return DeliveryOutcome.ACK;
        }
        if (result instanceof HandlerResult.Rejected rejected) {
            log.info("Rejected {} '{}': {}", message.type().wire(), safe(message.correlationId()), rejected.detail());
            rollback(ledger, message, rejected.detail());
            return DeliveryOutcome.DROP;
        }
        String reason = result == null ? "handler returned no result" : result.detail();
        log.info("Handler failed for {} '{}': {}", message.type().wire(), safe(message.correlationId()), reason);
        rollback(ledger, message, reason);
        return DeliveryOutcome.REQUEUE;
    }

    private void rollback(ChangeLedger ledger, RelayMessage message, String reason) {
        int size = ledger.size();
        List<LedgerEntry> failed = ledger.rollback(store);
        if (failed.isEmpty()) {
            log.info("Rolled back {} write(s) for {} '{}' ({})", size, message.type().wire(),
                safe(message.correlationId()), reason);
        } else {
            log.error("Rollback for {} '{}' left {} of {} write(s) in place: {}", message.type().wire(),
                safe(message.correlationId()), failed.size(), size, failed);
        }
    }

    private static String safe(String value) {
        return value == null || value.isBlank() ? "n/a" : value;
    }
}
