package io.taskrelay.sync;

import java.util.Objects;

/**
 * What a {@link StateChangeHandler} reports back to the {@link TransactionalStateUpdater}.
 */
public sealed interface HandlerResult permits HandlerResult.Committed, HandlerResult.Failed, HandlerResult.Rejected {

    String detail();

    static HandlerResult committed(String summary) {
        return new Committed(summary);
    }

    /** Transient failure: roll back and redeliver. */
    static HandlerResult failed(String reason) {
        return new Failed(reason);
    }

    /** Permanent failure: roll back and drop the message. */
    static HandlerResult rejected(String reason) {
        return new Rejected(reason);
    }

    record Committed(String detail) implements HandlerResult {
        public Committed {
            detail = detail == null ? "" : detail;
        }
    }

    record Failed(String detail) implements HandlerResult {
        public Failed {
            Objects.requireNonNull(detail, "detail");
        }
    }

    record Rejected(String detail) implements HandlerResult {
        public Rejected {
            Objects.requireNonNull(detail, "detail");
        }
    }
}
