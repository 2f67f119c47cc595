package io.taskrelay.message;

/**
 * How a consumed delivery is resolved with the broker.
 */
public enum DeliveryOutcome {
    /** Processed and committed; acknowledge. */
    ACK,
    /** Transient failure, state rolled back; negative-acknowledge with requeue. */
    REQUEUE,
    /** Permanently unprocessable; negative-acknowledge without requeue. */
    DROP
}
