package io.taskrelay.message;

/**
 * Processes one decoded message and decides how the delivery is resolved.
 */
@FunctionalInterface
public interface DeliveryProcessor {

    DeliveryOutcome process(RelayMessage message);
}
