package io.taskrelay.messaging.consume;

import io.taskrelay.message.DeliveryProcessor;
import java.util.Objects;

/**
 * One queue and the processor that handles its deliveries.
 */
public record RelaySubscription(String queueName, DeliveryProcessor processor) {

    public RelaySubscription {
        Objects.requireNonNull(queueName, "queueName");
        if (queueName.isBlank()) {
            throw new IllegalArgumentException("queueName must not be blank");
        }
        Objects.requireNonNull(processor, "processor");
    }
}
