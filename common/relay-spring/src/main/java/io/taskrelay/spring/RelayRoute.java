package io.taskrelay.spring;

import io.taskrelay.sync.StateChangeHandler;
import java.util.Objects;

/**
 * Declares that the local agent consumes {@code queueName} and applies each message with
 * {@code handler}. Services contribute one bean per consumed queue.
 */
public record RelayRoute(String queueName, StateChangeHandler handler) {

    public RelayRoute {
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(handler, "handler");
    }
}
