package io.taskrelay.sync;

import io.taskrelay.message.RelayMessage;
import io.taskrelay.store.StateStore;

/**
 * Applies the state-store effects of one message. Handlers write only through the store they
 * are given and must treat "already exists" or "already in the target state" as success, because
 * a message can be delivered more than once.
 */
@FunctionalInterface
public interface StateChangeHandler {

    HandlerResult handle(RelayMessage message, HandlerContext context, StateStore store) throws Exception;
}
