package io.taskrelay.sync;

import io.taskrelay.message.MessageType;
import io.taskrelay.message.RelayMessage;
import io.taskrelay.store.StateStore;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Routes a message to the handler registered for its type. A type with no route on this queue
 * is rejected, which drops the message without touching state.
 */
public final class MessageTypeDispatcher implements StateChangeHandler {

    private final Map<MessageType, StateChangeHandler> routes;

    private MessageTypeDispatcher(Builder builder) {
        this.routes = Collections.unmodifiableMap(new EnumMap<>(builder.routes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<MessageType> routedTypes() {
        return routes.keySet();
    }

    @Override
    public HandlerResult handle(RelayMessage message, HandlerContext context, StateStore store) throws Exception {
        StateChangeHandler handler = routes.get(message.type());
        if (handler == null) {
            return HandlerResult.rejected("no handler for " + message.type().wire() + " on queue '"
                + context.queueName() + "'");
        }
        return handler.handle(message, context, store);
    }

    public static final class Builder {

        private final EnumMap<MessageType, StateChangeHandler> routes = new EnumMap<>(MessageType.class);

        private Builder() {
        }

        public Builder route(MessageType type, StateChangeHandler handler) {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(handler, "handler");
            if (routes.putIfAbsent(type, handler) != null) {
                throw new IllegalStateException("A handler for " + type.wire() + " is already registered");
            }
            return this;
        }

        public MessageTypeDispatcher build() {
            if (routes.isEmpty()) {
                throw new IllegalStateException("At least one route is required");
            }
            return new MessageTypeDispatcher(this);
        }
    }
}
