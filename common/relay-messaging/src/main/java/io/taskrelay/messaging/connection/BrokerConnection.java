package io.taskrelay.messaging.connection;

import io.taskrelay.RelayTopology;
import java.util.Objects;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.DisposableBean;

/**
 * An established broker connection with the topology declared on it. Each publisher and each
 * consumer loop owns one; they are never shared.
 */
public final class BrokerConnection implements AutoCloseable {

    private final String name;
    private final ConnectionFactory connectionFactory;
    private final AmqpAdmin admin;
    private final RelayTopology topology;
    private volatile boolean closed;

    BrokerConnection(String name, ConnectionFactory connectionFactory, AmqpAdmin admin, RelayTopology topology) {
        this.name = Objects.requireNonNull(name, "name");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.admin = Objects.requireNonNull(admin, "admin");
        this.topology = Objects.requireNonNull(topology, "topology");
    }

    public String name() {
        return name;
    }

    public ConnectionFactory connectionFactory() {
        return connectionFactory;
    }

    public AmqpAdmin admin() {
        return admin;
    }

    public RelayTopology topology() {
        return topology;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the underlying connection. Unacknowledged deliveries go back to their queues.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        dispose(connectionFactory);
    }

    static void dispose(ConnectionFactory factory) {
        if (factory instanceof DisposableBean disposable) {
            try {
                disposable.destroy();
            } catch (Exception e) {
                throw new IllegalStateException("Failed to close broker connection", e);
            }
        }
    }
}
