package io.taskrelay.messaging.connection;

import io.taskrelay.RelayTopology;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;

/**
 * Opens broker connections and makes sure the relay topology exists on each of them.
 * <p>
 * Every call to {@link #connect(String)} builds a dedicated {@link CachingConnectionFactory} with
 * publisher confirms and returns enabled, tries to open it up to {@code maxRetries} times, and
 * then declares the exchange, the queues and their bindings. Declaration is idempotent, so
 * every participant can run it on start-up.
 */
public class BrokerConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(BrokerConnectionManager.class);

    private final BrokerConnectionSettings settings;
    private final RelayTopology topology;
    private final Function<String, ConnectionFactory> connectionFactories;
    private final Function<ConnectionFactory, AmqpAdmin> admins;
    private final Sleeper sleeper;

    public BrokerConnectionManager(BrokerConnectionSettings settings, RelayTopology topology) {
        this(settings, topology, null, RabbitAdmin::new, Thread::sleep);
    }

    BrokerConnectionManager(BrokerConnectionSettings settings,
                            RelayTopology topology,
                            Function<String, ConnectionFactory> connectionFactories,
                            Function<ConnectionFactory, AmqpAdmin> admins,
                            Sleeper sleeper) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.topology = Objects.requireNonNull(topology, "topology");
        this.connectionFactories = connectionFactories != null ? connectionFactories : this::cachingConnectionFactory;
        this.admins = Objects.requireNonNull(admins, "admins");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public BrokerConnectionSettings settings() {
        return settings;
    }

    public RelayTopology topology() {
        return topology;
    }

    /**
     * Connects and declares the topology.
     *
     * @param connectionName client-visible name of the connection, e.g. {@code worker-consumer-worker-inbox}
     * @throws BrokerConnectionFailedException when every attempt failed
     */
    public BrokerConnection connect(String connectionName) {
        Objects.requireNonNull(connectionName, "connectionName");
        ConnectionFactory factory = connectionFactories.apply(connectionName);
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= settings.maxRetries(); attempt++) {
            try {
                factory.createConnection();
                AmqpAdmin admin = admins.apply(factory);
                declareTopology(admin);
                log.info("Connected '{}' to {}:{}{} on attempt {}", connectionName, settings.host(), settings.port(),
                    settings.virtualHost(), attempt);
                return new BrokerConnection(connectionName, factory, admin, topology);
            } catch (AmqpException e) {
                lastFailure = e;
                log.info("Connection attempt {}/{} for '{}' failed: {}", attempt, settings.maxRetries(),
                    connectionName, e.getMessage());
            }
            if (attempt < settings.maxRetries() && !pause(settings.retryDelay())) {
                BrokerConnection.dispose(factory);
                throw new BrokerConnectionFailedException(connectionName, attempt, lastFailure);
            }
        }
        BrokerConnection.dispose(factory);
        log.warn("Giving up on broker connection '{}' after {} attempt(s)", connectionName, settings.maxRetries());
        throw new BrokerConnectionFailedException(connectionName, settings.maxRetries(), lastFailure);
    }

    public void close(BrokerConnection connection) {
        if (connection != null) {
            connection.close();
            log.info("Closed broker connection '{}'", connection.name());
        }
    }

    /**
     * Declares the direct exchange and every queue, each bound with its own name as routing key.
     */
    void declareTopology(AmqpAdmin admin) {
        DirectExchange exchange = new DirectExchange(topology.exchange(), true, false);
        admin.declareExchange(exchange);
        for (String queueName : topology.queues()) {
            Queue queue = QueueBuilder.durable(queueName).build();
            admin.declareQueue(queue);
            admin.declareBinding(BindingBuilder.bind(queue).to(exchange).with(queueName));
        }
        log.debug("Declared exchange {} with queues {}", topology.exchange(), topology.queues());
    }

    private boolean pause(Duration delay) {
        try {
            sleeper.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    CachingConnectionFactory cachingConnectionFactory(String connectionName) {
        CachingConnectionFactory factory = new CachingConnectionFactory(settings.host(), settings.port());
        factory.setUsername(settings.username());
        factory.setPassword(settings.password());
        factory.setVirtualHost(settings.virtualHost());
        factory.setConnectionTimeout((int) settings.connectTimeout().toMillis());
        factory.setRequestedHeartBeat((int) Math.max(1, settings.heartbeatInterval().toSeconds()));
        factory.setPublisherConfirmType(CachingConnectionFactory.ConfirmType.CORRELATED);
        factory.setPublisherReturns(true);
        factory.setConnectionNameStrategy(cf -> connectionName);
        return factory;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
