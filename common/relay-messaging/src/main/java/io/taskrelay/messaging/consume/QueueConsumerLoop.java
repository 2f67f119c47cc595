package io.taskrelay.messaging.consume;

import io.micrometer.core.instrument.MeterRegistry;
import io.taskrelay.message.RelayMessageCodec;
import io.taskrelay.messaging.connection.BrokerConnection;
import io.taskrelay.messaging.connection.BrokerConnectionFailedException;
import io.taskrelay.messaging.connection.BrokerConnectionManager;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.ListenerContainerConsumerFailedEvent;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Long-running consumer for one queue.
 * <p>
 * The loop owns a dedicated broker connection and a {@link SimpleMessageListenerContainer} with
 * manual acknowledgement, a prefetch of one and a single consumer, so at most one message of the
 * queue is in flight at a time. Channel and connection faults are recovered by the container
 * itself. When the initial connect fails or the container gives up, a supervisor reconnects and
 * resubscribes after the configured retry delay until {@link #stop()} is called.
 */
public class QueueConsumerLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QueueConsumerLoop.class);

    private final BrokerConnectionManager connectionManager;
    private final String connectionName;
    private final String queueName;
    private final RelayMessageListener listener;
    private final Duration retryDelay;
    private final ScheduledExecutorService supervisor;

    private boolean running;
    private BrokerConnection connection;
    private SimpleMessageListenerContainer container;
    private ScheduledFuture<?> pendingRestart;

    public QueueConsumerLoop(BrokerConnectionManager connectionManager,
                             String agentId,
                             RelaySubscription subscription,
                             RelayMessageCodec codec,
                             MeterRegistry meterRegistry) {
        this(connectionManager, agentId, subscription, codec, meterRegistry,
            Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "relay-supervisor-" + subscription.queueName());
                thread.setDaemon(true);
                return thread;
            }));
    }

    QueueConsumerLoop(BrokerConnectionManager connectionManager,
                      String agentId,
                      RelaySubscription subscription,
                      RelayMessageCodec codec,
                      MeterRegistry meterRegistry,
                      ScheduledExecutorService supervisor) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(subscription, "subscription");
        this.queueName = connectionManager.topology().requireQueue(subscription.queueName());
        this.connectionName = agentId + "-consumer-" + queueName;
        this.listener = new RelayMessageListener(queueName, subscription.processor(), codec, meterRegistry);
        this.retryDelay = connectionManager.settings().retryDelay();
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    }

    public String queueName() {
        return queueName;
    }

    public synchronized boolean isRunning() {
        return running;
    }

    /**
     * Whether a container is currently consuming. False while the supervisor waits to reconnect.
     */
    public synchronized boolean isConsuming() {
        return container != null && container.isRunning();
    }

    /**
     * Starts consuming. A stopped loop may be started again; a closed one may not.
     *
     * @throws IllegalStateException if the loop has been closed
     */
    public synchronized void start() {
        if (supervisor.isShutdown()) {
            throw new IllegalStateException("Consumer loop for " + queueName + " is closed");
        }
        if (running) {
            return;
        }
        running = true;
        subscribe();
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (pendingRestart != null) {
            pendingRestart.cancel(false);
            pendingRestart = null;
        }
        teardown();
        log.info("Stopped consuming from {}", queueName);
    }

    /**
     * Stops the loop for good and releases its supervisor thread.
     */
    @Override
    public void close() {
        stop();
        supervisor.shutdownNow();
    }

    /**
     * Builds the listener container for this queue without starting it.
     */
    SimpleMessageListenerContainer createContainer(ConnectionFactory connectionFactory) {
        SimpleMessageListenerContainer created = new SimpleMessageListenerContainer(connectionFactory);
        created.setQueueNames(queueName);
        created.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        created.setPrefetchCount(1);
        created.setConcurrentConsumers(1);
        created.setMaxConcurrentConsumers(1);
        created.setMissingQueuesFatal(false);
        created.setRecoveryBackOff(new FixedBackOff(retryDelay.toMillis(), FixedBackOff.UNLIMITED_ATTEMPTS));
        created.setMessageListener(listener);
        created.setApplicationEventPublisher(this::onContainerEvent);
        created.afterPropertiesSet();
        return created;
    }

    private void subscribe() {
        if (!running) {
            return;
        }
        pendingRestart = null;
        try {
            connection = connectionManager.connect(connectionName);
            container = createContainer(connection.connectionFactory());
            container.start();
            log.info("Consuming from {} on connection '{}'", queueName, connectionName);
        } catch (BrokerConnectionFailedException e) {
            log.warn("Could not subscribe to {}: {}; retrying in {} ms", queueName, e.getMessage(),
                retryDelay.toMillis());
            teardown();
            scheduleRestart();
        } catch (AmqpException e) {
            log.info("Listener container for {} failed to start: {}; retrying in {} ms", queueName, e.getMessage(),
                retryDelay.toMillis());
            teardown();
            scheduleRestart();
        }
    }

    /**
     * Receives the container's application events; a fatal consumer failure schedules a
     * reconnect and resubscribe.
     */
    void onContainerEvent(Object event) {
        if (event instanceof ListenerContainerConsumerFailedEvent failed && failed.isFatal()) {
            log.warn("Consumer on {} stopped: {}; resubscribing in {} ms", queueName, failed.getReason(),
                retryDelay.toMillis(), failed.getThrowable());
            synchronized (this) {
                if (running && pendingRestart == null) {
                    scheduleRestart();
                }
            }
        }
    }

    private void scheduleRestart() {
        pendingRestart = supervisor.schedule(this::restart, retryDelay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private synchronized void restart() {
        teardown();
        subscribe();
    }

    private void teardown() {
        if (container != null) {
            container.stop();
            container.destroy();
            container = null;
        }
        if (connection != null) {
            connectionManager.close(connection);
            connection = null;
        }
    }
}
