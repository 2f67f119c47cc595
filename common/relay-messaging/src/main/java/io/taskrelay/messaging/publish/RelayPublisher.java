package io.taskrelay.messaging.publish;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.taskrelay.RelayTopology;
import io.taskrelay.message.BrokerMetadata;
import io.taskrelay.message.RelayMessage;
import io.taskrelay.message.RelayMessageCodec;
import io.taskrelay.messaging.connection.BrokerConnection;
import io.taskrelay.messaging.connection.BrokerConnectionFailedException;
import io.taskrelay.messaging.connection.BrokerConnectionManager;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.ReturnedMessage;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

/**
 * Publishes envelopes to the relay exchange and waits for the broker to confirm each one.
 * <p>
 * Every publish gets a fresh {@link BrokerMetadata} stamp, goes out persistent and mandatory with
 * the queue name as routing key, and is reported as a {@link PublishResult}. Nothing is thrown for
 * broker-side problems; callers inspect the result or call {@link PublishResult#orElseThrow()}.
 * A publisher created with {@link #connecting} opens its own connection on first use and opens a
 * new one after a connection-level failure.
 */
public class RelayPublisher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RelayPublisher.class);
    static final String METRIC_NAME = "taskrelay.publishes";

    private final BrokerConnectionManager connectionManager;
    private final String connectionName;
    private final RelayTopology topology;
    private final RelayMessageCodec codec;
    private final Duration confirmTimeout;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Object connectionLock = new Object();
    private volatile RabbitTemplate template;
    private BrokerConnection connection;

    private RelayPublisher(BrokerConnectionManager connectionManager,
                           String connectionName,
                           RabbitTemplate template,
                           RelayTopology topology,
                           RelayMessageCodec codec,
                           Duration confirmTimeout,
                           Clock clock,
                           MeterRegistry meterRegistry) {
        this.connectionManager = connectionManager;
        this.connectionName = connectionName;
        this.template = template;
        this.topology = Objects.requireNonNull(topology, "topology");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.confirmTimeout = Objects.requireNonNull(confirmTimeout, "confirmTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    }

    /**
     * A publisher with its own broker connection, opened lazily through the manager.
     */
    public static RelayPublisher connecting(BrokerConnectionManager connectionManager,
                                            String connectionName,
                                            RelayMessageCodec codec,
                                            Clock clock,
                                            MeterRegistry meterRegistry) {
        Objects.requireNonNull(connectionManager, "connectionManager");
        Objects.requireNonNull(connectionName, "connectionName");
        return new RelayPublisher(connectionManager, connectionName, null, connectionManager.topology(), codec,
            connectionManager.settings().confirmTimeout(), clock, meterRegistry);
    }

    /**
     * A publisher over an existing template. The template's connection factory must have
     * correlated publisher confirms and returns enabled.
     */
    public static RelayPublisher using(RabbitTemplate template,
                                       RelayTopology topology,
                                       RelayMessageCodec codec,
                                       Duration confirmTimeout,
                                       Clock clock,
                                       MeterRegistry meterRegistry) {
        Objects.requireNonNull(template, "template");
        template.setMandatory(true);
        return new RelayPublisher(null, null, template, topology, codec, confirmTimeout, clock, meterRegistry);
    }

    public RelayTopology topology() {
        return topology;
    }

    public PublishResult publish(String queueName, RelayMessage message) {
        Objects.requireNonNull(message, "message");
        if (!topology.declares(queueName)) {
            return record(PublishResult.unconfirmed(null, queueName,
                "queue '" + queueName + "' is not part of the declared topology"));
        }
        String messageId = UUID.randomUUID().toString();
        Instant publishedAt = clock.instant();
        RelayMessage stamped = message.withBrokerMetadata(new BrokerMetadata(messageId, publishedAt, queueName));

        RabbitTemplate rabbit;
        try {
            rabbit = template();
        } catch (BrokerConnectionFailedException e) {
            return record(PublishResult.unconfirmed(messageId, queueName, e.getMessage()));
        }

        CorrelationData correlation = new CorrelationData(messageId);
        try {
            rabbit.send(topology.exchange(), queueName, toAmqpMessage(stamped, publishedAt), correlation);
            CorrelationData.Confirm confirm = correlation.getFuture()
                .get(confirmTimeout.toMillis(), TimeUnit.MILLISECONDS);
            ReturnedMessage returned = correlation.getReturned();
            if (returned != null) {
                return record(PublishResult.unconfirmed(messageId, queueName,
                    "returned as unroutable: " + returned.getReplyCode() + " " + returned.getReplyText()));
            }
            if (!confirm.isAck()) {
                return record(PublishResult.unconfirmed(messageId, queueName, "negative ack: " + confirm.getReason()));
            }
            log.debug("Published {} '{}' to {} as {}", message.type().wire(), safe(message.correlationId()),
                queueName, messageId);
            return record(PublishResult.confirmed(messageId, queueName));
        } catch (TimeoutException e) {
            return record(PublishResult.unconfirmed(messageId, queueName,
                "no confirm within " + confirmTimeout.toMillis() + " ms"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return record(PublishResult.unconfirmed(messageId, queueName, "interrupted while waiting for confirm"));
        } catch (ExecutionException e) {
            return record(PublishResult.unconfirmed(messageId, queueName, "confirm failed: " + e.getCause()));
        } catch (AmqpException e) {
            resetConnection();
            return record(PublishResult.unconfirmed(messageId, queueName, e.getClass().getSimpleName() + ": "
                + e.getMessage()));
        }
    }

    @Override
    public void close() {
        resetConnection();
    }

    private RabbitTemplate template() {
        RabbitTemplate current = template;
        if (current != null) {
            return current;
        }
        synchronized (connectionLock) {
            if (template == null) {
                connection = connectionManager.connect(connectionName);
                RabbitTemplate created = new RabbitTemplate(connection.connectionFactory());
                created.setMandatory(true);
                template = created;
            }
            return template;
        }
    }

    private void resetConnection() {
        if (connectionManager == null) {
            return;
        }
        synchronized (connectionLock) {
            if (connection != null) {
                connectionManager.close(connection);
            }
            connection = null;
            template = null;
        }
    }

    private Message toAmqpMessage(RelayMessage message, Instant publishedAt) {
        MessageProperties properties = new MessageProperties();
        properties.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        properties.setContentEncoding(StandardCharsets.UTF_8.name());
        properties.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        properties.setMessageId(message.messageId());
        properties.setType(message.type().wire());
        properties.setTimestamp(Date.from(publishedAt));
        return new Message(codec.encode(message), properties);
    }

    private PublishResult record(PublishResult result) {
        if (!result.confirmed()) {
            log.info("Publish to {} not confirmed ({}): {}", safe(result.queue()), safe(result.messageId()),
                result.failureReason());
        }
        Counter.builder(METRIC_NAME)
            .description("Relay publishes by queue and broker confirmation")
            .tag("queue", safe(result.queue()))
            .tag("result", result.confirmed() ? "confirmed" : "unconfirmed")
            .register(meterRegistry)
            .increment();
        return result;
    }

    private static String safe(String value) {
        return value == null || value.isBlank() ? "n/a" : value;
    }
}
