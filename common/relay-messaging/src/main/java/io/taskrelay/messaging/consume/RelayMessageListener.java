package io.taskrelay.messaging.consume;

import com.rabbitmq.client.Channel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.taskrelay.message.DeliveryOutcome;
import io.taskrelay.message.DeliveryProcessor;
import io.taskrelay.message.MalformedMessageException;
import io.taskrelay.message.RelayMessage;
import io.taskrelay.message.RelayMessageCodec;
import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

/**
 * Decodes each delivery, hands it to the {@link DeliveryProcessor} and settles it on the channel.
 * <p>
 * Malformed deliveries are rejected without requeue. Otherwise the processor's outcome decides:
 * {@code ACK} acknowledges, {@code REQUEUE} rejects with requeue and {@code DROP} rejects without.
 * A processor that throws is treated as {@code REQUEUE}.
 */
public class RelayMessageListener implements ChannelAwareMessageListener {

    private static final Logger log = LoggerFactory.getLogger(RelayMessageListener.class);
    static final String METRIC_NAME = "taskrelay.deliveries";

    static final String MDC_MESSAGE_ID = "messageId";
    static final String MDC_MESSAGE_TYPE = "messageType";
    static final String MDC_TASK_ID = "taskId";
    static final String MDC_QUEUE = "queue";

    private final String queueName;
    private final DeliveryProcessor processor;
    private final RelayMessageCodec codec;
    private final MeterRegistry meterRegistry;

    public RelayMessageListener(String queueName, DeliveryProcessor processor, RelayMessageCodec codec,
                                MeterRegistry meterRegistry) {
        this.queueName = Objects.requireNonNull(queueName, "queueName");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    @Override
    public void onMessage(Message delivery, Channel channel) throws IOException {
        long deliveryTag = delivery.getMessageProperties().getDeliveryTag();
        RelayMessage message;
        try {
            message = codec.decode(delivery.getBody());
        } catch (MalformedMessageException e) {
            log.warn("Dropping malformed delivery {} on {}: {}",
                safe(delivery.getMessageProperties().getMessageId()), queueName, e.getMessage());
            channel.basicNack(deliveryTag, false, false);
            count("malformed");
            return;
        }

        MDC.put(MDC_QUEUE, queueName);
        MDC.put(MDC_MESSAGE_TYPE, message.type().wire());
        MDC.put(MDC_MESSAGE_ID, safe(message.messageId()));
        MDC.put(MDC_TASK_ID, safe(message.correlationId()));
        try {
            DeliveryOutcome outcome = process(message);
            switch (outcome) {
                case ACK -> channel.basicAck(deliveryTag, false);
                case REQUEUE -> channel.basicNack(deliveryTag, false, true);
                case DROP -> channel.basicNack(deliveryTag, false, false);
            }
            log.debug("Settled {} '{}' on {} as {}", message.type().wire(), safe(message.correlationId()),
                queueName, outcome);
            count(outcome.name().toLowerCase(Locale.ROOT));
        } finally {
            MDC.remove(MDC_QUEUE);
            MDC.remove(MDC_MESSAGE_TYPE);
            MDC.remove(MDC_MESSAGE_ID);
            MDC.remove(MDC_TASK_ID);
        }
    }

    private DeliveryOutcome process(RelayMessage message) {
        try {
            DeliveryOutcome outcome = processor.process(message);
            return outcome == null ? DeliveryOutcome.REQUEUE : outcome;
        } catch (RuntimeException e) {
            log.info("Processor failed for {} '{}' on {}; requeueing", message.type().wire(),
                safe(message.correlationId()), queueName, e);
            return DeliveryOutcome.REQUEUE;
        }
    }

    private void count(String outcome) {
        Counter.builder(METRIC_NAME)
            .description("Relay deliveries by queue and settlement")
            .tag("queue", queueName)
            .tag("outcome", outcome)
            .register(meterRegistry)
            .increment();
    }

    private static String safe(String value) {
        return value == null || value.isBlank() ? "n/a" : value;
    }
}
