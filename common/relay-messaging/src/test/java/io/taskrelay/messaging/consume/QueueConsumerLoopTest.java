package io.taskrelay.messaging.consume;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.taskrelay.RelayTopology;
import io.taskrelay.message.DeliveryOutcome;
import io.taskrelay.message.RelayMessageCodec;
import io.taskrelay.messaging.connection.BrokerConnection;
import io.taskrelay.messaging.connection.BrokerConnectionFailedException;
import io.taskrelay.messaging.connection.BrokerConnectionManager;
import io.taskrelay.messaging.connection.BrokerConnectionSettings;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.ListenerContainerConsumerFailedEvent;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.test.util.ReflectionTestUtils;

class QueueConsumerLoopTest {

    private final BrokerConnectionManager manager = mock(BrokerConnectionManager.class);
    private final ScheduledExecutorService supervisor = mock(ScheduledExecutorService.class);
    private final ScheduledFuture<?> restart = mock(ScheduledFuture.class);

    @BeforeEach
    void setUp() {
        when(manager.topology()).thenReturn(RelayTopology.defaults());
        when(manager.settings()).thenReturn(new BrokerConnectionSettings("localhost", 5672, "guest", "guest", "/",
            Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofMillis(750), 2, Duration.ofSeconds(1)));
    }

    @Test
    void containerConsumesOneMessageAtATimeWithManualAck() {
        SimpleMessageListenerContainer container = loop("worker-inbox").createContainer(mock(ConnectionFactory.class));

        assertThat(container.getAcknowledgeMode()).isEqualTo(AcknowledgeMode.MANUAL);
        assertThat(ReflectionTestUtils.getField(container, "prefetchCount")).isEqualTo(1);
        assertThat(ReflectionTestUtils.getField(container, "concurrentConsumers")).isEqualTo(1);
        assertThat(ReflectionTestUtils.getField(container, "maxConcurrentConsumers")).isEqualTo(1);
        assertThat(container.getQueueNames()).containsExactly("worker-inbox");
        assertThat(container.getMessageListener()).isInstanceOf(RelayMessageListener.class);
        container.destroy();
    }

    @Test
    void failedInitialConnectIsRetriedBySupervisor() {
        when(manager.connect("worker-consumer-worker-inbox"))
            .thenThrow(new BrokerConnectionFailedException("worker-consumer-worker-inbox", 2, null));
        doReturn(restart).when(supervisor).schedule(any(Runnable.class), eq(750L), eq(TimeUnit.MILLISECONDS));
        QueueConsumerLoop loop = loop("worker-inbox");

        loop.start();

        ArgumentCaptor<Runnable> retry = ArgumentCaptor.forClass(Runnable.class);
        verify(supervisor).schedule(retry.capture(), eq(750L), eq(TimeUnit.MILLISECONDS));
        assertThat(loop.isRunning()).isTrue();
        assertThat(loop.isConsuming()).isFalse();

        retry.getValue().run();

        verify(manager, times(2)).connect("worker-consumer-worker-inbox");
        verify(supervisor, times(2)).schedule(any(Runnable.class), eq(750L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void stopCancelsPendingRestart() {
        when(manager.connect("worker-consumer-worker-inbox"))
            .thenThrow(new BrokerConnectionFailedException("worker-consumer-worker-inbox", 2, null));
        doReturn(restart).when(supervisor).schedule(any(Runnable.class), eq(750L), eq(TimeUnit.MILLISECONDS));
        QueueConsumerLoop loop = loop("worker-inbox");

        loop.start();
        loop.stop();

        verify(restart).cancel(false);
        assertThat(loop.isRunning()).isFalse();
    }

    @Test
    void fatalConsumerFailureReconnectsAndResubscribes() {
        BrokerConnection connection = mock(BrokerConnection.class);
        when(connection.connectionFactory()).thenReturn(mock(ConnectionFactory.class));
        when(manager.connect("worker-consumer-worker-inbox")).thenReturn(connection);
        doReturn(restart).when(supervisor).schedule(any(Runnable.class), eq(750L), eq(TimeUnit.MILLISECONDS));
        SimpleMessageListenerContainer container = mock(SimpleMessageListenerContainer.class);
        QueueConsumerLoop loop = loopWithContainer("worker-inbox", container);
        loop.start();
        verify(supervisor, never()).schedule(any(Runnable.class), eq(750L), eq(TimeUnit.MILLISECONDS));

        loop.onContainerEvent(new ListenerContainerConsumerFailedEvent(container, "Consumer thread error",
            new IllegalStateException("channel closed"), true));
        loop.onContainerEvent(new ListenerContainerConsumerFailedEvent(container, "Consumer thread error",
            new IllegalStateException("channel closed"), true));

        ArgumentCaptor<Runnable> resubscribe = ArgumentCaptor.forClass(Runnable.class);
        verify(supervisor).schedule(resubscribe.capture(), eq(750L), eq(TimeUnit.MILLISECONDS));

        resubscribe.getValue().run();

        verify(container).stop();
        verify(container).destroy();
        verify(manager).close(connection);
        verify(manager, times(2)).connect("worker-consumer-worker-inbox");
        verify(container, times(2)).start();
    }

    @Test
    void nonFatalConsumerFailureIsLeftToTheContainer() {
        BrokerConnection connection = mock(BrokerConnection.class);
        when(connection.connectionFactory()).thenReturn(mock(ConnectionFactory.class));
        when(manager.connect("worker-consumer-worker-inbox")).thenReturn(connection);
        SimpleMessageListenerContainer container = mock(SimpleMessageListenerContainer.class);
        QueueConsumerLoop loop = loopWithContainer("worker-inbox", container);
        loop.start();

        loop.onContainerEvent(new ListenerContainerConsumerFailedEvent(container, "Consumer raised exception",
            new IllegalStateException("transient"), false));

        verify(supervisor, never()).schedule(any(Runnable.class), eq(750L), eq(TimeUnit.MILLISECONDS));
        verify(manager, times(1)).connect("worker-consumer-worker-inbox");
    }

    @Test
    void stoppedLoopCanStartAgainButAClosedOneCannot() {
        when(manager.connect("worker-consumer-worker-inbox"))
            .thenThrow(new BrokerConnectionFailedException("worker-consumer-worker-inbox", 2, null));
        doReturn(restart).when(supervisor).schedule(any(Runnable.class), eq(750L), eq(TimeUnit.MILLISECONDS));
        QueueConsumerLoop loop = loop("worker-inbox");

        loop.start();
        loop.stop();
        loop.start();

        assertThat(loop.isRunning()).isTrue();
        verify(supervisor, times(2)).schedule(any(Runnable.class), eq(750L), eq(TimeUnit.MILLISECONDS));

        loop.close();
        verify(supervisor).shutdownNow();
        when(supervisor.isShutdown()).thenReturn(true);
        assertThatThrownBy(loop::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void queueMustBelongToTheTopology() {
        assertThatThrownBy(() -> loop("audit-inbox")).isInstanceOf(IllegalArgumentException.class);
    }

    private QueueConsumerLoop loopWithContainer(String queue, SimpleMessageListenerContainer container) {
        return new QueueConsumerLoop(manager, "worker", new RelaySubscription(queue, message -> DeliveryOutcome.ACK),
            new RelayMessageCodec(), new SimpleMeterRegistry(), supervisor) {
            @Override
            SimpleMessageListenerContainer createContainer(ConnectionFactory connectionFactory) {
                return container;
            }
        };
    }

    private QueueConsumerLoop loop(String queue) {
        return new QueueConsumerLoop(manager, "worker", new RelaySubscription(queue, message -> DeliveryOutcome.ACK),
            new RelayMessageCodec(), new SimpleMeterRegistry(), supervisor);
    }
}
