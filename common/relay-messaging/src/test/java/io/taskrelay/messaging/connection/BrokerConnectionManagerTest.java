package io.taskrelay.messaging.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.taskrelay.RelayTopology;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;

class BrokerConnectionManagerTest {

    private final ConnectionFactory connectionFactory = mock(ConnectionFactory.class);
    private final AmqpAdmin admin = mock(AmqpAdmin.class);
    private final List<Long> sleeps = new ArrayList<>();

    @Test
    void retriesUntilTheBrokerAnswers() {
        when(connectionFactory.createConnection())
            .thenThrow(refused())
            .thenThrow(refused())
            .thenReturn(mock(Connection.class));

        BrokerConnection connection = manager(5).connect("worker-publisher");

        assertThat(connection.name()).isEqualTo("worker-publisher");
        assertThat(connection.connectionFactory()).isSameAs(connectionFactory);
        assertThat(connection.admin()).isSameAs(admin);
        verify(connectionFactory, times(3)).createConnection();
        assertThat(sleeps).containsExactly(250L, 250L);
    }

    @Test
    void exhaustionReportsTheAttemptCount() {
        when(connectionFactory.createConnection()).thenThrow(refused());

        assertThatThrownBy(() -> manager(3).connect("coordinator-publisher"))
            .isInstanceOfSatisfying(BrokerConnectionFailedException.class, e -> {
                assertThat(e.attempts()).isEqualTo(3);
                assertThat(e.connectionName()).isEqualTo("coordinator-publisher");
                assertThat(e.getCause()).isInstanceOf(AmqpConnectException.class);
            });
        verify(connectionFactory, times(3)).createConnection();
        assertThat(sleeps).hasSize(2);
        verify(admin, never()).declareExchange(any());
    }

    @Test
    void singleAttemptDoesNotSleep() {
        when(connectionFactory.createConnection()).thenThrow(refused());

        assertThatThrownBy(() -> manager(1).connect("once"))
            .isInstanceOf(BrokerConnectionFailedException.class);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void declaresDirectExchangeAndBindsEveryQueueByName() {
        when(connectionFactory.createConnection()).thenReturn(mock(Connection.class));

        manager(1).connect("worker-consumer-worker-inbox");

        ArgumentCaptor<Exchange> exchange = ArgumentCaptor.forClass(Exchange.class);
        verify(admin).declareExchange(exchange.capture());
        assertThat(exchange.getValue()).isInstanceOf(DirectExchange.class);
        assertThat(exchange.getValue().getName()).isEqualTo("agent-network");
        assertThat(exchange.getValue().isDurable()).isTrue();

        ArgumentCaptor<Queue> queues = ArgumentCaptor.forClass(Queue.class);
        verify(admin, times(4)).declareQueue(queues.capture());
        assertThat(queues.getAllValues()).extracting(Queue::getName)
            .containsExactly("coordinator-inbox", "worker-inbox", "requirements-inbox", "work-request-inbox");
        assertThat(queues.getAllValues()).allMatch(Queue::isDurable);

        ArgumentCaptor<Binding> bindings = ArgumentCaptor.forClass(Binding.class);
        verify(admin, times(4)).declareBinding(bindings.capture());
        assertThat(bindings.getAllValues()).allSatisfy(binding -> {
            assertThat(binding.getExchange()).isEqualTo("agent-network");
            assertThat(binding.getRoutingKey()).isEqualTo(binding.getDestination());
        });
    }

    @Test
    void topologyDeclarationIsRepeatable() {
        when(connectionFactory.createConnection()).thenReturn(mock(Connection.class));
        BrokerConnectionManager manager = manager(1);

        manager.connect("first");
        manager.connect("second");

        verify(admin, times(2)).declareExchange(any());
        verify(admin, times(8)).declareQueue(any());
    }

    @Test
    void cachingFactoryIsConfiguredFromSettings() {
        BrokerConnectionManager manager = new BrokerConnectionManager(settings(2), RelayTopology.defaults());

        CachingConnectionFactory factory = manager.cachingConnectionFactory("worker-publisher");
        try {
            assertThat(factory.getHost()).isEqualTo("rabbit.local");
            assertThat(factory.getPort()).isEqualTo(5673);
            assertThat(factory.getVirtualHost()).isEqualTo("relay");
            assertThat(factory.getUsername()).isEqualTo("relay-user");
            assertThat(factory.isPublisherConfirms()).isTrue();
            assertThat(factory.isPublisherReturns()).isTrue();
            assertThat(factory.getRabbitConnectionFactory().getRequestedHeartbeat()).isEqualTo(15);
            assertThat(factory.getRabbitConnectionFactory().getConnectionTimeout()).isEqualTo(3000);
        } finally {
            factory.destroy();
        }
    }

    @Test
    void settingsRejectZeroRetries() {
        assertThatThrownBy(() -> settings(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private BrokerConnectionManager manager(int maxRetries) {
        return new BrokerConnectionManager(settings(maxRetries), RelayTopology.defaults(),
            name -> connectionFactory, factory -> admin, sleeps::add);
    }

    static BrokerConnectionSettings settings(int maxRetries) {
        return new BrokerConnectionSettings("rabbit.local", 5673, "relay-user", "secret", "relay",
            Duration.ofSeconds(3), Duration.ofSeconds(15), Duration.ofMillis(250), maxRetries, Duration.ofMillis(200));
    }

    private static AmqpConnectException refused() {
        return new AmqpConnectException(new ConnectException("Connection refused"));
    }
}
