package io.taskrelay.spring;

import static org.assertj.core.api.Assertions.assertThat;

import io.taskrelay.RelayTopology;
import io.taskrelay.message.RelayMessageCodec;
import io.taskrelay.messaging.connection.BrokerConnectionManager;
import io.taskrelay.messaging.consume.QueueConsumerLoop;
import io.taskrelay.messaging.publish.RelayPublisher;
import io.taskrelay.store.InMemoryStateStore;
import io.taskrelay.store.StateStore;
import io.taskrelay.store.jdbc.JdbcStateStore;
import io.taskrelay.sync.HandlerResult;
import io.taskrelay.sync.TransactionalStateUpdater;
import java.time.Duration;
import java.util.UUID;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

class RelayAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(RelayAutoConfiguration.class))
        .withPropertyValues(
            "taskrelay.agent.role=worker",
            "taskrelay.agent.auto-startup=false");

    @Test
    void registersRelayInfrastructureWithDocumentedDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(BrokerConnectionManager.class);
            assertThat(context).hasSingleBean(RelayPublisher.class);
            assertThat(context).hasSingleBean(TransactionalStateUpdater.class);
            assertThat(context).hasSingleBean(RelayMessageCodec.class);
            assertThat(context).hasSingleBean(AgentHeartbeatWriter.class);
            assertThat(context.getBean(StateStore.class)).isInstanceOf(InMemoryStateStore.class);
            assertThat(context.getBean(RelayTopology.class)).isEqualTo(RelayTopology.defaults());

            BrokerConnectionManager manager = context.getBean(BrokerConnectionManager.class);
            assertThat(manager.settings().host()).isEqualTo("localhost");
            assertThat(manager.settings().port()).isEqualTo(5672);
            assertThat(manager.settings().maxRetries()).isEqualTo(5);
            assertThat(manager.settings().retryDelay()).isEqualTo(Duration.ofSeconds(2));
            assertThat(manager.settings().confirmTimeout()).isEqualTo(Duration.ofSeconds(5));
            assertThat(context.getBean(RelayAgentProperties.class).resolveAgentId()).isEqualTo("worker");
        });
    }

    @Test
    void brokerAndTopologyAreConfigurable() {
        contextRunner
            .withPropertyValues(
                "taskrelay.broker.host=rabbit",
                "taskrelay.broker.max-retries=2",
                "taskrelay.broker.retry-delay=500ms",
                "taskrelay.topology.exchange=relay-net",
                "taskrelay.topology.worker-inbox=worker-queue")
            .run(context -> {
                BrokerConnectionManager manager = context.getBean(BrokerConnectionManager.class);
                assertThat(manager.settings().host()).isEqualTo("rabbit");
                assertThat(manager.settings().maxRetries()).isEqualTo(2);
                assertThat(manager.settings().retryDelay()).isEqualTo(Duration.ofMillis(500));
                assertThat(manager.topology().exchange()).isEqualTo("relay-net");
                assertThat(manager.topology().workerInbox()).isEqualTo("worker-queue");
            });
    }

    @Test
    void agentPropertiesBindFromTheAgentPrefix() {
        contextRunner
            .withPropertyValues(
                "taskrelay.agent.agent-id=worker-7",
                "taskrelay.agent.heartbeat-interval=5s")
            .run(context -> {
                assertThat(context).hasSingleBean(RelayAgentProperties.class);
                assertThat(context).hasBean("relayAgentProperties");
                RelayAgentProperties agent = context.getBean(RelayAgentProperties.class);
                assertThat(agent.resolveAgentId()).isEqualTo("worker-7");
                assertThat(agent.getHeartbeatInterval()).isEqualTo(Duration.ofSeconds(5));
                assertThat(agent.isAutoStartup()).isFalse();
            });
    }

    @Test
    void zeroRetriesFailsValidation() {
        contextRunner
            .withPropertyValues("taskrelay.broker.max-retries=0")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void missingRoleFailsValidation() {
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RelayAutoConfiguration.class))
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void createsOneConsumerLoopPerRoute() {
        contextRunner
            .withPropertyValues("taskrelay.agent.agent-id=worker-7")
            .withBean("workerInboxRoute", RelayRoute.class,
                () -> new RelayRoute("worker-inbox", (message, context, store) -> HandlerResult.committed("ok")))
            .run(context -> {
                RelaySubscriptionLifecycle lifecycle = context.getBean(RelaySubscriptionLifecycle.class);
                assertThat(lifecycle.isAutoStartup()).isFalse();
                assertThat(lifecycle.isRunning()).isFalse();
                assertThat(lifecycle.loops()).extracting(QueueConsumerLoop::queueName).containsExactly("worker-inbox");
            });
    }

    @Test
    void routeOutsideTheTopologyIsRefused() {
        contextRunner
            .withBean(RelayRoute.class,
                () -> new RelayRoute("audit-inbox", (message, context, store) -> HandlerResult.committed("ok")))
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void heartbeatCanBeDisabled() {
        contextRunner
            .withPropertyValues("taskrelay.agent.heartbeat-enabled=false")
            .run(context -> assertThat(context).doesNotHaveBean(AgentHeartbeatWriter.class));
    }

    @Test
    void jdbcStoreInitialisesItsSchema() {
        DataSource dataSource = new DriverManagerDataSource(
            "jdbc:h2:mem:spring-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
        contextRunner
            .withPropertyValues("taskrelay.store.type=jdbc")
            .withBean(JdbcTemplate.class, () -> new JdbcTemplate(dataSource))
            .run(context -> {
                assertThat(context.getBean(StateStore.class)).isInstanceOf(JdbcStateStore.class);
                JdbcTemplate jdbc = context.getBean(JdbcTemplate.class);
                assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM relay_task", Integer.class)).isZero();
            });
    }

    @Test
    void userDefinedStoreWins() {
        InMemoryStateStore custom = new InMemoryStateStore();
        contextRunner
            .withBean(StateStore.class, () -> custom)
            .run(context -> assertThat(context.getBean(StateStore.class)).isSameAs(custom));
    }
}
