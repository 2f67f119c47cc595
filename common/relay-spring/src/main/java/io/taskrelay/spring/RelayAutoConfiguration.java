package io.taskrelay.spring;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.taskrelay.RelayTopology;
import io.taskrelay.message.RelayMessageCodec;
import io.taskrelay.messaging.connection.BrokerConnectionManager;
import io.taskrelay.messaging.publish.RelayPublisher;
import io.taskrelay.store.InMemoryStateStore;
import io.taskrelay.store.StateStore;
import io.taskrelay.store.jdbc.JdbcStateStore;
import io.taskrelay.sync.TransactionalStateUpdater;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Wires the relay for a Spring Boot service: broker connections, publisher, state store,
 * transactional updater, one consumer loop per {@link RelayRoute} bean, and the agent heartbeat.
 * <p>
 * The broker connections are managed here rather than by Spring Boot's Rabbit auto-configuration,
 * since publishing and every consumed queue each need a connection of their own.
 */
@Configuration(proxyBeanMethods = false)
@AutoConfigureAfter(JdbcTemplateAutoConfiguration.class)
@EnableConfigurationProperties({RelayBrokerProperties.class, RelayTopologyProperties.class, RelayStoreProperties.class})
public class RelayAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RelayAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    RelayAgentProperties relayAgentProperties() {
        return new RelayAgentProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    RelayTopology relayTopology(RelayTopologyProperties properties) {
        return properties.toTopology();
    }

    @Bean
    @ConditionalOnMissingBean
    RelayMessageCodec relayMessageCodec() {
        return new RelayMessageCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    Clock relayClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(StateStore.class)
    @ConditionalOnProperty(prefix = "taskrelay.store", name = "type", havingValue = "memory", matchIfMissing = true)
    InMemoryStateStore inMemoryStateStore(Clock clock) {
        log.info("Using in-memory state store");
        return new InMemoryStateStore(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    TransactionalStateUpdater transactionalStateUpdater(StateStore store) {
        return new TransactionalStateUpdater(store);
    }

    @Bean
    @ConditionalOnMissingBean
    BrokerConnectionManager brokerConnectionManager(RelayBrokerProperties broker, RelayTopology topology) {
        return new BrokerConnectionManager(broker.toSettings(), topology);
    }

    @Bean
    @ConditionalOnMissingBean
    RelayPublisher relayPublisher(BrokerConnectionManager connectionManager,
                                  RelayAgentProperties agent,
                                  RelayMessageCodec codec,
                                  Clock clock,
                                  ObjectProvider<MeterRegistry> meterRegistry) {
        return RelayPublisher.connecting(connectionManager, agent.resolveAgentId() + "-publisher", codec, clock,
            meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    RelaySubscriptionLifecycle relaySubscriptionLifecycle(ObjectProvider<RelayRoute> routes,
                                                          RelayAgentProperties agent,
                                                          BrokerConnectionManager connectionManager,
                                                          TransactionalStateUpdater updater,
                                                          RelayMessageCodec codec,
                                                          ObjectProvider<MeterRegistry> meterRegistry) {
        return new RelaySubscriptionLifecycle(routes.orderedStream().toList(), agent.resolveAgentId(),
            connectionManager, updater, codec, meterRegistry.getIfAvailable(SimpleMeterRegistry::new),
            agent.isAutoStartup());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "taskrelay.agent", name = "heartbeat-enabled", havingValue = "true", matchIfMissing = true)
    AgentHeartbeatWriter agentHeartbeatWriter(StateStore store, RelayAgentProperties agent, Clock clock) {
        return new AgentHeartbeatWriter(store, agent.resolveAgentId(), clock);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JdbcTemplate.class)
    @ConditionalOnProperty(prefix = "taskrelay.store", name = "type", havingValue = "jdbc")
    static class JdbcStoreConfiguration {

        @Bean
        @ConditionalOnBean(JdbcTemplate.class)
        @ConditionalOnMissingBean(StateStore.class)
        JdbcStateStore jdbcStateStore(JdbcTemplate jdbcTemplate, RelayStoreProperties properties, Clock clock) {
            JdbcStateStore store = new JdbcStateStore(jdbcTemplate, RelayMessageCodec.defaultMapper(), clock);
            if (properties.isInitializeSchema()) {
                store.initializeSchema();
            }
            log.info("Using JDBC state store (schema initialisation {})",
                properties.isInitializeSchema() ? "enabled" : "disabled");
            return store;
        }
    }
}
