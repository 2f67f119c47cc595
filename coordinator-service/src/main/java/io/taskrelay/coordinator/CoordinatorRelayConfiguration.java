package io.taskrelay.coordinator;

import io.taskrelay.RelayTopology;
import io.taskrelay.message.RelayMessageCodec;
import io.taskrelay.messaging.publish.RelayPublisher;
import io.taskrelay.spring.RelayAgentProperties;
import io.taskrelay.spring.RelayRoute;
import io.taskrelay.store.StateStore;
import io.taskrelay.sync.handlers.StandardRoutes;
import java.time.Clock;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
class CoordinatorRelayConfiguration {

  @Bean
  @ConfigurationProperties(prefix = "taskrelay.coordinator")
  CoordinatorProperties coordinatorProperties() {
    return new CoordinatorProperties();
  }

  @Bean
  RelayRoute coordinatorInboxRoute(RelayTopology topology, Clock clock, RelayMessageCodec codec) {
    return new RelayRoute(topology.coordinatorInbox(), StandardRoutes.coordinatorInbox(clock, codec));
  }

  @Bean
  RelayRoute requirementsInboxRoute(RelayTopology topology, RelayMessageCodec codec) {
    return new RelayRoute(topology.requirementsInbox(), StandardRoutes.requirementsInbox(codec));
  }

  @Bean
  RelayRoute workRequestInboxRoute(RelayTopology topology, Clock clock) {
    return new RelayRoute(topology.workRequestInbox(), StandardRoutes.workRequestInbox(clock));
  }

  @Bean
  TaskDispatchService taskDispatchService(RelayPublisher publisher, StateStore store, RelayAgentProperties agent,
                                          Clock clock) {
    return new TaskDispatchService(publisher, store, agent.resolveAgentId(), clock);
  }

  @Bean
  AgentLivenessMonitor agentLivenessMonitor(StateStore store, CoordinatorProperties properties, Clock clock) {
    return new AgentLivenessMonitor(store, properties.getLivenessTimeout(), clock);
  }
}
