package io.taskrelay.worker;

import io.taskrelay.RelayTopology;
import io.taskrelay.message.RelayMessageCodec;
import io.taskrelay.messaging.publish.RelayPublisher;
import io.taskrelay.spring.RelayAgentProperties;
import io.taskrelay.spring.RelayRoute;
import io.taskrelay.sync.handlers.StandardRoutes;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The worker consumes its inbox and reports back through the coordinator-side queues.
 */
@Configuration(proxyBeanMethods = false)
class WorkerRelayConfiguration {

  @Bean
  RelayRoute workerInboxRoute(RelayTopology topology, Clock clock, RelayMessageCodec codec) {
    return new RelayRoute(topology.workerInbox(), StandardRoutes.workerInbox(clock, codec));
  }

  @Bean
  WorkerTaskReporter workerTaskReporter(RelayPublisher publisher, RelayAgentProperties agent, Clock clock) {
    return new WorkerTaskReporter(publisher, agent.resolveAgentId(), clock);
  }
}
