package io.taskrelay.spring;

import io.micrometer.core.instrument.MeterRegistry;
import io.taskrelay.message.RelayMessageCodec;
import io.taskrelay.messaging.connection.BrokerConnectionManager;
import io.taskrelay.messaging.consume.QueueConsumerLoop;
import io.taskrelay.messaging.consume.RelaySubscription;
import io.taskrelay.sync.HandlerContext;
import io.taskrelay.sync.TransactionalStateUpdater;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.SmartLifecycle;

/**
 * Starts one {@link QueueConsumerLoop} per {@link RelayRoute} when the application context is ready
 * and stops them when the context stops. Each loop applies its messages through the transactional
 * updater. A stopped context can be started again; the loops' supervisors are only released when
 * the bean is destroyed.
 */
public final class RelaySubscriptionLifecycle implements SmartLifecycle, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(RelaySubscriptionLifecycle.class);

    private final List<QueueConsumerLoop> loops;
    private final boolean autoStartup;
    private volatile boolean running;

    public RelaySubscriptionLifecycle(List<RelayRoute> routes,
                                      String agentId,
                                      BrokerConnectionManager connectionManager,
                                      TransactionalStateUpdater updater,
                                      RelayMessageCodec codec,
                                      MeterRegistry meterRegistry,
                                      boolean autoStartup) {
        Objects.requireNonNull(routes, "routes");
        Objects.requireNonNull(agentId, "agentId");
        Set<String> queues = new HashSet<>();
        List<QueueConsumerLoop> created = new ArrayList<>(routes.size());
        for (RelayRoute route : routes) {
            if (!queues.add(route.queueName())) {
                throw new IllegalStateException("Queue '" + route.queueName() + "' has more than one route");
            }
            HandlerContext context = new HandlerContext(agentId, route.queueName());
            RelaySubscription subscription = new RelaySubscription(route.queueName(),
                updater.bind(context, route.handler()));
            created.add(new QueueConsumerLoop(connectionManager, agentId, subscription, codec, meterRegistry));
        }
        this.loops = List.copyOf(created);
        this.autoStartup = autoStartup;
    }

    public List<QueueConsumerLoop> loops() {
        return loops;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        loops.forEach(QueueConsumerLoop::start);
        if (log.isInfoEnabled()) {
            log.info("Relay subscriptions started (queues={})", loops.stream().map(QueueConsumerLoop::queueName).toList());
        }
        running = true;
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        loops.forEach(QueueConsumerLoop::stop);
        log.info("Relay subscriptions stopped");
        running = false;
    }

    @Override
    public void destroy() {
        running = false;
        loops.forEach(QueueConsumerLoop::close);
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    @Override
    public int getPhase() {
        return 0;
    }
}
