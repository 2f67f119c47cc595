package io.taskrelay.sync;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.taskrelay.message.DeliveryOutcome;
import io.taskrelay.message.RelayMessage;
import io.taskrelay.message.RelayMessageCodec;
import io.taskrelay.message.TaskAssignmentPayload;
import io.taskrelay.model.AgentRole;
import io.taskrelay.model.AgentState;
import io.taskrelay.model.AgentStatus;
import io.taskrelay.model.Task;
import io.taskrelay.model.TaskStatus;
import io.taskrelay.store.jdbc.JdbcStateStore;
import io.taskrelay.sync.handlers.TaskAssignmentHandler;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

class JdbcRollbackTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final HandlerContext WORKER = new HandlerContext("worker", "worker-inbox");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private JdbcTemplate jdbc;
    private JdbcStateStore store;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            "jdbc:h2:mem:sync-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
        jdbc = new JdbcTemplate(dataSource);
        store = new JdbcStateStore(jdbc, new ObjectMapper(), clock);
        store.initializeSchema();
        store.updateAgentState("worker", AgentStatus.IDLE, null, Map.of("started", NOW.toString()));
        store.logActivity("worker", "startup", Map.of());
    }

    @Test
    void failedAssignmentLeavesNoRowsBehind() {
        AgentState workerBefore = store.getAgentState("worker").orElseThrow();
        TaskAssignmentHandler assignment = new TaskAssignmentHandler(clock, new RelayMessageCodec());
        StateChangeHandler failsAfterWriting = (message, context, facade) -> {
            assignment.handle(message, context, facade);
            return HandlerResult.failed("downstream unavailable");
        };

        DeliveryOutcome outcome = new TransactionalStateUpdater(store).apply(message("T-7"), WORKER, failsAfterWriting);

        assertThat(outcome).isEqualTo(DeliveryOutcome.REQUEUE);
        assertThat(store.getTask("T-7")).isEmpty();
        assertThat(store.getAgentState("worker")).contains(workerBefore);
        assertThat(count("relay_task")).isZero();
        assertThat(count("relay_activity_log")).isEqualTo(1);
    }

    @Test
    void committedAssignmentIsPersisted() {
        DeliveryOutcome outcome = new TransactionalStateUpdater(store)
            .apply(message("T-8"), WORKER, new TaskAssignmentHandler(clock, new RelayMessageCodec()));

        assertThat(outcome).isEqualTo(DeliveryOutcome.ACK);
        Task task = store.getTask("T-8").orElseThrow();
        assertThat(task.status()).isEqualTo(TaskStatus.ASSIGNED);
        assertThat(store.getAgentState("worker").orElseThrow().currentTaskId()).isEqualTo("T-8");
        assertThat(count("relay_activity_log")).isEqualTo(3);
    }

    private int count(String table) {
        return jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
    }

    private static RelayMessage message(String taskId) {
        return RelayMessage.taskAssignment(taskId, AgentRole.COORDINATOR, AgentRole.WORKER,
            TaskAssignmentPayload.of("jdbc", null), NOW);
    }
}
