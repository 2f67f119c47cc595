package io.taskrelay.store.jdbc;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.taskrelay.model.ActivityLogEntry;
import io.taskrelay.model.AgentRole;
import io.taskrelay.model.AgentState;
import io.taskrelay.model.AgentStatus;
import io.taskrelay.model.Task;
import io.taskrelay.model.TaskPriority;
import io.taskrelay.model.TaskStatus;
import io.taskrelay.model.WorkRequest;
import io.taskrelay.model.WorkRequestStatus;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

class JdbcStateStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private JdbcTemplate jdbc;
    private JdbcStateStore store;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            "jdbc:h2:mem:relay-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
        jdbc = new JdbcTemplate(dataSource);
        store = new JdbcStateStore(jdbc, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
        store.initializeSchema();
    }

    @Test
    void schemaInitialisationIsRepeatable() {
        store.initializeSchema();

        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM relay_task", Integer.class)).isZero();
    }

    @Test
    void createTaskIfAbsentIsIdempotent() {
        Task task = Task.pending("T-1", "worker", TaskPriority.HIGH, List.of("java", "sql"),
            Map.of("title", "demo"), NOW.minusSeconds(60));

        store.createTaskIfAbsent(task);
        store.createTaskIfAbsent(Task.pending("T-1", "someone-else", null, null, null, NOW));

        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM relay_task", Integer.class)).isEqualTo(1);
        assertThat(store.getTask("T-1")).contains(task);
    }

    @Test
    void updateTaskStatusBumpsVersionAndMergesMetadata() {
        store.createTaskIfAbsent(Task.pending("T-1", "worker", null, null, Map.of("title", "demo"), NOW.minusSeconds(60)));

        assertThat(store.updateTaskStatus("T-1", TaskStatus.ASSIGNED, Map.of("assigned_at", NOW.toString()))).isTrue();
        assertThat(store.updateTaskStatus("nope", TaskStatus.ASSIGNED, Map.of())).isFalse();

        Task task = store.getTask("T-1").orElseThrow();
        assertThat(task.status()).isEqualTo(TaskStatus.ASSIGNED);
        assertThat(task.metadata()).containsEntry("title", "demo").containsEntry("assigned_at", NOW.toString());
        assertThat(task.updatedAt()).isEqualTo(NOW);
        assertThat(jdbc.queryForObject("SELECT row_version FROM relay_task WHERE task_id = 'T-1'", Long.class))
            .isEqualTo(1L);
        assertThat(store.findTasksByStatus(TaskStatus.ASSIGNED)).extracting(Task::taskId).containsExactly("T-1");
        assertThat(store.findTasksByStatus(TaskStatus.PENDING)).isEmpty();
    }

    @Test
    void insertsReportDuplicatesAsNotCreated() {
        assertThat(store.insertTaskIfAbsent(Task.pending("T-1", null, null, null, null, NOW))).isTrue();
        assertThat(store.insertTaskIfAbsent(Task.pending("T-1", null, null, null, null, NOW))).isFalse();

        WorkRequest request = new WorkRequest("R-1", AgentRole.WORKER, "review", Map.of(), null, NOW, null);
        assertThat(store.insertWorkRequestIfAbsent(request)).isTrue();
        assertThat(store.insertWorkRequestIfAbsent(request)).isFalse();
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM relay_work_request", Integer.class)).isEqualTo(1);
    }

    @Test
    void updateTaskMetadataNeverWritesAStaleStatus() {
        store.createTaskIfAbsent(Task.pending("T-1", "worker", null, null, Map.of("title", "demo"), NOW.minusSeconds(60)));
        store.updateTaskStatus("T-1", TaskStatus.ASSIGNED, Map.of());

        assertThat(store.updateTaskMetadata("T-1", Map.of("notified_at", NOW.toString()))).isTrue();
        assertThat(store.updateTaskMetadata("nope", Map.of())).isFalse();

        Task task = store.getTask("T-1").orElseThrow();
        assertThat(task.status()).isEqualTo(TaskStatus.ASSIGNED);
        assertThat(task.metadata()).containsEntry("title", "demo").containsEntry("notified_at", NOW.toString());
        assertThat(jdbc.queryForObject("SELECT row_version FROM relay_task WHERE task_id = 'T-1'", Long.class))
            .isEqualTo(2L);
    }

    @Test
    void agentStatesUpsertAndRecordHeartbeats() {
        store.recordHeartbeat("worker", NOW.minusSeconds(10));
        AgentState working = store.updateAgentState("worker", AgentStatus.WORKING, "T-1", Map.of("last_activity", "x"));
        store.recordHeartbeat("worker", NOW);

        AgentState stored = store.getAgentState("worker").orElseThrow();
        assertThat(stored.status()).isEqualTo(AgentStatus.WORKING);
        assertThat(stored.currentTaskId()).isEqualTo("T-1");
        assertThat(stored.lastHeartbeat()).isEqualTo(NOW);
        assertThat(stored.metadata()).isEqualTo(working.metadata());
        assertThat(store.listAgentStates()).hasSize(1);
    }

    @Test
    void activityLogAppendsInOrder() {
        long first = store.logActivity("worker", "task_received", Map.of("task_id", "T-1"));
        long second = store.logActivity("coordinator", "task_completed", Map.of("task_id", "T-1"));

        assertThat(second).isEqualTo(first + 1);
        List<ActivityLogEntry> worker = store.getActivities("worker");
        assertThat(worker).singleElement().satisfies(entry -> {
            assertThat(entry.activityType()).isEqualTo("task_received");
            assertThat(entry.details()).containsEntry("task_id", "T-1");
            assertThat(entry.loggedAt()).isEqualTo(NOW);
        });
        assertThat(store.getActivities(null)).extracting(ActivityLogEntry::id).containsExactly(first, second);

        store.deleteActivity(second);
        assertThat(store.logActivity("worker", "again", Map.of())).isEqualTo(second);
    }

    @Test
    void rollbackPrimitivesRestoreSnapshots() {
        Task original = Task.pending("T-1", "worker", null, null, Map.of("title", "demo"), NOW.minusSeconds(60));
        store.createTaskIfAbsent(original);
        AgentState agentBefore = store.updateAgentState("worker", AgentStatus.IDLE, null, Map.of());
        store.updateTaskStatus("T-1", TaskStatus.ASSIGNED, Map.of("assigned_at", "t"));
        store.updateAgentState("worker", AgentStatus.WORKING, "T-1", Map.of("extra", true));
        store.createWorkRequest(new WorkRequest("R-1", AgentRole.WORKER, "review", Map.of(), null, NOW, null));

        store.restoreTask(original);
        store.restoreAgentState(agentBefore);
        store.deleteWorkRequest("R-1");

        assertThat(store.getTask("T-1")).contains(original);
        assertThat(store.getAgentState("worker")).contains(agentBefore);
        assertThat(store.getWorkRequest("R-1")).isEmpty();

        store.deleteTask("T-1");
        store.deleteAgentState("worker");
        assertThat(store.getTask("T-1")).isEmpty();
        assertThat(store.getAgentState("worker")).isEmpty();
    }

    @Test
    void workRequestsRoundTripAndTrackStatus() {
        WorkRequest request = new WorkRequest("R-1", AgentRole.WORKER, "clarification",
            Map.of("question", "which db?"), null, NOW.minusSeconds(5), null);

        store.createWorkRequest(request);
        store.createWorkRequest(new WorkRequest("R-1", AgentRole.COORDINATOR, "other", Map.of(), null, NOW, null));

        assertThat(store.getWorkRequest("R-1")).contains(request);
        assertThat(store.updateWorkRequestStatus("R-1", WorkRequestStatus.COMPLETED)).isTrue();
        assertThat(store.getWorkRequest("R-1").orElseThrow().status()).isEqualTo(WorkRequestStatus.COMPLETED);

        store.restoreWorkRequest(request);
        assertThat(store.getWorkRequest("R-1")).contains(request);
    }
}
