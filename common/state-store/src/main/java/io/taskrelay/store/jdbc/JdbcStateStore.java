package io.taskrelay.store.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
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
import io.taskrelay.store.StateStore;
import io.taskrelay.store.StateStoreException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

/**
 * {@link StateStore} backed by a relational database through {@link JdbcTemplate}. Written for
 * Postgres; the schema also runs on H2 in PostgreSQL mode.
 * <p>
 * Creates rely on primary-key uniqueness ({@link DuplicateKeyException} means "already there").
 * Read-modify-write updates of tasks and agent states use an optimistic {@code row_version}
 * and retry a bounded number of times before giving up with
 * {@link OptimisticLockingFailureException}. Metadata and list columns hold JSON text.
 */
public class JdbcStateStore implements StateStore {

    public static final String SCHEMA_LOCATION = "db/taskrelay/schema.sql";

    private static final Logger log = LoggerFactory.getLogger(JdbcStateStore.class);
    private static final int MAX_WRITE_ATTEMPTS = 5;
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JdbcStateStore(JdbcTemplate jdbc, ObjectMapper mapper, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates the tables if they are missing. Safe to run on every start.
     */
    public void initializeSchema() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
        populator.execute(Objects.requireNonNull(jdbc.getDataSource(), "dataSource"));
        log.info("State store schema '{}' initialised", SCHEMA_LOCATION);
    }

    // ---- tasks

    @Override
    public boolean insertTaskIfAbsent(Task task) {
        Objects.requireNonNull(task, "task");
        try {
            insertTask(task);
            return true;
        } catch (DuplicateKeyException alreadyThere) {
            log.debug("Task '{}' already exists; create is a no-op", task.taskId());
            return false;
        }
    }

    @Override
    public Optional<Task> getTask(String taskId) {
        return findTask(taskId).map(Versioned::value);
    }

    @Override
    public List<Task> findTasksByStatus(TaskStatus status) {
        return jdbc.query(
            "SELECT * FROM relay_task WHERE status = ? ORDER BY created_at, task_id",
            (rs, rowNum) -> mapTask(rs), status.wire());
    }

    @Override
    public boolean updateTaskStatus(String taskId, TaskStatus status, Map<String, Object> metadata) {
        Objects.requireNonNull(status, "status");
        return updateTask(taskId, task -> task.withStatus(status, metadata, clock.instant()));
    }

    @Override
    public boolean updateTaskMetadata(String taskId, Map<String, Object> metadata) {
        return updateTask(taskId, task -> task.withStatus(task.status(), metadata, clock.instant()));
    }

    private boolean updateTask(String taskId, UnaryOperator<Task> change) {
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            Optional<Versioned<Task>> current = findTask(taskId);
            if (current.isEmpty()) {
                return false;
            }
            Task updated = change.apply(current.get().value());
            int rows = jdbc.update("""
                    UPDATE relay_task
                       SET status = ?, metadata = ?, updated_at = ?, row_version = row_version + 1
                     WHERE task_id = ? AND row_version = ?
                    """,
                updated.status().wire(), toJson(updated.metadata()), Timestamp.from(updated.updatedAt()),
                taskId, current.get().version());
            if (rows == 1) {
                return true;
            }
            log.debug("Concurrent write on task '{}' (attempt {}), retrying", taskId, attempt);
        }
        throw new OptimisticLockingFailureException("Could not update task '" + taskId + "' after "
            + MAX_WRITE_ATTEMPTS + " attempts");
    }

    @Override
    public void deleteTask(String taskId) {
        jdbc.update("DELETE FROM relay_task WHERE task_id = ?", taskId);
    }

    @Override
    public void restoreTask(Task snapshot) {
        int rows = jdbc.update("""
                UPDATE relay_task
                   SET status = ?, assigned_to = ?, priority = ?, requirements = ?, metadata = ?,
                       created_at = ?, updated_at = ?, row_version = row_version + 1
                 WHERE task_id = ?
                """,
            snapshot.status().wire(), snapshot.assignedTo(), snapshot.priority().wire(),
            toJson(snapshot.requirements()), toJson(snapshot.metadata()),
            Timestamp.from(snapshot.createdAt()), Timestamp.from(snapshot.updatedAt()), snapshot.taskId());
        if (rows == 0) {
            insertTask(snapshot);
        }
    }

    private void insertTask(Task task) {
        jdbc.update("""
                INSERT INTO relay_task
                  (task_id, status, assigned_to, priority, requirements, metadata, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
            task.taskId(), task.status().wire(), task.assignedTo(), task.priority().wire(),
            toJson(task.requirements()), toJson(task.metadata()),
            Timestamp.from(task.createdAt()), Timestamp.from(task.updatedAt()));
    }

    private Optional<Versioned<Task>> findTask(String taskId) {
        List<Versioned<Task>> rows = jdbc.query("SELECT * FROM relay_task WHERE task_id = ?",
            (rs, rowNum) -> new Versioned<>(mapTask(rs), rs.getLong("row_version")), taskId);
        return rows.stream().findFirst();
    }

    private Task mapTask(ResultSet rs) throws SQLException {
        return new Task(
            rs.getString("task_id"),
            TaskStatus.fromWire(rs.getString("status")),
            rs.getString("assigned_to"),
            TaskPriority.fromWire(rs.getString("priority")),
            fromJson(rs.getString("requirements"), LIST_TYPE),
            fromJson(rs.getString("metadata"), MAP_TYPE),
            instant(rs, "created_at"),
            instant(rs, "updated_at"));
    }

    // ---- agent states

    @Override
    public Optional<AgentState> getAgentState(String agentId) {
        return findAgent(agentId).map(Versioned::value);
    }

    @Override
    public List<AgentState> listAgentStates() {
        return jdbc.query("SELECT * FROM relay_agent_state ORDER BY agent_id", (rs, rowNum) -> mapAgent(rs));
    }

    @Override
    public AgentState updateAgentState(String agentId, AgentStatus status, String currentTaskId,
                                       Map<String, Object> metadata) {
        Objects.requireNonNull(status, "status");
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            Instant now = clock.instant();
            Optional<Versioned<AgentState>> current = findAgent(agentId);
            if (current.isEmpty()) {
                AgentState created = new AgentState(agentId, status, currentTaskId, null, metadata, now);
                try {
                    insertAgent(created);
                    return created;
                } catch (DuplicateKeyException raced) {
                    log.debug("Agent state '{}' created concurrently (attempt {}), retrying", agentId, attempt);
                    continue;
                }
            }
            AgentState updated = current.get().value().withStatus(status, currentTaskId, metadata, now);
            int rows = jdbc.update("""
                    UPDATE relay_agent_state
                       SET status = ?, current_task_id = ?, metadata = ?, updated_at = ?,
                           row_version = row_version + 1
                     WHERE agent_id = ? AND row_version = ?
                    """,
                updated.status().wire(), updated.currentTaskId(), toJson(updated.metadata()),
                Timestamp.from(now), agentId, current.get().version());
            if (rows == 1) {
                return updated;
            }
            log.debug("Concurrent write on agent state '{}' (attempt {}), retrying", agentId, attempt);
        }
        throw new OptimisticLockingFailureException("Could not update agent state '" + agentId + "' after "
            + MAX_WRITE_ATTEMPTS + " attempts");
    }

    @Override
    public void recordHeartbeat(String agentId, Instant at) {
        Objects.requireNonNull(at, "at");
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            int rows = jdbc.update("UPDATE relay_agent_state SET last_heartbeat = ? WHERE agent_id = ?",
                Timestamp.from(at), agentId);
            if (rows == 1) {
                return;
            }
            try {
                insertAgent(new AgentState(agentId, AgentStatus.IDLE, null, at, Map.of(), at));
                return;
            } catch (DuplicateKeyException raced) {
                log.debug("Agent state '{}' created concurrently with heartbeat, retrying", agentId);
            }
        }
        throw new OptimisticLockingFailureException("Could not record heartbeat for '" + agentId + "'");
    }

    @Override
    public void deleteAgentState(String agentId) {
        jdbc.update("DELETE FROM relay_agent_state WHERE agent_id = ?", agentId);
    }

    @Override
    public void restoreAgentState(AgentState snapshot) {
        Instant heartbeat = snapshot.lastHeartbeat();
        Optional<AgentState> current = getAgentState(snapshot.agentId());
        if (current.isPresent() && current.get().lastHeartbeat() != null
            && (heartbeat == null || current.get().lastHeartbeat().isAfter(heartbeat))) {
            heartbeat = current.get().lastHeartbeat();
        }
        AgentState restored = snapshot.withHeartbeat(heartbeat);
        int rows = jdbc.update("""
                UPDATE relay_agent_state
                   SET status = ?, current_task_id = ?, last_heartbeat = ?, metadata = ?, updated_at = ?,
                       row_version = row_version + 1
                 WHERE agent_id = ?
                """,
            restored.status().wire(), restored.currentTaskId(), timestamp(restored.lastHeartbeat()),
            toJson(restored.metadata()), Timestamp.from(restored.updatedAt()), restored.agentId());
        if (rows == 0) {
            insertAgent(restored);
        }
    }

    private void insertAgent(AgentState state) {
        jdbc.update("""
                INSERT INTO relay_agent_state
                  (agent_id, status, current_task_id, last_heartbeat, metadata, updated_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """,
            state.agentId(), state.status().wire(), state.currentTaskId(), timestamp(state.lastHeartbeat()),
            toJson(state.metadata()), Timestamp.from(state.updatedAt()));
    }

    private Optional<Versioned<AgentState>> findAgent(String agentId) {
        List<Versioned<AgentState>> rows = jdbc.query("SELECT * FROM relay_agent_state WHERE agent_id = ?",
            (rs, rowNum) -> new Versioned<>(mapAgent(rs), rs.getLong("row_version")), agentId);
        return rows.stream().findFirst();
    }

    private AgentState mapAgent(ResultSet rs) throws SQLException {
        return new AgentState(
            rs.getString("agent_id"),
            AgentStatus.fromWire(rs.getString("status")),
            rs.getString("current_task_id"),
            instant(rs, "last_heartbeat"),
            fromJson(rs.getString("metadata"), MAP_TYPE),
            instant(rs, "updated_at"));
    }

    // ---- activity log

    @Override
    public long logActivity(String agentId, String activityType, Map<String, Object> details) {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(activityType, "activityType");
        String json = toJson(details == null ? Map.of() : details);
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            Long next = jdbc.queryForObject("SELECT COALESCE(MAX(id), 0) + 1 FROM relay_activity_log", Long.class);
            long id = next == null ? 1L : next;
            try {
                jdbc.update("""
                        INSERT INTO relay_activity_log (id, agent_id, activity_type, details, logged_at)
                        VALUES (?, ?, ?, ?, ?)
                        """,
                    id, agentId, activityType, json, Timestamp.from(clock.instant()));
                return id;
            } catch (DuplicateKeyException raced) {
                log.debug("Activity id {} taken concurrently (attempt {}), retrying", id, attempt);
            }
        }
        throw new StateStoreException("Could not append activity '" + activityType + "' for agent '"
            + agentId + "' after " + MAX_WRITE_ATTEMPTS + " attempts");
    }

    @Override
    public List<ActivityLogEntry> getActivities(String agentId) {
        RowMapper<ActivityLogEntry> rowMapper = (rs, rowNum) -> new ActivityLogEntry(
            rs.getLong("id"),
            rs.getString("agent_id"),
            rs.getString("activity_type"),
            fromJson(rs.getString("details"), MAP_TYPE),
            instant(rs, "logged_at"));
        if (agentId == null) {
            return jdbc.query("SELECT * FROM relay_activity_log ORDER BY id", rowMapper);
        }
        return jdbc.query("SELECT * FROM relay_activity_log WHERE agent_id = ? ORDER BY id", rowMapper, agentId);
    }

    @Override
    public void deleteActivity(long activityId) {
        jdbc.update("DELETE FROM relay_activity_log WHERE id = ?", activityId);
    }

    // ---- work requests

    @Override
    public boolean insertWorkRequestIfAbsent(WorkRequest request) {
        Objects.requireNonNull(request, "request");
        try {
            insertWorkRequest(request);
            return true;
        } catch (DuplicateKeyException alreadyThere) {
            log.debug("Work request '{}' already exists; create is a no-op", request.requestId());
            return false;
        }
    }

    @Override
    public Optional<WorkRequest> getWorkRequest(String requestId) {
        List<WorkRequest> rows = jdbc.query("SELECT * FROM relay_work_request WHERE request_id = ?",
            (rs, rowNum) -> new WorkRequest(
                rs.getString("request_id"),
                rs.getString("from_role") == null ? null : AgentRole.fromWire(rs.getString("from_role")),
                rs.getString("request_type"),
                fromJson(rs.getString("details"), MAP_TYPE),
                WorkRequestStatus.fromWire(rs.getString("status")),
                instant(rs, "created_at"),
                instant(rs, "updated_at")),
            requestId);
        return rows.stream().findFirst();
    }

    @Override
    public boolean updateWorkRequestStatus(String requestId, WorkRequestStatus status) {
        Objects.requireNonNull(status, "status");
        return jdbc.update("UPDATE relay_work_request SET status = ?, updated_at = ? WHERE request_id = ?",
            status.wire(), Timestamp.from(clock.instant()), requestId) == 1;
    }

    @Override
    public void deleteWorkRequest(String requestId) {
        jdbc.update("DELETE FROM relay_work_request WHERE request_id = ?", requestId);
    }

    @Override
    public void restoreWorkRequest(WorkRequest snapshot) {
        int rows = jdbc.update("""
                UPDATE relay_work_request
                   SET from_role = ?, request_type = ?, details = ?, status = ?, created_at = ?, updated_at = ?
                 WHERE request_id = ?
                """,
            snapshot.fromRole() == null ? null : snapshot.fromRole().wire(), snapshot.type(),
            toJson(snapshot.details()), snapshot.status().wire(),
            Timestamp.from(snapshot.createdAt()), Timestamp.from(snapshot.updatedAt()), snapshot.requestId());
        if (rows == 0) {
            insertWorkRequest(snapshot);
        }
    }

    private void insertWorkRequest(WorkRequest request) {
        jdbc.update("""
                INSERT INTO relay_work_request
                  (request_id, from_role, request_type, details, status, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """,
            request.requestId(), request.fromRole() == null ? null : request.fromRole().wire(), request.type(),
            toJson(request.details()), request.status().wire(),
            Timestamp.from(request.createdAt()), Timestamp.from(request.updatedAt()));
    }

    // ---- helpers

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to serialise state store column", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to read state store column", e);
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp value = rs.getTimestamp(column);
        return value == null ? null : value.toInstant();
    }

    private record Versioned<T>(T value, long version) {
    }
}
