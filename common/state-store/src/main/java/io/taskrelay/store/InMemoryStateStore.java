package io.taskrelay.store;

import io.taskrelay.model.ActivityLogEntry;
import io.taskrelay.model.AgentState;
import io.taskrelay.model.AgentStatus;
import io.taskrelay.model.Task;
import io.taskrelay.model.TaskStatus;
import io.taskrelay.model.WorkRequest;
import io.taskrelay.model.WorkRequestStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * {@link StateStore} held in concurrent maps. Used by tests and by deployments that run without a
 * database ({@code taskrelay.store.type=memory}).
 * <p>
 * Activity ids continue from the highest id present, so an entry removed by rollback frees its id
 * for the next append.
 */
public class InMemoryStateStore implements StateStore {

    private final Clock clock;
    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AgentState> agents = new ConcurrentHashMap<>();
    private final ConcurrentSkipListMap<Long, ActivityLogEntry> activities = new ConcurrentSkipListMap<>();
    private final ConcurrentHashMap<String, WorkRequest> workRequests = new ConcurrentHashMap<>();
    private final Object activityLock = new Object();

    public InMemoryStateStore() {
        this(Clock.systemUTC());
    }

    public InMemoryStateStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean insertTaskIfAbsent(Task task) {
        Objects.requireNonNull(task, "task");
        return tasks.putIfAbsent(task.taskId(), task) == null;
    }

    @Override
    public Optional<Task> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> findTasksByStatus(TaskStatus status) {
        return tasks.values().stream()
            .filter(task -> task.status() == status)
            .sorted(Comparator.comparing(Task::createdAt).thenComparing(Task::taskId))
            .toList();
    }

    @Override
    public boolean updateTaskStatus(String taskId, TaskStatus status, Map<String, Object> metadata) {
        Objects.requireNonNull(status, "status");
        Task updated = tasks.computeIfPresent(taskId,
            (id, existing) -> existing.withStatus(status, metadata, clock.instant()));
        return updated != null;
    }

    @Override
    public boolean updateTaskMetadata(String taskId, Map<String, Object> metadata) {
        Task updated = tasks.computeIfPresent(taskId,
            (id, existing) -> existing.withStatus(existing.status(), metadata, clock.instant()));
        return updated != null;
    }

    @Override
    public Optional<AgentState> getAgentState(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    @Override
    public List<AgentState> listAgentStates() {
        return agents.values().stream()
            .sorted(Comparator.comparing(AgentState::agentId))
            .toList();
    }

    @Override
    public AgentState updateAgentState(String agentId, AgentStatus status, String currentTaskId,
                                       Map<String, Object> metadata) {
        Objects.requireNonNull(status, "status");
        Instant now = clock.instant();
        return agents.compute(agentId, (id, existing) -> existing == null
            ? new AgentState(id, status, currentTaskId, null, metadata, now)
            : existing.withStatus(status, currentTaskId, metadata, now));
    }

    @Override
    public void recordHeartbeat(String agentId, Instant at) {
        Objects.requireNonNull(at, "at");
        agents.compute(agentId, (id, existing) -> existing == null
            ? new AgentState(id, AgentStatus.IDLE, null, at, Map.of(), at)
            : existing.withHeartbeat(at));
    }

    @Override
    public long logActivity(String agentId, String activityType, Map<String, Object> details) {
        synchronized (activityLock) {
            long id = activities.isEmpty() ? 1L : activities.lastKey() + 1L;
            activities.put(id, new ActivityLogEntry(id, agentId, activityType, details, clock.instant()));
            return id;
        }
    }

    @Override
    public List<ActivityLogEntry> getActivities(String agentId) {
        List<ActivityLogEntry> result = new ArrayList<>();
        for (ActivityLogEntry entry : activities.values()) {
            if (agentId == null || agentId.equals(entry.agentId())) {
                result.add(entry);
            }
        }
        return List.copyOf(result);
    }

    @Override
    public boolean insertWorkRequestIfAbsent(WorkRequest request) {
        Objects.requireNonNull(request, "request");
        return workRequests.putIfAbsent(request.requestId(), request) == null;
    }

    @Override
    public Optional<WorkRequest> getWorkRequest(String requestId) {
        return Optional.ofNullable(workRequests.get(requestId));
    }

    @Override
    public boolean updateWorkRequestStatus(String requestId, WorkRequestStatus status) {
        Objects.requireNonNull(status, "status");
        return workRequests.computeIfPresent(requestId,
            (id, existing) -> existing.withStatus(status, clock.instant())) != null;
    }

    @Override
    public void deleteTask(String taskId) {
        tasks.remove(taskId);
    }

    @Override
    public void deleteAgentState(String agentId) {
        agents.remove(agentId);
    }

    @Override
    public void deleteActivity(long activityId) {
        synchronized (activityLock) {
            activities.remove(activityId);
        }
    }

    @Override
    public void deleteWorkRequest(String requestId) {
        workRequests.remove(requestId);
    }

    @Override
    public void restoreTask(Task snapshot) {
        tasks.put(snapshot.taskId(), snapshot);
    }

    @Override
    public void restoreAgentState(AgentState snapshot) {
        agents.compute(snapshot.agentId(), (id, current) -> {
            if (current != null && current.lastHeartbeat() != null
                && (snapshot.lastHeartbeat() == null || current.lastHeartbeat().isAfter(snapshot.lastHeartbeat()))) {
                return snapshot.withHeartbeat(current.lastHeartbeat());
            }
            return snapshot;
        });
    }

    @Override
    public void restoreWorkRequest(WorkRequest snapshot) {
        workRequests.put(snapshot.requestId(), snapshot);
    }

    public StateSnapshot snapshot() {
        synchronized (activityLock) {
            return new StateSnapshot(tasks, agents, new ArrayList<>(activities.values()), workRequests);
        }
    }
}
