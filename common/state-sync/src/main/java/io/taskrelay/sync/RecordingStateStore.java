package io.taskrelay.sync;

import io.taskrelay.model.ActivityLogEntry;
import io.taskrelay.model.AgentState;
import io.taskrelay.model.AgentStatus;
import io.taskrelay.model.Task;
import io.taskrelay.model.TaskStatus;
import io.taskrelay.model.WorkRequest;
import io.taskrelay.model.WorkRequestStatus;
import io.taskrelay.store.StateStore;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link StateStore} facade handed to message handlers. Every write first captures what it is
 * about to overwrite into the {@link ChangeLedger}, then applies the write to the real store.
 * Reads pass straight through. The rollback primitives are reserved for the ledger itself.
 */
public final class RecordingStateStore implements StateStore {

    private final StateStore delegate;
    private final ChangeLedger ledger;

    public RecordingStateStore(StateStore delegate, ChangeLedger ledger) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    /**
     * Recorded only when the delegate reports a real insert, so a task created concurrently by
     * another consumer is never deleted by this message's rollback.
     */
    @Override
    public boolean insertTaskIfAbsent(Task task) {
        Objects.requireNonNull(task, "task");
        boolean inserted = delegate.insertTaskIfAbsent(task);
        if (inserted) {
            ledger.record(EntityType.TASK, task.taskId(), null);
        }
        return inserted;
    }

    @Override
    public Optional<Task> getTask(String taskId) {
        return delegate.getTask(taskId);
    }

    @Override
    public List<Task> findTasksByStatus(TaskStatus status) {
        return delegate.findTasksByStatus(status);
    }

    @Override
    public boolean updateTaskStatus(String taskId, TaskStatus status, Map<String, Object> metadata) {
        Optional<Task> prior = delegate.getTask(taskId);
        if (prior.isEmpty()) {
            return false;
        }
        ledger.record(EntityType.TASK, taskId, prior.get());
        return delegate.updateTaskStatus(taskId, status, metadata);
    }

    @Override
    public boolean updateTaskMetadata(String taskId, Map<String, Object> metadata) {
        Optional<Task> prior = delegate.getTask(taskId);
        if (prior.isEmpty()) {
            return false;
        }
        ledger.record(EntityType.TASK, taskId, prior.get());
        return delegate.updateTaskMetadata(taskId, metadata);
    }

    @Override
    public Optional<AgentState> getAgentState(String agentId) {
        return delegate.getAgentState(agentId);
    }

    @Override
    public List<AgentState> listAgentStates() {
        return delegate.listAgentStates();
    }

    @Override
    public AgentState updateAgentState(String agentId, AgentStatus status, String currentTaskId,
                                       Map<String, Object> metadata) {
        ledger.record(EntityType.AGENT_STATE, agentId, delegate.getAgentState(agentId).orElse(null));
        return delegate.updateAgentState(agentId, status, currentTaskId, metadata);
    }

    @Override
    public void recordHeartbeat(String agentId, Instant at) {
        ledger.record(EntityType.AGENT_STATE, agentId, delegate.getAgentState(agentId).orElse(null));
        delegate.recordHeartbeat(agentId, at);
    }

    /**
     * The id of an appended entry is only known after the append, so this is the one write that
     * is recorded afterwards; a failed append leaves nothing to undo.
     */
    @Override
    public long logActivity(String agentId, String activityType, Map<String, Object> details) {
        long id = delegate.logActivity(agentId, activityType, details);
        ledger.record(EntityType.ACTIVITY, Long.toString(id), null);
        return id;
    }

    @Override
    public List<ActivityLogEntry> getActivities(String agentId) {
        return delegate.getActivities(agentId);
    }

    @Override
    public boolean insertWorkRequestIfAbsent(WorkRequest request) {
        Objects.requireNonNull(request, "request");
        boolean inserted = delegate.insertWorkRequestIfAbsent(request);
        if (inserted) {
            ledger.record(EntityType.WORK_REQUEST, request.requestId(), null);
        }
        return inserted;
    }

    @Override
    public Optional<WorkRequest> getWorkRequest(String requestId) {
        return delegate.getWorkRequest(requestId);
    }

    @Override
    public boolean updateWorkRequestStatus(String requestId, WorkRequestStatus status) {
        Optional<WorkRequest> prior = delegate.getWorkRequest(requestId);
        if (prior.isEmpty()) {
            return false;
        }
        ledger.record(EntityType.WORK_REQUEST, requestId, prior.get());
        return delegate.updateWorkRequestStatus(requestId, status);
    }

    @Override
    public void deleteTask(String taskId) {
        throw rollbackOnly();
    }

    @Override
    public void deleteAgentState(String agentId) {
        throw rollbackOnly();
    }

    @Override
    public void deleteActivity(long activityId) {
        throw rollbackOnly();
    }

    @Override
    public void deleteWorkRequest(String requestId) {
        throw rollbackOnly();
    }

    @Override
    public void restoreTask(Task snapshot) {
        throw rollbackOnly();
    }

    @Override
    public void restoreAgentState(AgentState snapshot) {
        throw rollbackOnly();
    }

    @Override
    public void restoreWorkRequest(WorkRequest snapshot) {
        throw rollbackOnly();
    }

    private static UnsupportedOperationException rollbackOnly() {
        return new UnsupportedOperationException("Rollback primitives are not available to message handlers");
    }
}
