package io.taskrelay.store;

import io.taskrelay.model.ActivityLogEntry;
import io.taskrelay.model.AgentState;
import io.taskrelay.model.AgentStatus;
import io.taskrelay.model.Task;
import io.taskrelay.model.TaskStatus;
import io.taskrelay.model.WorkRequest;
import io.taskrelay.model.WorkRequestStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent home of tasks, agent states, the activity log and work requests.
 * <p>
 * Implementations serialise concurrent writes to the same entity. Metadata passed to update
 * operations is merged into the stored metadata; keys present in the update win. Store failures
 * surface as unchecked exceptions ({@link StateStoreException} or the data-access exception of the
 * backing technology).
 * <p>
 * The {@code delete*} and {@code restore*} operations exist for rollback: they put an entity
 * back to exactly the snapshot captured before a failed message began writing.
 */
public interface StateStore {

    /**
     * Inserts {@code task} unless a task with the same id exists, in which case nothing changes.
     * The existence check and the insert are one atomic step.
     *
     * @return {@code true} if this call inserted the task
     */
    boolean insertTaskIfAbsent(Task task);

    /**
     * {@link #insertTaskIfAbsent(Task)} for callers that only need the id.
     *
     * @return the task id
     */
    default String createTaskIfAbsent(Task task) {
        insertTaskIfAbsent(task);
        return task.taskId();
    }

    Optional<Task> getTask(String taskId);

    List<Task> findTasksByStatus(TaskStatus status);

    /**
     * Sets the status and merges metadata. The store does not enforce the task lifecycle.
     *
     * @return {@code false} when the task does not exist
     */
    boolean updateTaskStatus(String taskId, TaskStatus status, Map<String, Object> metadata);

    /**
     * Merges metadata into the task without touching its status, whatever the status is at the
     * moment of the write.
     *
     * @return {@code false} when the task does not exist
     */
    boolean updateTaskMetadata(String taskId, Map<String, Object> metadata);

    Optional<AgentState> getAgentState(String agentId);

    List<AgentState> listAgentStates();

    /**
     * Upserts the agent's status and current task, merging metadata into any existing state.
     *
     * @return the state as stored
     */
    AgentState updateAgentState(String agentId, AgentStatus status, String currentTaskId, Map<String, Object> metadata);

    /**
     * Refreshes {@code last_heartbeat}, creating an idle agent state on first contact.
     */
    void recordHeartbeat(String agentId, Instant at);

    /**
     * Appends an activity log entry.
     *
     * @return the id of the new entry
     */
    long logActivity(String agentId, String activityType, Map<String, Object> details);

    /**
     * Activity entries in append order; {@code agentId == null} returns every entry.
     */
    List<ActivityLogEntry> getActivities(String agentId);

    /**
     * Inserts {@code request} unless a request with the same id exists, atomically.
     *
     * @return {@code true} if this call inserted the request
     */
    boolean insertWorkRequestIfAbsent(WorkRequest request);

    /**
     * {@link #insertWorkRequestIfAbsent(WorkRequest)} for callers that only need the id.
     *
     * @return the request id
     */
    default String createWorkRequest(WorkRequest request) {
        insertWorkRequestIfAbsent(request);
        return request.requestId();
    }

    Optional<WorkRequest> getWorkRequest(String requestId);

    boolean updateWorkRequestStatus(String requestId, WorkRequestStatus status);

    void deleteTask(String taskId);

    void deleteAgentState(String agentId);

    void deleteActivity(long activityId);

    void deleteWorkRequest(String requestId);

    void restoreTask(Task snapshot);

    /**
     * Puts the agent state back to {@code snapshot}. A heartbeat newer than the snapshot's is kept,
     * since heartbeats are written outside message processing.
     */
    void restoreAgentState(AgentState snapshot);

    void restoreWorkRequest(WorkRequest snapshot);
}
