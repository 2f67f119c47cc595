package io.taskrelay.store;

import io.taskrelay.model.ActivityLogEntry;
import io.taskrelay.model.AgentState;
import io.taskrelay.model.Task;
import io.taskrelay.model.WorkRequest;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Point-in-time copy of every entity held by an {@link InMemoryStateStore}; equal snapshots mean
 * equal stores.
 */
public record StateSnapshot(
    Map<String, Task> tasks,
    Map<String, AgentState> agentStates,
    List<ActivityLogEntry> activities,
    Map<String, WorkRequest> workRequests
) {

    public StateSnapshot {
        tasks = Collections.unmodifiableMap(new TreeMap<>(tasks));
        agentStates = Collections.unmodifiableMap(new TreeMap<>(agentStates));
        activities = List.copyOf(activities);
        workRequests = Collections.unmodifiableMap(new TreeMap<>(workRequests));
    }
}
