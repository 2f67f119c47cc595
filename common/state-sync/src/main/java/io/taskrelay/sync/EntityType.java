package io.taskrelay.sync;

public enum EntityType {
    TASK,
    AGENT_STATE,
    ACTIVITY,
    WORK_REQUEST
}
