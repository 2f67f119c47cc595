package io.taskrelay.sync.handlers;

/**
 * Activity log types written by the message handlers.
 */
public final class ActivityTypes {

    private ActivityTypes() {
    }

    public static final String TASK_RECEIVED = "task_received";
    public static final String TASK_ASSIGNMENT_ARCHIVED = "task_assignment_archived";
    public static final String TASK_COMPLETED = "task_completed";
    public static final String TASK_FAILED = "task_failed";
    public static final String TASK_COMPLETION_DUPLICATE = "task_completion_duplicate";
    public static final String TASK_COMPLETION_ORPHANED = "task_completion_orphaned";
    public static final String TASK_UPDATED = "task_updated";
    public static final String TASK_UPDATE_ORPHANED = "task_update_orphaned";
    public static final String WORK_REQUEST_RECEIVED = "work_request_received";
    public static final String STATUS_UPDATE_RECEIVED = "status_update_received";
    public static final String RESOURCE_REQUESTED = "resource_requested";
    public static final String RESOURCE_ALLOCATED = "resource_allocated";
}
