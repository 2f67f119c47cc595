package io.taskrelay.sync.handlers;

import static org.assertj.core.api.Assertions.assertThat;

import io.taskrelay.message.RelayMessage;
import io.taskrelay.message.RelayMessageCodec;
import io.taskrelay.message.TaskAssignmentPayload;
import io.taskrelay.model.ActivityLogEntry;
import io.taskrelay.model.AgentRole;
import io.taskrelay.model.AgentState;
import io.taskrelay.model.AgentStatus;
import io.taskrelay.model.Task;
import io.taskrelay.model.TaskPriority;
import io.taskrelay.model.TaskStatus;
import io.taskrelay.store.InMemoryStateStore;
import io.taskrelay.sync.HandlerContext;
import io.taskrelay.sync.HandlerResult;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TaskAssignmentHandlerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final HandlerContext WORKER = new HandlerContext("worker", "worker-inbox");

    private final InMemoryStateStore store = new InMemoryStateStore(Clock.fixed(NOW, ZoneOffset.UTC));
    private final TaskAssignmentHandler handler =
        new TaskAssignmentHandler(Clock.fixed(NOW, ZoneOffset.UTC), new RelayMessageCodec());

    @Test
    void createsAssignsAndArchivesAFreshTask() {
        RelayMessage message = RelayMessage.taskAssignment("T-1", AgentRole.COORDINATOR, AgentRole.WORKER,
            new TaskAssignmentPayload("Build API", "REST endpoints", TaskPriority.HIGH, List.of("java"), null, Map.of()),
            NOW.minusSeconds(2));

        HandlerResult result = handler.handle(message, WORKER, store);

        assertThat(result).isInstanceOf(HandlerResult.Committed.class);
        Task task = store.getTask("T-1").orElseThrow();
        assertThat(task.status()).isEqualTo(TaskStatus.ASSIGNED);
        assertThat(task.assignedTo()).isEqualTo("worker");
        assertThat(task.priority()).isEqualTo(TaskPriority.HIGH);
        assertThat(task.requirements()).containsExactly("java");
        assertThat(task.metadata()).containsEntry("title", "Build API").containsKeys("pending_at", "assigned_at");

        AgentState agent = store.getAgentState("worker").orElseThrow();
        assertThat(agent.status()).isEqualTo(AgentStatus.WORKING);
        assertThat(agent.currentTaskId()).isEqualTo("T-1");

        List<ActivityLogEntry> activities = store.getActivities("worker");
        assertThat(activities).extracting(ActivityLogEntry::activityType)
            .containsExactly(ActivityTypes.TASK_RECEIVED, ActivityTypes.TASK_ASSIGNMENT_ARCHIVED);
        assertThat(activities.get(0).details()).containsEntry("assigned_by", "coordinator").containsEntry("duplicate", false);
        @SuppressWarnings("unchecked")
        Map<String, Object> archived = (Map<String, Object>) activities.get(1).details().get("assignment_details");
        assertThat(archived).containsEntry("message_type", "task_assignment").containsEntry("task_id", "T-1");
    }

    @Test
    void assignsATaskTheCoordinatorAlreadyCreated() {
        store.createTaskIfAbsent(Task.pending("T-2", "worker-2", TaskPriority.LOW, List.of(),
            Map.of("title", "from coordinator"), NOW.minusSeconds(30)));

        handler.handle(RelayMessage.taskAssignment("T-2", AgentRole.COORDINATOR, AgentRole.WORKER,
            new TaskAssignmentPayload("ignored", null, null, null, "worker-2", null), NOW), WORKER, store);

        Task task = store.getTask("T-2").orElseThrow();
        assertThat(task.status()).isEqualTo(TaskStatus.ASSIGNED);
        assertThat(task.metadata()).containsEntry("title", "from coordinator");
        assertThat(store.getAgentState("worker-2").orElseThrow().currentTaskId()).isEqualTo("T-2");
        assertThat(store.getAgentState("worker")).isEmpty();
    }

    @Test
    void redeliveryAfterCompletionLeavesTaskAndAgentAlone() {
        store.createTaskIfAbsent(Task.pending("T-3", "worker", null, null, null, NOW.minusSeconds(60)));
        store.updateTaskStatus("T-3", TaskStatus.COMPLETED, Map.of());
        store.updateAgentState("worker", AgentStatus.IDLE, null, Map.of());

        HandlerResult result = handler.handle(RelayMessage.taskAssignment("T-3", null, AgentRole.WORKER,
            TaskAssignmentPayload.of("again", null), NOW), WORKER, store);

        assertThat(result).isInstanceOf(HandlerResult.Committed.class);
        assertThat(store.getTask("T-3").orElseThrow().status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(store.getAgentState("worker").orElseThrow().status()).isEqualTo(AgentStatus.IDLE);
        assertThat(store.getActivities("worker").get(0).details()).containsEntry("duplicate", true);
    }
}
