package com.agentmesh.core.model;

import com.agentmesh.core.exception.InvalidStateTransitionException;
import com.agentmesh.core.serialization.ObjectMappers;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class WorkflowTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private Workflow workflow;

    @BeforeEach
    void setUp() {
        WorkflowSpec spec = WorkflowSpec.builder("chain")
            .task("t1", "research", JsonNodeFactory.instance.textNode("topic"))
            .task("t2", "writing", null, "t1")
            .task("t3", "seo", null, "t2")
            .build();
        workflow = Workflow.create(UUID.randomUUID(), spec.name(), spec.labels(), spec.context(),
            TaskGraph.of(spec).topologicalOrder(), NOW);
    }

    @Test
    void create_shouldStartRunningWithPendingTasks() {
        assertThat(workflow.state()).isEqualTo(WorkflowState.RUNNING);
        assertThat(workflow.tasks().values()).allMatch(t -> t.state() == TaskState.PENDING);
        assertThat(workflow.promotableTasks()).extracting(Task::taskId).containsExactly("t1");
    }

    @Test
    void promotableTasks_shouldRequireAllDependenciesSucceeded() {
        Task t1 = succeed(workflow.task("t1"));
        Workflow updated = workflow.withTask(t1, NOW);

        assertThat(updated.promotableTasks()).extracting(Task::taskId).containsExactly("t2");
        assertThat(updated.progress()).isCloseTo(1.0 / 3, within(0.001));
    }

    @Test
    void doomedTasks_shouldFollowAbandonedDependencies() {
        Task t1 = workflow.task("t1").withAbandoned("EXEC_FAILED", "boom", NOW);
        Workflow updated = workflow.withTask(t1, NOW);

        assertThat(updated.doomedTasks()).extracting(Task::taskId).containsExactly("t2");
    }

    @Test
    void withTask_shouldDeriveTerminalStateAndCompletionTime() {
        Workflow w = workflow;
        for (String id : new String[]{"t1", "t2", "t3"}) {
            w = w.withTask(succeed(w.task(id)), NOW.plusSeconds(5));
        }

        assertThat(w.state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(w.completedAt()).isEqualTo(NOW.plusSeconds(5));
    }

    @Test
    void withCancelled_shouldWinOverTaskStates() {
        Workflow cancelled = workflow.withCancelled(NOW);

        assertThat(cancelled.state()).isEqualTo(WorkflowState.CANCELLED);
        assertThat(cancelled.completedAt()).isEqualTo(NOW);
    }

    @Test
    void task_shouldRejectIllegalTransitions() {
        Task pending = workflow.task("t2");

        assertThatThrownBy(() -> pending.withSucceeded(null, NOW))
            .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    void withFailed_shouldCountRetryAndExcludeAgent() {
        Task dispatched = workflow.task("t1").withReady(NOW).withNegotiating(NOW)
            .withDispatched("agent-a", "d-1", NOW.plusSeconds(60), NOW);

        Task failed = dispatched.withFailed("EXEC_FAILED", "bad input", NOW);

        assertThat(failed.retryCount()).isEqualTo(1);
        assertThat(failed.attempt()).isEqualTo(2);
        assertThat(failed.excludedAgents()).containsExactly("agent-a");
        assertThat(failed.assignedAgentId()).isNull();
        assertThat(failed.dispatchCount()).isEqualTo(1);
    }

    @Test
    void checkpoint_shouldSurviveJsonRoundTrip() throws Exception {
        ObjectMapper mapper = ObjectMappers.create();
        Task t1 = workflow.task("t1").withReady(NOW).withNegotiating(NOW)
            .withDispatched("agent-a", workflow.task("t1").nextDispatchId(workflow.workflowId()),
                NOW.plus(Duration.ofSeconds(60)), NOW);
        Workflow original = workflow.withTask(t1, NOW);

        Workflow restored = mapper.treeToValue(mapper.valueToTree(original), Workflow.class);

        assertThat(restored).isEqualTo(original);
        assertThat(restored.tasks().keySet()).containsExactly("t1", "t2", "t3");
    }

    private static Task succeed(Task task) {
        return task.withReady(NOW).withNegotiating(NOW)
            .withDispatched("agent", "d", NOW.plusSeconds(60), NOW)
            .withSucceeded(JsonNodeFactory.instance.textNode("ok"), NOW);
    }
}
