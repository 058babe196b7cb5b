package com.agentmesh.engine.history;

import com.agentmesh.core.exception.NotFoundException;
import com.agentmesh.core.model.TaskSpec;
import com.agentmesh.core.model.TaskState;
import com.agentmesh.core.model.Workflow;
import com.agentmesh.core.model.WorkflowSpec;
import com.agentmesh.core.model.WorkflowState;
import com.agentmesh.engine.history.WorkflowHistoryService.TimelineEntry;
import com.agentmesh.engine.history.WorkflowHistoryService.WorkflowHistory;
import com.agentmesh.engine.memory.MemoryManager;
import com.agentmesh.engine.memory.MemorySettings;
import com.agentmesh.engine.test.MeshHarness;
import com.agentmesh.engine.test.ScriptedAgent.Reply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class WorkflowHistoryServiceTest {

    private MeshHarness mesh;

    @BeforeEach
    void setUp() {
        mesh = new MeshHarness().start();
    }

    @AfterEach
    void tearDown() {
        mesh.close();
    }

    @Test
    @DisplayName("Timeline follows every task transition in order")
    void testTimelineOfCompletedWorkflow() {
        mesh.agent("writer", "write", 1.0);
        UUID id = mesh.workflows.submit(WorkflowSpec.builder("history")
            .task("T1", "write", null)
            .task("T2", "write", null, "T1")
            .build());
        mesh.awaitState(id, WorkflowState.COMPLETED);

        WorkflowHistory history = mesh.history.history(id);

        assertThat(history.currentState()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(history.oldestRetainedVersion()).isEqualTo(1);
        assertThat(history.taskHistory().get("T1").transitions()).extracting(TimelineEntry::to)
            .containsExactly(TaskState.PENDING, TaskState.READY, TaskState.NEGOTIATING,
                TaskState.DISPATCHED, TaskState.SUCCEEDED);
        assertThat(history.taskHistory().get("T1").transitions().get(0).from()).isNull();
        assertThat(history.taskHistory().get("T1").transitions()).filteredOn(e -> e.to() == TaskState.DISPATCHED)
            .extracting(TimelineEntry::agentId).containsExactly("writer");
        assertThat(history.timeline()).extracting(TimelineEntry::checkpointVersion).isSorted();

        // T2 cannot leave PENDING before T1 succeeded
        long t1Succeeded = versionOf(history, "T1", TaskState.SUCCEEDED);
        long t2Ready = versionOf(history, "T2", TaskState.READY);
        assertThat(t2Ready).isGreaterThanOrEqualTo(t1Succeeded);

        assertThat(history.statistics().totalTasks()).isEqualTo(2);
        assertThat(history.statistics().succeededTasks()).isEqualTo(2);
        assertThat(history.statistics().dispatches()).isEqualTo(2);
        assertThat(history.statistics().failedAttempts()).isZero();
    }

    @Test
    @DisplayName("Retries show up as FAILED then READY again")
    void testRetriesInTimeline() {
        AtomicInteger calls = new AtomicInteger();
        mesh.agent("flaky", "write", 1.0)
            .script(d -> calls.incrementAndGet() == 1 ? Reply.failure("MODEL_ERROR", true) : Reply.result(null));
        UUID id = mesh.workflows.submit(WorkflowSpec.of("retry", TaskSpec.of("T1", "write", null)));
        mesh.awaitState(id, WorkflowState.COMPLETED);

        WorkflowHistory history = mesh.history.history(id);

        assertThat(history.taskHistory().get("T1").transitions()).extracting(TimelineEntry::to)
            .containsSubsequence(TaskState.DISPATCHED, TaskState.FAILED, TaskState.READY,
                TaskState.NEGOTIATING, TaskState.DISPATCHED, TaskState.SUCCEEDED);
        assertThat(history.timeline()).filteredOn(e -> e.to() == TaskState.FAILED)
            .extracting(TimelineEntry::errorCode).containsExactly("MODEL_ERROR");
        assertThat(history.taskHistory().get("T1").retries()).isEqualTo(1);
        assertThat(history.statistics().failedAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("History reaches back only as far as compaction kept versions")
    void testHistoryAfterCompaction() {
        mesh.agent("writer", "write", 1.0);
        UUID id = mesh.workflows.submit(WorkflowSpec.of("compacted", TaskSpec.of("T1", "write", null)));
        mesh.awaitState(id, WorkflowState.COMPLETED);
        int before = mesh.history.history(id).versionsRetained();

        new MemoryManager(mesh.repository, new MemorySettings(1, Duration.ofHours(1)), mesh.clock).compact();

        WorkflowHistory history = mesh.history.history(id);
        assertThat(before).isGreaterThan(1);
        assertThat(history.versionsRetained()).isEqualTo(1);
        assertThat(history.oldestRetainedVersion()).isGreaterThan(1);
        assertThat(history.currentState()).isEqualTo(WorkflowState.COMPLETED);
    }

    @Test
    void stateAt_shouldReturnEmptyBeforeSubmission() {
        mesh.agent("writer", "write", 1.0);
        Instant beforeSubmit = mesh.clock.instant();
        mesh.clock.advanceSeconds(1);
        UUID id = mesh.workflows.submit(WorkflowSpec.of("timed", TaskSpec.of("T1", "write", null)));
        mesh.awaitState(id, WorkflowState.COMPLETED);

        assertThat(mesh.history.stateAt(id, beforeSubmit)).isEmpty();
        Optional<Workflow> now = mesh.history.stateAt(id, mesh.clock.instant());
        assertThat(now).map(Workflow::state).contains(WorkflowState.COMPLETED);
    }

    @Test
    void history_shouldRejectUnknownWorkflow() {
        assertThatThrownBy(() -> mesh.history.history(UUID.randomUUID()))
            .isInstanceOf(NotFoundException.class);
    }

    private static long versionOf(WorkflowHistory history, String taskId, TaskState state) {
        return history.timeline().stream()
            .filter(e -> e.taskId().equals(taskId) && e.to() == state)
            .mapToLong(TimelineEntry::checkpointVersion)
            .findFirst()
            .orElseThrow();
    }
}
