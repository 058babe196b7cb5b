package com.agentmesh.recovery;

import com.agentmesh.core.model.ScopeKey;
import com.agentmesh.core.model.TaskSpec;
import com.agentmesh.core.model.TaskState;
import com.agentmesh.core.model.WorkflowSpec;
import com.agentmesh.core.model.WorkflowState;
import com.agentmesh.core.protocol.Dispatch;
import com.agentmesh.core.test.Await;
import com.agentmesh.engine.memory.CompactionReport;
import com.agentmesh.engine.memory.MemoryManager;
import com.agentmesh.engine.memory.MemorySettings;
import com.agentmesh.engine.service.WorkflowService.WorkflowStatus;
import com.agentmesh.engine.test.MeshHarness;
import com.agentmesh.engine.test.ScriptedAgent;
import com.agentmesh.engine.test.ScriptedAgent.Reply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class RecoveryEngineTest {

    private static final RecoverySettings FAST = new RecoverySettings(
        Duration.ofMillis(50),
        Duration.ofMillis(50),
        Duration.ofMillis(50),
        Duration.ofHours(1),
        Duration.ofMillis(50)
    );

    private MeshHarness mesh;
    private RecoveryEngine recovery;

    @BeforeEach
    void setUp() {
        mesh = new MeshHarness().start();
    }

    @AfterEach
    void tearDown() {
        if (recovery != null) {
            recovery.stop();
        }
        mesh.close();
    }

    private RecoveryEngine recoveryEngine(RecoverySettings settings) {
        return recoveryEngine(settings, mesh.memory);
    }

    private RecoveryEngine recoveryEngine(RecoverySettings settings, MemoryManager memory) {
        recovery = new RecoveryEngine(mesh.tasks, mesh.checkpoints, mesh.registry, memory, settings, mesh.clock);
        return recovery;
    }

    @Test
    @DisplayName("Startup reconciliation re-negotiates a dispatch whose agent disappeared")
    void testRecoverOnStartup() {
        mesh.agent("gone", "write", 1.0).script(d -> Reply.silent());
        UUID id = mesh.workflows.submit(WorkflowSpec.of("restart", TaskSpec.of("T1", "write", null)));
        Await.until(() -> mesh.workflows.status(id).task("T1").state() == TaskState.DISPATCHED, "dispatch");

        mesh.crashOrchestrator();
        mesh.registry.deregister("gone");
        ScriptedAgent heir = mesh.agent("heir", "write", 1.0);
        mesh.rebuildOrchestrator();

        assertThat(recoveryEngine(RecoverySettings.defaults()).recoverOnStartup()).isEqualTo(1);

        WorkflowStatus status = mesh.awaitState(id, WorkflowState.COMPLETED);
        assertThat(status.task("T1").assignedAgentId()).isEqualTo("heir");
        assertThat(heir.dispatches()).hasSize(1);
    }

    @Test
    @DisplayName("The periodic liveness sweep hands a silent agent's task to a live one")
    void testPeriodicLivenessSweep() {
        ScriptedAgent stalled = mesh.agent("a-stalled", "write", 1.0).script(d -> Reply.silent());
        UUID id = mesh.workflows.submit(WorkflowSpec.of("stall", TaskSpec.of("T1", "write", null)));
        Await.value(stalled::lastDispatch, "dispatch to stalled agent");

        mesh.clock.advanceSeconds(31);
        ScriptedAgent backup = mesh.agent("b-backup", "write", 1.0);
        recoveryEngine(FAST).start();

        WorkflowStatus status = mesh.awaitState(id, WorkflowState.COMPLETED);
        assertThat(status.task("T1").assignedAgentId()).isEqualTo("b-backup");
        assertThat(status.task("T1").retryCount()).isEqualTo(1);
        assertThat(backup.dispatches()).hasSize(1);
        assertThat(recovery.isRunning()).isTrue();
    }

    @Test
    @DisplayName("An overrun dispatch is failed and retried")
    void testDeadlineSweep() {
        ScriptedAgent agent = mesh.agent("sleepy", "write", 1.0).script(d -> Reply.silent());
        UUID id = mesh.workflows.submit(WorkflowSpec.of("timed",
            TaskSpec.of("T1", "write", null).withTimeout(Duration.ofSeconds(5))));
        Dispatch first = Await.value(agent::lastDispatch, "first dispatch");
        RecoveryEngine engine = recoveryEngine(RecoverySettings.defaults());

        assertThat(engine.checkDeadlines()).isZero();
        agent.script(d -> Reply.result(null));
        mesh.clock.advanceSeconds(6);
        assertThat(engine.checkDeadlines()).isEqualTo(1);

        mesh.awaitState(id, WorkflowState.COMPLETED);
        assertThat(agent.lastDispatch().dispatchId()).isNotEqualTo(first.dispatchId());
    }

    @Test
    @DisplayName("A workflow whose ready task was never scheduled is picked up again")
    void testStalledWorkflowReevaluated() {
        mesh.crashOrchestrator();
        UUID id = mesh.workflows.submit(WorkflowSpec.of("orphan", TaskSpec.of("T1", "write", null)));
        mesh.rebuildOrchestrator();
        mesh.checkpoints.reload();
        RecoveryEngine engine = recoveryEngine(RecoverySettings.defaults());

        assertThat(engine.detectStalledWorkflows()).isEmpty();

        mesh.clock.advance(Duration.ofMinutes(6));
        ScriptedAgent writer = mesh.agent("writer", "write", 1.0);
        assertThat(engine.detectStalledWorkflows()).containsExactly(id);

        mesh.awaitState(id, WorkflowState.COMPLETED);
        assertThat(writer.dispatches()).hasSize(1);
    }

    @Test
    @DisplayName("Workflows waiting on a dispatch are not considered stalled")
    void testDispatchedWorkflowNotStalled() {
        ScriptedAgent agent = mesh.agent("slow", "write", 1.0).script(d -> Reply.silent());
        mesh.workflows.submit(WorkflowSpec.of("slow", TaskSpec.of("T1", "write", null)));
        Await.value(agent::lastDispatch, "dispatch");

        mesh.clock.advance(Duration.ofMinutes(10));

        assertThat(recoveryEngine(RecoverySettings.defaults()).detectStalledWorkflows()).isEmpty();
    }

    @Test
    @DisplayName("Compaction trims old versions under the configured retention")
    void testCompaction() {
        MemoryManager memory = new MemoryManager(mesh.repository, new MemorySettings(2, Duration.ofHours(1)), mesh.clock);
        ScopeKey notes = ScopeKey.agent("a", "notes");
        for (int i = 1; i <= 5; i++) {
            memory.put(notes, mesh.objectMapper.createObjectNode().put("n", i));
        }

        CompactionReport report = recoveryEngine(RecoverySettings.defaults(), memory).compactMemory();

        assertThat(report.versionsRemoved()).isEqualTo(3);
        assertThat(memory.listVersions(notes)).hasSize(2);
        assertThat(memory.get(notes).orElseThrow().content().get("n").asInt()).isEqualTo(5);
    }

    @Test
    void settings_shouldRejectNonPositiveIntervals() {
        assertThatThrownBy(() -> new RecoverySettings(Duration.ZERO, Duration.ofSeconds(1), Duration.ofSeconds(1),
            Duration.ofSeconds(1), Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("livenessInterval");
    }
}
