package com.agentmesh.engine.coordinator;

import com.agentmesh.core.exception.DeadlineExceededException;
import com.agentmesh.core.exception.InvalidGraphException;
import com.agentmesh.core.exception.NoQualifiedAgentException;
import com.agentmesh.core.exception.NotFoundException;
import com.agentmesh.core.model.AgentAvailability;
import com.agentmesh.core.model.RetryPolicy;
import com.agentmesh.core.model.TaskSpec;
import com.agentmesh.core.model.TaskState;
import com.agentmesh.core.model.WorkflowSpec;
import com.agentmesh.core.model.WorkflowState;
import com.agentmesh.core.protocol.Dispatch;
import com.agentmesh.core.test.Await;
import com.agentmesh.engine.event.WorkflowEventType;
import com.agentmesh.engine.service.WorkflowService.TaskOutcome;
import com.agentmesh.engine.service.WorkflowService.WorkflowStatus;
import com.agentmesh.engine.test.MeshHarness;
import com.agentmesh.engine.test.ScriptedAgent;
import com.agentmesh.engine.test.ScriptedAgent.Reply;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end orchestration over the in-memory bus with scripted agents.
 */
class OrchestratorScenarioTest {

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
    @DisplayName("Chained tasks complete and the dependent is dispatched only after its dependency's result")
    void testChainCompletes() {
        AtomicBoolean dependencyDoneAtDispatch = new AtomicBoolean(false);
        ScriptedAgent writer = mesh.agent("writer", "write", 1.0);
        writer.script(d -> {
            if (d.taskId().equals("T2")) {
                TaskState t1 = mesh.workflows.status(d.workflowId()).task("T1").state();
                dependencyDoneAtDispatch.set(t1 == TaskState.SUCCEEDED);
            }
            return Reply.result(mesh.objectMapper.createObjectNode().put("text", d.taskId()));
        });

        UUID id = mesh.workflows.submit(WorkflowSpec.builder("chain")
            .task("T1", "write", null)
            .task("T2", "write", null, "T1")
            .build());

        WorkflowStatus status = mesh.awaitState(id, WorkflowState.COMPLETED);

        assertThat(status.tasks()).extracting(t -> t.state()).containsOnly(TaskState.SUCCEEDED);
        assertThat(writer.dispatches()).extracting(Dispatch::taskId).containsExactly("T1", "T2");
        assertThat(dependencyDoneAtDispatch).isTrue();
        assertThat(status.completedAt()).isNotNull();
        assertThat(status.progress()).isEqualTo(1.0);
        assertThat(status.team()).containsExactly("writer");

        Map<String, TaskOutcome> results = mesh.workflows.results(id);
        assertThat(results.get("T2").result().get("text").asText()).isEqualTo("T2");
        assertThat(mesh.registry.get("writer").availability()).isEqualTo(AgentAvailability.IDLE);
        assertThat(mesh.count(WorkflowEventType.WORKFLOW_COMPLETED)).isEqualTo(1);
    }

    @Test
    @DisplayName("A dependent task sees its dependency's result and the mapped workflow context")
    void testChainPassesResultsDownstream() {
        ScriptedAgent writer = mesh.agent("writer", "write", 1.0);
        writer.script(d -> d.taskId().equals("T1")
            ? Reply.result(mesh.objectMapper.createObjectNode().put("summary", "bees dance"))
            : Reply.result(mesh.objectMapper.createObjectNode().put("text", "done")));

        ObjectNode researchInput = mesh.objectMapper.createObjectNode().put("subject", "${context.topic}");
        ObjectNode writeInput = mesh.objectMapper.createObjectNode()
            .put("notes", "${research.summary}")
            .put("missing", "${research.nothing}");
        UUID id = mesh.workflows.submit(WorkflowSpec.builder("handoff")
            .context(mesh.objectMapper.createObjectNode().put("topic", "bees"))
            .task(TaskSpec.of("T1", "write", researchInput).withOutput("summary", "research.summary"))
            .task("T2", "write", writeInput, "T1")
            .build());

        WorkflowStatus status = mesh.awaitState(id, WorkflowState.COMPLETED);

        Dispatch first = writer.dispatches().get(0);
        Dispatch second = writer.dispatches().get(1);
        assertThat(first.input().get("subject").asText()).isEqualTo("bees");
        assertThat(first.dependencyResults()).isEmpty();
        assertThat(second.taskId()).isEqualTo("T2");
        assertThat(second.input().get("notes").asText()).isEqualTo("bees dance");
        assertThat(second.input().get("missing").isNull()).isTrue();
        assertThat(second.dependencyResults()).containsOnlyKeys("T1");
        assertThat(second.dependencyResults().get("T1").get("summary").asText()).isEqualTo("bees dance");
        assertThat(status.context().at("/research/summary").asText()).isEqualTo("bees dance");
        assertThat(status.context().get("topic").asText()).isEqualTo("bees");
    }

    @Test
    @DisplayName("A sole busy agent makes sibling tasks wait instead of exhausting negotiation")
    void testBusyAgentDoesNotAbandonSiblings() {
        ScriptedAgent solo = mesh.agent("solo", "write", 1.0).script(d -> Reply.silent());

        UUID id = mesh.workflows.submit(WorkflowSpec.builder("queue")
            .task("a", "write", null)
            .task("b", "write", null)
            .build());
        Dispatch first = Await.value(solo::lastDispatch, "first dispatch");

        // Well past the three-attempt negotiation ceiling of the fast settings.
        Await.quietPeriod(Duration.ofMillis(500));
        WorkflowStatus waiting = mesh.workflows.status(id);
        assertThat(waiting.state()).isEqualTo(WorkflowState.RUNNING);
        assertThat(waiting.tasks()).extracting(t -> t.state()).doesNotContain(TaskState.ABANDONED);
        assertThat(solo.dispatches()).hasSize(1);

        solo.script(d -> Reply.result(null));
        solo.reply(first, Reply.result(null));

        WorkflowStatus status = mesh.awaitState(id, WorkflowState.COMPLETED);
        assertThat(status.tasks()).extracting(t -> t.state()).containsOnly(TaskState.SUCCEEDED);
        assertThat(mesh.checkpoints.get(id).tasks().values()).extracting(t -> t.negotiationAttempts()).containsOnly(0);
        assertThat(solo.dispatches()).hasSize(2);
        assertThat(mesh.count(WorkflowEventType.NEGOTIATION_FAILED)).isZero();
    }

    @Test
    @DisplayName("A task failing maxAttempts times is abandoned and its dependent never dispatched")
    void testFailureExhaustsAttemptsAndCascades() {
        ScriptedAgent flaky = mesh.agent("flaky", "write", 1.0);
        flaky.script(d -> d.taskId().equals("T1") ? Reply.failure("MODEL_ERROR", true) : Reply.result(null));

        UUID id = mesh.workflows.submit(WorkflowSpec.builder("doomed")
            .task("T1", "write", null)
            .task("T2", "write", null, "T1")
            .build());

        WorkflowStatus status = mesh.awaitState(id, WorkflowState.FAILED);

        assertThat(status.task("T1").state()).isEqualTo(TaskState.ABANDONED);
        assertThat(status.task("T1").retryCount()).isEqualTo(3);
        assertThat(status.task("T1").errorCode()).isEqualTo("MODEL_ERROR");
        assertThat(status.task("T2").state()).isEqualTo(TaskState.ABANDONED);
        assertThat(status.task("T2").errorCode()).isEqualTo(TaskCoordinator.DEPENDENCY_ABANDONED);
        assertThat(flaky.dispatches()).extracting(Dispatch::taskId).containsExactly("T1", "T1", "T1");
        assertThat(flaky.dispatches()).extracting(Dispatch::attempt).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("A non-retryable failure abandons on the first attempt")
    void testNonRetryableFailure() {
        mesh.agent("strict", "write", 1.0).script(d -> Reply.failure("BAD_INPUT", false));

        UUID id = mesh.workflows.submit(WorkflowSpec.of("one", TaskSpec.of("T1", "write", null)));

        WorkflowStatus status = mesh.awaitState(id, WorkflowState.FAILED);
        assertThat(status.task("T1").retryCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("The cheaper bidder wins")
    void testCheapestBidderAssigned() {
        ScriptedAgent pricey = mesh.agent("pricey", "research", 5.0);
        ScriptedAgent cheap = mesh.agent("cheap", "research", 3.0);

        UUID id = mesh.workflows.submit(WorkflowSpec.of("bid", TaskSpec.of("T1", "research", null)));

        WorkflowStatus status = mesh.awaitState(id, WorkflowState.COMPLETED);
        assertThat(status.task("T1").assignedAgentId()).isEqualTo("cheap");
        assertThat(cheap.dispatches()).hasSize(1);
        assertThat(pricey.dispatches()).isEmpty();
        assertThat(pricey.bidRounds()).hasSize(1);
    }

    @Test
    @DisplayName("A result arriving after cancellation is ignored")
    void testLateResultAfterCancel() {
        ScriptedAgent slow = mesh.agent("slow", "write", 1.0).script(d -> Reply.silent());

        UUID id = mesh.workflows.submit(WorkflowSpec.builder("cancel-me")
            .task("T1", "write", null)
            .task("T2", "write", null, "T1")
            .build());
        Dispatch dispatch = Await.value(slow::lastDispatch, "dispatch of T1");

        mesh.workflows.cancel(id);
        slow.reply(dispatch, Reply.result(mesh.objectMapper.createObjectNode().put("late", true)));
        Await.quietPeriod(Duration.ofMillis(200));

        WorkflowStatus status = mesh.workflows.status(id);
        assertThat(status.state()).isEqualTo(WorkflowState.CANCELLED);
        assertThat(status.task("T1").state()).isEqualTo(TaskState.ABANDONED);
        assertThat(mesh.workflows.results(id).get("T1").result()).isNull();
        assertThat(mesh.registry.get("slow").availability()).isEqualTo(AgentAvailability.IDLE);
        assertThat(slow.dispatches()).hasSize(1);
    }

    @Test
    @DisplayName("Cancelling a finished workflow changes nothing")
    void testCancelIsIdempotent() {
        mesh.agent("writer", "write", 1.0);
        UUID id = mesh.workflows.submit(WorkflowSpec.of("done", TaskSpec.of("T1", "write", null)));
        mesh.awaitState(id, WorkflowState.COMPLETED);

        mesh.workflows.cancel(id);
        mesh.workflows.cancel(id);

        assertThat(mesh.workflows.status(id).state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(mesh.count(WorkflowEventType.WORKFLOW_CANCELLED)).isZero();
    }

    @Test
    @DisplayName("Cyclic specs are rejected and nothing is dispatched")
    void testCyclicSpecRejected() {
        ScriptedAgent writer = mesh.agent("writer", "write", 1.0);

        assertThatThrownBy(() -> mesh.workflows.submit(WorkflowSpec.builder("cycle")
                .task("a", "write", null, "b")
                .task("b", "write", null, "a")
                .build()))
            .isInstanceOf(InvalidGraphException.class);

        Await.quietPeriod(Duration.ofMillis(100));
        assertThat(writer.dispatches()).isEmpty();
        assertThat(mesh.workflows.list(null)).isEmpty();
    }

    @Test
    @DisplayName("Redelivering a processed result changes nothing")
    void testDuplicateResultIgnored() {
        ScriptedAgent writer = mesh.agent("writer", "write", 1.0);
        UUID id = mesh.workflows.submit(WorkflowSpec.builder("dup")
            .task("T1", "write", null)
            .task("T2", "write", null, "T1")
            .build());
        mesh.awaitState(id, WorkflowState.COMPLETED);
        long versionBefore = mesh.memory.currentVersion(WorkflowCheckpoints.checkpointKey(id));

        writer.resendLastReply();
        Await.quietPeriod(Duration.ofMillis(200));

        assertThat(mesh.memory.currentVersion(WorkflowCheckpoints.checkpointKey(id))).isEqualTo(versionBefore);
        assertThat(mesh.count(WorkflowEventType.TASK_SUCCEEDED)).isEqualTo(2);
        assertThat(writer.dispatches()).hasSize(2);
    }

    @Test
    @DisplayName("A passed deadline fails the attempt and forces a fresh dispatch")
    void testDeadlineExceeded() {
        ScriptedAgent agent = mesh.agent("sleepy", "write", 1.0).script(d -> Reply.silent());
        UUID id = mesh.workflows.submit(WorkflowSpec.of("timed",
            TaskSpec.of("T1", "write", null).withTimeout(Duration.ofSeconds(5))));
        Dispatch first = Await.value(agent::lastDispatch, "first dispatch");

        assertThat(mesh.tasks.checkDeadlines()).isZero();
        agent.script(d -> Reply.result(null));
        mesh.clock.advanceSeconds(6);
        assertThat(mesh.tasks.checkDeadlines()).isEqualTo(1);

        WorkflowStatus status = mesh.awaitState(id, WorkflowState.COMPLETED);
        assertThat(status.task("T1").retryCount()).isEqualTo(1);
        assertThat(agent.dispatches()).hasSize(2);
        assertThat(agent.lastDispatch().dispatchId()).isNotEqualTo(first.dispatchId());
        assertThat(mesh.count(WorkflowEventType.TASK_FAILED)).isEqualTo(1);
        assertThat(mesh.recorded).anyMatch(e -> e.type() == WorkflowEventType.TASK_FAILED
            && DeadlineExceededException.ERROR_CODE.equals(e.detail()));
    }

    @Test
    @DisplayName("With no qualified agent the task backs off and is abandoned at the ceiling")
    void testNoQualifiedAgentAbandons() {
        UUID id = mesh.workflows.submit(WorkflowSpec.of("nobody", TaskSpec.of("T1", "translate", null)));

        WorkflowStatus status = mesh.awaitState(id, WorkflowState.FAILED);
        assertThat(status.task("T1").errorCode()).isEqualTo(NoQualifiedAgentException.ERROR_CODE);
        assertThat(mesh.count(WorkflowEventType.NEGOTIATION_FAILED)).isEqualTo(3);
    }

    @Test
    @DisplayName("An agent registering during backoff picks up the waiting task")
    void testLateRegistrationRescuesTask() {
        OrchestratorSettings patient = MeshHarness.fastSettings().withNegotiationPolicy(
            RetryPolicy.builder()
                .maxAttempts(50)
                .initialBackoff(Duration.ofMillis(20))
                .maxBackoff(Duration.ofMillis(20))
                .jitterFactor(0.0)
                .build());
        mesh.close();
        mesh = new MeshHarness(patient).start();

        UUID id = mesh.workflows.submit(WorkflowSpec.of("late", TaskSpec.of("T1", "translate", null)));
        Await.until(() -> mesh.count(WorkflowEventType.NEGOTIATION_FAILED) >= 1, "first failed negotiation");
        mesh.agent("linguist", "translate", 1.0);

        mesh.awaitState(id, WorkflowState.COMPLETED);
    }

    @Test
    @DisplayName("An unreachable winner is reported and the task re-negotiated with its retry count incremented")
    void testRecipientUnavailableRenegotiates() {
        mesh.agent("vanishing", "write", 1.0).dropAfterBid();
        ScriptedAgent steady = mesh.agent("steady", "write", 2.0);

        UUID id = mesh.workflows.submit(WorkflowSpec.of("lost", TaskSpec.of("T1", "write", null)));

        WorkflowStatus status = mesh.awaitState(id, WorkflowState.COMPLETED);
        assertThat(status.task("T1").retryCount()).isEqualTo(1);
        assertThat(status.task("T1").assignedAgentId()).isEqualTo("steady");
        assertThat(steady.dispatches()).hasSize(1);
        assertThat(mesh.registry.get("vanishing").availability()).isEqualTo(AgentAvailability.UNREACHABLE);
        assertThat(mesh.count(WorkflowEventType.AGENT_LOST)).isEqualTo(1);
    }

    @Test
    @DisplayName("An agent missing heartbeats loses its task to a live agent")
    void testLivenessSweepRenegotiates() {
        ScriptedAgent stalled = mesh.agent("a-stalled", "write", 1.0).script(d -> Reply.silent());
        UUID id = mesh.workflows.submit(WorkflowSpec.of("stall", TaskSpec.of("T1", "write", null)));
        Await.value(stalled::lastDispatch, "dispatch to stalled agent");

        ScriptedAgent backup = mesh.agent("b-backup", "write", 1.0);
        mesh.clock.advanceSeconds(31);
        mesh.registry.heartbeat("b-backup");
        assertThat(mesh.registry.sweepLiveness()).containsExactly("a-stalled");

        WorkflowStatus status = mesh.awaitState(id, WorkflowState.COMPLETED);
        assertThat(status.task("T1").assignedAgentId()).isEqualTo("b-backup");
        assertThat(status.task("T1").retryCount()).isEqualTo(1);
        assertThat(backup.dispatches()).hasSize(1);
    }

    @Test
    @DisplayName("Independent tasks run on different agents at the same time")
    void testParallelTasks() {
        mesh.agent("one", "write", 1.0).script(d -> Reply.silent());
        mesh.agent("two", "write", 1.0).script(d -> Reply.silent());

        UUID id = mesh.workflows.submit(WorkflowSpec.builder("fan-out")
            .task("a", "write", null)
            .task("b", "write", null)
            .build());

        Await.until(() -> mesh.workflows.status(id).tasks().stream()
            .allMatch(t -> t.state() == TaskState.DISPATCHED), "both tasks dispatched");
        assertThat(mesh.workflows.status(id).team()).containsExactlyInAnyOrder("one", "two");
    }

    @Test
    @DisplayName("Some succeeded, some abandoned: PARTIALLY_FAILED")
    void testPartiallyFailed() {
        mesh.agent("mixed", "write", 1.0)
            .script(d -> d.taskId().equals("bad") ? Reply.failure("BROKEN", false) : Reply.result(null));

        UUID id = mesh.workflows.submit(WorkflowSpec.builder("mixed")
            .task("good", "write", null)
            .task("bad", "write", null)
            .build());

        mesh.awaitState(id, WorkflowState.PARTIALLY_FAILED);
    }

    @Test
    @DisplayName("A restarted orchestrator keeps waiting on a live agent's dispatch")
    void testRecoveryKeepsLiveDispatch() {
        ScriptedAgent agent = mesh.agent("durable", "write", 1.0).script(d -> Reply.silent());
        UUID id = mesh.workflows.submit(WorkflowSpec.of("restart", TaskSpec.of("T1", "write", null)));
        Dispatch dispatch = Await.value(agent::lastDispatch, "dispatch");

        mesh.crashOrchestrator();
        assertThat(mesh.restartOrchestrator()).isEqualTo(1);
        assertThat(mesh.workflows.status(id).task("T1").state()).isEqualTo(TaskState.DISPATCHED);

        agent.reply(dispatch, Reply.result(null));
        WorkflowStatus status = mesh.awaitState(id, WorkflowState.COMPLETED);
        assertThat(status.task("T1").retryCount()).isZero();
        assertThat(agent.dispatches()).hasSize(1);
    }

    @Test
    @DisplayName("A restarted orchestrator re-negotiates a dispatch whose agent is gone")
    void testRecoveryRenegotiatesLostDispatch() {
        mesh.agent("gone", "write", 1.0).script(d -> Reply.silent());
        UUID id = mesh.workflows.submit(WorkflowSpec.of("restart", TaskSpec.of("T1", "write", null)));
        Await.until(() -> mesh.workflows.status(id).task("T1").state() == TaskState.DISPATCHED, "dispatch");

        mesh.crashOrchestrator();
        mesh.registry.deregister("gone");
        ScriptedAgent heir = mesh.agent("heir", "write", 1.0);
        mesh.restartOrchestrator();

        WorkflowStatus status = mesh.awaitState(id, WorkflowState.COMPLETED);
        assertThat(status.task("T1").retryCount()).isEqualTo(1);
        assertThat(heir.dispatches()).hasSize(1);
    }

    @Test
    @DisplayName("Archived workflows disappear from list but stay queryable")
    void testArchive() {
        mesh.agent("writer", "write", 1.0);
        UUID id = mesh.workflows.submit(WorkflowSpec.of("archive", TaskSpec.of("T1", "write", null)));
        mesh.awaitState(id, WorkflowState.COMPLETED);

        assertThat(mesh.workflows.list(WorkflowState.COMPLETED)).hasSize(1);
        mesh.workflows.archive(id);

        assertThat(mesh.workflows.list(null)).isEmpty();
        assertThat(mesh.workflows.status(id).archived()).isTrue();
    }

    @Test
    void testUnknownWorkflow() {
        assertThatThrownBy(() -> mesh.workflows.status(UUID.randomUUID()))
            .isInstanceOf(NotFoundException.class);
    }
}
