package com.agentmesh.agent;

import com.agentmesh.core.exception.DeadlineExceededException;
import com.agentmesh.core.model.AgentAvailability;
import com.agentmesh.core.model.Capability;
import com.agentmesh.core.model.Message;
import com.agentmesh.core.model.MessageType;
import com.agentmesh.core.model.ScopeKey;
import com.agentmesh.core.model.WorkflowSpec;
import com.agentmesh.core.model.WorkflowState;
import com.agentmesh.core.protocol.Bid;
import com.agentmesh.core.protocol.BidRequest;
import com.agentmesh.core.protocol.Dispatch;
import com.agentmesh.core.protocol.DispatchAccepted;
import com.agentmesh.core.protocol.Endpoints;
import com.agentmesh.core.protocol.TaskFailure;
import com.agentmesh.core.protocol.TaskResult;
import com.agentmesh.core.serialization.ObjectMappers;
import com.agentmesh.core.test.Await;
import com.agentmesh.core.test.FailureInjector;
import com.agentmesh.core.test.TimeController;
import com.agentmesh.engine.bus.BusSettings;
import com.agentmesh.engine.bus.InMemoryCommunicationBus;
import com.agentmesh.engine.bus.MessageFilters;
import com.agentmesh.engine.memory.MemoryManager;
import com.agentmesh.engine.memory.MemorySettings;
import com.agentmesh.engine.negotiation.AgentRegistry;
import com.agentmesh.engine.negotiation.NegotiationSettings;
import com.agentmesh.engine.persistence.InMemoryMemoryRepository;
import com.agentmesh.engine.service.WorkflowService.WorkflowStatus;
import com.agentmesh.engine.test.MeshHarness;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class AgentRuntimeTest {

    private static final AgentSettings FAST = AgentSettings.defaults().withHeartbeatInterval(Duration.ofMillis(50));

    @Nested
    @DisplayName("Against a running orchestrator")
    class EndToEnd {

        private MeshHarness mesh;
        private final List<AgentRuntime> runtimes = new CopyOnWriteArrayList<>();

        @BeforeEach
        void setUp() {
            mesh = new MeshHarness().start();
        }

        @AfterEach
        void tearDown() {
            runtimes.forEach(AgentRuntime::stop);
            mesh.close();
        }

        private AgentRuntime runtime(String agentId) {
            AgentRuntime runtime = new AgentRuntime(agentId, mesh.registry, mesh.bus, mesh.memory, FAST,
                mesh.objectMapper, mesh.clock);
            runtimes.add(runtime);
            return runtime;
        }

        @Test
        @DisplayName("A researcher and a writer complete a two-step workflow")
        void testWorkflowCompletesThroughRuntimes() {
            runtime("researcher")
                .registerCapability(Capability.of("research", 1.0),
                    ctx -> ctx.toJsonNode(Map.of("facts", "bees dance")))
                .start();
            runtime("writer")
                .registerCapability(Capability.of("write", 2.0),
                    ctx -> ctx.toJsonNode(Map.of("draft", "On " + ctx.getInput().get("topic").asText() + ": "
                        + ctx.getDependencyResult("research").map(r -> r.get("facts").asText()).orElse("nothing"))))
                .start();

            UUID id = mesh.workflows.submit(WorkflowSpec.builder("article")
                .task("research", "research", null)
                .task("write", "write", mesh.objectMapper.createObjectNode().put("topic", "bees"), "research")
                .build());

            WorkflowStatus status = mesh.awaitState(id, WorkflowState.COMPLETED);

            assertThat(status.task("research").assignedAgentId()).isEqualTo("researcher");
            assertThat(status.task("write").assignedAgentId()).isEqualTo("writer");
            assertThat(mesh.workflows.results(id).get("write").result().get("draft").asText())
                .isEqualTo("On bees: bees dance");
            Await.until(() -> runtimes.get(1).stats().tasksCompleted() == 1, "writer stats to settle");
            assertThat(runtimes.get(1).stats().reliability()).isEqualTo(1.0);
            assertThat(runtimes.get(1).pendingReplies()).isZero();
        }

        @Test
        @DisplayName("A permanent executor failure abandons the task with the executor's code")
        void testPermanentFailure() {
            runtime("strict")
                .registerCapability(Capability.of("write", 1.0), ctx -> {
                    throw TaskExecutionException.permanent("BAD_PROMPT", "prompt is empty");
                })
                .start();

            UUID id = mesh.workflows.submit(WorkflowSpec.builder("one").task("T1", "write", null).build());

            WorkflowStatus status = mesh.awaitState(id, WorkflowState.FAILED);
            assertThat(status.task("T1").errorCode()).isEqualTo("BAD_PROMPT");
            assertThat(status.task("T1").retryCount()).isEqualTo(1);
            Await.until(() -> runtimes.get(0).stats().tasksFailed() == 1, "stats to settle");
            assertThat(runtimes.get(0).stats().reliability()).isZero();
        }

        @Test
        @DisplayName("A transient failure is retried and the workflow still completes")
        void testTransientFailureRecovers() {
            FailureInjector flaky = FailureInjector.failFirst(1);
            runtime("flaky")
                .registerCapability(Capability.of("write", 1.0), ctx -> {
                    if (flaky.shouldFail()) {
                        throw TaskExecutionException.transientFailure("RATE_LIMITED", "provider throttled");
                    }
                    return ctx.toJsonNode(Map.of("ok", true));
                })
                .start();

            UUID id = mesh.workflows.submit(WorkflowSpec.builder("one").task("T1", "write", null).build());

            WorkflowStatus status = mesh.awaitState(id, WorkflowState.COMPLETED);
            assertThat(status.task("T1").retryCount()).isEqualTo(1);
            assertThat(flaky.getCallCount()).isEqualTo(2);
            assertThat(flaky.getFailureCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("An unexpected exception is reported as a retryable EXECUTION_ERROR")
        void testUnexpectedExceptionIsRetried() {
            AtomicInteger calls = new AtomicInteger();
            runtime("buggy")
                .registerCapability(Capability.of("write", 1.0), ctx -> {
                    if (calls.incrementAndGet() < 3) {
                        throw new IllegalStateException("boom");
                    }
                    return ctx.toJsonNode(Map.of("ok", true));
                })
                .start();

            UUID id = mesh.workflows.submit(WorkflowSpec.builder("one").task("T1", "write", null).build());

            WorkflowStatus status = mesh.awaitState(id, WorkflowState.COMPLETED);
            assertThat(status.task("T1").retryCount()).isEqualTo(2);
            assertThat(calls).hasValue(3);
        }

        @Test
        @DisplayName("Stopping a runtime removes the agent from the registry")
        void testStopDeregisters() {
            AgentRuntime runtime = runtime("temp");
            runtime.registerCapability(Capability.of("write", 1.0), ctx -> null).start();
            assertThat(mesh.registry.get("temp").availability()).isEqualTo(AgentAvailability.IDLE);

            runtime.stop();

            assertThat(mesh.registry.find("temp")).isEmpty();
            assertThat(runtime.isRunning()).isFalse();
        }
    }

    @Nested
    @DisplayName("On the bus alone")
    class BusLevel {

        private final TimeController clock = new TimeController();
        private final ObjectMapper objectMapper = ObjectMappers.create();
        private final List<Message> orchestratorInbox = new CopyOnWriteArrayList<>();
        private final List<Message> negotiatorInbox = new CopyOnWriteArrayList<>();
        private InMemoryCommunicationBus bus;
        private AgentRegistry registry;
        private MemoryManager memory;
        private AgentRuntime runtime;

        @BeforeEach
        void setUp() {
            bus = new InMemoryCommunicationBus(BusSettings.defaults(), clock);
            bus.start();
            registry = new AgentRegistry(NegotiationSettings.defaults(), clock);
            memory = new MemoryManager(new InMemoryMemoryRepository(), MemorySettings.defaults(), clock);
            bus.subscribe(Endpoints.NEGOTIATOR, MessageFilters.addressedTo(Endpoints.NEGOTIATOR), (m, r) -> {
                negotiatorInbox.add(m);
                bus.ack(r);
            });
            runtime = new AgentRuntime("agent-1", registry, bus, memory, FAST, objectMapper, clock);
        }

        @AfterEach
        void tearDown() {
            runtime.stop();
            bus.stop();
        }

        private void listenAsOrchestrator() {
            bus.subscribe(Endpoints.ORCHESTRATOR, MessageFilters.addressedTo(Endpoints.ORCHESTRATOR), (m, r) -> {
                orchestratorInbox.add(m);
                bus.ack(r);
            });
        }

        private Dispatch dispatch(String dispatchId, String capability) {
            return new Dispatch(UUID.randomUUID(), "T1", dispatchId, capability, null,
                clock.instant().plusSeconds(60), 1, Map.of());
        }

        private void send(Dispatch dispatch) {
            bus.send(Message.create(Endpoints.ORCHESTRATOR, "agent-1", MessageType.DISPATCH,
                objectMapper.valueToTree(dispatch), dispatch.dispatchId(), dispatch.workflowId().toString()));
        }

        private List<Message> received(MessageType type) {
            return orchestratorInbox.stream().filter(m -> m.type() == type).toList();
        }

        @Test
        @DisplayName("A runtime without capabilities refuses to start")
        void testEmptyManifest() {
            assertThatThrownBy(runtime::start).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Bids carry the manifest cost; unknown capabilities are declined")
        void testBidAndDecline() throws Exception {
            runtime.registerCapability(new Capability("summarize", 4.0, 0.8), ctx -> null).start();

            bus.send(Message.create(Endpoints.NEGOTIATOR, "agent-1", MessageType.BID_REQUEST,
                objectMapper.valueToTree(new BidRequest("r1", UUID.randomUUID(), "T1", "summarize", clock.instant()))));
            bus.send(Message.create(Endpoints.NEGOTIATOR, "agent-1", MessageType.BID_REQUEST,
                objectMapper.valueToTree(new BidRequest("r2", UUID.randomUUID(), "T1", "translate", clock.instant()))));

            Await.until(() -> negotiatorInbox.size() == 2, "two bids");
            Bid first = objectMapper.treeToValue(negotiatorInbox.get(0).payload(), Bid.class);
            Bid second = objectMapper.treeToValue(negotiatorInbox.get(1).payload(), Bid.class);

            assertThat(first.declined()).isFalse();
            assertThat(first.costEstimate()).isEqualTo(4.0);
            assertThat(first.qualityEstimate()).isEqualTo(0.8);
            assertThat(negotiatorInbox.get(0).idempotencyKey()).isEqualTo("r1:agent-1");
            assertThat(second.declined()).isTrue();
        }

        @Test
        @DisplayName("A busy agent declines further bids")
        void testBusyAgentDeclines() throws Exception {
            listenAsOrchestrator();
            CountDownLatch release = new CountDownLatch(1);
            runtime.registerCapability(Capability.of("write", 1.0), ctx -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return null;
            }).start();

            send(dispatch("d-1", "write"));
            Await.until(() -> runtime.stats().tasksRunning() == 1, "execution to start");

            bus.send(Message.create(Endpoints.NEGOTIATOR, "agent-1", MessageType.BID_REQUEST,
                objectMapper.valueToTree(new BidRequest("r1", UUID.randomUUID(), "T2", "write", clock.instant()))));
            Await.until(() -> negotiatorInbox.size() == 1, "bid");
            release.countDown();

            assertThat(objectMapper.treeToValue(negotiatorInbox.get(0).payload(), Bid.class).declined()).isTrue();
            Await.until(() -> received(MessageType.RESULT).size() == 1, "result");
        }

        @Test
        @DisplayName("A custom estimator returning null declines")
        void testEstimatorDeclines() throws Exception {
            runtime.registerCapability(Capability.of("write", 1.0), ctx -> null)
                .withBidEstimator((agentId, request, capability, stats) -> null)
                .start();

            bus.send(Message.create(Endpoints.NEGOTIATOR, "agent-1", MessageType.BID_REQUEST,
                objectMapper.valueToTree(new BidRequest("r1", UUID.randomUUID(), "T1", "write", clock.instant()))));

            Await.until(() -> negotiatorInbox.size() == 1, "bid");
            assertThat(objectMapper.treeToValue(negotiatorInbox.get(0).payload(), Bid.class).declined()).isTrue();
        }

        @Test
        @DisplayName("A dispatch delivered twice is executed once")
        void testRedeliveredDispatchExecutedOnce() {
            listenAsOrchestrator();
            AtomicInteger executions = new AtomicInteger();
            runtime.registerCapability(Capability.of("write", 1.0), ctx -> {
                executions.incrementAndGet();
                return ctx.toJsonNode(Map.of("n", executions.get()));
            }).start();

            Dispatch dispatch = dispatch("d-1", "write");
            send(dispatch);
            Await.until(() -> received(MessageType.RESULT).size() == 1, "result");
            send(dispatch);
            Await.quietPeriod(Duration.ofMillis(200));

            assertThat(executions).hasValue(1);
            assertThat(received(MessageType.RESULT)).hasSize(1);
            assertThat(received(MessageType.ACCEPT)).hasSize(1);
            assertThat(received(MessageType.RESULT).get(0).idempotencyKey()).isEqualTo("d-1:result");
        }

        @Test
        @DisplayName("A dispatch for a capability the agent lacks is rejected")
        void testUnknownCapabilityRejected() throws Exception {
            listenAsOrchestrator();
            runtime.registerCapability(Capability.of("write", 1.0), ctx -> null).start();

            send(dispatch("d-1", "paint"));

            Await.until(() -> received(MessageType.REJECT).size() == 1, "reject");
            DispatchAccepted reject = objectMapper.treeToValue(received(MessageType.REJECT).get(0).payload(),
                DispatchAccepted.class);
            assertThat(reject.reason()).isEqualTo(AgentRuntime.UNKNOWN_CAPABILITY);
            assertThat(reject.dispatchId()).isEqualTo("d-1");
        }

        @Test
        @DisplayName("A dispatch whose deadline already passed fails without executing")
        void testExpiredDispatch() throws Exception {
            listenAsOrchestrator();
            AtomicInteger executions = new AtomicInteger();
            runtime.registerCapability(Capability.of("write", 1.0), ctx -> {
                executions.incrementAndGet();
                return null;
            }).start();

            send(new Dispatch(UUID.randomUUID(), "T1", "d-1", "write", null, clock.instant().minusSeconds(1), 1, Map.of()));

            Await.until(() -> received(MessageType.FAILURE).size() == 1, "failure");
            TaskFailure failure = objectMapper.treeToValue(received(MessageType.FAILURE).get(0).payload(),
                TaskFailure.class);
            assertThat(failure.errorCode()).isEqualTo(DeadlineExceededException.ERROR_CODE);
            assertThat(failure.retryable()).isTrue();
            assertThat(executions).hasValue(0);
        }

        @Test
        @DisplayName("Executors keep notes in the agent's memory scope between dispatches")
        void testRememberAndRecall() throws Exception {
            listenAsOrchestrator();
            runtime.registerCapability(Capability.of("count", 1.0), ctx -> {
                int seen = ctx.recall("seen").map(n -> n.asInt()).orElse(0) + 1;
                ctx.remember("seen", ctx.toJsonNode(seen));
                return ctx.toJsonNode(Map.of("seen", seen));
            }).start();

            send(dispatch("d-1", "count"));
            Await.until(() -> received(MessageType.RESULT).size() == 1, "first result");
            send(dispatch("d-2", "count"));
            Await.until(() -> received(MessageType.RESULT).size() == 2, "second result");

            TaskResult second = objectMapper.treeToValue(received(MessageType.RESULT).get(1).payload(), TaskResult.class);
            assertThat(second.result().get("seen").asInt()).isEqualTo(2);
            assertThat(memory.listVersions(ScopeKey.agent("agent-1", "seen"))).hasSize(2);
        }

        @Test
        @DisplayName("A result the orchestrator could not take is resent on a later heartbeat")
        void testReplyKeptUntilOrchestratorReturns() {
            runtime.registerCapability(Capability.of("write", 1.0), ctx -> ctx.toJsonNode("done")).start();

            send(dispatch("d-1", "write"));
            Await.until(() -> runtime.stats().tasksCompleted() == 1, "execution");
            assertThat(runtime.pendingReplies()).isEqualTo(1);

            listenAsOrchestrator();
            runtime.heartbeat();

            Await.until(() -> received(MessageType.RESULT).size() == 1, "resent result");
            assertThat(runtime.pendingReplies()).isZero();
        }
    }
}
