package com.agentmesh.agent;

import com.agentmesh.core.exception.DeadlineExceededException;
import com.agentmesh.core.exception.RecipientUnavailableException;
import com.agentmesh.core.model.Capability;
import com.agentmesh.core.model.DeliveryReceipt;
import com.agentmesh.core.model.Message;
import com.agentmesh.core.model.MessageType;
import com.agentmesh.core.protocol.Bid;
import com.agentmesh.core.protocol.BidRequest;
import com.agentmesh.core.protocol.Dispatch;
import com.agentmesh.core.protocol.DispatchAccepted;
import com.agentmesh.core.protocol.Endpoints;
import com.agentmesh.core.protocol.TaskFailure;
import com.agentmesh.core.protocol.TaskResult;
import com.agentmesh.engine.bus.CommunicationBus;
import com.agentmesh.engine.bus.MessageFilters;
import com.agentmesh.engine.bus.ProcessedKeys;
import com.agentmesh.engine.bus.Subscription;
import com.agentmesh.engine.logging.LoggingContext;
import com.agentmesh.engine.memory.MemoryManager;
import com.agentmesh.engine.negotiation.AgentRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Agent side of the mesh: registers a capability manifest, heartbeats, answers bid requests
 * and executes dispatches.
 *
 * Usage:
 * <pre>
 * AgentRuntime writer = new AgentRuntime("writer-1", registry, bus, memory, AgentSettings.defaults(),
 *     objectMapper, clock);
 * writer.registerCapability(new Capability("write", 2.0, 0.9), context -> {
 *     // produce the draft
 *     return context.toJsonNode(Map.of("draft", text));
 * });
 * writer.start();
 * </pre>
 *
 * Every dispatch gets exactly one RESULT or FAILURE. Redelivered dispatches are recognised by
 * their dispatch id and not executed twice. Replies the orchestrator cannot take right now are
 * kept and resent on every heartbeat until they go through.
 */
public class AgentRuntime {

    private static final Logger log = LoggerFactory.getLogger(AgentRuntime.class);

    public static final String EXECUTION_ERROR = "EXECUTION_ERROR";
    public static final String UNKNOWN_CAPABILITY = "UNKNOWN_CAPABILITY";

    private final String agentId;
    private final AgentRegistry registry;
    private final CommunicationBus bus;
    private final MemoryManager memory;
    private final AgentSettings settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Capability> manifest = new ConcurrentHashMap<>();
    private final Map<String, CapabilityExecutor> executors = new ConcurrentHashMap<>();
    private final Map<String, Message> pendingReplies = new ConcurrentHashMap<>();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final ProcessedKeys processedDispatches;
    private final AtomicReference<AgentStats> stats = new AtomicReference<>(AgentStats.initial());
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService worker;
    private final ScheduledExecutorService heartbeatScheduler;

    private volatile BidEstimator bidEstimator = BidEstimator.manifest();

    public AgentRuntime(
            String agentId,
            AgentRegistry registry,
            CommunicationBus bus,
            MemoryManager memory,
            AgentSettings settings,
            ObjectMapper objectMapper,
            Clock clock) {
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.registry = registry;
        this.bus = bus;
        this.memory = memory;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.processedDispatches = new ProcessedKeys(settings.dedupCapacity());
        this.worker = Executors.newSingleThreadExecutor(namedThreads("agentmesh-agent-" + agentId));
        this.heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(
            namedThreads("agentmesh-heartbeat-" + agentId));
    }

    /**
     * Add a capability to the manifest. A running agent re-registers with the new manifest.
     */
    public AgentRuntime registerCapability(Capability capability, CapabilityExecutor executor) {
        manifest.put(capability.name(), capability);
        executors.put(capability.name(), executor);
        log.info("Agent {} registered capability {} (cost={}, quality={})",
            agentId, capability.name(), capability.costEstimate(), capability.qualityEstimate());
        if (running.get()) {
            registry.register(agentId, List.copyOf(manifest.values()));
        }
        return this;
    }

    public AgentRuntime withBidEstimator(BidEstimator estimator) {
        this.bidEstimator = Objects.requireNonNull(estimator, "estimator");
        return this;
    }

    /**
     * Subscribe, register and start heartbeating.
     */
    public void start() {
        if (manifest.isEmpty()) {
            throw new IllegalStateException("Agent " + agentId + " has no capabilities to offer");
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Agent {} already running", agentId);
            return;
        }
        subscriptions.add(bus.subscribe(agentId,
            MessageFilters.addressedTo(agentId).and(MessageFilters.ofType(MessageType.DISPATCH, MessageType.BID_REQUEST)),
            this::onMessage));
        registry.register(agentId, List.copyOf(manifest.values()));

        long period = settings.heartbeatInterval().toMillis();
        heartbeatScheduler.scheduleAtFixedRate(this::heartbeatSafely, 0, period, TimeUnit.MILLISECONDS);
        log.info("Agent {} started with capabilities {}", agentId, manifest.keySet());
    }

    /**
     * Stop taking work, let a running execution finish (bounded), then deregister.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping agent {}", agentId);
        subscriptions.forEach(Subscription::unsubscribe);
        subscriptions.clear();
        heartbeatScheduler.shutdownNow();

        worker.shutdown();
        try {
            if (!worker.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Agent {} did not finish its task within {}; interrupting", agentId, settings.shutdownTimeout());
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        registry.deregister(agentId);
        log.info("Agent {} stopped ({})", agentId, stats.get());
    }

    /**
     * Broadcast a heartbeat and retry replies that could not be delivered yet.
     */
    public void heartbeat() {
        bus.send(Message.create(agentId, Endpoints.HEARTBEAT_TOPIC, MessageType.HEARTBEAT,
            objectMapper.createObjectNode().put("running", stats.get().tasksRunning())));
        for (Message reply : new ArrayList<>(pendingReplies.values())) {
            trySend(reply);
        }
    }

    public String agentId() {
        return agentId;
    }

    public boolean isRunning() {
        return running.get();
    }

    public AgentStats stats() {
        return stats.get();
    }

    public int pendingReplies() {
        return pendingReplies.size();
    }

    // ========== Internal Methods ==========

    private void onMessage(Message message, DeliveryReceipt receipt) {
        try (LoggingContext ctx = LoggingContext.forAgent(agentId)) {
            switch (message.type()) {
                case BID_REQUEST -> onBidRequest(message, receipt);
                case DISPATCH -> onDispatch(message, receipt);
                default -> bus.ack(receipt);
            }
        } catch (JsonProcessingException e) {
            log.warn("Agent {} discarding malformed {} {}", agentId, message.type(), message.messageId(), e);
            bus.ack(receipt);
        }
    }

    private void onBidRequest(Message message, DeliveryReceipt receipt) throws JsonProcessingException {
        BidRequest request = objectMapper.treeToValue(message.payload(), BidRequest.class);
        bus.ack(receipt);

        Capability capability = manifest.get(request.capability());
        Bid bid = null;
        if (capability != null && stats.get().tasksRunning() == 0) {
            bid = bidEstimator.estimate(agentId, request, capability, stats.get());
        }
        if (bid == null) {
            bid = Bid.decline(request.roundId(), agentId, request.capability());
        }
        log.debug("Agent {} {} round {} for {}", agentId, bid.declined() ? "declines" : "bids " + bid.costEstimate() + " in",
            request.roundId(), request.capability());

        try {
            bus.send(Message.create(agentId, Endpoints.NEGOTIATOR, MessageType.BID, objectMapper.valueToTree(bid),
                request.roundId() + ":" + agentId, request.roundId()));
        } catch (RecipientUnavailableException e) {
            log.debug("Negotiator unreachable; bid for round {} dropped", request.roundId());
        }
    }

    private void onDispatch(Message message, DeliveryReceipt receipt) throws JsonProcessingException {
        Dispatch dispatch = objectMapper.treeToValue(message.payload(), Dispatch.class);
        if (!processedDispatches.markProcessed(dispatch.dispatchId())) {
            log.debug("Agent {} ignoring redelivered dispatch {}", agentId, dispatch.dispatchId());
            bus.ack(receipt);
            return;
        }
        bus.ack(receipt);

        CapabilityExecutor executor = executors.get(dispatch.capability());
        if (executor == null) {
            log.warn("Agent {} rejects dispatch {}: no executor for {}", agentId, dispatch.dispatchId(),
                dispatch.capability());
            reply(dispatch, MessageType.REJECT, objectMapper.valueToTree(new DispatchAccepted(dispatch.workflowId(),
                dispatch.taskId(), dispatch.dispatchId(), agentId, UNKNOWN_CAPABILITY)));
            return;
        }

        try {
            worker.execute(() -> execute(dispatch, executor));
        } catch (RejectedExecutionException e) {
            processedDispatches.forget(dispatch.dispatchId());
            reply(dispatch, MessageType.REJECT, objectMapper.valueToTree(new DispatchAccepted(dispatch.workflowId(),
                dispatch.taskId(), dispatch.dispatchId(), agentId, "agent stopping")));
            return;
        }
        sendBestEffort(Message.create(agentId, Endpoints.ORCHESTRATOR, MessageType.ACCEPT,
            objectMapper.valueToTree(new DispatchAccepted(dispatch.workflowId(), dispatch.taskId(),
                dispatch.dispatchId(), agentId, null)),
            dispatch.dispatchId() + ":accept", dispatch.workflowId().toString()));
    }

    private void execute(Dispatch dispatch, CapabilityExecutor executor) {
        long started = System.nanoTime();
        boolean succeeded = false;
        stats.updateAndGet(s -> s.withRunning(s.tasksRunning() + 1));

        try (LoggingContext ctx = LoggingContext.forTask(dispatch.workflowId(), dispatch.taskId(), dispatch.attempt())) {
            LoggingContext.setAgentId(agentId);
            TaskContext context = new TaskContext(agentId, dispatch, objectMapper, memory, clock);
            if (context.isPastDeadline()) {
                log.warn("Dispatch {} arrived after its deadline {}", dispatch.dispatchId(), dispatch.deadline());
                fail(dispatch, DeadlineExceededException.ERROR_CODE, "Deadline passed before execution", true);
                return;
            }

            log.info("Executing {} (attempt {})", dispatch.capability(), dispatch.attempt());
            JsonNode result = executor.execute(context);
            succeeded = true;
            reply(dispatch, MessageType.RESULT, objectMapper.valueToTree(new TaskResult(dispatch.workflowId(),
                dispatch.taskId(), dispatch.dispatchId(), agentId, result)));
            log.info("Task {} completed", dispatch.taskId());

        } catch (TaskExecutionException e) {
            log.warn("Task {} failed: {} - {}", dispatch.taskId(), e.getErrorCode(), e.getMessage());
            fail(dispatch, e.getErrorCode(), e.getMessage(), e.isRetryable());

        } catch (RuntimeException e) {
            log.error("Task {} failed with unexpected error", dispatch.taskId(), e);
            fail(dispatch, EXECUTION_ERROR, String.valueOf(e.getMessage()), true);

        } finally {
            Duration took = Duration.ofNanos(System.nanoTime() - started);
            boolean ok = succeeded;
            stats.updateAndGet(s -> s.withSettled(ok, took).withRunning(s.tasksRunning() - 1));
        }
    }

    private void fail(Dispatch dispatch, String errorCode, String errorMessage, boolean retryable) {
        reply(dispatch, MessageType.FAILURE, objectMapper.valueToTree(new TaskFailure(dispatch.workflowId(),
            dispatch.taskId(), dispatch.dispatchId(), agentId, errorCode, errorMessage, retryable)));
    }

    /**
     * Send a reply the orchestrator must see. The idempotency key is derived from the dispatch,
     * so resending it is harmless.
     */
    private void reply(Dispatch dispatch, MessageType type, JsonNode payload) {
        String idempotencyKey = dispatch.dispatchId() + ":" + type.name().toLowerCase();
        Message message = Message.create(agentId, Endpoints.ORCHESTRATOR, type, payload, idempotencyKey,
            dispatch.workflowId().toString());
        pendingReplies.put(idempotencyKey, message);
        trySend(message);
    }

    private void trySend(Message message) {
        try {
            bus.send(message);
            pendingReplies.remove(message.idempotencyKey());
        } catch (RecipientUnavailableException e) {
            log.warn("Orchestrator unreachable; {} for {} kept for the next heartbeat",
                message.type(), message.idempotencyKey());
        }
    }

    private void sendBestEffort(Message message) {
        try {
            bus.send(message);
        } catch (RecipientUnavailableException e) {
            log.debug("Dropped {} {}: orchestrator unreachable", message.type(), message.idempotencyKey());
        }
    }

    private void heartbeatSafely() {
        if (!running.get()) {
            return;
        }
        try {
            heartbeat();
        } catch (Exception e) {
            log.error("Heartbeat of agent {} failed", agentId, e);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        return runnable -> {
            Thread thread = new Thread(runnable, prefix);
            thread.setDaemon(true);
            return thread;
        };
    }
}
