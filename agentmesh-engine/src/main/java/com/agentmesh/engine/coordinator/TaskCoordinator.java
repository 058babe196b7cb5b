package com.agentmesh.engine.coordinator;

import com.agentmesh.core.exception.DeadlineExceededException;
import com.agentmesh.core.exception.NoQualifiedAgentException;
import com.agentmesh.core.exception.NotFoundException;
import com.agentmesh.core.exception.RecipientUnavailableException;
import com.agentmesh.core.model.DeliveryReceipt;
import com.agentmesh.core.model.Message;
import com.agentmesh.core.model.MessageType;
import com.agentmesh.core.model.RetryPolicy;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.model.TaskRef;
import com.agentmesh.core.model.TaskState;
import com.agentmesh.core.model.Workflow;
import com.agentmesh.core.model.WorkflowState;
import com.agentmesh.core.protocol.Dispatch;
import com.agentmesh.core.protocol.DispatchAccepted;
import com.agentmesh.core.protocol.Endpoints;
import com.agentmesh.core.protocol.TaskFailure;
import com.agentmesh.core.protocol.TaskResult;
import com.agentmesh.engine.bus.CommunicationBus;
import com.agentmesh.engine.bus.DeadLetter;
import com.agentmesh.engine.bus.MessageFilters;
import com.agentmesh.engine.bus.ProcessedKeys;
import com.agentmesh.engine.bus.Subscription;
import com.agentmesh.engine.coordinator.WorkflowCheckpoints.Update;
import com.agentmesh.engine.event.WorkflowEvent;
import com.agentmesh.engine.event.WorkflowEventPublisher;
import com.agentmesh.engine.event.WorkflowEventType;
import com.agentmesh.engine.logging.LoggingContext;
import com.agentmesh.engine.negotiation.AgentLivenessListener;
import com.agentmesh.engine.negotiation.AgentRegistry;
import com.agentmesh.engine.negotiation.Assignment;
import com.agentmesh.engine.negotiation.AssignmentOutcome;
import com.agentmesh.engine.negotiation.RoleNegotiator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives tasks through their lifecycle: negotiation, dispatch, outcome handling, retries,
 * deadlines and agent loss.
 *
 * <p>Every transition is checkpointed through {@link WorkflowCheckpoints} before any message
 * that depends on it is sent. Outcomes are matched on the dispatch id, so late or duplicate
 * results and failures leave the workflow unchanged.</p>
 */
public class TaskCoordinator implements AgentLivenessListener {

    private static final Logger log = LoggerFactory.getLogger(TaskCoordinator.class);

    public static final String DEPENDENCY_ABANDONED = "DEPENDENCY_ABANDONED";
    public static final String DISPATCH_REJECTED = "DISPATCH_REJECTED";
    public static final String CANCELLED = "CANCELLED";

    private static final int PROCESSED_KEY_CAPACITY = 10_000;

    private final WorkflowCheckpoints checkpoints;
    private final RoleNegotiator negotiator;
    private final AgentRegistry registry;
    private final CommunicationBus bus;
    private final WorkflowEventPublisher events;
    private final OrchestratorSettings settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final Set<TaskRef> scheduled = ConcurrentHashMap.newKeySet();
    private final ProcessedKeys processed = new ProcessedKeys(PROCESSED_KEY_CAPACITY);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean listenersRegistered = new AtomicBoolean(false);

    public TaskCoordinator(
            WorkflowCheckpoints checkpoints,
            RoleNegotiator negotiator,
            AgentRegistry registry,
            CommunicationBus bus,
            WorkflowEventPublisher events,
            OrchestratorSettings settings,
            ObjectMapper objectMapper,
            Clock clock) {
        this.checkpoints = checkpoints;
        this.negotiator = negotiator;
        this.registry = registry;
        this.bus = bus;
        this.events = events;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(settings.workerThreads(), namedThreads("agentmesh-orchestrator"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("agentmesh-retry"));
    }

    /**
     * Subscribe to agent replies and start reacting to agent loss and dead letters.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Task coordinator already running");
            return;
        }
        if (listenersRegistered.compareAndSet(false, true)) {
            registry.addListener(this);
            bus.onDeadLetter(this::onDeadLetter);
        }
        subscriptions.add(bus.subscribe(Endpoints.ORCHESTRATOR,
            MessageFilters.addressedTo(Endpoints.ORCHESTRATOR).and(MessageFilters.ofType(
                MessageType.RESULT, MessageType.FAILURE, MessageType.ACCEPT, MessageType.REJECT)),
            this::onMessage));
        log.info("Task coordinator started (workers={}, dispatchTimeout={})",
            settings.workerThreads(), settings.dispatchTimeout());
    }

    public void stop() {
        running.set(false);
        subscriptions.forEach(Subscription::unsubscribe);
        subscriptions.clear();
        scheduler.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Task coordinator stopped");
    }

    /**
     * Wait until no negotiation is running.
     *
     * @return true if quiescent before the timeout
     */
    public boolean awaitQuiescence(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (inFlight.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    public int inFlightNegotiations() {
        return inFlight.get();
    }

    /**
     * Promote tasks whose dependencies succeeded, cascade abandonment, and schedule every READY
     * task for negotiation.
     */
    public void advance(UUID workflowId) {
        Update update = checkpoints.update(workflowId, w -> settle(w, now()));
        publishTransitions(update);
        scheduleReady(update.after());
    }

    /**
     * Abandon every unsettled task, release their agents and mark the workflow CANCELLED.
     * Does nothing if the workflow already reached a terminal state.
     *
     * @return true if this call cancelled the workflow
     */
    public boolean cancel(UUID workflowId) {
        Update update = checkpoints.update(workflowId, w -> {
            if (w.isTerminal()) {
                return w;
            }
            Instant now = now();
            Workflow out = w;
            for (Task task : w.tasks().values()) {
                if (!task.isTerminal()) {
                    out = out.withTask(task.withAbandoned(CANCELLED, "Workflow cancelled", now), now);
                }
            }
            return out.withCancelled(now);
        });
        if (!update.changed()) {
            log.debug("Workflow {} already {}; cancel ignored", workflowId, update.after().state());
            return false;
        }
        for (Task task : update.before().tasks().values()) {
            if (task.state() == TaskState.DISPATCHED) {
                negotiator.release(task.assignedAgentId(), new TaskRef(workflowId, task.taskId()),
                    AssignmentOutcome.CANCELLED);
            }
        }
        publishTransitions(update);
        return true;
    }

    /**
     * Fail every dispatch whose deadline has passed.
     *
     * @return number of dispatches timed out
     */
    public int checkDeadlines() {
        Instant now = now();
        int expired = 0;
        for (Workflow workflow : checkpoints.all()) {
            if (workflow.isTerminal()) {
                continue;
            }
            for (Task task : workflow.tasksInState(TaskState.DISPATCHED)) {
                if (task.deadline() == null || !now.isAfter(task.deadline())) {
                    continue;
                }
                TaskRef ref = new TaskRef(workflow.workflowId(), task.taskId());
                DeadlineExceededException timeout =
                    new DeadlineExceededException(workflow.workflowId(), task.taskId(), task.deadline());
                if (onFailure(ref, task.dispatchId(), task.assignedAgentId(), timeout.getErrorCode(),
                        timeout.getMessage(), true, AssignmentOutcome.TIMED_OUT)) {
                    expired++;
                }
            }
        }
        return expired;
    }

    /**
     * Resume every unfinished workflow found in the Memory Manager.
     *
     * <p>NEGOTIATING and FAILED tasks go back to READY. A DISPATCHED task keeps waiting if its
     * agent is still live and can be re-bound to it; otherwise it is re-negotiated with its
     * retry count incremented.</p>
     *
     * @return number of workflows resumed
     */
    public int recover() {
        int resumed = 0;
        for (Workflow workflow : checkpoints.reload()) {
            if (workflow.isTerminal()) {
                continue;
            }
            UUID workflowId = workflow.workflowId();
            Set<String> kept = new HashSet<>();
            for (Task task : workflow.tasksInState(TaskState.DISPATCHED)) {
                if (negotiator.reclaim(task.assignedAgentId(), new TaskRef(workflowId, task.taskId()))) {
                    kept.add(task.taskId());
                }
            }

            Update update = checkpoints.update(workflowId, w -> {
                Instant now = now();
                Workflow out = w;
                for (Task task : w.tasks().values()) {
                    switch (task.state()) {
                        case NEGOTIATING, FAILED -> out = out.withTask(task.withReady(now), now);
                        case DISPATCHED -> {
                            if (!kept.contains(task.taskId())) {
                                out = out.withTask(lose(task, RecipientUnavailableException.ERROR_CODE,
                                    "Agent " + task.assignedAgentId() + " not live after restart", now), now);
                            }
                        }
                        default -> {
                        }
                    }
                }
                return settle(out, now);
            });
            publishTransitions(update);
            scheduleReady(update.after());
            resumed++;
            log.info("Resumed workflow {} ({} dispatches kept)", workflowId, kept.size());
        }
        return resumed;
    }

    @Override
    public void onAgentLost(String agentId, TaskRef assignment, String reason) {
        if (assignment == null || !running.get()) {
            return;
        }
        checkpoints.find(assignment.workflowId()).ifPresent(workflow -> {
            if (!workflow.hasTask(assignment.taskId())) {
                return;
            }
            Task task = workflow.task(assignment.taskId());
            if (task.state() == TaskState.DISPATCHED && agentId.equals(task.assignedAgentId())) {
                onRecipientLost(assignment, task.dispatchId(), agentId, RecipientUnavailableException.ERROR_CODE,
                    "Agent " + agentId + " lost: " + reason, false);
            }
        });
    }

    // ========== Internal Methods ==========

    private void scheduleReady(Workflow workflow) {
        if (workflow.isTerminal()) {
            return;
        }
        for (Task task : workflow.tasksInState(TaskState.READY)) {
            TaskRef ref = new TaskRef(workflow.workflowId(), task.taskId());
            if (scheduled.add(ref)) {
                enqueue(ref, Duration.ZERO);
            }
        }
    }

    /**
     * Queue a negotiation for a task already recorded in {@code scheduled}.
     */
    private void enqueue(TaskRef ref, Duration delay) {
        try {
            if (delay.isZero()) {
                workers.execute(() -> negotiate(ref));
            } else {
                scheduler.schedule(() -> enqueue(ref, Duration.ZERO), delay.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (RejectedExecutionException e) {
            scheduled.remove(ref);
            log.debug("Coordinator shutting down; not scheduling {}", ref);
        }
    }

    private void negotiate(TaskRef ref) {
        scheduled.remove(ref);
        inFlight.incrementAndGet();
        try {
            Update update = checkpoints.update(ref.workflowId(), w -> {
                if (w.isTerminal() || !w.hasTask(ref.taskId())) {
                    return w;
                }
                Task task = w.task(ref.taskId());
                if (task.state() != TaskState.READY) {
                    return w;
                }
                Instant now = now();
                return w.withTask(task.withNegotiating(now), now);
            });
            if (!update.changed()) {
                return;
            }
            publishTransitions(update);
            Task task = update.after().task(ref.taskId());

            try (LoggingContext ctx = LoggingContext.forTask(ref.workflowId(), ref.taskId(), task.attempt())) {
                Assignment assignment;
                try {
                    assignment = negotiator.negotiate(ref, task.requiredCapability(), task.excludedAgents());
                } catch (NoQualifiedAgentException e) {
                    onNoQualifiedAgent(ref, e);
                    return;
                }
                dispatch(ref, assignment.agentId());
            }
        } catch (RuntimeException e) {
            log.error("Negotiation of {} failed unexpectedly", ref, e);
            requeueAfterError(ref);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void onNoQualifiedAgent(TaskRef ref, NoQualifiedAgentException cause) {
        if (cause.isAgentsBusy()) {
            awaitBusyAgent(ref, cause);
            return;
        }
        RetryPolicy policy = settings.negotiationPolicy();
        scheduled.add(ref);
        Update update = checkpoints.update(ref.workflowId(), w -> {
            Task task = w.task(ref.taskId());
            if (w.isTerminal() || task.state() != TaskState.NEGOTIATING) {
                return w;
            }
            Instant now = now();
            Task backedOff = task.withNoQualifiedAgent(cause.getMessage(), now);
            if (!policy.hasMoreAttempts(backedOff.negotiationAttempts())) {
                backedOff = backedOff.withAbandoned(cause.getErrorCode(), cause.getMessage(), now);
            }
            return settle(w.withTask(backedOff, now), now);
        });
        Task task = update.after().task(ref.taskId());
        events.publish(WorkflowEvent.task(WorkflowEventType.NEGOTIATION_FAILED, ref.workflowId(), ref.taskId(),
            null, cause.getErrorCode(), now()));
        publishTransitions(update);

        if (update.changed() && task.state() == TaskState.READY) {
            Duration delay = policy.computeBackoff(task.negotiationAttempts());
            log.warn("No qualified agent for {} ({}); negotiation {} of {} failed, retrying in {}",
                ref, cause.getMessage(), task.negotiationAttempts(), policy.maxAttempts(), delay);
            enqueue(ref, delay);
        } else {
            scheduled.remove(ref);
            if (task.state() == TaskState.ABANDONED) {
                log.warn("Abandoned {} after {} failed negotiations", ref, task.negotiationAttempts());
            }
        }
    }

    /**
     * Qualified agents exist but are all working. The task waits in READY without using up
     * a negotiation attempt and is re-negotiated after the first backoff step.
     */
    private void awaitBusyAgent(TaskRef ref, NoQualifiedAgentException cause) {
        scheduled.add(ref);
        Update update = checkpoints.update(ref.workflowId(), w -> {
            Task task = w.task(ref.taskId());
            if (w.isTerminal() || task.state() != TaskState.NEGOTIATING) {
                return w;
            }
            Instant now = now();
            return w.withTask(task.withReady(now), now);
        });
        publishTransitions(update);
        if (update.changed()) {
            Duration delay = settings.negotiationPolicy().computeBackoff(1);
            log.debug("{} waiting for a busy agent ({}); retrying in {}", ref, cause.getMessage(), delay);
            enqueue(ref, delay);
        } else {
            scheduled.remove(ref);
        }
    }

    private void dispatch(TaskRef ref, String agentId) {
        Update update = checkpoints.update(ref.workflowId(), w -> {
            Task task = w.task(ref.taskId());
            if (w.isTerminal() || task.state() != TaskState.NEGOTIATING) {
                return w;
            }
            Instant now = now();
            Duration timeout = task.timeout() != null ? task.timeout() : settings.dispatchTimeout();
            return w.withTask(task.withDispatched(agentId, task.nextDispatchId(ref.workflowId()),
                now.plus(timeout), now), now);
        });
        Task task = update.after().task(ref.taskId());
        if (!update.changed()) {
            log.info("{} no longer awaiting dispatch ({}); releasing agent {}", ref, task.state(), agentId);
            negotiator.release(agentId, ref, AssignmentOutcome.CANCELLED);
            return;
        }
        publishTransitions(update);

        Workflow workflow = update.after();
        Map<String, JsonNode> dependencyResults = new LinkedHashMap<>();
        for (String dependency : task.dependsOn()) {
            dependencyResults.put(dependency, workflow.task(dependency).result());
        }
        Dispatch dispatch = new Dispatch(ref.workflowId(), ref.taskId(), task.dispatchId(),
            task.requiredCapability(), ContextMapping.resolve(task.input(), workflow.context()),
            task.deadline(), task.attempt(), dependencyResults);
        Message message = Message.create(Endpoints.ORCHESTRATOR, agentId, MessageType.DISPATCH,
            objectMapper.valueToTree(dispatch), task.dispatchId(), ref.workflowId().toString());
        try {
            bus.send(message);
            log.info("Dispatched {} to agent {} (dispatchId={}, deadline={})",
                ref, agentId, task.dispatchId(), task.deadline());
        } catch (RecipientUnavailableException e) {
            onRecipientLost(ref, task.dispatchId(), agentId, e.getErrorCode(), e.getMessage(), true);
        }
    }

    private void onResult(TaskResult result) {
        TaskRef ref = new TaskRef(result.workflowId(), result.taskId());
        Update update = checkpoints.update(result.workflowId(), w -> {
            if (!w.hasTask(result.taskId())) {
                return w;
            }
            Task task = w.task(result.taskId());
            if (!isCurrentDispatch(task, result.dispatchId())) {
                return w;
            }
            Instant now = now();
            Workflow out = w.withTask(task.withSucceeded(result.result(), now), now);
            if (!task.outputMapping().isEmpty()) {
                out = out.withContext(ContextMapping.applyOutputs(w.context(), task.outputMapping(), result.result()));
            }
            return settle(out, now);
        });
        if (!update.changed()) {
            log.info("Ignoring late or duplicate result {} for {}", result.dispatchId(), ref);
            return;
        }
        String agentId = update.before().task(result.taskId()).assignedAgentId();
        negotiator.release(agentId, ref, AssignmentOutcome.SUCCEEDED);
        log.info("Task {} succeeded on agent {}", ref, agentId);
        publishTransitions(update);
        scheduleReady(update.after());
    }

    /**
     * Record a failed attempt, then either schedule a retry or abandon the task.
     *
     * @return false if the dispatch was no longer current
     */
    private boolean onFailure(TaskRef ref, String dispatchId, String agentId, String errorCode,
                              String errorMessage, boolean retryable, AssignmentOutcome outcome) {
        Update update = checkpoints.update(ref.workflowId(), w -> {
            if (!w.hasTask(ref.taskId())) {
                return w;
            }
            Task task = w.task(ref.taskId());
            if (!isCurrentDispatch(task, dispatchId)) {
                return w;
            }
            Instant now = now();
            RetryPolicy policy = retryPolicyFor(task);
            Task failed = task.withFailed(errorCode, errorMessage, now);
            if (!policy.shouldRetry(errorCode, retryable) || !policy.hasMoreAttempts(failed.retryCount())) {
                failed = failed.withAbandoned(errorCode, errorMessage, now);
            }
            return settle(w.withTask(failed, now), now);
        });
        if (!update.changed()) {
            log.info("Ignoring stale failure {} for {} ({})", dispatchId, ref, errorCode);
            return false;
        }
        negotiator.release(agentId, ref, outcome);

        Task task = update.after().task(ref.taskId());
        if (task.state() == TaskState.ABANDONED) {
            events.publish(WorkflowEvent.task(WorkflowEventType.TASK_FAILED, ref.workflowId(), ref.taskId(),
                agentId, errorCode, now()));
        }
        publishTransitions(update);

        if (task.state() == TaskState.FAILED) {
            Duration delay = retryPolicyFor(task).computeBackoff(task.retryCount());
            log.warn("Task {} attempt {} failed on agent {} with {}; retrying in {}",
                ref, task.retryCount(), agentId, errorCode, delay);
            try {
                scheduler.schedule(() -> retry(ref), delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Coordinator shutting down; retry of {} left to recovery", ref);
            }
        } else {
            log.warn("Task {} abandoned after {} attempts: {} {}", ref, task.retryCount(), errorCode, errorMessage);
        }
        return true;
    }

    private void retry(TaskRef ref) {
        try {
            Update update = checkpoints.update(ref.workflowId(), w -> {
                Task task = w.task(ref.taskId());
                if (w.isTerminal() || task.state() != TaskState.FAILED) {
                    return w;
                }
                Instant now = now();
                return w.withTask(task.withReady(now), now);
            });
            publishTransitions(update);
            scheduleReady(update.after());
        } catch (RuntimeException e) {
            log.error("Retry of {} failed", ref, e);
        }
    }

    /**
     * The agent holding a dispatch cannot be reached. The task goes back to READY with its
     * retry count incremented, or is abandoned once attempts run out.
     */
    private void onRecipientLost(TaskRef ref, String dispatchId, String agentId, String errorCode,
                                 String errorMessage, boolean reportUnreachable) {
        Update update = checkpoints.update(ref.workflowId(), w -> {
            if (!w.hasTask(ref.taskId())) {
                return w;
            }
            Task task = w.task(ref.taskId());
            if (!isCurrentDispatch(task, dispatchId)) {
                return w;
            }
            Instant now = now();
            return settle(w.withTask(lose(task, errorCode, errorMessage, now), now), now);
        });
        if (!update.changed()) {
            return;
        }
        negotiator.release(agentId, ref, AssignmentOutcome.LOST);
        if (reportUnreachable) {
            registry.markUnreachable(agentId);
        }
        log.warn("Lost agent {} holding {}: {}", agentId, ref, errorMessage);
        events.publish(WorkflowEvent.task(WorkflowEventType.AGENT_LOST, ref.workflowId(), ref.taskId(),
            agentId, errorCode, now()));
        publishTransitions(update);
        scheduleReady(update.after());
    }

    private void requeueAfterError(TaskRef ref) {
        try {
            Update update = checkpoints.update(ref.workflowId(), w -> {
                Task task = w.task(ref.taskId());
                if (w.isTerminal() || task.state() != TaskState.NEGOTIATING) {
                    return w;
                }
                Instant now = now();
                return w.withTask(task.withReady(now), now);
            });
            if (update.changed() && scheduled.add(ref)) {
                enqueue(ref, settings.negotiationPolicy().computeBackoff(1));
            }
        } catch (RuntimeException e) {
            log.error("Could not requeue {}; left for recovery", ref, e);
        }
    }

    private void onMessage(Message message, DeliveryReceipt receipt) {
        if (processed.contains(message.idempotencyKey())) {
            log.debug("Duplicate {} {} ignored", message.type(), message.idempotencyKey());
            bus.ack(receipt);
            return;
        }
        try {
            switch (message.type()) {
                case RESULT -> onResult(objectMapper.treeToValue(message.payload(), TaskResult.class));
                case FAILURE -> {
                    TaskFailure failure = objectMapper.treeToValue(message.payload(), TaskFailure.class);
                    onFailure(new TaskRef(failure.workflowId(), failure.taskId()), failure.dispatchId(),
                        message.sender(), failure.errorCode(), failure.errorMessage(), failure.retryable(),
                        AssignmentOutcome.FAILED);
                }
                case REJECT -> {
                    DispatchAccepted rejected = objectMapper.treeToValue(message.payload(), DispatchAccepted.class);
                    onFailure(new TaskRef(rejected.workflowId(), rejected.taskId()), rejected.dispatchId(),
                        message.sender(), DISPATCH_REJECTED, rejected.reason(), true, AssignmentOutcome.FAILED);
                }
                case ACCEPT -> log.debug("Agent {} accepted dispatch {}", message.sender(), message.idempotencyKey());
                default -> log.debug("Ignoring {} from {}", message.type(), message.sender());
            }
            processed.markProcessed(message.idempotencyKey());
            bus.ack(receipt);
        } catch (JsonProcessingException | NotFoundException e) {
            log.warn("Discarding unprocessable {} from {}", message.type(), message.sender(), e);
            bus.ack(receipt);
        } catch (RuntimeException e) {
            log.error("Failed to process {} from {}; leaving it for redelivery",
                message.type(), message.sender(), e);
        }
    }

    private void onDeadLetter(DeadLetter deadLetter) {
        Message message = deadLetter.message();
        if (!running.get() || message.type() != MessageType.DISPATCH
                || !Endpoints.ORCHESTRATOR.equals(message.sender())) {
            return;
        }
        try {
            Dispatch dispatch = objectMapper.treeToValue(message.payload(), Dispatch.class);
            onRecipientLost(new TaskRef(dispatch.workflowId(), dispatch.taskId()), dispatch.dispatchId(),
                message.recipient(), RecipientUnavailableException.ERROR_CODE,
                "Dispatch dead-lettered (" + deadLetter.reason() + ")", true);
        } catch (JsonProcessingException | NotFoundException e) {
            log.warn("Could not handle dead-lettered dispatch {}", message.messageId(), e);
        }
    }

    private void publishTransitions(Update update) {
        if (!update.changed()) {
            return;
        }
        Workflow before = update.before();
        Workflow after = update.after();
        Instant now = now();
        for (Task task : after.tasks().values()) {
            Task prior = before.tasks().get(task.taskId());
            if (prior != null && prior.state() == task.state()) {
                continue;
            }
            WorkflowEventType type = taskEventType(task.state());
            if (type != null) {
                String agentId = task.assignedAgentId() != null || prior == null
                    ? task.assignedAgentId()
                    : prior.assignedAgentId();
                events.publish(WorkflowEvent.task(type, after.workflowId(), task.taskId(), agentId,
                    task.errorCode(), now));
            }
        }
        if (!before.isTerminal() && after.isTerminal()) {
            log.info("Workflow {} finished as {}", after.workflowId(), after.state());
            events.publish(WorkflowEvent.workflow(workflowEventType(after.state()), after.workflowId(), now));
        }
    }

    /**
     * Cascade abandonment forward and promote tasks whose dependencies all succeeded.
     */
    static Workflow settle(Workflow workflow, Instant now) {
        if (workflow.isTerminal()) {
            return workflow;
        }
        Workflow out = workflow;
        List<Task> doomed = out.doomedTasks();
        while (!doomed.isEmpty()) {
            for (Task task : doomed) {
                out = out.withTask(task.withAbandoned(DEPENDENCY_ABANDONED,
                    "A dependency of " + task.taskId() + " was abandoned", now), now);
            }
            doomed = out.doomedTasks();
        }
        for (Task task : out.promotableTasks()) {
            out = out.withTask(task.withReady(now), now);
        }
        return out;
    }

    private Task lose(Task task, String errorCode, String errorMessage, Instant now) {
        Task lost = task.withRecipientLost(errorCode, errorMessage, now);
        if (!retryPolicyFor(task).hasMoreAttempts(lost.retryCount())) {
            lost = lost.withAbandoned(errorCode, errorMessage, now);
        }
        return lost;
    }

    private RetryPolicy retryPolicyFor(Task task) {
        return task.maxAttempts() != null
            ? settings.retryPolicy().withMaxAttempts(task.maxAttempts())
            : settings.retryPolicy();
    }

    private static boolean isCurrentDispatch(Task task, String dispatchId) {
        return task.state() == TaskState.DISPATCHED && dispatchId != null && dispatchId.equals(task.dispatchId());
    }

    private static WorkflowEventType taskEventType(TaskState state) {
        return switch (state) {
            case READY -> WorkflowEventType.TASK_READY;
            case NEGOTIATING -> WorkflowEventType.TASK_NEGOTIATING;
            case DISPATCHED -> WorkflowEventType.TASK_DISPATCHED;
            case SUCCEEDED -> WorkflowEventType.TASK_SUCCEEDED;
            case FAILED -> WorkflowEventType.TASK_FAILED;
            case ABANDONED -> WorkflowEventType.TASK_ABANDONED;
            case PENDING -> null;
        };
    }

    private static WorkflowEventType workflowEventType(WorkflowState state) {
        return switch (state) {
            case COMPLETED -> WorkflowEventType.WORKFLOW_COMPLETED;
            case PARTIALLY_FAILED -> WorkflowEventType.WORKFLOW_PARTIALLY_FAILED;
            case FAILED -> WorkflowEventType.WORKFLOW_FAILED;
            case CANCELLED -> WorkflowEventType.WORKFLOW_CANCELLED;
            case RUNNING -> WorkflowEventType.WORKFLOW_SUBMITTED;
        };
    }

    private Instant now() {
        return clock.instant();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
