package com.agentmesh.engine.coordinator;

import com.agentmesh.core.exception.InvalidStateTransitionException;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.model.TaskGraph;
import com.agentmesh.core.model.Workflow;
import com.agentmesh.core.model.WorkflowSpec;
import com.agentmesh.core.model.WorkflowState;
import com.agentmesh.engine.event.WorkflowEvent;
import com.agentmesh.engine.event.WorkflowEventPublisher;
import com.agentmesh.engine.event.WorkflowEventType;
import com.agentmesh.engine.logging.LoggingContext;
import com.agentmesh.engine.negotiation.AssignmentLedger;
import com.agentmesh.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Workflow-level entry point of the orchestrator.
 * Validates and records submissions, answers status queries, and cancels.
 *
 * This is the central control plane component; task progression is delegated to
 * {@link TaskCoordinator}.
 */
public class WorkflowCoordinator implements WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    private final WorkflowCheckpoints checkpoints;
    private final TaskCoordinator taskCoordinator;
    private final AssignmentLedger ledger;
    private final WorkflowEventPublisher events;
    private final Clock clock;

    private final AtomicBoolean accepting = new AtomicBoolean(true);

    public WorkflowCoordinator(
            WorkflowCheckpoints checkpoints,
            TaskCoordinator taskCoordinator,
            AssignmentLedger ledger,
            WorkflowEventPublisher events,
            Clock clock) {
        this.checkpoints = checkpoints;
        this.taskCoordinator = taskCoordinator;
        this.ledger = ledger;
        this.events = events;
        this.clock = clock;
    }

    @Override
    public UUID submit(WorkflowSpec spec) {
        if (!accepting.get()) {
            throw new IllegalStateException("Orchestrator is shutting down; not accepting workflows");
        }

        // Rejects invalid graphs before anything is written
        TaskGraph graph = TaskGraph.of(spec);

        UUID workflowId = UUID.randomUUID();
        try (LoggingContext ctx = LoggingContext.forWorkflow(workflowId)) {
            log.info("Submitting workflow '{}' with {} tasks", spec.name(), graph.size());

            Instant now = clock.instant();
            Workflow workflow = Workflow.create(workflowId, spec.name(), spec.labels(), spec.context(),
                graph.topologicalOrder(), now);
            checkpoints.create(workflow, spec);
            events.publish(WorkflowEvent.workflow(WorkflowEventType.WORKFLOW_SUBMITTED, workflowId, now));

            taskCoordinator.advance(workflowId);
            log.info("Started workflow {} ({} root tasks)", workflowId, graph.roots().size());
        }
        return workflowId;
    }

    @Override
    public WorkflowStatus status(UUID workflowId) {
        return toStatus(checkpoints.get(workflowId));
    }

    @Override
    public void cancel(UUID workflowId) {
        try (LoggingContext ctx = LoggingContext.forWorkflow(workflowId)) {
            if (taskCoordinator.cancel(workflowId)) {
                log.info("Cancelled workflow {}", workflowId);
            }
        }
    }

    @Override
    public Map<String, TaskOutcome> results(UUID workflowId) {
        Workflow workflow = checkpoints.get(workflowId);
        Map<String, TaskOutcome> results = new LinkedHashMap<>();
        for (Task task : workflow.tasks().values()) {
            results.put(task.taskId(), new TaskOutcome(
                task.taskId(), task.state(), task.result(), task.errorCode(), task.errorMessage()));
        }
        return results;
    }

    @Override
    public List<WorkflowStatus> list(WorkflowState state) {
        return checkpoints.all().stream()
            .filter(w -> !w.archived())
            .filter(w -> state == null || w.state() == state)
            .sorted(Comparator.comparing(Workflow::createdAt))
            .map(this::toStatus)
            .collect(Collectors.toList());
    }

    @Override
    public void archive(UUID workflowId) {
        WorkflowCheckpoints.Update update = checkpoints.update(workflowId, w -> {
            if (!w.isTerminal()) {
                throw new InvalidStateTransitionException("Workflow", workflowId.toString(),
                    w.state(), WorkflowState.COMPLETED);
            }
            return w.archived() ? w : w.withArchived();
        });
        if (update.changed()) {
            log.info("Archived workflow {} ({})", workflowId, update.after().state());
        }
    }

    /**
     * Reject further submissions. Running workflows continue.
     */
    public void stopAccepting() {
        if (accepting.compareAndSet(true, false)) {
            log.info("Workflow intake stopped");
        }
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    // ========== Internal Methods ==========

    private WorkflowStatus toStatus(Workflow workflow) {
        List<TaskStatus> tasks = workflow.tasks().values().stream()
            .map(t -> new TaskStatus(t.taskId(), t.requiredCapability(), t.state(), t.retryCount(),
                t.assignedAgentId(), t.errorCode(), t.errorMessage(), t.updatedAt()))
            .collect(Collectors.toList());
        return new WorkflowStatus(
            workflow.workflowId(),
            workflow.name(),
            workflow.state(),
            workflow.labels(),
            workflow.progress(),
            tasks,
            ledger.team(workflow.workflowId()),
            workflow.archived(),
            workflow.createdAt(),
            workflow.completedAt(),
            workflow.context()
        );
    }
}
