package com.agentmesh.engine.history;

import com.agentmesh.core.exception.NotFoundException;
import com.agentmesh.core.model.Task;
import com.agentmesh.core.model.TaskState;
import com.agentmesh.core.model.Workflow;
import com.agentmesh.core.model.WorkflowState;
import com.agentmesh.engine.coordinator.WorkflowCheckpoints;
import com.agentmesh.engine.coordinator.WorkflowCheckpoints.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for workflow execution history.
 *
 * Provides:
 * - Per-task transition timeline, rebuilt from retained checkpoint versions
 * - Workflow state as of a point in time
 * - Execution statistics
 *
 * History reaches back as far as Memory Manager compaction has kept checkpoint versions.
 */
public class WorkflowHistoryService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowHistoryService.class);

    private final WorkflowCheckpoints checkpoints;

    public WorkflowHistoryService(WorkflowCheckpoints checkpoints) {
        this.checkpoints = checkpoints;
    }

    /**
     * Get the execution history of a workflow.
     */
    public WorkflowHistory history(UUID workflowId) {
        List<Snapshot> snapshots = checkpoints.versions(workflowId);
        if (snapshots.isEmpty()) {
            throw new NotFoundException("Workflow", workflowId.toString());
        }

        List<TimelineEntry> timeline = buildTimeline(snapshots);
        Workflow latest = snapshots.get(snapshots.size() - 1).workflow();
        log.debug("Rebuilt {} transitions for workflow {} from {} checkpoint versions",
            timeline.size(), workflowId, snapshots.size());

        return new WorkflowHistory(
            workflowId,
            latest.name(),
            latest.state(),
            snapshots.get(0).version(),
            snapshots.size(),
            timeline,
            buildTaskHistory(latest, timeline),
            calculateStatistics(latest, timeline)
        );
    }

    /**
     * The workflow as recorded at the given time, or empty if it did not exist yet
     * (or the versions covering that time were compacted away).
     */
    public Optional<Workflow> stateAt(UUID workflowId, Instant at) {
        Workflow found = null;
        for (Snapshot snapshot : checkpoints.versions(workflowId)) {
            if (snapshot.writtenAt().isAfter(at)) {
                break;
            }
            found = snapshot.workflow();
        }
        return Optional.ofNullable(found);
    }

    // ========== Internal Methods ==========

    private List<TimelineEntry> buildTimeline(List<Snapshot> snapshots) {
        List<TimelineEntry> timeline = new ArrayList<>();
        Workflow previous = null;
        for (Snapshot snapshot : snapshots) {
            Workflow current = snapshot.workflow();
            for (Task task : current.tasks().values()) {
                Task prior = previous != null ? previous.tasks().get(task.taskId()) : null;
                TaskState from = prior != null ? prior.state() : null;
                if (from == task.state()) {
                    continue;
                }
                String agentId = task.assignedAgentId() != null || prior == null
                    ? task.assignedAgentId()
                    : prior.assignedAgentId();
                timeline.add(new TimelineEntry(
                    snapshot.version(),
                    task.updatedAt(),
                    task.taskId(),
                    from,
                    task.state(),
                    task.attempt(),
                    agentId,
                    task.errorCode()
                ));
            }
            previous = current;
        }
        return timeline;
    }

    private Map<String, TaskHistory> buildTaskHistory(Workflow latest, List<TimelineEntry> timeline) {
        Map<String, TaskHistory> histories = new LinkedHashMap<>();
        for (Task task : latest.tasks().values()) {
            List<TimelineEntry> entries = timeline.stream()
                .filter(e -> e.taskId().equals(task.taskId()))
                .toList();
            histories.put(task.taskId(), new TaskHistory(
                task.taskId(),
                task.state(),
                task.dispatchCount(),
                task.retryCount(),
                entries,
                calculateTaskDuration(entries)
            ));
        }
        return histories;
    }

    private Duration calculateTaskDuration(List<TimelineEntry> entries) {
        Instant firstDispatch = null;
        Instant settled = null;
        for (TimelineEntry entry : entries) {
            if (entry.to() == TaskState.DISPATCHED && firstDispatch == null) {
                firstDispatch = entry.at();
            }
            if (entry.to().isTerminal()) {
                settled = entry.at();
            }
        }
        if (firstDispatch == null || settled == null) {
            return null;
        }
        return Duration.between(firstDispatch, settled);
    }

    private ExecutionStatistics calculateStatistics(Workflow latest, List<TimelineEntry> timeline) {
        int dispatches = 0;
        int failures = 0;
        for (TimelineEntry entry : timeline) {
            if (entry.to() == TaskState.DISPATCHED) {
                dispatches++;
            }
            if (entry.to() == TaskState.FAILED) {
                failures++;
            }
        }
        Duration totalDuration = latest.completedAt() != null
            ? Duration.between(latest.createdAt(), latest.completedAt())
            : null;
        return new ExecutionStatistics(
            latest.tasks().size(),
            latest.tasksInState(TaskState.SUCCEEDED).size(),
            latest.tasksInState(TaskState.ABANDONED).size(),
            dispatches,
            failures,
            totalDuration
        );
    }

    // ========== DTOs ==========

    public record WorkflowHistory(
        UUID workflowId,
        String name,
        WorkflowState currentState,
        long oldestRetainedVersion,
        int versionsRetained,
        List<TimelineEntry> timeline,
        Map<String, TaskHistory> taskHistory,
        ExecutionStatistics statistics
    ) {}

    /**
     * One task transition.
     *
     * @param from null for the task's first recorded state
     */
    public record TimelineEntry(
        long checkpointVersion,
        Instant at,
        String taskId,
        TaskState from,
        TaskState to,
        int attempt,
        String agentId,
        String errorCode
    ) {}

    public record TaskHistory(
        String taskId,
        TaskState currentState,
        int dispatches,
        int retries,
        List<TimelineEntry> transitions,
        Duration duration
    ) {}

    public record ExecutionStatistics(
        int totalTasks,
        int succeededTasks,
        int abandonedTasks,
        int dispatches,
        int failedAttempts,
        Duration totalDuration
    ) {}
}
