package com.agentmesh.engine.service;

import com.agentmesh.core.model.TaskState;
import com.agentmesh.core.model.WorkflowSpec;
import com.agentmesh.core.model.WorkflowState;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Submission API of the orchestrator.
 * Manages workflow lifecycle; task progression happens behind it.
 */
public interface WorkflowService {

    /**
     * Validate and start a workflow.
     *
     * @param spec The workflow spec
     * @return The id of the new workflow
     * @throws com.agentmesh.core.exception.InvalidGraphException if the task graph is invalid
     */
    UUID submit(WorkflowSpec spec);

    /**
     * Get the current status of a workflow, with per-task detail.
     *
     * @param workflowId The workflow id
     * @return The workflow status
     * @throws com.agentmesh.core.exception.NotFoundException if the workflow is unknown
     */
    WorkflowStatus status(UUID workflowId);

    /**
     * Cancel a workflow. No-op if it already reached a terminal state.
     *
     * @param workflowId The workflow id
     */
    void cancel(UUID workflowId);

    /**
     * Per-task outputs and errors, in submission order.
     *
     * @param workflowId The workflow id
     */
    Map<String, TaskOutcome> results(UUID workflowId);

    /**
     * List non-archived workflows.
     *
     * @param state Only workflows in this state, or all if null
     */
    List<WorkflowStatus> list(WorkflowState state);

    /**
     * Hide a terminal workflow from {@link #list}. Its checkpoint history is kept.
     *
     * @param workflowId The workflow id
     */
    void archive(UUID workflowId);

    /**
     * Snapshot of a workflow.
     */
    record WorkflowStatus(
        UUID workflowId,
        String name,
        WorkflowState state,
        Map<String, String> labels,
        double progress,
        List<TaskStatus> tasks,
        Set<String> team,
        boolean archived,
        Instant createdAt,
        Instant completedAt,
        JsonNode context
    ) {
        public TaskStatus task(String taskId) {
            return tasks.stream()
                .filter(t -> t.taskId().equals(taskId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No task " + taskId));
        }
    }

    /**
     * Snapshot of a task.
     */
    record TaskStatus(
        String taskId,
        String requiredCapability,
        TaskState state,
        int retryCount,
        String assignedAgentId,
        String errorCode,
        String errorMessage,
        Instant updatedAt
    ) {}

    /**
     * Settled (or not yet settled) output of a task.
     */
    record TaskOutcome(
        String taskId,
        TaskState state,
        JsonNode result,
        String errorCode,
        String errorMessage
    ) {}
}
