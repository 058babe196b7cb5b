package com.agentmesh.engine.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Something that happened to a workflow or one of its tasks.
 *
 * @param taskId  null for workflow-level events
 * @param agentId agent involved, if any
 * @param detail  free-form detail such as an error code
 */
public record WorkflowEvent(
    WorkflowEventType type,
    UUID workflowId,
    String taskId,
    String agentId,
    String detail,
    Instant occurredAt
) {
    public static WorkflowEvent workflow(WorkflowEventType type, UUID workflowId, Instant at) {
        return new WorkflowEvent(type, workflowId, null, null, null, at);
    }

    public static WorkflowEvent task(WorkflowEventType type, UUID workflowId, String taskId,
                                     String agentId, String detail, Instant at) {
        return new WorkflowEvent(type, workflowId, taskId, agentId, detail, at);
    }
}
