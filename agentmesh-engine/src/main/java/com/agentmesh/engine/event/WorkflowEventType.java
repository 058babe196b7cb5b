package com.agentmesh.engine.event;

/**
 * Lifecycle events published by the orchestrator.
 */
public enum WorkflowEventType {
    WORKFLOW_SUBMITTED,
    WORKFLOW_COMPLETED,
    WORKFLOW_PARTIALLY_FAILED,
    WORKFLOW_FAILED,
    WORKFLOW_CANCELLED,

    TASK_READY,
    TASK_NEGOTIATING,
    TASK_DISPATCHED,
    TASK_SUCCEEDED,
    TASK_FAILED,
    TASK_ABANDONED,

    /** Negotiation found no agent; the task backs off. */
    NEGOTIATION_FAILED,

    /** An agent holding a dispatch went away. */
    AGENT_LOST;

    public boolean isWorkflowTerminal() {
        return this == WORKFLOW_COMPLETED || this == WORKFLOW_PARTIALLY_FAILED
            || this == WORKFLOW_FAILED || this == WORKFLOW_CANCELLED;
    }
}
