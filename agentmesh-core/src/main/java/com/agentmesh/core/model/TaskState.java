package com.agentmesh.core.model;

/**
 * Lifecycle states for a task inside a workflow.
 */
public enum TaskState {
    /**
     * Waiting for dependencies.
     * Transitions: -> READY, ABANDONED
     */
    PENDING,

    /**
     * All dependencies succeeded; waiting to be staffed.
     * Transitions: -> NEGOTIATING, ABANDONED
     */
    READY,

    /**
     * Role negotiation in progress.
     * Transitions: -> DISPATCHED, READY (backoff), ABANDONED
     */
    NEGOTIATING,

    /**
     * Dispatched to an agent, awaiting RESULT or FAILURE.
     * Transitions: -> SUCCEEDED, FAILED, READY (recipient lost), ABANDONED
     */
    DISPATCHED,

    /**
     * Completed with a result. Terminal state.
     */
    SUCCEEDED,

    /**
     * Last attempt failed; awaiting the retry decision.
     * Transitions: -> READY (retry), ABANDONED
     */
    FAILED,

    /**
     * Given up on, either directly or because a dependency was abandoned. Terminal state.
     */
    ABANDONED;

    /**
     * Check if this state is terminal (no further transitions).
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == ABANDONED;
    }

    /**
     * Check if an agent is (or is about to be) bound to the task.
     */
    public boolean isActive() {
        return this == NEGOTIATING || this == DISPATCHED;
    }

    public boolean canTransitionTo(TaskState target) {
        return switch (this) {
            case PENDING -> target == READY || target == ABANDONED;
            case READY -> target == NEGOTIATING || target == ABANDONED;
            case NEGOTIATING -> target == DISPATCHED || target == READY || target == ABANDONED;
            case DISPATCHED -> target == SUCCEEDED || target == FAILED || target == READY || target == ABANDONED;
            case FAILED -> target == READY || target == ABANDONED;
            case SUCCEEDED, ABANDONED -> false;
        };
    }
}
