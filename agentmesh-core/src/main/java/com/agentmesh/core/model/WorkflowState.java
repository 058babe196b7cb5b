package com.agentmesh.core.model;

import java.util.Collection;

/**
 * Overall workflow state. Derived from task states, except CANCELLED which is set explicitly.
 */
public enum WorkflowState {
    /**
     * At least one task has not settled.
     */
    RUNNING,

    /**
     * Every task succeeded. Terminal state.
     */
    COMPLETED,

    /**
     * Some tasks succeeded, the rest were abandoned. Terminal state.
     */
    PARTIALLY_FAILED,

    /**
     * No task succeeded. Terminal state.
     */
    FAILED,

    /**
     * Cancelled by the caller. Terminal state.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /**
     * Derive the workflow state from its task states.
     *
     * @param taskStates states of every task in the workflow
     * @param cancelled  whether the caller cancelled the workflow
     */
    public static WorkflowState derive(Collection<TaskState> taskStates, boolean cancelled) {
        if (cancelled) {
            return CANCELLED;
        }
        boolean anySucceeded = false;
        boolean anyAbandoned = false;
        for (TaskState state : taskStates) {
            if (!state.isTerminal()) {
                return RUNNING;
            }
            if (state == TaskState.SUCCEEDED) {
                anySucceeded = true;
            } else {
                anyAbandoned = true;
            }
        }
        if (!anyAbandoned) {
            return COMPLETED;
        }
        return anySucceeded ? PARTIALLY_FAILED : FAILED;
    }
}
