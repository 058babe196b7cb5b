package com.agentmesh.engine.negotiation;

/**
 * How an assignment ended, as recorded in the assignment ledger.
 */
public enum AssignmentOutcome {
    IN_PROGRESS,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    LOST,
    CANCELLED
}
