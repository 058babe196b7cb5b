package com.agentmesh.core.exception;

/**
 * Thrown when a task or agent is asked to make a transition its state machine forbids.
 */
public class InvalidStateTransitionException extends AgentMeshException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(String entityType, String entityId, Enum<?> from, Enum<?> to) {
        super(ERROR_CODE, String.format(
            "Invalid state transition for %s[%s]: %s -> %s",
            entityType, entityId, from, to
        ));
    }
}
