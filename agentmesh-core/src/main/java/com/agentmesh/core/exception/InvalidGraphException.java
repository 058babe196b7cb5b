package com.agentmesh.core.exception;

/**
 * Thrown when a submitted workflow does not describe a valid task DAG.
 * Never retried.
 */
public class InvalidGraphException extends AgentMeshException {

    public static final String ERROR_CODE = "INVALID_GRAPH";

    public InvalidGraphException(String message) {
        super(ERROR_CODE, message);
    }

    public InvalidGraphException(String taskId, String reason) {
        super(ERROR_CODE, String.format("Invalid task graph at task %s: %s", taskId, reason));
    }
}
