package com.agentmesh.core.exception;

/**
 * Thrown when a workflow, task or agent is not found.
 */
public class NotFoundException extends AgentMeshException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
