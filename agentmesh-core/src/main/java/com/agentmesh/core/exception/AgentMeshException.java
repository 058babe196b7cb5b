package com.agentmesh.core.exception;

/**
 * Base exception for all AgentMesh errors.
 */
public class AgentMeshException extends RuntimeException {

    private final String errorCode;

    public AgentMeshException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AgentMeshException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
