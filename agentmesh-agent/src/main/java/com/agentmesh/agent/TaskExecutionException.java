package com.agentmesh.agent;

/**
 * Exception thrown by capability executors on failure.
 */
public class TaskExecutionException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public TaskExecutionException(String errorCode, String message) {
        this(errorCode, message, true);
    }

    public TaskExecutionException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public TaskExecutionException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * A failure that will not go away on another attempt, e.g. malformed input.
     */
    public static TaskExecutionException permanent(String errorCode, String message) {
        return new TaskExecutionException(errorCode, message, false);
    }

    /**
     * A failure worth another attempt, possibly by a different agent.
     */
    public static TaskExecutionException transientFailure(String errorCode, String message) {
        return new TaskExecutionException(errorCode, message, true);
    }
}
