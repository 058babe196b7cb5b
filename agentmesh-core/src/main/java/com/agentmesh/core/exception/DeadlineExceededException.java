package com.agentmesh.core.exception;

import java.time.Instant;
import java.util.UUID;

/**
 * Raised when a dispatched task passes its deadline without a result.
 */
public class DeadlineExceededException extends AgentMeshException {

    public static final String ERROR_CODE = "DEADLINE_EXCEEDED";

    public DeadlineExceededException(UUID workflowId, String taskId, Instant deadline) {
        super(ERROR_CODE, String.format(
            "Task %s of workflow %s exceeded its deadline %s",
            taskId, workflowId, deadline
        ));
    }
}
