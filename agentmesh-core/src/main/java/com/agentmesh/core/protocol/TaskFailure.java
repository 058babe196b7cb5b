package com.agentmesh.core.protocol;

import java.util.UUID;

/**
 * FAILURE payload.
 */
public record TaskFailure(
    UUID workflowId,
    String taskId,
    String dispatchId,
    String agentId,
    String errorCode,
    String errorMessage,
    boolean retryable
) {
}
