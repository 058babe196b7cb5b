package com.agentmesh.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * RESULT payload.
 */
public record TaskResult(
    UUID workflowId,
    String taskId,
    String dispatchId,
    String agentId,
    JsonNode result
) {
}
