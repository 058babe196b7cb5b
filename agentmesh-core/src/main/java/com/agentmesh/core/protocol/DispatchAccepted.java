package com.agentmesh.core.protocol;

import java.util.UUID;

/**
 * ACCEPT / REJECT payload: the agent took (or refused) a dispatch.
 */
public record DispatchAccepted(
    UUID workflowId,
    String taskId,
    String dispatchId,
    String agentId,
    String reason
) {
}
