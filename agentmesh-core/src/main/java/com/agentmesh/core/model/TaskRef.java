package com.agentmesh.core.model;

import java.util.UUID;

/**
 * Reference to one task of one workflow.
 */
public record TaskRef(UUID workflowId, String taskId) {

    @Override
    public String toString() {
        return workflowId + "/" + taskId;
    }
}
