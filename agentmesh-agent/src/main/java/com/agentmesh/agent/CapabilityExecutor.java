package com.agentmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Does the actual work behind one capability. Implementations may be invoked concurrently.
 */
@FunctionalInterface
public interface CapabilityExecutor {

    /**
     * Execute one dispatch.
     *
     * @param context input, deadline and agent-scoped memory for this dispatch
     * @return the task result, may be null
     * @throws TaskExecutionException if the task fails
     */
    JsonNode execute(TaskContext context) throws TaskExecutionException;
}
