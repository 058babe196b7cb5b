package com.agentmesh.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * DISPATCH payload. dispatchId is also the message idempotency key.
 *
 * <p>input has its context references already resolved. dependencyResults holds the result
 * of every task this one depends on, keyed by task id.</p>
 */
public record Dispatch(
    UUID workflowId,
    String taskId,
    String dispatchId,
    String capability,
    JsonNode input,
    Instant deadline,
    int attempt,
    Map<String, JsonNode> dependencyResults
) {
    public Dispatch {
        Map<String, JsonNode> results = new LinkedHashMap<>();
        if (dependencyResults != null) {
            dependencyResults.forEach((depTaskId, result) ->
                results.put(depTaskId, result != null ? result : NullNode.getInstance()));
        }
        dependencyResults = Collections.unmodifiableMap(results);
    }
}
