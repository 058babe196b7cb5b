package com.agentmesh.agent;

import com.agentmesh.core.model.MemoryEntry;
import com.agentmesh.core.model.ScopeKey;
import com.agentmesh.core.protocol.Dispatch;
import com.agentmesh.engine.memory.MemoryManager;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Context provided to capability executors during execution.
 */
public class TaskContext {

    private final String agentId;
    private final Dispatch dispatch;
    private final ObjectMapper objectMapper;
    private final MemoryManager memory;
    private final Clock clock;

    public TaskContext(String agentId, Dispatch dispatch, ObjectMapper objectMapper, MemoryManager memory,
                       Clock clock) {
        this.agentId = agentId;
        this.dispatch = dispatch;
        this.objectMapper = objectMapper;
        this.memory = memory;
        this.clock = clock;
    }

    public String getAgentId() {
        return agentId;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public JsonNode getInput() {
        return dispatch.input();
    }

    /**
     * Get the task input as a specific type.
     */
    public <T> T getInput(Class<T> type) {
        return objectMapper.convertValue(dispatch.input(), type);
    }

    /**
     * Results of the tasks this one depends on, keyed by task id.
     */
    public Map<String, JsonNode> getDependencyResults() {
        return dispatch.dependencyResults();
    }

    public Optional<JsonNode> getDependencyResult(String taskId) {
        return Optional.ofNullable(dispatch.dependencyResults().get(taskId));
    }

    public UUID getWorkflowId() {
        return dispatch.workflowId();
    }

    public String getTaskId() {
        return dispatch.taskId();
    }

    public int getAttempt() {
        return dispatch.attempt();
    }

    /**
     * Stable across redeliveries of this dispatch. Use it when calling external systems.
     */
    public String getIdempotencyKey() {
        return dispatch.dispatchId();
    }

    public Instant getDeadline() {
        return dispatch.deadline();
    }

    public boolean isPastDeadline() {
        return dispatch.deadline() != null && clock.instant().isAfter(dispatch.deadline());
    }

    /**
     * Store a note in this agent's private memory scope.
     *
     * @return the version written
     */
    public long remember(String name, JsonNode value) {
        return memory.put(ScopeKey.agent(agentId, name), value);
    }

    /**
     * Latest note of this agent under the given name.
     */
    public Optional<JsonNode> recall(String name) {
        return memory.get(ScopeKey.agent(agentId, name)).map(MemoryEntry::content);
    }

    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }
}
