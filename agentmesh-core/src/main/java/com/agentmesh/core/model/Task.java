package com.agentmesh.core.model;

import com.agentmesh.core.exception.InvalidStateTransitionException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A task owned by a workflow, as checkpointed by the orchestrator.
 *
 * Invariants:
 * - deadline set iff state == DISPATCHED
 * - assignedAgentId and dispatchId set iff state is DISPATCHED or SUCCEEDED; a SUCCEEDED task
 *   keeps the assignment that produced its result
 * - result set iff state == SUCCEEDED
 * - no transition out of SUCCEEDED or ABANDONED
 * - dispatchCount strictly increases, so every dispatch id is unique
 */
public record Task(
    String taskId,
    String requiredCapability,
    JsonNode input,
    List<String> dependsOn,
    Duration timeout,
    Integer maxAttempts,
    Map<String, String> outputMapping,

    TaskState state,
    int retryCount,
    int negotiationAttempts,
    int dispatchCount,

    // Current dispatch
    String assignedAgentId,
    String dispatchId,
    Instant dispatchedAt,
    Instant deadline,

    // Outcome
    JsonNode result,
    String errorCode,
    String errorMessage,

    Set<String> excludedAgents,
    Instant updatedAt
) {
    public Task {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        outputMapping = outputMapping == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputMapping));
        excludedAgents = excludedAgents == null ? Set.of() : Set.copyOf(excludedAgents);
    }

    /**
     * Create a PENDING task from its submitted spec.
     */
    public static Task fromSpec(TaskSpec spec, Instant now) {
        return new Task(
            spec.taskId(),
            spec.requiredCapability(),
            spec.input(),
            spec.dependsOn(),
            spec.timeout(),
            spec.maxAttempts(),
            spec.outputMapping(),
            TaskState.PENDING,
            0, 0, 0,
            null, null, null, null,
            null, null, null,
            Set.of(),
            now
        );
    }

    /**
     * 1-indexed number of the attempt currently being made.
     */
    @JsonIgnore
    public int attempt() {
        return retryCount + 1;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * Idempotency key of the next dispatch of this task.
     */
    public String nextDispatchId(UUID workflowId) {
        return workflowId + ":" + taskId + ":" + (dispatchCount + 1);
    }

    public Task withReady(Instant now) {
        checkTransition(TaskState.READY);
        return toBuilder()
            .state(TaskState.READY)
            .clearDispatch()
            .updatedAt(now)
            .build();
    }

    public Task withNegotiating(Instant now) {
        checkTransition(TaskState.NEGOTIATING);
        return toBuilder()
            .state(TaskState.NEGOTIATING)
            .updatedAt(now)
            .build();
    }

    /**
     * Negotiation found nobody; back to READY with one more strike.
     */
    public Task withNoQualifiedAgent(String message, Instant now) {
        checkTransition(TaskState.READY);
        return toBuilder()
            .state(TaskState.READY)
            .negotiationAttempts(negotiationAttempts + 1)
            .errorCode("NO_QUALIFIED_AGENT")
            .errorMessage(message)
            .updatedAt(now)
            .build();
    }

    public Task withDispatched(String agentId, String dispatchId, Instant deadline, Instant now) {
        checkTransition(TaskState.DISPATCHED);
        return toBuilder()
            .state(TaskState.DISPATCHED)
            .assignedAgentId(agentId)
            .dispatchId(dispatchId)
            .dispatchCount(dispatchCount + 1)
            .dispatchedAt(now)
            .deadline(deadline)
            .negotiationAttempts(0)
            .errorCode(null)
            .errorMessage(null)
            .updatedAt(now)
            .build();
    }

    public Task withSucceeded(JsonNode result, Instant now) {
        checkTransition(TaskState.SUCCEEDED);
        return toBuilder()
            .state(TaskState.SUCCEEDED)
            .result(result)
            .errorCode(null)
            .errorMessage(null)
            .deadline(null)
            .updatedAt(now)
            .build();
    }

    /**
     * Record a failed attempt. The failing agent is excluded from later negotiations of this task.
     */
    public Task withFailed(String errorCode, String errorMessage, Instant now) {
        checkTransition(TaskState.FAILED);
        Set<String> excluded = new HashSet<>(excludedAgents);
        if (assignedAgentId != null) {
            excluded.add(assignedAgentId);
        }
        return toBuilder()
            .state(TaskState.FAILED)
            .retryCount(retryCount + 1)
            .errorCode(errorCode)
            .errorMessage(errorMessage)
            .excludedAgents(excluded)
            .clearDispatch()
            .updatedAt(now)
            .build();
    }

    /**
     * The assigned agent could not be reached; re-queue for negotiation with the retry count incremented.
     */
    public Task withRecipientLost(String errorCode, String errorMessage, Instant now) {
        checkTransition(TaskState.READY);
        return toBuilder()
            .state(TaskState.READY)
            .retryCount(retryCount + 1)
            .errorCode(errorCode)
            .errorMessage(errorMessage)
            .clearDispatch()
            .updatedAt(now)
            .build();
    }

    public Task withAbandoned(String errorCode, String errorMessage, Instant now) {
        checkTransition(TaskState.ABANDONED);
        return toBuilder()
            .state(TaskState.ABANDONED)
            .errorCode(errorCode)
            .errorMessage(errorMessage)
            .clearDispatch()
            .updatedAt(now)
            .build();
    }

    private void checkTransition(TaskState target) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidStateTransitionException("Task", taskId, state, target);
        }
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private String taskId;
        private String requiredCapability;
        private JsonNode input;
        private List<String> dependsOn;
        private Duration timeout;
        private Integer maxAttempts;
        private Map<String, String> outputMapping;
        private TaskState state;
        private int retryCount;
        private int negotiationAttempts;
        private int dispatchCount;
        private String assignedAgentId;
        private String dispatchId;
        private Instant dispatchedAt;
        private Instant deadline;
        private JsonNode result;
        private String errorCode;
        private String errorMessage;
        private Set<String> excludedAgents;
        private Instant updatedAt;

        private Builder(Task task) {
            this.taskId = task.taskId;
            this.requiredCapability = task.requiredCapability;
            this.input = task.input;
            this.dependsOn = task.dependsOn;
            this.timeout = task.timeout;
            this.maxAttempts = task.maxAttempts;
            this.outputMapping = task.outputMapping;
            this.state = task.state;
            this.retryCount = task.retryCount;
            this.negotiationAttempts = task.negotiationAttempts;
            this.dispatchCount = task.dispatchCount;
            this.assignedAgentId = task.assignedAgentId;
            this.dispatchId = task.dispatchId;
            this.dispatchedAt = task.dispatchedAt;
            this.deadline = task.deadline;
            this.result = task.result;
            this.errorCode = task.errorCode;
            this.errorMessage = task.errorMessage;
            this.excludedAgents = task.excludedAgents;
            this.updatedAt = task.updatedAt;
        }

        public Builder state(TaskState state) { this.state = state; return this; }
        public Builder retryCount(int retryCount) { this.retryCount = retryCount; return this; }
        public Builder negotiationAttempts(int negotiationAttempts) { this.negotiationAttempts = negotiationAttempts; return this; }
        public Builder dispatchCount(int dispatchCount) { this.dispatchCount = dispatchCount; return this; }
        public Builder assignedAgentId(String assignedAgentId) { this.assignedAgentId = assignedAgentId; return this; }
        public Builder dispatchId(String dispatchId) { this.dispatchId = dispatchId; return this; }
        public Builder dispatchedAt(Instant dispatchedAt) { this.dispatchedAt = dispatchedAt; return this; }
        public Builder deadline(Instant deadline) { this.deadline = deadline; return this; }
        public Builder result(JsonNode result) { this.result = result; return this; }
        public Builder errorCode(String errorCode) { this.errorCode = errorCode; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }
        public Builder excludedAgents(Set<String> excludedAgents) { this.excludedAgents = excludedAgents; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }

        public Builder clearDispatch() {
            this.assignedAgentId = null;
            this.dispatchId = null;
            this.dispatchedAt = null;
            this.deadline = null;
            return this;
        }

        public Task build() {
            return new Task(
                taskId, requiredCapability, input, dependsOn, timeout, maxAttempts, outputMapping,
                state, retryCount, negotiationAttempts, dispatchCount,
                assignedAgentId, dispatchId, dispatchedAt, deadline,
                result, errorCode, errorMessage,
                excludedAgents, updatedAt
            );
        }
    }
}
