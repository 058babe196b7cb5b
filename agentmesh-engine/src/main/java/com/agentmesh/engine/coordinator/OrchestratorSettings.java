package com.agentmesh.engine.coordinator;

import com.agentmesh.core.model.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Orchestrator tuning.
 *
 * @param retryPolicy        attempts and backoff for failed tasks; a task's own maxAttempts wins
 * @param negotiationPolicy  backoff after NoQualifiedAgent; its maxAttempts is the abandon ceiling
 * @param dispatchTimeout    deadline for a dispatch when the task sets no timeout
 * @param workerThreads      negotiation and dispatch pool size
 * @param checkpointRetries  re-read and re-apply rounds on a checkpoint version conflict
 */
public record OrchestratorSettings(
    RetryPolicy retryPolicy,
    RetryPolicy negotiationPolicy,
    Duration dispatchTimeout,
    int workerThreads,
    int checkpointRetries
) {
    public OrchestratorSettings {
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(negotiationPolicy, "negotiationPolicy");
        if (dispatchTimeout == null || dispatchTimeout.isNegative() || dispatchTimeout.isZero()) {
            throw new IllegalArgumentException("dispatchTimeout must be positive");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1");
        }
        if (checkpointRetries < 1) {
            throw new IllegalArgumentException("checkpointRetries must be >= 1");
        }
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(
            RetryPolicy.defaultPolicy(),
            RetryPolicy.builder().maxAttempts(5).build(),
            Duration.ofSeconds(60),
            8,
            5
        );
    }

    public OrchestratorSettings withRetryPolicy(RetryPolicy policy) {
        return new OrchestratorSettings(policy, negotiationPolicy, dispatchTimeout, workerThreads, checkpointRetries);
    }

    public OrchestratorSettings withNegotiationPolicy(RetryPolicy policy) {
        return new OrchestratorSettings(retryPolicy, policy, dispatchTimeout, workerThreads, checkpointRetries);
    }

    public OrchestratorSettings withDispatchTimeout(Duration timeout) {
        return new OrchestratorSettings(retryPolicy, negotiationPolicy, timeout, workerThreads, checkpointRetries);
    }
}
