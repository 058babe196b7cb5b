package com.agentmesh.core.model;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry and backoff settings, used both for failed task attempts and for
 * negotiations that found no qualified agent.
 *
 * Invariants:
 * - maxAttempts >= 1
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor,
    Set<String> nonRetryableErrors
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1]");
        }
        nonRetryableErrors = nonRetryableErrors == null ? Set.of() : Set.copyOf(nonRetryableErrors);
    }

    /**
     * Default retry policy: 3 attempts, exponential backoff starting at 1s.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(
            3,
            Duration.ofSeconds(1),
            Duration.ofMinutes(5),
            2.0,
            0.1,
            Set.of()
        );
    }

    /**
     * No retry policy: single attempt only.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, 0.0, Set.of());
    }

    /**
     * Compute the backoff duration for a given attempt number.
     *
     * @param attemptNumber 1-indexed attempt number
     * @return Duration to wait before next attempt
     */
    public Duration computeBackoff(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }

        // initialBackoff * multiplier^(attempt - 1), capped
        double baseBackoffMs = initialBackoff.toMillis() *
            Math.pow(backoffMultiplier, attemptNumber - 1);
        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());

        double jitterRange = cappedBackoffMs * jitterFactor;
        double jitteredBackoffMs = cappedBackoffMs - jitterRange +
            ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;

        return Duration.ofMillis((long) jitteredBackoffMs);
    }

    /**
     * Check if a failure should be retried, given what the agent reported.
     *
     * @param errorCode code reported with the failure
     * @param retryable the agent's own verdict
     */
    public boolean shouldRetry(String errorCode, boolean retryable) {
        return retryable && (errorCode == null || !nonRetryableErrors.contains(errorCode));
    }

    /**
     * Check if more attempts are available.
     *
     * @param failedAttempts number of attempts that already failed
     */
    public boolean hasMoreAttempts(int failedAttempts) {
        return failedAttempts < maxAttempts;
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, initialBackoff, maxBackoff, backoffMultiplier, jitterFactor,
            nonRetryableErrors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofMinutes(5);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;
        private Set<String> nonRetryableErrors = Set.of();

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(
                maxAttempts, initialBackoff, maxBackoff,
                backoffMultiplier, jitterFactor, nonRetryableErrors
            );
        }
    }
}
