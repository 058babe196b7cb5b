package com.agentmesh.agent;

import java.time.Duration;

/**
 * @param heartbeatInterval period of HEARTBEAT broadcasts, well inside the liveness window
 * @param dedupCapacity     dispatch ids remembered for deduplication
 * @param shutdownTimeout   how long stop() waits for a running execution
 */
public record AgentSettings(
    Duration heartbeatInterval,
    int dedupCapacity,
    Duration shutdownTimeout
) {
    public AgentSettings {
        if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (dedupCapacity < 1) {
            throw new IllegalArgumentException("dedupCapacity must be >= 1");
        }
    }

    public static AgentSettings defaults() {
        return new AgentSettings(Duration.ofSeconds(10), 1_000, Duration.ofSeconds(30));
    }

    public AgentSettings withHeartbeatInterval(Duration interval) {
        return new AgentSettings(interval, dedupCapacity, shutdownTimeout);
    }
}
