package com.agentmesh.engine.negotiation;

import java.time.Duration;

/**
 * @param bidTimeout     how long a bid round waits for replies (wall-clock)
 * @param livenessWindow heartbeat silence after which an agent is UNREACHABLE
 * @param historyLimit   assignment records kept per agent
 */
public record NegotiationSettings(
    Duration bidTimeout,
    Duration livenessWindow,
    int historyLimit
) {
    public static NegotiationSettings defaults() {
        return new NegotiationSettings(Duration.ofSeconds(2), Duration.ofSeconds(30), 100);
    }

    public NegotiationSettings withBidTimeout(Duration timeout) {
        return new NegotiationSettings(timeout, livenessWindow, historyLimit);
    }
}
