package com.agentmesh.engine.bus;

/**
 * Point-in-time delivery counters.
 */
public record BusStats(
    long sent,
    long delivered,
    long redelivered,
    long deadLettered,
    int inFlight,
    int queued,
    int subscriptions
) {
}
