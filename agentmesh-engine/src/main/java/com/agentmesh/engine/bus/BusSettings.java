package com.agentmesh.engine.bus;

import java.time.Duration;

/**
 * Delivery settings for {@link InMemoryCommunicationBus}.
 *
 * @param ackTimeout         how long a delivery may stay unacknowledged before redelivery
 * @param maxDeliveries      deliveries per message before it is dead-lettered
 * @param livenessWindow     silence after which a heartbeating endpoint is unreachable
 * @param sweepInterval      period of the redelivery sweep once started
 * @param dispatcherThreads  threads running handlers
 * @param deadLetterCapacity dead letters retained for inspection
 */
public record BusSettings(
    Duration ackTimeout,
    int maxDeliveries,
    Duration livenessWindow,
    Duration sweepInterval,
    int dispatcherThreads,
    int deadLetterCapacity
) {
    public BusSettings {
        if (maxDeliveries < 1) {
            throw new IllegalArgumentException("maxDeliveries must be >= 1");
        }
        if (dispatcherThreads < 1) {
            throw new IllegalArgumentException("dispatcherThreads must be >= 1");
        }
    }

    public static BusSettings defaults() {
        return new BusSettings(
            Duration.ofSeconds(30),
            5,
            Duration.ofSeconds(30),
            Duration.ofSeconds(1),
            8,
            10_000
        );
    }

    public BusSettings withAckTimeout(Duration timeout) {
        return new BusSettings(timeout, maxDeliveries, livenessWindow, sweepInterval, dispatcherThreads,
            deadLetterCapacity);
    }

    public BusSettings withMaxDeliveries(int deliveries) {
        return new BusSettings(ackTimeout, deliveries, livenessWindow, sweepInterval, dispatcherThreads,
            deadLetterCapacity);
    }
}
