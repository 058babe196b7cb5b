package com.agentmesh.engine.bus;

import com.agentmesh.core.model.Message;

import java.time.Instant;

/**
 * A message the bus gave up on.
 */
public record DeadLetter(
    Message message,
    Reason reason,
    int deliveries,
    Instant deadLetteredAt
) {
    public enum Reason {
        /** Redelivered the maximum number of times without an ack. */
        MAX_DELIVERIES_EXCEEDED,
        /** The recipient went away while the message was queued or in flight. */
        RECIPIENT_UNAVAILABLE
    }
}
