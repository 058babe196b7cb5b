package com.agentmesh.engine.negotiation;

import com.agentmesh.core.model.TaskRef;

import java.time.Instant;

/**
 * Outcome of a successful negotiation. The agent is BUSY for the task until released.
 *
 * @param bidsReceived number of bids considered, 0 when the only candidate was assigned directly
 */
public record Assignment(
    String agentId,
    TaskRef task,
    String capability,
    double cost,
    int candidates,
    int bidsReceived,
    Instant assignedAt
) {
    public boolean viaBidRound() {
        return candidates > 1;
    }
}
