package com.agentmesh.core.protocol;

import java.time.Instant;
import java.util.UUID;

/**
 * BID_REQUEST payload: asks one candidate to price a task before the deadline.
 */
public record BidRequest(
    String roundId,
    UUID workflowId,
    String taskId,
    String capability,
    Instant replyBy
) {
}
