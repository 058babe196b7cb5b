package com.agentmesh.agent;

import com.agentmesh.core.model.Capability;
import com.agentmesh.core.protocol.Bid;
import com.agentmesh.core.protocol.BidRequest;

/**
 * Prices a task when the negotiator asks for a bid.
 */
@FunctionalInterface
public interface BidEstimator {

    /**
     * @param capability the manifest entry the request is for
     * @param stats      this agent's track record so far
     * @return a bid, or null to decline
     */
    Bid estimate(String agentId, BidRequest request, Capability capability, AgentStats stats);

    /**
     * Bid the manifest cost; quality is the manifest estimate scaled by reliability.
     */
    static BidEstimator manifest() {
        return (agentId, request, capability, stats) -> new Bid(
            request.roundId(),
            agentId,
            request.capability(),
            capability.costEstimate(),
            capability.qualityEstimate() * stats.reliability(),
            false
        );
    }
}
