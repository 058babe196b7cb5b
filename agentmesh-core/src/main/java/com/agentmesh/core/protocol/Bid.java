package com.agentmesh.core.protocol;

/**
 * BID payload: an agent's self-estimate for a task, or a decline.
 */
public record Bid(
    String roundId,
    String agentId,
    String capability,
    double costEstimate,
    double qualityEstimate,
    boolean declined
) {
    public static Bid decline(String roundId, String agentId, String capability) {
        return new Bid(roundId, agentId, capability, 0.0, 0.0, true);
    }
}
