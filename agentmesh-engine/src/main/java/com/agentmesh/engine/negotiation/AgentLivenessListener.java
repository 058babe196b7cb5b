package com.agentmesh.engine.negotiation;

import com.agentmesh.core.model.TaskRef;

/**
 * Notified when an agent stops being usable while it may hold an assignment.
 */
@FunctionalInterface
public interface AgentLivenessListener {

    /**
     * @param agentId    the agent that went away
     * @param assignment the task it was working on, or null if it was idle
     * @param reason     UNREACHABLE or DEREGISTERED
     */
    void onAgentLost(String agentId, TaskRef assignment, String reason);
}
