package com.agentmesh.core.protocol;

/**
 * Well-known bus endpoints and topics. Agents use their agent id as endpoint.
 */
public final class Endpoints {

    public static final String ORCHESTRATOR = "orchestrator";
    public static final String NEGOTIATOR = "negotiator";
    public static final String HEARTBEAT_TOPIC = "agent-heartbeats";

    private Endpoints() {
    }
}
