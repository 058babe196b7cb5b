package com.agentmesh.core.model;

/**
 * Availability of a registered agent.
 */
public enum AgentAvailability {
    /** Registered, live and free to be claimed. */
    IDLE,
    /** Claimed for exactly one task. */
    BUSY,
    /** Missed its heartbeat window; a heartbeat revives it as IDLE. */
    UNREACHABLE
}
