package com.agentmesh.core.model;

/**
 * Message types carried by the communication bus.
 */
public enum MessageType {
    DISPATCH,
    ACCEPT,
    REJECT,
    RESULT,
    FAILURE,
    HEARTBEAT,
    BID_REQUEST,
    BID;

    /**
     * Broadcast types fan out to every matching subscription and are not redelivered.
     */
    public boolean isBroadcast() {
        return this == HEARTBEAT;
    }
}
