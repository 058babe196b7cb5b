package com.agentmesh.core.exception;

/**
 * Thrown by role negotiation when no idle agent declares the required capability,
 * or every candidate declined.
 *
 * <p>{@link #isAgentsBusy()} distinguishes a temporary shortage, where live agents declare the
 * capability but are all working, from the capability being unstaffed.</p>
 */
public class NoQualifiedAgentException extends AgentMeshException {

    public static final String ERROR_CODE = "NO_QUALIFIED_AGENT";

    private final String capability;
    private final boolean agentsBusy;

    public NoQualifiedAgentException(String capability) {
        super(ERROR_CODE, "No qualified agent available for capability: " + capability);
        this.capability = capability;
        this.agentsBusy = false;
    }

    public NoQualifiedAgentException(String capability, String reason) {
        this(capability, reason, false);
    }

    public NoQualifiedAgentException(String capability, String reason, boolean agentsBusy) {
        super(ERROR_CODE, String.format("No qualified agent available for capability %s: %s", capability, reason));
        this.capability = capability;
        this.agentsBusy = agentsBusy;
    }

    /**
     * Live agents declare the capability but none of them is IDLE.
     */
    public static NoQualifiedAgentException busy(String capability, String reason) {
        return new NoQualifiedAgentException(capability, reason, true);
    }

    public String getCapability() {
        return capability;
    }

    public boolean isAgentsBusy() {
        return agentsBusy;
    }
}
