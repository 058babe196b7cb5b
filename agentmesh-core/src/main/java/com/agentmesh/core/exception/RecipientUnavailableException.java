package com.agentmesh.core.exception;

/**
 * Thrown by the communication bus when a message cannot be handed to its recipient
 * because the endpoint has no subscription or has gone silent.
 */
public class RecipientUnavailableException extends AgentMeshException {

    public static final String ERROR_CODE = "RECIPIENT_UNAVAILABLE";

    private final String recipient;

    public RecipientUnavailableException(String recipient, String reason) {
        super(ERROR_CODE, String.format("Recipient %s unavailable: %s", recipient, reason));
        this.recipient = recipient;
    }

    public String getRecipient() {
        return recipient;
    }
}
