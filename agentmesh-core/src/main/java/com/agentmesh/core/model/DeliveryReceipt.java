package com.agentmesh.core.model;

import java.time.Instant;

/**
 * Handle for one delivery of a message. Acknowledging any delivery of a message settles it.
 */
public record DeliveryReceipt(
    String messageId,
    String sender,
    String recipient,
    long sequenceNumber,
    int deliveryAttempt,
    Instant issuedAt
) {
    public static DeliveryReceipt of(Message message, Instant now) {
        return new DeliveryReceipt(message.messageId(), message.sender(), message.recipient(),
            message.sequenceNumber(), message.deliveryAttempt(), now);
    }
}
