package com.agentmesh.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Envelope for everything that crosses the communication bus.
 * sequenceNumber, deliveryAttempt and createdAt are stamped by the bus when it accepts the
 * message; senders leave them unset.
 * For broadcast types, recipient holds the topic.
 */
public record Message(
    String messageId,
    String sender,
    String recipient,
    MessageType type,
    JsonNode payload,
    String idempotencyKey,
    String correlationId,
    long sequenceNumber,
    int deliveryAttempt,
    Instant createdAt
) {
    public Message {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Create an unsent message. The idempotency key defaults to the message id.
     */
    public static Message create(String sender, String recipient, MessageType type, JsonNode payload,
                                 String idempotencyKey, String correlationId) {
        String messageId = UUID.randomUUID().toString();
        return new Message(
            messageId,
            sender,
            recipient,
            type,
            payload,
            idempotencyKey != null ? idempotencyKey : messageId,
            correlationId,
            0L,
            0,
            null
        );
    }

    public static Message create(String sender, String recipient, MessageType type, JsonNode payload) {
        return create(sender, recipient, type, payload, null, null);
    }

    public Message withSequence(long sequenceNumber, Instant acceptedAt) {
        return new Message(messageId, sender, recipient, type, payload, idempotencyKey, correlationId,
            sequenceNumber, deliveryAttempt, acceptedAt);
    }

    public Message withDeliveryAttempt(int attempt) {
        return new Message(messageId, sender, recipient, type, payload, idempotencyKey, correlationId,
            sequenceNumber, attempt, createdAt);
    }
}
