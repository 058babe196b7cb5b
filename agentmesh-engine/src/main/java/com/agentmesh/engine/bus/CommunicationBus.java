package com.agentmesh.engine.bus;

import com.agentmesh.core.exception.RecipientUnavailableException;
import com.agentmesh.core.model.DeliveryReceipt;
import com.agentmesh.core.model.Message;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Inter-agent messaging substrate.
 *
 * <ul>
 *   <li>Point-to-point messages are delivered at least once, to exactly one subscription of the
 *       recipient endpoint, until acknowledged or dead-lettered.</li>
 *   <li>Messages from one sender to one recipient arrive in sequence order.</li>
 *   <li>Broadcast types fan out to every matching subscription, best effort.</li>
 *   <li>Deduplication is the recipient's job; the idempotency key is stable across redeliveries.</li>
 * </ul>
 */
public interface CommunicationBus {

    /**
     * Accept a message for delivery and stamp its per-pair sequence number.
     *
     * @throws RecipientUnavailableException if the recipient has no subscription or has gone silent
     */
    DeliveryReceipt send(Message message);

    /**
     * Subscribe an endpoint. Point-to-point messages addressed to the endpoint, and broadcasts,
     * reach the handler when the filter accepts them.
     */
    Subscription subscribe(String endpoint, Predicate<Message> filter, MessageHandler handler);

    /**
     * Settle a delivery. Acknowledging an unknown or already settled message is a no-op.
     */
    void ack(DeliveryReceipt receipt);

    /**
     * Record a liveness signal for an endpoint without sending anything.
     */
    void touch(String endpoint);

    boolean isReachable(String endpoint);

    List<DeadLetter> deadLetters();

    void onDeadLetter(Consumer<DeadLetter> listener);

    BusStats stats();
}
