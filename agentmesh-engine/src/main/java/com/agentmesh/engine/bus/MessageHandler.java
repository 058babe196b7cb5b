package com.agentmesh.engine.bus;

import com.agentmesh.core.model.DeliveryReceipt;
import com.agentmesh.core.model.Message;

/**
 * Receives deliveries. Handlers must call {@link CommunicationBus#ack} once the message is
 * safely processed; an exception or a missing ack leads to redelivery.
 */
@FunctionalInterface
public interface MessageHandler {

    void onMessage(Message message, DeliveryReceipt receipt);
}
