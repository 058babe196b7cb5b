package com.agentmesh.engine.bus;

import com.agentmesh.core.model.Message;
import com.agentmesh.core.model.MessageType;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Common subscription predicates.
 */
public final class MessageFilters {

    private MessageFilters() {
    }

    public static Predicate<Message> any() {
        return m -> true;
    }

    public static Predicate<Message> addressedTo(String endpoint) {
        return m -> endpoint.equals(m.recipient());
    }

    public static Predicate<Message> ofType(MessageType first, MessageType... rest) {
        Set<MessageType> types = EnumSet.of(first, rest);
        return m -> types.contains(m.type());
    }

    public static Predicate<Message> from(String sender) {
        return m -> sender.equals(m.sender());
    }

    /**
     * Broadcasts published on a topic.
     */
    public static Predicate<Message> topic(String topic) {
        return m -> m.type().isBroadcast() && topic.equals(m.recipient());
    }
}
