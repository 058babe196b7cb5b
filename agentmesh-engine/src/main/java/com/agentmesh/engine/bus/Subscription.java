package com.agentmesh.engine.bus;

/**
 * Handle returned by {@link CommunicationBus#subscribe}.
 */
public interface Subscription extends AutoCloseable {

    String endpoint();

    boolean isActive();

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
