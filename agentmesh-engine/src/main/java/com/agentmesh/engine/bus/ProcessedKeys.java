package com.agentmesh.engine.bus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded record of idempotency keys a recipient has already processed.
 * The oldest keys are evicted first once capacity is reached.
 */
public class ProcessedKeys {

    private final Map<String, Boolean> keys;

    public ProcessedKeys(int capacity) {
        this.keys = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * Record a key.
     *
     * @return true if the key was new and the message should be processed
     */
    public synchronized boolean markProcessed(String idempotencyKey) {
        return keys.putIfAbsent(idempotencyKey, Boolean.TRUE) == null;
    }

    public synchronized boolean contains(String idempotencyKey) {
        return keys.containsKey(idempotencyKey);
    }

    /**
     * Forget a key so a later redelivery is processed again.
     */
    public synchronized void forget(String idempotencyKey) {
        keys.remove(idempotencyKey);
    }

    public synchronized int size() {
        return keys.size();
    }
}
