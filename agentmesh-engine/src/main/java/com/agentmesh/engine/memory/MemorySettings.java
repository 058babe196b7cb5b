package com.agentmesh.engine.memory;

import java.time.Duration;

/**
 * Retention policy applied by {@link MemoryManager#compact()}.
 *
 * @param retainVersions        versions kept per live key (the latest always survives)
 * @param tombstoneGracePeriod  how long a deleted key's history stays listable
 */
public record MemorySettings(int retainVersions, Duration tombstoneGracePeriod) {

    public MemorySettings {
        if (retainVersions < 1) {
            throw new IllegalArgumentException("retainVersions must be >= 1");
        }
    }

    public static MemorySettings defaults() {
        return new MemorySettings(50, Duration.ofHours(1));
    }
}
