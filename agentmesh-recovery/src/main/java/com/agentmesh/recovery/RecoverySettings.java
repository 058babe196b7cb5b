package com.agentmesh.recovery;

import java.time.Duration;

/**
 * Sweep periods of the {@link RecoveryEngine}.
 *
 * @param livenessInterval   how often silent agents are marked unreachable
 * @param deadlineInterval   how often dispatch deadlines are checked
 * @param stallInterval      how often stalled workflows are looked for
 * @param stallThreshold     quiet time after which a workflow with nothing in flight is re-evaluated
 * @param compactionInterval how often old memory versions are compacted
 */
public record RecoverySettings(
    Duration livenessInterval,
    Duration deadlineInterval,
    Duration stallInterval,
    Duration stallThreshold,
    Duration compactionInterval
) {
    public RecoverySettings {
        requirePositive(livenessInterval, "livenessInterval");
        requirePositive(deadlineInterval, "deadlineInterval");
        requirePositive(stallInterval, "stallInterval");
        requirePositive(stallThreshold, "stallThreshold");
        requirePositive(compactionInterval, "compactionInterval");
    }

    public static RecoverySettings defaults() {
        return new RecoverySettings(
            Duration.ofSeconds(5),
            Duration.ofSeconds(5),
            Duration.ofMinutes(1),
            Duration.ofMinutes(5),
            Duration.ofMinutes(10)
        );
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
