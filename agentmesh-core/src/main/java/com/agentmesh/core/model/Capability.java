package com.agentmesh.core.model;

import java.util.Objects;

/**
 * A named skill in an agent's manifest, with the agent's own cost and quality estimates.
 */
public record Capability(
    String name,
    double costEstimate,
    double qualityEstimate
) {
    public Capability {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Capability name must not be blank");
        }
        if (costEstimate < 0) {
            throw new IllegalArgumentException("costEstimate must be >= 0");
        }
    }

    public static Capability of(String name, double costEstimate) {
        return new Capability(name, costEstimate, 1.0);
    }
}
