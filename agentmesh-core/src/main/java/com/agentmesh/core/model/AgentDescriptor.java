package com.agentmesh.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry view of an agent: identity, capability manifest and availability.
 *
 * Invariants:
 * - currentAssignment set iff availability == BUSY
 * - capabilities keyed by capability name
 */
public record AgentDescriptor(
    String agentId,
    Map<String, Capability> capabilities,
    AgentAvailability availability,
    Instant registeredAt,
    Instant lastHeartbeatAt,
    TaskRef currentAssignment
) {
    public AgentDescriptor {
        Objects.requireNonNull(agentId, "agentId");
        capabilities = capabilities == null ? Map.of() : Map.copyOf(capabilities);
    }

    /**
     * Create an IDLE descriptor from a capability manifest.
     */
    public static AgentDescriptor create(String agentId, Collection<Capability> manifest, Instant now) {
        Map<String, Capability> byName = new LinkedHashMap<>();
        for (Capability capability : manifest) {
            byName.put(capability.name(), capability);
        }
        return new AgentDescriptor(agentId, byName, AgentAvailability.IDLE, now, now, null);
    }

    public boolean hasCapability(String name) {
        return capabilities.containsKey(name);
    }

    public Optional<Capability> capability(String name) {
        return Optional.ofNullable(capabilities.get(name));
    }

    @JsonIgnore
    public boolean isIdle() {
        return availability == AgentAvailability.IDLE;
    }

    public AgentDescriptor withHeartbeat(Instant at) {
        AgentAvailability next = availability == AgentAvailability.UNREACHABLE
            ? AgentAvailability.IDLE
            : availability;
        TaskRef assignment = next == AgentAvailability.BUSY ? currentAssignment : null;
        return new AgentDescriptor(agentId, capabilities, next, registeredAt, at, assignment);
    }

    public AgentDescriptor withClaimed(TaskRef assignment) {
        return new AgentDescriptor(agentId, capabilities, AgentAvailability.BUSY,
            registeredAt, lastHeartbeatAt, assignment);
    }

    public AgentDescriptor withReleased() {
        return new AgentDescriptor(agentId, capabilities, AgentAvailability.IDLE,
            registeredAt, lastHeartbeatAt, null);
    }

    public AgentDescriptor withUnreachable() {
        return new AgentDescriptor(agentId, capabilities, AgentAvailability.UNREACHABLE,
            registeredAt, lastHeartbeatAt, null);
    }
}
