package com.agentmesh.engine.negotiation;

import com.agentmesh.core.exception.NotFoundException;
import com.agentmesh.core.model.AgentAvailability;
import com.agentmesh.core.model.AgentDescriptor;
import com.agentmesh.core.model.Capability;
import com.agentmesh.core.model.TaskRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Single owner of agent availability.
 *
 * Every mutation is one atomic step on the agent's entry, so an agent can never be claimed
 * twice: claim only moves IDLE to BUSY, release only moves BUSY to IDLE for the matching task.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    public static final String REASON_UNREACHABLE = "UNREACHABLE";
    public static final String REASON_DEREGISTERED = "DEREGISTERED";

    private final NegotiationSettings settings;
    private final Clock clock;
    private final Map<String, AgentDescriptor> agents = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> capabilityIndex = new ConcurrentHashMap<>();
    private final List<AgentLivenessListener> listeners = new CopyOnWriteArrayList<>();

    public AgentRegistry(NegotiationSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public void addListener(AgentLivenessListener listener) {
        listeners.add(listener);
    }

    /**
     * Register an agent, or refresh the manifest of a known one. A re-registering agent keeps
     * its current assignment if it is BUSY.
     */
    public AgentDescriptor register(String agentId, Collection<Capability> manifest) {
        Objects.requireNonNull(agentId, "agentId");
        if (manifest == null || manifest.isEmpty()) {
            throw new IllegalArgumentException("Agent " + agentId + " must declare at least one capability");
        }
        Instant now = clock.instant();
        AgentDescriptor fresh = AgentDescriptor.create(agentId, manifest, now);

        AgentDescriptor registered = agents.compute(agentId, (id, existing) -> {
            if (existing != null && existing.availability() == AgentAvailability.BUSY) {
                return fresh.withClaimed(existing.currentAssignment());
            }
            return fresh;
        });
        reindex(agentId, registered.capabilities().keySet());

        log.info("Registered agent {} with capabilities {}", agentId, registered.capabilities().keySet());
        return registered;
    }

    /**
     * Remove an agent. A BUSY agent's task is reported lost.
     *
     * @return true if the agent was registered
     */
    public boolean deregister(String agentId) {
        AgentDescriptor removed = agents.remove(agentId);
        if (removed == null) {
            return false;
        }
        capabilityIndex.values().forEach(ids -> ids.remove(agentId));
        log.info("Deregistered agent {}", agentId);
        if (removed.currentAssignment() != null) {
            notifyLost(agentId, removed.currentAssignment(), REASON_DEREGISTERED);
        }
        return true;
    }

    /**
     * Record a heartbeat. An UNREACHABLE agent comes back as IDLE.
     *
     * @return false if the agent is unknown
     */
    public boolean heartbeat(String agentId) {
        Instant now = clock.instant();
        AgentDescriptor[] before = new AgentDescriptor[1];
        AgentDescriptor updated = agents.computeIfPresent(agentId, (id, existing) -> {
            before[0] = existing;
            return existing.withHeartbeat(now);
        });
        if (updated == null) {
            log.debug("Heartbeat from unknown agent {}", agentId);
            return false;
        }
        if (before[0].availability() == AgentAvailability.UNREACHABLE) {
            log.info("Agent {} is reachable again", agentId);
        }
        return true;
    }

    /**
     * Atomically move an IDLE agent to BUSY for the given task.
     */
    public boolean claim(String agentId, TaskRef task) {
        boolean[] claimed = new boolean[1];
        agents.computeIfPresent(agentId, (id, existing) -> {
            if (existing.availability() != AgentAvailability.IDLE) {
                return existing;
            }
            claimed[0] = true;
            return existing.withClaimed(task);
        });
        if (claimed[0]) {
            log.debug("Agent {} claimed for {}", agentId, task);
        }
        return claimed[0];
    }

    /**
     * Return a BUSY agent to IDLE. Only the task it was claimed for can release it.
     */
    public boolean release(String agentId, TaskRef task) {
        boolean[] released = new boolean[1];
        agents.computeIfPresent(agentId, (id, existing) -> {
            if (existing.availability() != AgentAvailability.BUSY
                    || !Objects.equals(existing.currentAssignment(), task)) {
                return existing;
            }
            released[0] = true;
            return existing.withReleased();
        });
        if (released[0]) {
            log.debug("Agent {} released from {}", agentId, task);
        }
        return released[0];
    }

    /**
     * Mark an agent UNREACHABLE, reporting any task it held.
     *
     * @return true if the agent changed state
     */
    public boolean markUnreachable(String agentId) {
        AgentDescriptor[] before = new AgentDescriptor[1];
        agents.computeIfPresent(agentId, (id, existing) -> {
            if (existing.availability() == AgentAvailability.UNREACHABLE) {
                return existing;
            }
            before[0] = existing;
            return existing.withUnreachable();
        });
        if (before[0] == null) {
            return false;
        }
        log.warn("Agent {} marked unreachable (last heartbeat {})", agentId, before[0].lastHeartbeatAt());
        notifyLost(agentId, before[0].currentAssignment(), REASON_UNREACHABLE);
        return true;
    }

    /**
     * Move every agent whose last heartbeat is older than the liveness window to UNREACHABLE.
     *
     * @return ids of the agents that changed state
     */
    public List<String> sweepLiveness() {
        Instant cutoff = clock.instant().minus(settings.livenessWindow());
        List<String> lost = new ArrayList<>();
        for (AgentDescriptor agent : agents.values()) {
            if (agent.availability() != AgentAvailability.UNREACHABLE
                    && agent.lastHeartbeatAt().isBefore(cutoff)
                    && markUnreachable(agent.agentId())) {
                lost.add(agent.agentId());
            }
        }
        return lost;
    }

    /**
     * IDLE agents declaring the capability, ordered by agent id.
     */
    public List<AgentDescriptor> candidates(String capability) {
        return capabilityIndex.getOrDefault(capability, Set.of()).stream()
            .map(agents::get)
            .filter(Objects::nonNull)
            .filter(AgentDescriptor::isIdle)
            .sorted(Comparator.comparing(AgentDescriptor::agentId))
            .collect(Collectors.toList());
    }

    /**
     * Registered, not UNREACHABLE, and heard from within the liveness window.
     */
    /**
     * Whether any live agent declares the capability, whatever its availability.
     */
    public boolean hasLiveAgent(String capability) {
        return capabilityIndex.getOrDefault(capability, Set.of()).stream().anyMatch(this::isLive);
    }

    public boolean isLive(String agentId) {
        AgentDescriptor agent = agents.get(agentId);
        if (agent == null || agent.availability() == AgentAvailability.UNREACHABLE) {
            return false;
        }
        return !agent.lastHeartbeatAt().plus(settings.livenessWindow()).isBefore(clock.instant());
    }

    public Optional<AgentDescriptor> find(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public AgentDescriptor get(String agentId) {
        return find(agentId).orElseThrow(() -> new NotFoundException("Agent", agentId));
    }

    public List<AgentDescriptor> all() {
        return agents.values().stream()
            .sorted(Comparator.comparing(AgentDescriptor::agentId))
            .collect(Collectors.toList());
    }

    public Map<AgentAvailability, Long> countsByAvailability() {
        Map<AgentAvailability, Long> counts = new EnumMap<>(AgentAvailability.class);
        for (AgentAvailability availability : AgentAvailability.values()) {
            counts.put(availability, 0L);
        }
        agents.values().forEach(a -> counts.merge(a.availability(), 1L, Long::sum));
        return counts;
    }

    // ========== Internal Methods ==========

    private void reindex(String agentId, Set<String> capabilities) {
        capabilityIndex.forEach((capability, ids) -> {
            if (!capabilities.contains(capability)) {
                ids.remove(agentId);
            }
        });
        for (String capability : capabilities) {
            capabilityIndex.computeIfAbsent(capability, k -> ConcurrentHashMap.newKeySet()).add(agentId);
        }
    }

    private void notifyLost(String agentId, TaskRef assignment, String reason) {
        for (AgentLivenessListener listener : listeners) {
            try {
                listener.onAgentLost(agentId, assignment, reason);
            } catch (RuntimeException e) {
                log.error("Liveness listener failed for agent {}", agentId, e);
            }
        }
    }
}
