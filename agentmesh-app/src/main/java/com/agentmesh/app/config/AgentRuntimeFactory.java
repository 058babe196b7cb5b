package com.agentmesh.app.config;

import com.agentmesh.agent.AgentRuntime;
import com.agentmesh.engine.bus.CommunicationBus;
import com.agentmesh.engine.memory.MemoryManager;
import com.agentmesh.engine.negotiation.AgentRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds agent runtimes attached to this process's mesh.
 *
 * Declare hosted agents as beans so the shutdown handler stops them:
 * <pre>
 * &#64;Bean(initMethod = "start")
 * AgentRuntime summarizer(AgentRuntimeFactory agents) {
 *     return agents.create("summarizer-1")
 *         .registerCapability(Capability.of("summarize", 1.0), context -> summarize(context.getInput()));
 * }
 * </pre>
 */
@Component
public class AgentRuntimeFactory {

    private final AgentRegistry registry;
    private final CommunicationBus bus;
    private final MemoryManager memory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AgentMeshProperties properties;

    public AgentRuntimeFactory(AgentRegistry registry, CommunicationBus bus, MemoryManager memory,
                               ObjectMapper objectMapper, Clock clock, AgentMeshProperties properties) {
        this.registry = registry;
        this.bus = bus;
        this.memory = memory;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties;
    }

    public AgentRuntime create(String agentId) {
        return new AgentRuntime(agentId, registry, bus, memory, properties.getAgent().toSettings(), objectMapper, clock);
    }
}
