package com.agentmesh.app.config;

import com.agentmesh.core.repository.MemoryRepository;
import com.agentmesh.core.serialization.ObjectMappers;
import com.agentmesh.engine.bus.InMemoryCommunicationBus;
import com.agentmesh.engine.coordinator.TaskCoordinator;
import com.agentmesh.engine.coordinator.WorkflowCheckpoints;
import com.agentmesh.engine.coordinator.WorkflowCoordinator;
import com.agentmesh.engine.event.WorkflowEventPublisher;
import com.agentmesh.engine.history.WorkflowHistoryService;
import com.agentmesh.engine.memory.MemoryManager;
import com.agentmesh.engine.negotiation.AgentRegistry;
import com.agentmesh.engine.negotiation.AssignmentLedger;
import com.agentmesh.engine.negotiation.RoleNegotiator;
import com.agentmesh.engine.persistence.InMemoryMemoryRepository;
import com.agentmesh.engine.persistence.jdbc.JdbcMemoryRepository;
import com.agentmesh.recovery.RecoveryEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Wires the engine from {@link AgentMeshProperties}.
 *
 * Components with background threads are started here and stopped by
 * {@link com.agentmesh.app.lifecycle.GracefulShutdownHandler}, in dependency order.
 */
@Configuration
@EnableConfigurationProperties(AgentMeshProperties.class)
public class AgentMeshConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return ObjectMappers.create();
    }

    @Bean
    @ConditionalOnProperty(prefix = "agentmesh", name = "store", havingValue = "jdbc")
    public MemoryRepository jdbcMemoryRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcMemoryRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "agentmesh", name = "store", havingValue = "memory", matchIfMissing = true)
    public MemoryRepository inMemoryMemoryRepository() {
        return new InMemoryMemoryRepository();
    }

    @Bean
    public MemoryManager memoryManager(MemoryRepository repository, AgentMeshProperties properties, Clock clock) {
        return new MemoryManager(repository, properties.getMemory().toSettings(), clock);
    }

    @Bean(initMethod = "start")
    public InMemoryCommunicationBus communicationBus(AgentMeshProperties properties, Clock clock) {
        return new InMemoryCommunicationBus(properties.getBus().toSettings(), clock);
    }

    @Bean
    public AgentRegistry agentRegistry(AgentMeshProperties properties, Clock clock) {
        return new AgentRegistry(properties.getNegotiation().toSettings(), clock);
    }

    @Bean
    public AssignmentLedger assignmentLedger(AgentMeshProperties properties, Clock clock) {
        return new AssignmentLedger(properties.getNegotiation().getHistoryLimit(), clock);
    }

    @Bean(initMethod = "start")
    public RoleNegotiator roleNegotiator(
            AgentRegistry registry,
            InMemoryCommunicationBus bus,
            AssignmentLedger ledger,
            AgentMeshProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        return new RoleNegotiator(registry, bus, ledger, properties.getNegotiation().toSettings(), objectMapper, clock);
    }

    @Bean
    public WorkflowEventPublisher workflowEventPublisher() {
        return new WorkflowEventPublisher();
    }

    @Bean
    public WorkflowCheckpoints workflowCheckpoints(MemoryManager memory, ObjectMapper objectMapper,
                                                   AgentMeshProperties properties) {
        return new WorkflowCheckpoints(memory, objectMapper, properties.getOrchestrator().getCheckpointRetries());
    }

    @Bean(initMethod = "start")
    public TaskCoordinator taskCoordinator(
            WorkflowCheckpoints checkpoints,
            RoleNegotiator negotiator,
            AgentRegistry registry,
            InMemoryCommunicationBus bus,
            WorkflowEventPublisher events,
            AgentMeshProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        return new TaskCoordinator(checkpoints, negotiator, registry, bus, events,
            properties.getOrchestrator().toSettings(), objectMapper, clock);
    }

    @Bean
    public WorkflowCoordinator workflowCoordinator(
            WorkflowCheckpoints checkpoints,
            TaskCoordinator tasks,
            AssignmentLedger ledger,
            WorkflowEventPublisher events,
            Clock clock) {
        return new WorkflowCoordinator(checkpoints, tasks, ledger, events, clock);
    }

    @Bean
    public WorkflowHistoryService workflowHistoryService(WorkflowCheckpoints checkpoints) {
        return new WorkflowHistoryService(checkpoints);
    }

    /**
     * Starting reconciles any unfinished workflows left in memory before the sweeps begin.
     */
    @Bean(initMethod = "start")
    public RecoveryEngine recoveryEngine(
            TaskCoordinator tasks,
            WorkflowCheckpoints checkpoints,
            AgentRegistry registry,
            MemoryManager memory,
            AgentMeshProperties properties,
            Clock clock) {
        return new RecoveryEngine(tasks, checkpoints, registry, memory, properties.getRecovery().toSettings(), clock);
    }
}
