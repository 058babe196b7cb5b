package com.agentmesh.app.health;

import com.agentmesh.core.model.Workflow;
import com.agentmesh.core.model.WorkflowState;
import com.agentmesh.engine.bus.BusStats;
import com.agentmesh.engine.bus.CommunicationBus;
import com.agentmesh.engine.coordinator.TaskCoordinator;
import com.agentmesh.engine.coordinator.WorkflowCheckpoints;
import com.agentmesh.engine.coordinator.WorkflowCoordinator;
import com.agentmesh.engine.negotiation.AgentRegistry;
import com.agentmesh.recovery.RecoveryEngine;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Custom health indicator for the mesh.
 * Reports health status based on:
 * - Database connectivity, when the JDBC store is in use
 * - Intake and recovery state
 * - Registry and bus state
 */
@Component
public class AgentMeshHealthIndicator implements HealthIndicator {

    static final int DEAD_LETTER_WARNING = 100;

    private final ObjectProvider<JdbcTemplate> jdbcTemplate;
    private final WorkflowCoordinator workflows;
    private final WorkflowCheckpoints checkpoints;
    private final TaskCoordinator tasks;
    private final AgentRegistry registry;
    private final CommunicationBus bus;
    private final RecoveryEngine recovery;

    public AgentMeshHealthIndicator(
            ObjectProvider<JdbcTemplate> jdbcTemplate,
            WorkflowCoordinator workflows,
            WorkflowCheckpoints checkpoints,
            TaskCoordinator tasks,
            AgentRegistry registry,
            CommunicationBus bus,
            RecoveryEngine recovery) {
        this.jdbcTemplate = jdbcTemplate;
        this.workflows = workflows;
        this.checkpoints = checkpoints;
        this.tasks = tasks;
        this.registry = registry;
        this.bus = bus;
        this.recovery = recovery;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            JdbcTemplate jdbc = jdbcTemplate.getIfAvailable();
            if (jdbc != null && !checkDatabase(jdbc, details)) {
                return Health.down()
                    .withDetails(details)
                    .build();
            }

            details.put("accepting", workflows.isAccepting());
            details.put("recovery", recovery.isRunning() ? "running" : "stopped");
            details.put("inFlightNegotiations", tasks.inFlightNegotiations());
            checkWorkflowHealth(details);
            checkAgentHealth(details);
            checkBusHealth(details);

            if (!workflows.isAccepting() || !recovery.isRunning()) {
                return Health.outOfService()
                    .withDetails(details)
                    .build();
            }
            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private boolean checkDatabase(JdbcTemplate jdbc, Map<String, Object> details) {
        try {
            Integer result = jdbc.queryForObject("SELECT 1", Integer.class);
            details.put("database", "connected");
            return result != null && result == 1;
        } catch (Exception e) {
            details.put("database", "disconnected");
            details.put("databaseError", e.getMessage());
            return false;
        }
    }

    private void checkWorkflowHealth(Map<String, Object> details) {
        Map<WorkflowState, Integer> counts = new EnumMap<>(WorkflowState.class);
        for (Workflow workflow : checkpoints.all()) {
            counts.merge(workflow.state(), 1, Integer::sum);
        }
        details.put("workflows", counts);
    }

    private void checkAgentHealth(Map<String, Object> details) {
        details.put("agents", registry.countsByAvailability());
    }

    private void checkBusHealth(Map<String, Object> details) {
        BusStats stats = bus.stats();
        details.put("busInFlight", stats.inFlight());
        details.put("busQueued", stats.queued());
        details.put("deadLetters", stats.deadLettered());

        if (stats.deadLettered() > DEAD_LETTER_WARNING) {
            details.put("busWarning", "High number of dead letters - agents may be failing to acknowledge");
        }
    }
}
