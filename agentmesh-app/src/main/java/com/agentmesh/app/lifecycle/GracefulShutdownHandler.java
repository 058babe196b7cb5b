package com.agentmesh.app.lifecycle;

import com.agentmesh.agent.AgentRuntime;
import com.agentmesh.app.config.AgentMeshProperties;
import com.agentmesh.engine.bus.InMemoryCommunicationBus;
import com.agentmesh.engine.coordinator.TaskCoordinator;
import com.agentmesh.engine.coordinator.WorkflowCoordinator;
import com.agentmesh.engine.negotiation.RoleNegotiator;
import com.agentmesh.recovery.RecoveryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown for the mesh.
 *
 * On shutdown:
 * 1. Stops accepting new workflows
 * 2. Waits for in-flight negotiations to finish (with timeout)
 * 3. Stops recovery sweeps
 * 4. Stops hosted agents, which finish their current task and deregister
 * 5. Stops the negotiator, the task coordinator and the bus
 *
 * Unfinished workflows stay checkpointed in memory and are resumed by the next start.
 */
@Component
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final WorkflowCoordinator workflows;
    private final TaskCoordinator tasks;
    private final RoleNegotiator negotiator;
    private final InMemoryCommunicationBus bus;
    private final RecoveryEngine recovery;
    private final ObjectProvider<AgentRuntime> agents;
    private final Duration shutdownTimeout;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownHandler(
            WorkflowCoordinator workflows,
            TaskCoordinator tasks,
            RoleNegotiator negotiator,
            InMemoryCommunicationBus bus,
            RecoveryEngine recovery,
            ObjectProvider<AgentRuntime> agents,
            AgentMeshProperties properties) {
        this.workflows = workflows;
        this.tasks = tasks;
        this.negotiator = negotiator;
        this.bus = bus;
        this.recovery = recovery;
        this.agents = agents;
        this.shutdownTimeout = properties.getOrchestrator().getShutdownTimeout();
    }

    /**
     * Check if shutdown is in progress.
     */
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Handle application shutdown event.
     * This runs before the Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown");

        workflows.stopAccepting();
        waitForNegotiations();

        recovery.stop();
        agents.orderedStream().forEach(this::stopAgent);
        negotiator.stop();
        tasks.stop();
        bus.stop();

        log.info("Graceful shutdown complete");
    }

    private void waitForNegotiations() {
        int inFlight = tasks.inFlightNegotiations();
        if (inFlight == 0) {
            log.info("No negotiations to wait for");
            return;
        }

        log.info("Waiting for {} negotiations to finish (timeout: {})", inFlight, shutdownTimeout);
        if (tasks.awaitQuiescence(shutdownTimeout)) {
            log.info("All negotiations finished");
        } else {
            log.warn("Shutdown timeout reached with {} negotiations still running", tasks.inFlightNegotiations());
        }
    }

    private void stopAgent(AgentRuntime agent) {
        try {
            agent.stop();
        } catch (Exception e) {
            log.error("Failed to stop agent {}", agent.agentId(), e);
        }
    }
}
