package com.agentmesh.engine.metrics;

import com.agentmesh.core.model.AgentAvailability;
import com.agentmesh.core.model.Workflow;
import com.agentmesh.core.model.WorkflowState;
import com.agentmesh.engine.bus.BusStats;
import com.agentmesh.engine.bus.CommunicationBus;
import com.agentmesh.engine.coordinator.WorkflowCheckpoints;
import com.agentmesh.engine.event.WorkflowEvent;
import com.agentmesh.engine.event.WorkflowEventListener;
import com.agentmesh.engine.negotiation.AgentRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.function.ToDoubleFunction;

/**
 * Micrometer metrics for the orchestration engine.
 *
 * Metrics exposed:
 * - Workflow and task lifecycle counters, fed by {@link WorkflowEvent}s
 * - Workflow duration timer
 * - Workflows by state, agents by availability
 * - Bus delivery counters and queue depths
 */
public class AgentMeshMetrics implements MeterBinder, WorkflowEventListener {

    // Metric names
    public static final String WORKFLOW_COUNT = "agentmesh.workflows";
    public static final String WORKFLOW_EVENTS = "agentmesh.workflow.events";
    public static final String WORKFLOW_DURATION = "agentmesh.workflow.duration";
    public static final String TASK_EVENTS = "agentmesh.task.events";
    public static final String NEGOTIATION_FAILURES = "agentmesh.negotiation.failures";
    public static final String AGENT_COUNT = "agentmesh.agents";
    public static final String AGENTS_LOST = "agentmesh.agents.lost";

    public static final String BUS_SENT = "agentmesh.bus.sent";
    public static final String BUS_DELIVERED = "agentmesh.bus.delivered";
    public static final String BUS_REDELIVERED = "agentmesh.bus.redelivered";
    public static final String BUS_DEAD_LETTERED = "agentmesh.bus.dead_lettered";
    public static final String BUS_IN_FLIGHT = "agentmesh.bus.in_flight";
    public static final String BUS_QUEUED = "agentmesh.bus.queued";

    private final CommunicationBus bus;
    private final AgentRegistry agents;
    private final WorkflowCheckpoints checkpoints;

    private volatile MeterRegistry registry;

    public AgentMeshMetrics(CommunicationBus bus, AgentRegistry agents, WorkflowCheckpoints checkpoints) {
        this.bus = bus;
        this.agents = agents;
        this.checkpoints = checkpoints;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        for (WorkflowState state : WorkflowState.values()) {
            Gauge.builder(WORKFLOW_COUNT, checkpoints, c -> countWorkflows(c, state))
                .tag("state", state.name())
                .description("Workflows in " + state + " state")
                .register(registry);
        }

        for (AgentAvailability availability : AgentAvailability.values()) {
            Gauge.builder(AGENT_COUNT, agents, a -> a.countsByAvailability().getOrDefault(availability, 0L))
                .tag("availability", availability.name())
                .description("Registered agents that are " + availability)
                .register(registry);
        }

        busCounter(registry, BUS_SENT, "Messages sent", BusStats::sent);
        busCounter(registry, BUS_DELIVERED, "Deliveries to handlers", BusStats::delivered);
        busCounter(registry, BUS_REDELIVERED, "Redeliveries after ack timeout", BusStats::redelivered);
        busCounter(registry, BUS_DEAD_LETTERED, "Messages routed to the dead-letter stream", BusStats::deadLettered);

        Gauge.builder(BUS_IN_FLIGHT, bus, b -> b.stats().inFlight())
            .description("Messages awaiting acknowledgement")
            .register(registry);
        Gauge.builder(BUS_QUEUED, bus, b -> b.stats().queued())
            .description("Messages queued behind an in-flight message")
            .register(registry);
    }

    @Override
    public void onEvent(WorkflowEvent event) {
        MeterRegistry meters = registry;
        if (meters == null) {
            return;
        }

        switch (event.type()) {
            case NEGOTIATION_FAILED -> Counter.builder(NEGOTIATION_FAILURES)
                .description("Negotiations that found no qualified agent")
                .register(meters)
                .increment();
            case AGENT_LOST -> Counter.builder(AGENTS_LOST)
                .description("Agents lost while holding a dispatch")
                .register(meters)
                .increment();
            default -> {
                if (event.taskId() != null) {
                    Counter.builder(TASK_EVENTS)
                        .tag("type", event.type().name())
                        .description("Task lifecycle transitions")
                        .register(meters)
                        .increment();
                } else {
                    Counter.builder(WORKFLOW_EVENTS)
                        .tag("type", event.type().name())
                        .description("Workflow lifecycle transitions")
                        .register(meters)
                        .increment();
                }
            }
        }

        if (event.type().isWorkflowTerminal()) {
            checkpoints.find(event.workflowId()).ifPresent(w -> recordDuration(meters, w));
        }
    }

    // ========== Internal Methods ==========

    private void recordDuration(MeterRegistry meters, Workflow workflow) {
        if (workflow.completedAt() == null) {
            return;
        }
        Timer.builder(WORKFLOW_DURATION)
            .tag("outcome", workflow.state().name())
            .description("Submission to terminal state")
            .register(meters)
            .record(Duration.between(workflow.createdAt(), workflow.completedAt()));
    }

    private void busCounter(MeterRegistry registry, String name, String description,
                            ToDoubleFunction<BusStats> field) {
        FunctionCounter.builder(name, bus, b -> field.applyAsDouble(b.stats()))
            .description(description)
            .register(registry);
    }

    private static double countWorkflows(WorkflowCheckpoints checkpoints, WorkflowState state) {
        return checkpoints.all().stream().filter(w -> w.state() == state).count();
    }
}
