package com.agentmesh.app.metrics;

import com.agentmesh.engine.bus.CommunicationBus;
import com.agentmesh.engine.coordinator.WorkflowCheckpoints;
import com.agentmesh.engine.event.WorkflowEventPublisher;
import com.agentmesh.engine.metrics.AgentMeshMetrics;
import com.agentmesh.engine.negotiation.AgentRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the mesh.
 *
 * Configures:
 * - Common tags for all metrics
 * - The engine's meter binder, fed by workflow events
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "agentmesh");
    }

    @Bean
    public AgentMeshMetrics agentMeshMetrics(
            CommunicationBus bus,
            AgentRegistry registry,
            WorkflowCheckpoints checkpoints,
            WorkflowEventPublisher events) {
        AgentMeshMetrics metrics = new AgentMeshMetrics(bus, registry, checkpoints);
        events.addListener(metrics);
        return metrics;
    }
}
