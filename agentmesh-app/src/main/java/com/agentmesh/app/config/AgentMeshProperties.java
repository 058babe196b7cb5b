package com.agentmesh.app.config;

import com.agentmesh.agent.AgentSettings;
import com.agentmesh.core.model.RetryPolicy;
import com.agentmesh.engine.bus.BusSettings;
import com.agentmesh.engine.coordinator.OrchestratorSettings;
import com.agentmesh.engine.memory.MemorySettings;
import com.agentmesh.engine.negotiation.NegotiationSettings;
import com.agentmesh.recovery.RecoverySettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties under {@code agentmesh.*}. Each section converts to the settings
 * record its component takes.
 */
@ConfigurationProperties(prefix = "agentmesh")
public class AgentMeshProperties {

    /**
     * Where the Memory Manager keeps its versions: {@code memory} or {@code jdbc}.
     */
    private String store = "memory";

    private Bus bus = new Bus();
    private Negotiation negotiation = new Negotiation();
    private Orchestrator orchestrator = new Orchestrator();
    private Memory memory = new Memory();
    private Recovery recovery = new Recovery();
    private Agent agent = new Agent();

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public Bus getBus() {
        return bus;
    }

    public void setBus(Bus bus) {
        this.bus = bus;
    }

    public Negotiation getNegotiation() {
        return negotiation;
    }

    public void setNegotiation(Negotiation negotiation) {
        this.negotiation = negotiation;
    }

    public Orchestrator getOrchestrator() {
        return orchestrator;
    }

    public void setOrchestrator(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public Memory getMemory() {
        return memory;
    }

    public void setMemory(Memory memory) {
        this.memory = memory;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public Agent getAgent() {
        return agent;
    }

    public void setAgent(Agent agent) {
        this.agent = agent;
    }

    public static class Bus {
        private Duration ackTimeout = Duration.ofSeconds(30);
        private int maxDeliveries = 5;
        private Duration livenessWindow = Duration.ofSeconds(30);
        private Duration sweepInterval = Duration.ofSeconds(1);
        private int dispatcherThreads = 8;
        private int deadLetterCapacity = 10_000;

        public BusSettings toSettings() {
            return new BusSettings(ackTimeout, maxDeliveries, livenessWindow, sweepInterval,
                dispatcherThreads, deadLetterCapacity);
        }

        public Duration getAckTimeout() {
            return ackTimeout;
        }

        public void setAckTimeout(Duration ackTimeout) {
            this.ackTimeout = ackTimeout;
        }

        public int getMaxDeliveries() {
            return maxDeliveries;
        }

        public void setMaxDeliveries(int maxDeliveries) {
            this.maxDeliveries = maxDeliveries;
        }

        public Duration getLivenessWindow() {
            return livenessWindow;
        }

        public void setLivenessWindow(Duration livenessWindow) {
            this.livenessWindow = livenessWindow;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public int getDispatcherThreads() {
            return dispatcherThreads;
        }

        public void setDispatcherThreads(int dispatcherThreads) {
            this.dispatcherThreads = dispatcherThreads;
        }

        public int getDeadLetterCapacity() {
            return deadLetterCapacity;
        }

        public void setDeadLetterCapacity(int deadLetterCapacity) {
            this.deadLetterCapacity = deadLetterCapacity;
        }
    }

    public static class Negotiation {
        private Duration bidTimeout = Duration.ofSeconds(2);
        private Duration livenessWindow = Duration.ofSeconds(30);
        private int historyLimit = 100;

        public NegotiationSettings toSettings() {
            return new NegotiationSettings(bidTimeout, livenessWindow, historyLimit);
        }

        public Duration getBidTimeout() {
            return bidTimeout;
        }

        public void setBidTimeout(Duration bidTimeout) {
            this.bidTimeout = bidTimeout;
        }

        public Duration getLivenessWindow() {
            return livenessWindow;
        }

        public void setLivenessWindow(Duration livenessWindow) {
            this.livenessWindow = livenessWindow;
        }

        public int getHistoryLimit() {
            return historyLimit;
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit;
        }
    }

    public static class Orchestrator {
        private Backoff retry = new Backoff(3, Duration.ofSeconds(1), Duration.ofMinutes(5));
        private Backoff negotiation = new Backoff(5, Duration.ofSeconds(1), Duration.ofMinutes(5));
        private Duration dispatchTimeout = Duration.ofSeconds(60);
        private int workerThreads = 8;
        private int checkpointRetries = 5;
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public OrchestratorSettings toSettings() {
            return new OrchestratorSettings(retry.toPolicy(), negotiation.toPolicy(), dispatchTimeout,
                workerThreads, checkpointRetries);
        }

        public Backoff getRetry() {
            return retry;
        }

        public void setRetry(Backoff retry) {
            this.retry = retry;
        }

        public Backoff getNegotiation() {
            return negotiation;
        }

        public void setNegotiation(Backoff negotiation) {
            this.negotiation = negotiation;
        }

        public Duration getDispatchTimeout() {
            return dispatchTimeout;
        }

        public void setDispatchTimeout(Duration dispatchTimeout) {
            this.dispatchTimeout = dispatchTimeout;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getCheckpointRetries() {
            return checkpointRetries;
        }

        public void setCheckpointRetries(int checkpointRetries) {
            this.checkpointRetries = checkpointRetries;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    /**
     * Exponential backoff with jitter; maxAttempts counts every attempt, the first included.
     */
    public static class Backoff {
        private int maxAttempts;
        private Duration initialBackoff;
        private Duration maxBackoff;
        private double multiplier = 2.0;
        private double jitterFactor = 0.1;

        public Backoff() {
            this(3, Duration.ofSeconds(1), Duration.ofMinutes(5));
        }

        public Backoff(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
            this.maxAttempts = maxAttempts;
            this.initialBackoff = initialBackoff;
            this.maxBackoff = maxBackoff;
        }

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialBackoff(initialBackoff)
                .maxBackoff(maxBackoff)
                .backoffMultiplier(multiplier)
                .jitterFactor(jitterFactor)
                .build();
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }
    }

    public static class Memory {
        private int retainVersions = 50;
        private Duration tombstoneGracePeriod = Duration.ofHours(1);

        public MemorySettings toSettings() {
            return new MemorySettings(retainVersions, tombstoneGracePeriod);
        }

        public int getRetainVersions() {
            return retainVersions;
        }

        public void setRetainVersions(int retainVersions) {
            this.retainVersions = retainVersions;
        }

        public Duration getTombstoneGracePeriod() {
            return tombstoneGracePeriod;
        }

        public void setTombstoneGracePeriod(Duration tombstoneGracePeriod) {
            this.tombstoneGracePeriod = tombstoneGracePeriod;
        }
    }

    public static class Recovery {
        private Duration livenessInterval = Duration.ofSeconds(5);
        private Duration deadlineInterval = Duration.ofSeconds(5);
        private Duration stallInterval = Duration.ofMinutes(1);
        private Duration stallThreshold = Duration.ofMinutes(5);
        private Duration compactionInterval = Duration.ofMinutes(10);

        public RecoverySettings toSettings() {
            return new RecoverySettings(livenessInterval, deadlineInterval, stallInterval, stallThreshold,
                compactionInterval);
        }

        public Duration getLivenessInterval() {
            return livenessInterval;
        }

        public void setLivenessInterval(Duration livenessInterval) {
            this.livenessInterval = livenessInterval;
        }

        public Duration getDeadlineInterval() {
            return deadlineInterval;
        }

        public void setDeadlineInterval(Duration deadlineInterval) {
            this.deadlineInterval = deadlineInterval;
        }

        public Duration getStallInterval() {
            return stallInterval;
        }

        public void setStallInterval(Duration stallInterval) {
            this.stallInterval = stallInterval;
        }

        public Duration getStallThreshold() {
            return stallThreshold;
        }

        public void setStallThreshold(Duration stallThreshold) {
            this.stallThreshold = stallThreshold;
        }

        public Duration getCompactionInterval() {
            return compactionInterval;
        }

        public void setCompactionInterval(Duration compactionInterval) {
            this.compactionInterval = compactionInterval;
        }
    }

    /**
     * Defaults for agent runtimes hosted in this process.
     */
    public static class Agent {
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private int dedupCapacity = 1_000;
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public AgentSettings toSettings() {
            return new AgentSettings(heartbeatInterval, dedupCapacity, shutdownTimeout);
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public int getDedupCapacity() {
            return dedupCapacity;
        }

        public void setDedupCapacity(int dedupCapacity) {
            this.dedupCapacity = dedupCapacity;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }
}
