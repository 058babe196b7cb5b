package com.agentmesh.recovery;

import com.agentmesh.core.model.Task;
import com.agentmesh.core.model.Workflow;
import com.agentmesh.engine.coordinator.TaskCoordinator;
import com.agentmesh.engine.coordinator.WorkflowCheckpoints;
import com.agentmesh.engine.memory.CompactionReport;
import com.agentmesh.engine.memory.MemoryManager;
import com.agentmesh.engine.negotiation.AgentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Recovery Engine responsible for detecting and recovering from failures.
 *
 * Responsibilities:
 * - Reconcile unfinished workflows after a restart
 * - Mark agents that stopped heartbeating unreachable (their tasks are re-negotiated)
 * - Fail dispatches that overran their deadline
 * - Re-evaluate workflows that stopped making progress
 * - Compact old memory versions
 *
 * Each sweep is also callable directly, which is how tests drive it.
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private final TaskCoordinator tasks;
    private final WorkflowCheckpoints checkpoints;
    private final AgentRegistry registry;
    private final MemoryManager memory;
    private final RecoverySettings settings;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public RecoveryEngine(
            TaskCoordinator tasks,
            WorkflowCheckpoints checkpoints,
            AgentRegistry registry,
            MemoryManager memory,
            RecoverySettings settings,
            Clock clock) {
        this.tasks = tasks;
        this.checkpoints = checkpoints;
        this.registry = registry;
        this.memory = memory;
        this.settings = settings;
        this.clock = clock;
        this.scheduler = Executors.newScheduledThreadPool(2, namedThreads("agentmesh-recovery-"));
    }

    /**
     * Reconcile persisted workflows, then start the periodic sweeps.
     */
    public void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }

        running = true;
        log.info("Starting recovery engine");

        recoverOnStartup();

        schedule(this::sweepLiveness, settings.livenessInterval());
        schedule(this::checkDeadlines, settings.deadlineInterval());
        schedule(this::detectStalledWorkflows, settings.stallInterval());
        schedule(this::compactMemory, settings.compactionInterval());

        log.info("Recovery engine started");
    }

    /**
     * Stop the recovery engine.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recovery engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Resume every unfinished workflow found in memory.
     *
     * @return number of workflows resumed
     */
    public int recoverOnStartup() {
        int resumed = tasks.recover();
        if (resumed > 0) {
            log.info("Recovered {} unfinished workflows", resumed);
        }
        return resumed;
    }

    /**
     * @return agents marked unreachable by this sweep
     */
    public List<String> sweepLiveness() {
        List<String> lost = registry.sweepLiveness();
        if (!lost.isEmpty()) {
            log.warn("Agents stopped heartbeating: {}", lost);
        }
        return lost;
    }

    /**
     * @return dispatches failed with DEADLINE_EXCEEDED
     */
    public int checkDeadlines() {
        int expired = tasks.checkDeadlines();
        if (expired > 0) {
            log.info("Timed out {} dispatches", expired);
        }
        return expired;
    }

    /**
     * Find unfinished workflows with nothing negotiating or dispatched whose tasks have not
     * changed within the stall threshold, and advance them again.
     *
     * @return workflows re-evaluated
     */
    public List<UUID> detectStalledWorkflows() {
        Instant threshold = clock.instant().minus(settings.stallThreshold());
        List<UUID> stalled = new ArrayList<>();

        for (Workflow workflow : checkpoints.all()) {
            if (workflow.isTerminal() || hasWorkInFlight(workflow) || lastChange(workflow).isAfter(threshold)) {
                continue;
            }
            log.warn("Workflow {} appears stalled (state={}, last change before {})",
                workflow.workflowId(), workflow.state(), threshold);
            try {
                tasks.advance(workflow.workflowId());
                stalled.add(workflow.workflowId());
            } catch (Exception e) {
                log.error("Failed to re-evaluate workflow {}", workflow.workflowId(), e);
            }
        }
        return stalled;
    }

    public CompactionReport compactMemory() {
        CompactionReport report = memory.compact();
        if (report.versionsRemoved() > 0) {
            log.info("Memory compaction removed {} versions across {} keys",
                report.versionsRemoved(), report.keysCompacted());
        }
        return report;
    }

    // ========== Internal Methods ==========

    private void schedule(Runnable sweep, Duration period) {
        long millis = period.toMillis();
        scheduler.scheduleWithFixedDelay(() -> runSafely(sweep), millis, millis, TimeUnit.MILLISECONDS);
    }

    private void runSafely(Runnable sweep) {
        if (!running) return;

        try {
            sweep.run();
        } catch (Exception e) {
            log.error("Error in recovery sweep", e);
        }
    }

    private static boolean hasWorkInFlight(Workflow workflow) {
        return workflow.tasks().values().stream().anyMatch(t -> t.state().isActive());
    }

    private static Instant lastChange(Workflow workflow) {
        return workflow.tasks().values().stream()
            .map(Task::updatedAt)
            .max(Instant::compareTo)
            .orElse(workflow.createdAt());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
