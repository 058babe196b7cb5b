package com.agentmesh.engine.negotiation;

import com.agentmesh.core.model.TaskRef;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Who worked on what: the team formed for each workflow and each agent's assignment history.
 */
public class AssignmentLedger {

    /**
     * One assignment and, once settled, its outcome.
     */
    public record Entry(
        String agentId,
        TaskRef task,
        String capability,
        Instant assignedAt,
        AssignmentOutcome outcome,
        Instant settledAt
    ) {
        Entry settle(AssignmentOutcome result, Instant at) {
            return new Entry(agentId, task, capability, assignedAt, result, at);
        }
    }

    private final int historyLimit;
    private final Clock clock;
    private final Map<UUID, List<Entry>> byWorkflow = new ConcurrentHashMap<>();
    private final Map<String, Deque<Entry>> byAgent = new ConcurrentHashMap<>();

    public AssignmentLedger(int historyLimit, Clock clock) {
        this.historyLimit = historyLimit;
        this.clock = clock;
    }

    public void recordAssignment(Assignment assignment) {
        Entry entry = new Entry(assignment.agentId(), assignment.task(), assignment.capability(),
            assignment.assignedAt(), AssignmentOutcome.IN_PROGRESS, null);
        byWorkflow.compute(assignment.task().workflowId(), (k, entries) -> {
            List<Entry> team = entries != null ? entries : new ArrayList<>();
            team.add(entry);
            return team;
        });
        byAgent.compute(assignment.agentId(), (k, entries) -> {
            Deque<Entry> history = entries != null ? entries : new ArrayDeque<>();
            history.addLast(entry);
            while (history.size() > historyLimit) {
                history.pollFirst();
            }
            return history;
        });
    }

    /**
     * Settle the open assignment of an agent to a task. Unknown or settled assignments are ignored.
     */
    public void recordOutcome(String agentId, TaskRef task, AssignmentOutcome outcome) {
        Instant now = clock.instant();
        byWorkflow.computeIfPresent(task.workflowId(), (k, entries) -> {
            entries.replaceAll(e -> isOpen(e, agentId, task) ? e.settle(outcome, now) : e);
            return entries;
        });
        byAgent.computeIfPresent(agentId, (k, entries) -> {
            Deque<Entry> settled = new ArrayDeque<>(entries.size());
            for (Entry e : entries) {
                settled.addLast(isOpen(e, agentId, task) ? e.settle(outcome, now) : e);
            }
            return settled;
        });
    }

    /**
     * Agents that held at least one assignment in the workflow, in order of first assignment.
     */
    public Set<String> team(UUID workflowId) {
        Set<String> team = new LinkedHashSet<>();
        for (Entry entry : assignments(workflowId)) {
            team.add(entry.agentId());
        }
        return team;
    }

    public List<Entry> assignments(UUID workflowId) {
        AtomicReference<List<Entry>> copy = new AtomicReference<>(List.of());
        byWorkflow.computeIfPresent(workflowId, (k, entries) -> {
            copy.set(List.copyOf(entries));
            return entries;
        });
        return copy.get();
    }

    public List<Entry> history(String agentId) {
        AtomicReference<List<Entry>> copy = new AtomicReference<>(List.of());
        byAgent.computeIfPresent(agentId, (k, entries) -> {
            copy.set(List.copyOf(entries));
            return entries;
        });
        return copy.get();
    }

    public void forgetWorkflow(UUID workflowId) {
        byWorkflow.remove(workflowId);
    }

    private static boolean isOpen(Entry entry, String agentId, TaskRef task) {
        return entry.outcome() == AssignmentOutcome.IN_PROGRESS
            && entry.agentId().equals(agentId)
            && entry.task().equals(task);
    }
}
