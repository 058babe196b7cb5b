package com.agentmesh.core.model;

import com.agentmesh.core.exception.NotFoundException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A submitted workflow and its tasks. This is the unit the orchestrator checkpoints.
 *
 * Invariants:
 * - tasks keep submission order (topologically sorted at submission)
 * - state == WorkflowState.derive(task states, cancelled)
 * - completedAt set iff state is terminal
 * - context is a JSON object, changed only when a task with an output mapping succeeds
 */
public record Workflow(
    UUID workflowId,
    String name,
    Map<String, String> labels,
    Map<String, Task> tasks,
    JsonNode context,
    WorkflowState state,
    boolean cancelled,
    boolean archived,
    Instant createdAt,
    Instant completedAt
) {
    public Workflow {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        tasks = tasks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
        context = context == null || !context.isObject() ? JsonNodeFactory.instance.objectNode() : context;
    }

    /**
     * Create a RUNNING workflow. Tasks must already be in topological order.
     */
    public static Workflow create(UUID workflowId, String name, Map<String, String> labels,
                                  JsonNode context, List<TaskSpec> orderedTasks, Instant now) {
        Map<String, Task> tasks = new LinkedHashMap<>();
        for (TaskSpec spec : orderedTasks) {
            tasks.put(spec.taskId(), Task.fromSpec(spec, now));
        }
        WorkflowState state = WorkflowState.derive(taskStates(tasks.values()), false);
        return new Workflow(workflowId, name, labels, tasks, context, state, false, false, now,
            state.isTerminal() ? now : null);
    }

    public Task task(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new NotFoundException("Task", workflowId + "/" + taskId);
        }
        return task;
    }

    public boolean hasTask(String taskId) {
        return tasks.containsKey(taskId);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * PENDING tasks whose dependencies have all succeeded.
     */
    public List<Task> promotableTasks() {
        List<Task> promotable = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (task.state() != TaskState.PENDING) {
                continue;
            }
            boolean ready = task.dependsOn().stream()
                .allMatch(dep -> tasks.get(dep).state() == TaskState.SUCCEEDED);
            if (ready) {
                promotable.add(task);
            }
        }
        return promotable;
    }

    /**
     * Non-terminal tasks with at least one abandoned dependency.
     */
    public List<Task> doomedTasks() {
        List<Task> doomed = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (task.isTerminal()) {
                continue;
            }
            boolean depAbandoned = task.dependsOn().stream()
                .anyMatch(dep -> tasks.get(dep).state() == TaskState.ABANDONED);
            if (depAbandoned) {
                doomed.add(task);
            }
        }
        return doomed;
    }

    public List<Task> tasksInState(TaskState state) {
        return tasks.values().stream()
            .filter(t -> t.state() == state)
            .collect(Collectors.toList());
    }

    /**
     * Fraction of tasks that have settled, in [0, 1].
     */
    public double progress() {
        if (tasks.isEmpty()) {
            return 1.0;
        }
        long settled = tasks.values().stream().filter(Task::isTerminal).count();
        return (double) settled / tasks.size();
    }

    /**
     * Replace one task and re-derive the workflow state.
     */
    public Workflow withTask(Task task, Instant now) {
        Map<String, Task> updated = new LinkedHashMap<>(tasks);
        updated.put(task.taskId(), task);
        return rederive(updated, cancelled, now);
    }

    public Workflow withCancelled(Instant now) {
        return rederive(tasks, true, now);
    }

    public Workflow withArchived() {
        return new Workflow(workflowId, name, labels, tasks, context, state, cancelled, true, createdAt, completedAt);
    }

    public Workflow withContext(JsonNode newContext) {
        return new Workflow(workflowId, name, labels, tasks, newContext, state, cancelled, archived,
            createdAt, completedAt);
    }

    private Workflow rederive(Map<String, Task> newTasks, boolean newCancelled, Instant now) {
        WorkflowState newState = WorkflowState.derive(taskStates(newTasks.values()), newCancelled);
        Instant newCompletedAt = completedAt;
        if (newState.isTerminal() && newCompletedAt == null) {
            newCompletedAt = now;
        }
        return new Workflow(workflowId, name, labels, newTasks, context, newState, newCancelled, archived,
            createdAt, newCompletedAt);
    }

    private static List<TaskState> taskStates(Collection<Task> tasks) {
        return tasks.stream().map(Task::state).collect(Collectors.toList());
    }
}
