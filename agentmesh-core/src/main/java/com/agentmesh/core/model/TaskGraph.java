package com.agentmesh.core.model;

import com.agentmesh.core.exception.InvalidGraphException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Validated dependency graph of a workflow submission.
 * Construction fails with {@link InvalidGraphException} unless the tasks form a DAG.
 */
public final class TaskGraph {

    private final Map<String, TaskSpec> tasks;
    private final List<TaskSpec> topologicalOrder;

    private TaskGraph(Map<String, TaskSpec> tasks, List<TaskSpec> topologicalOrder) {
        this.tasks = tasks;
        this.topologicalOrder = topologicalOrder;
    }

    public static TaskGraph of(WorkflowSpec spec) {
        if (spec == null || spec.tasks().isEmpty()) {
            throw new InvalidGraphException("Workflow must contain at least one task");
        }
        if (spec.context() != null && !spec.context().isNull() && !spec.context().isObject()) {
            throw new InvalidGraphException("Workflow context must be a JSON object");
        }

        Map<String, TaskSpec> byId = new LinkedHashMap<>();
        for (TaskSpec task : spec.tasks()) {
            if (task.taskId().isBlank()) {
                throw new InvalidGraphException("Task id must not be blank");
            }
            if (task.requiredCapability() == null || task.requiredCapability().isBlank()) {
                throw new InvalidGraphException(task.taskId(), "required capability must not be blank");
            }
            if (task.maxAttempts() != null && task.maxAttempts() < 1) {
                throw new InvalidGraphException(task.taskId(), "maxAttempts must be >= 1");
            }
            if (task.timeout() != null && (task.timeout().isNegative() || task.timeout().isZero())) {
                throw new InvalidGraphException(task.taskId(), "timeout must be positive");
            }
            for (Map.Entry<String, String> output : task.outputMapping().entrySet()) {
                if (output.getKey() == null || output.getKey().isBlank()
                        || output.getValue() == null || output.getValue().isBlank()) {
                    throw new InvalidGraphException(task.taskId(), "output mapping paths must not be blank");
                }
            }
            if (byId.putIfAbsent(task.taskId(), task) != null) {
                throw new InvalidGraphException(task.taskId(), "duplicate task id");
            }
        }

        for (TaskSpec task : byId.values()) {
            for (String dep : task.dependsOn()) {
                if (dep.equals(task.taskId())) {
                    throw new InvalidGraphException(task.taskId(), "task depends on itself");
                }
                if (!byId.containsKey(dep)) {
                    throw new InvalidGraphException(task.taskId(), "unknown dependency " + dep);
                }
            }
        }

        return new TaskGraph(byId, sort(byId));
    }

    /**
     * Kahn's algorithm. Ties keep submission order so the result is deterministic.
     */
    private static List<TaskSpec> sort(Map<String, TaskSpec> byId) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (TaskSpec task : byId.values()) {
            inDegree.put(task.taskId(), (int) task.dependsOn().stream().distinct().count());
            for (String dep : task.dependsOn().stream().distinct().collect(Collectors.toList())) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(task.taskId());
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        for (TaskSpec task : byId.values()) {
            if (inDegree.get(task.taskId()) == 0) {
                queue.add(task.taskId());
            }
        }

        List<TaskSpec> order = new ArrayList<>(byId.size());
        while (!queue.isEmpty()) {
            String id = queue.poll();
            order.add(byId.get(id));
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    queue.add(dependent);
                }
            }
        }

        if (order.size() != byId.size()) {
            List<String> cyclic = inDegree.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.toList());
            throw new InvalidGraphException("Dependency cycle detected; unresolvable tasks " + cyclic);
        }
        return order;
    }

    public List<TaskSpec> topologicalOrder() {
        return topologicalOrder;
    }

    public TaskSpec task(String taskId) {
        return tasks.get(taskId);
    }

    public int size() {
        return tasks.size();
    }

    /**
     * Tasks with no dependencies.
     */
    public List<TaskSpec> roots() {
        return topologicalOrder.stream()
            .filter(t -> t.dependsOn().isEmpty())
            .collect(Collectors.toList());
    }
}
