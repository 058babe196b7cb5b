package com.agentmesh.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A workflow submission: a named set of tasks with dependencies, and an optional initial
 * context that task inputs can reference and task outputs are mapped into.
 */
public record WorkflowSpec(
    String name,
    List<TaskSpec> tasks,
    Map<String, String> labels,
    JsonNode context
) {
    public WorkflowSpec {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public static WorkflowSpec of(String name, TaskSpec... tasks) {
        return new WorkflowSpec(name, List.of(tasks), Map.of(), null);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private final List<TaskSpec> tasks = new ArrayList<>();
        private final Map<String, String> labels = new HashMap<>();
        private JsonNode context;

        private Builder(String name) {
            this.name = name;
        }

        public Builder task(TaskSpec task) {
            tasks.add(task);
            return this;
        }

        public Builder task(String taskId, String capability, JsonNode input, String... dependsOn) {
            return task(TaskSpec.of(taskId, capability, input, dependsOn));
        }

        public Builder label(String key, String value) {
            labels.put(key, value);
            return this;
        }

        public Builder context(JsonNode context) {
            this.context = context;
            return this;
        }

        public WorkflowSpec build() {
            return new WorkflowSpec(name, tasks, labels, context);
        }
    }
}
