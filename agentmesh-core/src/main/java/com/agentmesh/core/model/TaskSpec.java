package com.agentmesh.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied description of one task in a workflow submission.
 * timeout and maxAttempts are optional per-task overrides of the orchestrator defaults.
 *
 * <p>String values of the form {@code ${path}} anywhere in the input are replaced at dispatch
 * time with the value at that dotted path of the workflow context (a leading {@code context.}
 * is optional). outputMapping copies parts of the task's result into the context once it
 * succeeds: keys are result paths ({@code $} for the whole result), values are context paths.</p>
 */
public record TaskSpec(
    String taskId,
    String requiredCapability,
    JsonNode input,
    List<String> dependsOn,
    Duration timeout,
    Integer maxAttempts,
    Map<String, String> outputMapping
) {
    public TaskSpec {
        Objects.requireNonNull(taskId, "taskId");
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        outputMapping = outputMapping == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputMapping));
    }

    public static TaskSpec of(String taskId, String requiredCapability, JsonNode input, String... dependsOn) {
        return new TaskSpec(taskId, requiredCapability, input, List.of(dependsOn), null, null, Map.of());
    }

    public TaskSpec withTimeout(Duration timeout) {
        return new TaskSpec(taskId, requiredCapability, input, dependsOn, timeout, maxAttempts, outputMapping);
    }

    public TaskSpec withMaxAttempts(int maxAttempts) {
        return new TaskSpec(taskId, requiredCapability, input, dependsOn, timeout, maxAttempts, outputMapping);
    }

    /**
     * Copy the value at {@code resultPath} of this task's result to {@code contextPath} of the
     * workflow context when the task succeeds.
     */
    public TaskSpec withOutput(String resultPath, String contextPath) {
        Map<String, String> mapping = new LinkedHashMap<>(outputMapping);
        mapping.put(resultPath, contextPath);
        return new TaskSpec(taskId, requiredCapability, input, dependsOn, timeout, maxAttempts, mapping);
    }
}
