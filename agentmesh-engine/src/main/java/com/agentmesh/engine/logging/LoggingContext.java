package com.agentmesh.engine.logging;

import com.agentmesh.core.model.Message;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures logs carry the workflow, task, agent and message they concern.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(workflowId, taskId, attempt)) {
 *     log.info("Dispatching"); // includes workflowId, taskId, attempt
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [agentmesh-orchestrator-1] INFO  c.a.e.c.TaskCoordinator - Dispatching
 *   workflowId=abc-123 taskId=write-draft attempt=1 agentId=writer-2
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String TASK_ID = "taskId";
    public static final String ATTEMPT = "attempt";
    public static final String AGENT_ID = "agentId";
    public static final String MESSAGE_ID = "messageId";
    public static final String CORRELATION_ID = "correlationId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // use static factory methods
    }

    /**
     * Create a logging context for workflow-level operations.
     */
    public static LoggingContext forWorkflow(UUID workflowId) {
        LoggingContext ctx = new LoggingContext();
        if (workflowId != null) {
            MDC.put(WORKFLOW_ID, workflowId.toString());
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for task-level operations.
     */
    public static LoggingContext forTask(UUID workflowId, String taskId, int attempt) {
        LoggingContext ctx = forWorkflow(workflowId);
        if (taskId != null) {
            MDC.put(TASK_ID, taskId);
        }
        MDC.put(ATTEMPT, String.valueOf(attempt));
        return ctx;
    }

    /**
     * Create a logging context for agent-side operations.
     */
    public static LoggingContext forAgent(String agentId) {
        LoggingContext ctx = new LoggingContext();
        if (agentId != null) {
            MDC.put(AGENT_ID, agentId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for handling one bus delivery.
     */
    public static LoggingContext forMessage(Message message) {
        LoggingContext ctx = new LoggingContext();
        MDC.put(MESSAGE_ID, message.messageId());
        if (message.correlationId() != null) {
            MDC.put(CORRELATION_ID, message.correlationId());
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Add the agent to the current context.
     */
    public static void setAgentId(String agentId) {
        if (agentId != null) {
            MDC.put(AGENT_ID, agentId);
        }
    }

    public static String getWorkflowId() {
        return MDC.get(WORKFLOW_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(WORKFLOW_ID);
        MDC.remove(TASK_ID);
        MDC.remove(ATTEMPT);
        MDC.remove(AGENT_ID);
        MDC.remove(MESSAGE_ID);
        MDC.remove(CORRELATION_ID);
        // Keep TRACE_ID for the rest of the unit of work
    }

    /**
     * Clear all MDC context. Call at the end of a pooled task.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
