package com.agentmesh.agent;

import java.time.Duration;

/**
 * Accountability figures of one agent runtime.
 *
 * @param reliability completed / (completed + failed), 1.0 before the first settled task
 */
public record AgentStats(
    long tasksCompleted,
    long tasksFailed,
    int tasksRunning,
    Duration averageResponseTime,
    double reliability
) {
    public static AgentStats initial() {
        return new AgentStats(0, 0, 0, Duration.ZERO, 1.0);
    }

    public long tasksSettled() {
        return tasksCompleted + tasksFailed;
    }

    AgentStats withRunning(int running) {
        return new AgentStats(tasksCompleted, tasksFailed, running, averageResponseTime, reliability);
    }

    /**
     * Fold one settled execution into the rolling figures.
     */
    AgentStats withSettled(boolean succeeded, Duration took) {
        long completed = tasksCompleted + (succeeded ? 1 : 0);
        long failed = tasksFailed + (succeeded ? 0 : 1);
        long settled = completed + failed;
        Duration average = averageResponseTime.multipliedBy(settled - 1).plus(took).dividedBy(settled);
        return new AgentStats(completed, failed, tasksRunning, average, (double) completed / settled);
    }
}
