package com.agentmesh.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class TaskStateTest {

    @Test
    void terminalStates_shouldBeSucceededAndAbandoned() {
        assertTrue(TaskState.SUCCEEDED.isTerminal());
        assertTrue(TaskState.ABANDONED.isTerminal());
        assertFalse(TaskState.FAILED.isTerminal());
        assertFalse(TaskState.DISPATCHED.isTerminal());
    }

    @ParameterizedTest
    @EnumSource(TaskState.class)
    void terminalStates_shouldNotTransition(TaskState target) {
        assertFalse(TaskState.SUCCEEDED.canTransitionTo(target));
        assertFalse(TaskState.ABANDONED.canTransitionTo(target));
    }

    @Test
    void pending_shouldOnlyBecomeReadyOrAbandoned() {
        assertTrue(TaskState.PENDING.canTransitionTo(TaskState.READY));
        assertTrue(TaskState.PENDING.canTransitionTo(TaskState.ABANDONED));
        assertFalse(TaskState.PENDING.canTransitionTo(TaskState.DISPATCHED));
        assertFalse(TaskState.PENDING.canTransitionTo(TaskState.SUCCEEDED));
    }

    @Test
    void dispatched_shouldAllowOutcomesAndRequeue() {
        assertTrue(TaskState.DISPATCHED.canTransitionTo(TaskState.SUCCEEDED));
        assertTrue(TaskState.DISPATCHED.canTransitionTo(TaskState.FAILED));
        assertTrue(TaskState.DISPATCHED.canTransitionTo(TaskState.READY));
        assertFalse(TaskState.DISPATCHED.canTransitionTo(TaskState.NEGOTIATING));
    }

    @Test
    void failed_shouldRetryOrAbandon() {
        assertTrue(TaskState.FAILED.canTransitionTo(TaskState.READY));
        assertTrue(TaskState.FAILED.canTransitionTo(TaskState.ABANDONED));
        assertFalse(TaskState.FAILED.canTransitionTo(TaskState.SUCCEEDED));
    }

    @Test
    void active_shouldBeNegotiatingAndDispatchedOnly() {
        assertTrue(TaskState.NEGOTIATING.isActive());
        assertTrue(TaskState.DISPATCHED.isActive());
        assertFalse(TaskState.READY.isActive());
        assertFalse(TaskState.FAILED.isActive());
        assertFalse(TaskState.SUCCEEDED.isActive());
    }
}
