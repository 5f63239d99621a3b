package io.mcp.spec;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class TaskStatusTest {

    @Test
    public void testTerminalStates() {
        assertFalse(TaskStatus.QUEUED.isFinal());
        assertFalse(TaskStatus.RUNNING.isFinal());
        assertTrue(TaskStatus.COMPLETED.isFinal());
        assertTrue(TaskStatus.FAILED.isFinal());
        assertTrue(TaskStatus.CANCELLED.isFinal());
    }

    @Test
    public void testForwardTransitions() {
        assertTrue(TaskStatus.QUEUED.canTransitionTo(TaskStatus.RUNNING));
        assertTrue(TaskStatus.QUEUED.canTransitionTo(TaskStatus.COMPLETED));
        assertTrue(TaskStatus.QUEUED.canTransitionTo(TaskStatus.CANCELLED));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.COMPLETED));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.FAILED));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.CANCELLED));
    }

    @Test
    public void testNoStateReturnsToQueued() {
        for (TaskStatus status : TaskStatus.values()) {
            if (status != TaskStatus.QUEUED) {
                assertFalse(status.canTransitionTo(TaskStatus.QUEUED), status + " -> queued");
            }
        }
    }

    @Test
    public void testTerminalStatesAreNeverLeft() {
        for (TaskStatus from : TaskStatus.values()) {
            if (!from.isFinal()) {
                continue;
            }
            for (TaskStatus to : TaskStatus.values()) {
                assertEquals(from == to, from.canTransitionTo(to), from + " -> " + to);
            }
        }
    }

    @Test
    public void testFromStringIsCaseInsensitive() {
        assertEquals(TaskStatus.RUNNING, TaskStatus.fromString("RUNNING"));
        assertEquals(TaskStatus.CANCELLED, TaskStatus.fromString(" Canceled "));
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.fromString("paused"));
    }

    @Test
    public void testRunOutcomeNames() {
        assertEquals(TaskStatus.COMPLETED, TaskStatus.fromString("success"));
        assertEquals(TaskStatus.FAILED, TaskStatus.fromString("error"));
        assertEquals(TaskStatus.FAILED, TaskStatus.fromString("Error"));
        assertEquals("completed", TaskStatus.fromString("success").asString());
    }
}
