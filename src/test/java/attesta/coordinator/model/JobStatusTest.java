package attesta.coordinator.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JobStatusTest {

    @Test
    void terminalStates() {
        assertTrue(JobStatus.COMPLETED.isTerminal());
        assertTrue(JobStatus.FAILED.isTerminal());
        assertFalse(JobStatus.PENDING.isTerminal());
        assertFalse(JobStatus.DISPATCHED.isTerminal());
        assertFalse(JobStatus.RUNNING.isTerminal());
    }

    @Test
    void onlyForwardTransitions() {
        assertTrue(JobStatus.PENDING.canAdvanceTo(JobStatus.DISPATCHED));
        assertTrue(JobStatus.PENDING.canAdvanceTo(JobStatus.FAILED));
        assertTrue(JobStatus.DISPATCHED.canAdvanceTo(JobStatus.RUNNING));
        assertTrue(JobStatus.DISPATCHED.canAdvanceTo(JobStatus.COMPLETED));
        assertTrue(JobStatus.RUNNING.canAdvanceTo(JobStatus.COMPLETED));

        assertFalse(JobStatus.RUNNING.canAdvanceTo(JobStatus.DISPATCHED));
        assertFalse(JobStatus.RUNNING.canAdvanceTo(JobStatus.RUNNING));
        assertFalse(JobStatus.DISPATCHED.canAdvanceTo(JobStatus.PENDING));
        assertFalse(JobStatus.PENDING.canAdvanceTo(null));
    }

    @Test
    void failedIsFinal() {
        for (JobStatus next : JobStatus.values()) {
            assertFalse(JobStatus.FAILED.canAdvanceTo(next), "FAILED -> " + next);
        }
    }

    @Test
    void completedCanOnlyBeDemoted() {
        assertTrue(JobStatus.COMPLETED.canAdvanceTo(JobStatus.FAILED));
        assertFalse(JobStatus.COMPLETED.canAdvanceTo(JobStatus.RUNNING));
        assertFalse(JobStatus.COMPLETED.canAdvanceTo(JobStatus.COMPLETED));
    }
}
