package com.ryuqq.lifecycle.core.reason;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ShutdownReason 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ShutdownReasonTest {

    @Test
    void runnerFailure_IsFailure() {
        ShutdownReason reason = new RunnerFailure("worker", new RuntimeException("boom"));

        assertTrue(reason.isFailure());
    }

    @Test
    void externalSignalAndAllCompleted_AreNotFailures() {
        assertFalse(new ExternalSignal("SIGTERM").isFailure());
        assertFalse(AllCompleted.instance().isFailure());
    }

    @Test
    void externalSignal_BlankSource_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new ExternalSignal(null));
        assertThrows(IllegalArgumentException.class, () -> new ExternalSignal(" "));
    }

    @Test
    void runnerFailure_InvalidArguments_ThrowsException() {
        RuntimeException error = new RuntimeException("boom");

        assertThrows(IllegalArgumentException.class, () -> new RunnerFailure("", error));
        assertThrows(IllegalArgumentException.class, () -> new RunnerFailure("worker", null));
    }

    @Test
    void allCompleted_Singleton() {
        assertSame(AllCompleted.instance(), AllCompleted.instance());
        assertEquals(new AllCompleted(), AllCompleted.instance());
    }
}
