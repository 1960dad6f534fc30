package com.ryuqq.lifecycle.testkit.fixture;

import com.ryuqq.lifecycle.core.signal.CancellationSignal;
import com.ryuqq.lifecycle.core.spi.CleanupHook;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cleanup hook that records its invocations and optionally fails.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingCleanupHook implements CleanupHook {

    private final Exception failureOrNull;
    private final AtomicInteger invocations = new AtomicInteger();
    private final AtomicReference<CancellationSignal> lastSignal = new AtomicReference<>();

    private RecordingCleanupHook(Exception failureOrNull) {
        this.failureOrNull = failureOrNull;
    }

    /**
     * Creates a hook that always succeeds.
     */
    public static RecordingCleanupHook succeeding() {
        return new RecordingCleanupHook(null);
    }

    /**
     * Creates a hook that throws the given exception on every invocation.
     *
     * @throws IllegalArgumentException if failure is null
     */
    public static RecordingCleanupHook failingWith(Exception failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        return new RecordingCleanupHook(failure);
    }

    @Override
    public void cleanup(CancellationSignal signal) throws Exception {
        invocations.incrementAndGet();
        lastSignal.set(signal);
        if (failureOrNull != null) {
            throw failureOrNull;
        }
    }

    public int invocations() {
        return invocations.get();
    }

    /**
     * @return the signal passed to the most recent invocation, or null if never invoked
     */
    public CancellationSignal lastSignal() {
        return lastSignal.get();
    }
}
