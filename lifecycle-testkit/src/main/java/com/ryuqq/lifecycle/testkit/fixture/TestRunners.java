package com.ryuqq.lifecycle.testkit.fixture;

import com.ryuqq.lifecycle.core.outcome.Outcome;
import com.ryuqq.lifecycle.core.runner.Runner;
import com.ryuqq.lifecycle.core.signal.CancellationSignal;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Factory methods for runners with scripted behaviour.
 *
 * <p><strong>Available Runners:</strong></p>
 * <ul>
 *   <li>{@link #succeedAfter(Duration)}: succeeds after a delay unless cancelled first</li>
 *   <li>{@link #failAfter(Duration, Throwable)}: returns a Failure after a delay</li>
 *   <li>{@link #failImmediately(Throwable)}: returns a Failure at once</li>
 *   <li>{@link #throwing(Exception)}: throws instead of returning an outcome</li>
 *   <li>{@link #blockUntilCancelled()}: waits for cancellation, records that it observed it</li>
 *   <li>{@link #ignoreCancellation(Duration)}: sleeps without ever looking at the signal</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TestRunners {

    // Utility class - prevent instantiation
    private TestRunners() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Runner succeedAfter(Duration delay) {
        return signal -> signal.await(delay) ? Outcome.cancelled() : Outcome.success();
    }

    public static Runner failAfter(Duration delay, Throwable error) {
        return signal -> {
            signal.await(delay);
            return Outcome.failure(error);
        };
    }

    public static Runner failImmediately(Throwable error) {
        return signal -> Outcome.failure(error);
    }

    public static Runner throwing(Exception error) {
        return signal -> {
            throw error;
        };
    }

    public static BlockingRunner blockUntilCancelled() {
        return new BlockingRunner();
    }

    public static Runner ignoreCancellation(Duration duration) {
        return signal -> {
            Thread.sleep(duration.toMillis());
            return Outcome.success();
        };
    }

    /**
     * Runner that blocks until its signal is cancelled.
     */
    public static final class BlockingRunner implements Runner {

        private final CountDownLatch started = new CountDownLatch(1);
        private final AtomicBoolean cancelled = new AtomicBoolean();

        private BlockingRunner() {
        }

        @Override
        public Outcome run(CancellationSignal signal) throws InterruptedException {
            started.countDown();
            signal.await();
            cancelled.set(true);
            return Outcome.cancelled();
        }

        /**
         * Waits until {@link #run} has been entered.
         *
         * @return true if the runner started within the timeout
         */
        public boolean awaitStarted(Duration timeout) throws InterruptedException {
            return started.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        public boolean isStarted() {
            return started.getCount() == 0;
        }

        public boolean wasCancelled() {
            return cancelled.get();
        }
    }
}
