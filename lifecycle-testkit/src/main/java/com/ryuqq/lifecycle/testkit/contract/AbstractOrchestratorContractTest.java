package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.adapter.inmemory.signal.ManualShutdownSignalSource;
import com.ryuqq.lifecycle.application.orchestrator.Orchestrator;
import com.ryuqq.lifecycle.application.orchestrator.RunResult;
import com.ryuqq.lifecycle.application.orchestrator.TerminationCategory;
import com.ryuqq.lifecycle.application.orchestrator.TerminationCause;
import com.ryuqq.lifecycle.core.error.CleanupFailureException;
import com.ryuqq.lifecycle.core.error.RunnerFailureException;
import com.ryuqq.lifecycle.core.error.ShutdownDeadlineExceededException;
import com.ryuqq.lifecycle.core.outcome.Outcome;
import com.ryuqq.lifecycle.core.reason.ExternalSignal;
import com.ryuqq.lifecycle.core.reason.RunnerFailure;
import com.ryuqq.lifecycle.core.runner.Runner;
import com.ryuqq.lifecycle.core.runner.Runners;
import com.ryuqq.lifecycle.core.spi.CleanupHook;
import com.ryuqq.lifecycle.core.spi.ShutdownSignalSource;
import com.ryuqq.lifecycle.testkit.fixture.RecordingCleanupHook;
import com.ryuqq.lifecycle.testkit.fixture.TestRunners;
import com.ryuqq.lifecycle.testkit.fixture.TestRunners.BlockingRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Orchestrator 구현체가 만족해야 하는 동작 계약.
 *
 * <p>구현체 테스트는 이 클래스를 상속하고 {@link #createOrchestrator}만 구현하면 됩니다.</p>
 *
 * <p><strong>검증 시나리오:</strong></p>
 * <ul>
 *   <li>Runner 0개 / N개 모두 성공 → 성공</li>
 *   <li>한 Runner 실패 → 나머지 취소, RunnerFailure 보고</li>
 *   <li>동시 실패 → 하나만 사유로 채택, deadlock 없음</li>
 *   <li>취소를 무시하는 Runner → shutdown timeout 후 forced</li>
 *   <li>cleanup은 모든 경로에서 정확히 한 번</li>
 *   <li>오류 우선순위 (forced &gt; Runner 실패 &gt; cleanup 실패)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * class MyOrchestratorContractTest extends AbstractOrchestratorContractTest {
 *     {@literal @}Override
 *     protected Orchestrator createOrchestrator(List&lt;Runner&gt; runners, CleanupHook cleanup,
 *                                               long shutdownTimeoutMs, ShutdownSignalSource signals) {
 *         return new MyOrchestrator(runners, cleanup, shutdownTimeoutMs, signals);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractOrchestratorContractTest {

    protected static final Duration RESULT_TIMEOUT = Duration.ofSeconds(10);

    protected ManualShutdownSignalSource signals;

    @BeforeEach
    void setUpSignals() {
        signals = new ManualShutdownSignalSource();
    }

    /**
     * 테스트 대상 Orchestrator 생성.
     *
     * @param runners 실행할 Runner
     * @param cleanupOrNull cleanup hook (없으면 null)
     * @param shutdownTimeoutMs shutdown timeout (밀리초)
     * @param signalSource 외부 종료 신호 출처
     * @return IDLE 상태의 Orchestrator
     */
    protected abstract Orchestrator createOrchestrator(List<Runner> runners, CleanupHook cleanupOrNull,
                                                       long shutdownTimeoutMs, ShutdownSignalSource signalSource);

    // ========================================
    // 정상 종료
    // ========================================

    @Test
    @DisplayName("Runner가 없으면 즉시 AllCompleted로 성공하고 cleanup을 한 번 실행한다")
    void Runner가_없으면_즉시_성공() throws Exception {
        // given
        RecordingCleanupHook cleanup = RecordingCleanupHook.succeeding();

        // when
        RunResult result = runToCompletion(createOrchestrator(List.of(), cleanup, 1000, signals));

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCause()).isEqualTo(TerminationCause.ALL_COMPLETED);
        assertThat(result.getExitCode()).isZero();
        assertThat(cleanup.invocations()).isEqualTo(1);
    }

    @Test
    @DisplayName("[A: 10ms, B: 20ms], timeout 1s → 성공, cleanup 1회, 약 20ms")
    void 모든_Runner가_성공하면_성공() throws Exception {
        // given
        RecordingCleanupHook cleanup = RecordingCleanupHook.succeeding();
        List<Runner> runners = List.of(
            TestRunners.succeedAfter(Duration.ofMillis(10)),
            TestRunners.succeedAfter(Duration.ofMillis(20))
        );

        // when
        RunResult result = runToCompletion(createOrchestrator(runners, cleanup, 1000, signals));

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isAllCompleted()).isTrue();
        assertThat(result.getCategory()).isEqualTo(TerminationCategory.SUCCESS);
        assertThat(cleanup.invocations()).isEqualTo(1);
        assertThat(result.getElapsed()).isGreaterThanOrEqualTo(Duration.ofMillis(20));
        assertThat(result.getElapsed()).isLessThan(Duration.ofMillis(1000));
    }

    @Test
    void Cancelled_결과는_실패로_취급하지_않는다() throws Exception {
        // given
        List<Runner> runners = List.of(
            signal -> Outcome.cancelled(),
            TestRunners.succeedAfter(Duration.ofMillis(10))
        );

        // when
        RunResult result = runToCompletion(createOrchestrator(runners, null, 1000, signals));

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCause()).isEqualTo(TerminationCause.ALL_COMPLETED);
    }

    @Test
    void 외부_신호를_받으면_모든_Runner를_취소하고_성공으로_종료한다() throws Exception {
        // given
        BlockingRunner first = TestRunners.blockUntilCancelled();
        BlockingRunner second = TestRunners.blockUntilCancelled();
        RecordingCleanupHook cleanup = RecordingCleanupHook.succeeding();
        Orchestrator orchestrator = createOrchestrator(List.of(first, second), cleanup, 5000, signals);

        // when
        CompletableFuture<RunResult> future = runAsync(orchestrator);
        assertThat(first.awaitStarted(RESULT_TIMEOUT)).isTrue();
        assertThat(second.awaitStarted(RESULT_TIMEOUT)).isTrue();
        awaitSubscribed();
        signals.trigger("SIGTERM");
        RunResult result = await(future);

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCause()).isEqualTo(TerminationCause.EXTERNAL_SIGNAL);
        assertThat(result.getReason()).isEqualTo(new ExternalSignal("SIGTERM"));
        assertThat(first.wasCancelled()).isTrue();
        assertThat(second.wasCancelled()).isTrue();
        assertThat(cleanup.invocations()).isEqualTo(1);
    }

    @Test
    @DisplayName("SIGTERM 후 취소 처리 중 'flusher' 실패 → RunnerFailureException, exit 1, 사유는 ExternalSignal")
    void 외부_신호_후_취소_처리_중_Runner가_실패하면_실패로_보고한다() throws Exception {
        // given
        CountDownLatch started = new CountDownLatch(1);
        RuntimeException flushError = new RuntimeException("flush failed during shutdown");
        Runner flusher = Runners.named("flusher", signal -> {
            started.countDown();
            signal.await();
            return Outcome.failure(flushError);
        });
        RecordingCleanupHook cleanup = RecordingCleanupHook.succeeding();
        Orchestrator orchestrator = createOrchestrator(List.of(flusher), cleanup, 5000, signals);

        // when
        CompletableFuture<RunResult> future = runAsync(orchestrator);
        assertThat(started.await(RESULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();
        awaitSubscribed();
        signals.trigger("SIGTERM");
        RunResult result = await(future);

        // then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getCategory()).isEqualTo(TerminationCategory.GRACEFUL_FAILURE);
        assertThat(result.getCause()).isEqualTo(TerminationCause.RUNNER_FAILURE);
        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getReason()).isEqualTo(new ExternalSignal("SIGTERM"));
        assertThat(result.getErrorOrNull())
            .isInstanceOf(RunnerFailureException.class)
            .hasCause(flushError);
        assertThat(((RunnerFailureException) result.getErrorOrNull()).getRunnerLabel()).isEqualTo("flusher");
        assertThat(cleanup.invocations()).isEqualTo(1);
    }

    // ========================================
    // Runner 실패
    // ========================================

    @Test
    @DisplayName("[A: 취소 대기, B: 'boom' 실패], 5s → RunnerFailure('boom'), A는 조기 취소")
    void 한_Runner가_실패하면_나머지를_취소하고_실패를_보고한다() throws Exception {
        // given
        BlockingRunner blocking = TestRunners.blockUntilCancelled();
        IllegalStateException boom = new IllegalStateException("boom");
        RecordingCleanupHook cleanup = RecordingCleanupHook.succeeding();
        List<Runner> runners = List.of(blocking, TestRunners.failAfter(Duration.ofMillis(20), boom));

        // when
        RunResult result = runToCompletion(createOrchestrator(runners, cleanup, 5000, signals));

        // then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getCause()).isEqualTo(TerminationCause.RUNNER_FAILURE);
        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getReason()).isInstanceOf(RunnerFailure.class);
        assertThat(result.getErrorOrNull())
            .isInstanceOf(RunnerFailureException.class)
            .hasCause(boom);
        assertThat(blocking.wasCancelled()).isTrue();
        assertThat(result.getElapsed()).isLessThan(Duration.ofMillis(5000));
        assertThat(cleanup.invocations()).isEqualTo(1);
    }

    @Test
    void 예외를_던진_Runner는_라벨과_함께_실패로_보고된다() throws Exception {
        // given
        Runner database = Runners.named("database", TestRunners.throwing(new java.io.IOException("connection reset")));

        // when
        RunResult result = runToCompletion(createOrchestrator(List.of(database), null, 1000, signals));

        // then
        assertThat(result.getCause()).isEqualTo(TerminationCause.RUNNER_FAILURE);
        RunnerFailureException error = (RunnerFailureException) result.getErrorOrNull();
        assertThat(error.getRunnerLabel()).isEqualTo("database");
        assertThat(error).hasMessageContaining("database").hasMessageContaining("connection reset");
    }

    @Test
    void 동시에_실패한_Runner_중_하나만_사유로_채택된다() throws Exception {
        // given
        CountDownLatch gate = new CountDownLatch(1);
        RuntimeException first = new RuntimeException("first");
        RuntimeException second = new RuntimeException("second");
        List<Runner> runners = List.of(
            signal -> {
                gate.await();
                return Outcome.failure(first);
            },
            signal -> {
                gate.await();
                return Outcome.failure(second);
            }
        );
        Orchestrator orchestrator = createOrchestrator(runners, null, 5000, signals);

        // when
        CompletableFuture<RunResult> future = runAsync(orchestrator);
        gate.countDown();
        RunResult result = await(future);

        // then
        assertThat(result.getCause()).isEqualTo(TerminationCause.RUNNER_FAILURE);
        Throwable surfaced = result.getErrorOrNull().getCause();
        assertThat(surfaced).isIn(first, second);
        assertThat(result.getDiscardedFailures()).hasSize(1);
        assertThat(result.getDiscardedFailures().get(0).error()).isIn(first, second).isNotSameAs(surfaced);
        assertThat(result.getErrorOrNull().getSuppressed()).hasSize(1);
    }

    // ========================================
    // 강제 종료
    // ========================================

    @Test
    @DisplayName("[A: 취소 무시 10s], 200ms, 외부 신호 → 약 200ms에 deadline exceeded")
    void 취소를_무시하는_Runner는_shutdown_timeout_후_강제_종료된다() throws Exception {
        // given
        RecordingCleanupHook cleanup = RecordingCleanupHook.succeeding();
        Orchestrator orchestrator = createOrchestrator(
            List.of(TestRunners.ignoreCancellation(Duration.ofSeconds(10))), cleanup, 200, signals);

        // when
        CompletableFuture<RunResult> future = runAsync(orchestrator);
        awaitSubscribed();
        long signalledAt = System.nanoTime();
        signals.trigger("SIGTERM");
        RunResult result = await(future);
        long shutdownMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - signalledAt);

        // then
        assertThat(result.isForced()).isTrue();
        assertThat(result.getCategory()).isEqualTo(TerminationCategory.FORCED);
        assertThat(result.getExitCode()).isEqualTo(2);
        assertThat(result.getErrorOrNull()).isInstanceOf(ShutdownDeadlineExceededException.class);
        assertThat(((ShutdownDeadlineExceededException) result.getErrorOrNull()).getPendingRunners()).isEqualTo(1);
        assertThat(shutdownMs).isBetween(150L, 5000L);
        assertThat(cleanup.invocations()).isEqualTo(1);
    }

    @Test
    void 강제_종료는_Runner_실패보다_우선한다() throws Exception {
        // given
        IllegalStateException boom = new IllegalStateException("boom");
        List<Runner> runners = List.of(
            TestRunners.ignoreCancellation(Duration.ofSeconds(10)),
            TestRunners.failAfter(Duration.ofMillis(10), boom)
        );

        // when
        RunResult result = runToCompletion(createOrchestrator(runners, null, 200, signals));

        // then
        assertThat(result.getCause()).isEqualTo(TerminationCause.SHUTDOWN_DEADLINE_EXCEEDED);
        assertThat(result.getReason()).isInstanceOf(RunnerFailure.class);
        assertThat(result.getErrorOrNull()).hasCause(boom);
    }

    // ========================================
    // Cleanup
    // ========================================

    @Test
    void 모든_Runner가_성공하고_cleanup이_실패하면_cleanup_실패를_보고한다() throws Exception {
        // given
        RecordingCleanupHook cleanup = RecordingCleanupHook.failingWith(new IllegalStateException("close failed"));

        // when
        RunResult result = runToCompletion(createOrchestrator(
            List.of(TestRunners.succeedAfter(Duration.ofMillis(5))), cleanup, 1000, signals));

        // then
        assertThat(result.getCause()).isEqualTo(TerminationCause.CLEANUP_FAILURE);
        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getErrorOrNull()).isInstanceOf(CleanupFailureException.class);
        assertThat(result.getCleanupErrorOrNull()).hasRootCauseMessage("close failed");
        assertThat(cleanup.invocations()).isEqualTo(1);
    }

    @Test
    void Runner_실패는_cleanup_실패보다_우선하지만_cleanup_오류도_기록된다() throws Exception {
        // given
        RecordingCleanupHook cleanup = RecordingCleanupHook.failingWith(new IllegalStateException("close failed"));
        IllegalStateException boom = new IllegalStateException("boom");

        // when
        RunResult result = runToCompletion(createOrchestrator(
            List.of(TestRunners.failImmediately(boom)), cleanup, 1000, signals));

        // then
        assertThat(result.getCause()).isEqualTo(TerminationCause.RUNNER_FAILURE);
        assertThat(result.getErrorOrNull()).hasCause(boom);
        assertThat(result.getCleanupErrorOrNull()).isNotNull();
        assertThat(cleanup.invocations()).isEqualTo(1);
    }

    @Test
    void cleanup은_제한_시간이_있는_새_신호를_받는다() throws Exception {
        // given
        RecordingCleanupHook cleanup = RecordingCleanupHook.succeeding();

        // when
        runToCompletion(createOrchestrator(List.of(TestRunners.succeedAfter(Duration.ofMillis(5))), cleanup, 1000, signals));

        // then
        assertThat(cleanup.lastSignal()).isNotNull();
        assertThat(cleanup.lastSignal().deadline()).isPresent();
    }

    // ========================================
    // 생명주기
    // ========================================

    @Test
    void run은_한_번만_호출할_수_있다() throws Exception {
        // given
        Orchestrator orchestrator = createOrchestrator(List.of(), null, 1000, signals);
        runToCompletion(orchestrator);

        // when & then
        assertThatThrownBy(orchestrator::run).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 종료_후_신호_구독이_해제된다() throws Exception {
        // when
        runToCompletion(createOrchestrator(List.of(TestRunners.succeedAfter(Duration.ofMillis(5))), null, 1000, signals));

        // then
        assertThat(signals.activeSubscriptions()).isZero();
    }

    // ========================================
    // Helper Methods
    // ========================================

    /**
     * 별도 스레드에서 run()을 실행하고 제한 시간 내 결과를 기다립니다.
     */
    protected RunResult runToCompletion(Orchestrator orchestrator) throws Exception {
        return await(runAsync(orchestrator));
    }

    protected CompletableFuture<RunResult> runAsync(Orchestrator orchestrator) {
        CompletableFuture<RunResult> future = new CompletableFuture<>();
        Thread thread = new Thread(() -> {
            try {
                future.complete(orchestrator.run());
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        }, "contract-orchestrator");
        thread.setDaemon(true);
        thread.start();
        return future;
    }

    protected RunResult await(CompletableFuture<RunResult> future) throws Exception {
        return future.get(RESULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Orchestrator가 종료 신호를 구독할 때까지 대기.
     */
    protected void awaitSubscribed() throws InterruptedException {
        long deadline = System.nanoTime() + RESULT_TIMEOUT.toNanos();
        while (signals.activeSubscriptions() == 0) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("orchestrator did not subscribe to shutdown signals");
            }
            Thread.sleep(5);
        }
    }
}
