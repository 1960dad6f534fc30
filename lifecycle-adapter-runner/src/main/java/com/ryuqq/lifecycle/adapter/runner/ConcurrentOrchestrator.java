package com.ryuqq.lifecycle.adapter.runner;

import com.ryuqq.lifecycle.application.orchestrator.Orchestrator;
import com.ryuqq.lifecycle.application.orchestrator.RunResult;
import com.ryuqq.lifecycle.core.error.CleanupFailureException;
import com.ryuqq.lifecycle.core.error.ShutdownDeadlineExceededException;
import com.ryuqq.lifecycle.core.outcome.Failure;
import com.ryuqq.lifecycle.core.outcome.Outcome;
import com.ryuqq.lifecycle.core.reason.AllCompleted;
import com.ryuqq.lifecycle.core.reason.ExternalSignal;
import com.ryuqq.lifecycle.core.reason.RunnerFailure;
import com.ryuqq.lifecycle.core.reason.ShutdownReason;
import com.ryuqq.lifecycle.core.runner.Runner;
import com.ryuqq.lifecycle.core.runner.Runners;
import com.ryuqq.lifecycle.core.signal.CancellationSignal;
import com.ryuqq.lifecycle.core.signal.CancellationSource;
import com.ryuqq.lifecycle.core.spi.CleanupHook;
import com.ryuqq.lifecycle.core.spi.ShutdownSignalSource;
import com.ryuqq.lifecycle.core.spi.SignalSubscription;
import com.ryuqq.lifecycle.core.statemachine.OrchestratorState;
import com.ryuqq.lifecycle.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 스레드 기반 Orchestrator 구현체.
 *
 * <p>Runner마다 전용 스레드를 할당하고, 호출 스레드가 종료 절차를 조정합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run() 호출 (IDLE → RUNNING)
 *   ↓
 * 종료 신호 구독 + Runner N개 시작 (공유 CancellationSignal 전달)
 *   ↓
 * ShutdownTrigger 대기: 외부 신호 | 첫 Failure | 마지막 Runner 반환
 *   ↓
 * RUNNING → SHUTTING_DOWN
 *   1. 취소 전파 (root.cancel())
 *   2. 최대 shutdownTimeoutMs 동안 Runner 반환 대기
 *      - 초과 시 forced: 더 이상 기다리지 않음 (스레드 중단 없음)
 *   3. cleanup hook 실행 (cleanupTimeoutMs 제한 신호)
 *   ↓
 * SHUTTING_DOWN → TERMINATED → RunResult 집계
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>공유 가변 상태는 CancellationSource(1회 기록)와 ShutdownTrigger(첫 기록 채택)뿐</li>
 *   <li>Runner 스레드는 daemon이므로 forced 이후 남은 Runner가 JVM 종료를 막지 않음</li>
 *   <li>cleanup은 취소 전에 시작되지 않으며, forced가 아니면 모든 Runner 반환 후 시작</li>
 * </ul>
 *
 * <p><strong>인터럽트:</strong> 첫 트리거 대기 중 호출 스레드가 인터럽트되면
 * 출처가 "interrupt"인 외부 신호로 처리하고, drain 중 인터럽트되면 forced로 처리합니다.
 * 어느 경우든 run() 반환 전에 인터럽트 플래그를 복원합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConcurrentOrchestrator implements Orchestrator {

    static final String INTERRUPT_SOURCE = "interrupt";

    private static final Logger DEFAULT_LOG = LoggerFactory.getLogger(ConcurrentOrchestrator.class);

    private final List<Runner> runners;
    private final CleanupHook cleanupOrNull;
    private final OrchestratorConfig config;
    private final ShutdownSignalSource signalSource;
    private final ThreadFactory threadFactory;
    private final Logger log;

    private final AtomicReference<OrchestratorState> state = new AtomicReference<>(OrchestratorState.IDLE);
    private final AtomicBoolean interrupted = new AtomicBoolean();

    /**
     * 생성자 (기본 RunnerThreadFactory, 기본 Logger 사용).
     *
     * @param runners 실행할 Runner 목록
     * @param cleanupOrNull cleanup hook (없으면 null)
     * @param config 설정
     * @param signalSource 외부 종료 신호 출처
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ConcurrentOrchestrator(List<Runner> runners, CleanupHook cleanupOrNull,
                                  OrchestratorConfig config, ShutdownSignalSource signalSource) {
        this(runners, cleanupOrNull, config, signalSource, new RunnerThreadFactory(), DEFAULT_LOG);
    }

    /**
     * 생성자 (커스텀 ThreadFactory, Logger 주입).
     *
     * @param runners 실행할 Runner 목록
     * @param cleanupOrNull cleanup hook (없으면 null)
     * @param config 설정
     * @param signalSource 외부 종료 신호 출처
     * @param threadFactory Runner 스레드 팩토리
     * @param logger 생명주기 로그를 기록할 Logger
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ConcurrentOrchestrator(List<Runner> runners, CleanupHook cleanupOrNull,
                                  OrchestratorConfig config, ShutdownSignalSource signalSource,
                                  ThreadFactory threadFactory, Logger logger) {
        if (runners == null) {
            throw new IllegalArgumentException("runners cannot be null");
        }
        for (Runner runner : runners) {
            if (runner == null) {
                throw new IllegalArgumentException("runners cannot contain null");
            }
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (signalSource == null) {
            throw new IllegalArgumentException("signalSource cannot be null");
        }
        if (threadFactory == null) {
            throw new IllegalArgumentException("threadFactory cannot be null");
        }
        if (logger == null) {
            throw new IllegalArgumentException("logger cannot be null");
        }

        this.runners = List.copyOf(runners);
        this.cleanupOrNull = cleanupOrNull;
        this.config = config;
        this.signalSource = signalSource;
        this.threadFactory = threadFactory;
        this.log = logger;
    }

    /**
     * 현재 상태 조회.
     *
     * @return IDLE, RUNNING, SHUTTING_DOWN 또는 TERMINATED
     */
    public OrchestratorState getState() {
        return state.get();
    }

    @Override
    public RunResult run() {
        transition(OrchestratorState.IDLE, OrchestratorState.RUNNING);
        long startNanos = System.nanoTime();

        ShutdownTrigger trigger = new ShutdownTrigger();
        CountDownLatch stopped = new CountDownLatch(runners.size());
        ExecutorService executor = runners.isEmpty()
            ? null
            : Executors.newFixedThreadPool(runners.size(), threadFactory);

        try (CancellationSource root = new CancellationSource();
             SignalSubscription subscription = signalSource.subscribe(source -> onExternalSignal(trigger, source))) {

            // 1. 모든 Runner 시작
            log.info("Starting {} runner(s)", runners.size());
            if (executor == null) {
                trigger.fire(AllCompleted.instance());
            } else {
                for (int i = 0; i < runners.size(); i++) {
                    int index = i;
                    executor.execute(() -> runOne(index, root.signal(), trigger, stopped));
                }
            }

            // 2. 첫 번째 트리거 대기
            ShutdownReason reason = awaitFirstTrigger(trigger);
            transition(OrchestratorState.RUNNING, OrchestratorState.SHUTTING_DOWN);
            log.info("Shutting down: {}", reason);

            // 3. 취소 전파 + drain
            propagateCancellation(root);
            ShutdownDeadlineExceededException deadlineError = drain(stopped, reason);

            // 4. cleanup
            CleanupFailureException cleanupError = runCleanup();
            transition(OrchestratorState.SHUTTING_DOWN, OrchestratorState.TERMINATED);

            // 5. 결과 집계
            RunResult result = RunResult.aggregate(
                reason,
                deadlineError,
                cleanupError,
                trigger.discardedFailures(),
                Duration.ofNanos(System.nanoTime() - startNanos)
            );
            log.info("Orchestration terminated: {}", result);
            return result;

        } finally {
            if (executor != null) {
                // 남은 Runner를 중단하지 않음 (협력적 취소만 사용)
                executor.shutdown();
            }
            if (interrupted.get()) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void runOne(int index, CancellationSignal signal, ShutdownTrigger trigger, CountDownLatch stopped) {
        Runner runner = runners.get(index);
        String label = Runners.labelOf(runner, index);
        log.debug("Runner {} started", label);

        try {
            Outcome outcome = Runners.invoke(runner, signal);
            if (outcome instanceof Failure failure) {
                if (trigger.fire(new RunnerFailure(label, failure.error()))) {
                    log.error("Runner {} failed, initiating shutdown", label, failure.error());
                } else {
                    log.warn("Runner {} failed after shutdown was triggered; not used as shutdown reason",
                        label, failure.error());
                }
            } else {
                log.debug("Runner {} returned {}", label, outcome);
            }
        } finally {
            stopped.countDown();
            if (stopped.getCount() == 0) {
                trigger.fire(AllCompleted.instance());
            }
        }
    }

    private void onExternalSignal(ShutdownTrigger trigger, String source) {
        if (trigger.fire(new ExternalSignal(source))) {
            log.info("Received shutdown signal from {}", source);
        } else {
            log.debug("Ignoring shutdown signal from {}: shutdown already triggered", source);
        }
    }

    private ShutdownReason awaitFirstTrigger(ShutdownTrigger trigger) {
        try {
            return trigger.await();
        } catch (InterruptedException e) {
            // drain 동안은 플래그를 비워 두고 반환 직전에 복원
            interrupted.set(true);
            trigger.fire(new ExternalSignal(INTERRUPT_SOURCE));
            return trigger.reason().orElseThrow();
        }
    }

    private void propagateCancellation(CancellationSource root) {
        try {
            root.cancel();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed", e);
        }
    }

    private ShutdownDeadlineExceededException drain(CountDownLatch stopped, ShutdownReason reason) {
        try {
            if (stopped.await(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.debug("All runners stopped");
                return null;
            }
        } catch (InterruptedException e) {
            interrupted.set(true);
            log.warn("Interrupted while waiting for runners to stop");
        }

        int pending = (int) stopped.getCount();
        if (pending == 0) {
            return null;
        }
        log.warn("Shutdown deadline of {}ms exceeded: {} runner(s) still running, no longer waiting",
            config.shutdownTimeoutMs(), pending);
        return new ShutdownDeadlineExceededException(config.shutdownTimeoutMs(), pending, reason);
    }

    private CleanupFailureException runCleanup() {
        if (cleanupOrNull == null) {
            return null;
        }

        log.debug("Running cleanup (timeout {}ms)", config.cleanupTimeoutMs());
        try (CancellationSource bounded = CancellationSource.withTimeout(config.cleanupTimeout())) {
            cleanupOrNull.cleanup(bounded.signal());
            return null;
        } catch (InterruptedException e) {
            interrupted.set(true);
            log.error("Cleanup interrupted", e);
            return new CleanupFailureException(e);
        } catch (Exception e) {
            log.error("Cleanup failed", e);
            return new CleanupFailureException(e);
        }
    }

    private void transition(OrchestratorState from, OrchestratorState to) {
        StateTransition.validate(from, to);
        if (!state.compareAndSet(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", state.get(), to)
            );
        }
    }
}
