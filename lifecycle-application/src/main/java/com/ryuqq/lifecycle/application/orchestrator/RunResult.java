package com.ryuqq.lifecycle.application.orchestrator;

import com.ryuqq.lifecycle.core.error.CleanupFailureException;
import com.ryuqq.lifecycle.core.error.LifecycleException;
import com.ryuqq.lifecycle.core.error.RunnerFailureException;
import com.ryuqq.lifecycle.core.error.ShutdownDeadlineExceededException;
import com.ryuqq.lifecycle.core.reason.AllCompleted;
import com.ryuqq.lifecycle.core.reason.ExternalSignal;
import com.ryuqq.lifecycle.core.reason.RunnerFailure;
import com.ryuqq.lifecycle.core.reason.ShutdownReason;

import java.time.Duration;
import java.util.List;

/**
 * Orchestration 실행 결과.
 *
 * <p>종료 사유, 강제 종료 여부, 노출할 단일 최상위 오류, 별도로 기록된 cleanup 오류를 담습니다.</p>
 *
 * <p><strong>오류 우선순위 ({@link #aggregate}):</strong></p>
 * <ol>
 *   <li>강제 종료 → {@link ShutdownDeadlineExceededException} (FORCED)</li>
 *   <li>사유가 RunnerFailure → {@link RunnerFailureException} (GRACEFUL_FAILURE)</li>
 *   <li>사유가 ExternalSignal이지만 종료 중 Runner가 실패 → 첫 실패의 {@link RunnerFailureException}
 *       (GRACEFUL_FAILURE, 사유는 ExternalSignal 유지)</li>
 *   <li>cleanup 오류 → {@link CleanupFailureException} (GRACEFUL_FAILURE)</li>
 *   <li>그 외 → 성공 (SUCCESS)</li>
 * </ol>
 *
 * <p>사유로 채택되지 못한 Runner 실패는 {@link #getDiscardedFailures()}에 남고,
 * 최상위 오류로 쓰이지 않은 실패는 모두 suppressed로 첨부됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunResult {

    private final ShutdownReason reason;
    private final TerminationCause cause;
    private final LifecycleException errorOrNull;
    private final CleanupFailureException cleanupErrorOrNull;
    private final List<RunnerFailure> discardedFailures;
    private final Duration elapsed;

    private RunResult(ShutdownReason reason, TerminationCause cause, LifecycleException errorOrNull,
                      CleanupFailureException cleanupErrorOrNull, List<RunnerFailure> discardedFailures,
                      Duration elapsed) {
        this.reason = reason;
        this.cause = cause;
        this.errorOrNull = errorOrNull;
        this.cleanupErrorOrNull = cleanupErrorOrNull;
        this.discardedFailures = discardedFailures;
        this.elapsed = elapsed;
    }

    /**
     * 종료 단계의 관찰 결과를 우선순위에 따라 집계.
     *
     * @param reason 첫 번째 트리거가 결정한 종료 사유
     * @param deadlineErrorOrNull 강제 종료된 경우의 오류 (아니면 null)
     * @param cleanupErrorOrNull cleanup hook 오류 (없으면 null)
     * @param discardedFailures 사유가 되지 못한 Runner 실패 목록
     * @param elapsed run() 시작부터 종료까지 걸린 시간
     * @return RunResult
     * @throws IllegalArgumentException reason, discardedFailures 또는 elapsed가 null인 경우
     */
    public static RunResult aggregate(ShutdownReason reason,
                                      ShutdownDeadlineExceededException deadlineErrorOrNull,
                                      CleanupFailureException cleanupErrorOrNull,
                                      List<RunnerFailure> discardedFailures,
                                      Duration elapsed) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (discardedFailures == null) {
            throw new IllegalArgumentException("discardedFailures cannot be null");
        }
        if (elapsed == null) {
            throw new IllegalArgumentException("elapsed cannot be null");
        }

        TerminationCause cause;
        LifecycleException error;
        int surfacedDiscarded = 0;
        if (deadlineErrorOrNull != null) {
            cause = TerminationCause.SHUTDOWN_DEADLINE_EXCEEDED;
            error = deadlineErrorOrNull;
        } else if (reason instanceof RunnerFailure failure) {
            cause = TerminationCause.RUNNER_FAILURE;
            error = new RunnerFailureException(failure.runnerLabel(), failure.error());
        } else if (reason instanceof ExternalSignal && !discardedFailures.isEmpty()) {
            // 신호에 의한 종료 중 실패한 Runner
            RunnerFailure first = discardedFailures.get(0);
            cause = TerminationCause.RUNNER_FAILURE;
            error = new RunnerFailureException(first.runnerLabel(), first.error());
            surfacedDiscarded = 1;
        } else if (cleanupErrorOrNull != null) {
            cause = TerminationCause.CLEANUP_FAILURE;
            error = cleanupErrorOrNull;
        } else {
            cause = reason instanceof ExternalSignal ? TerminationCause.EXTERNAL_SIGNAL : TerminationCause.ALL_COMPLETED;
            error = null;
        }

        if (error != null) {
            for (RunnerFailure discarded : discardedFailures.subList(surfacedDiscarded, discardedFailures.size())) {
                error.addSuppressed(discarded.error());
            }
        }

        return new RunResult(reason, cause, error, cleanupErrorOrNull, List.copyOf(discardedFailures), elapsed);
    }

    /**
     * 종료 사유 조회.
     *
     * @return 첫 번째 트리거가 결정한 사유 (non-null)
     */
    public ShutdownReason getReason() {
        return reason;
    }

    /**
     * 종료 원인 조회.
     *
     * @return 최종 결과를 결정한 원인
     */
    public TerminationCause getCause() {
        return cause;
    }

    /**
     * 결과 분류 조회.
     *
     * @return SUCCESS, GRACEFUL_FAILURE 또는 FORCED
     */
    public TerminationCategory getCategory() {
        return cause.category();
    }

    /**
     * 성공 여부.
     *
     * @return 최상위 오류가 없는 경우 true
     */
    public boolean isSuccess() {
        return errorOrNull == null;
    }

    /**
     * 강제 종료 여부.
     *
     * @return shutdown timeout이 Runner drain보다 먼저 경과한 경우 true
     */
    public boolean isForced() {
        return cause == TerminationCause.SHUTDOWN_DEADLINE_EXCEEDED;
    }

    /**
     * 노출할 단일 최상위 오류 조회.
     *
     * @return 최상위 오류 또는 null (성공 시)
     */
    public LifecycleException getErrorOrNull() {
        return errorOrNull;
    }

    /**
     * Cleanup hook 오류 조회.
     *
     * <p><strong>주의:</strong> 다른 오류가 우선하여 최상위 오류가 아니더라도 항상 기록됩니다.</p>
     *
     * @return cleanup 오류 또는 null
     */
    public CleanupFailureException getCleanupErrorOrNull() {
        return cleanupErrorOrNull;
    }

    /**
     * 사유가 되지 못한 Runner 실패 목록 조회.
     *
     * @return 불변 목록 (관찰 순서)
     */
    public List<RunnerFailure> getDiscardedFailures() {
        return discardedFailures;
    }

    /**
     * 실행 시간 조회.
     *
     * @return run() 시작부터 결과 집계까지 걸린 시간
     */
    public Duration getElapsed() {
        return elapsed;
    }

    /**
     * 프로세스 종료 코드.
     *
     * @return 0 (SUCCESS), 1 (GRACEFUL_FAILURE), 2 (FORCED)
     */
    public int getExitCode() {
        return getCategory().exitCode();
    }

    /**
     * 완료 사유인지 확인 (편의 메서드).
     *
     * @return 사유가 AllCompleted인 경우 true
     */
    public boolean isAllCompleted() {
        return reason instanceof AllCompleted;
    }

    @Override
    public String toString() {
        return "RunResult{cause=" + cause + ", reason=" + reason + ", elapsed=" + elapsed.toMillis() + "ms"
            + (errorOrNull != null ? ", error=" + errorOrNull.getMessage() : "")
            + (cleanupErrorOrNull != null && cleanupErrorOrNull != errorOrNull
                ? ", cleanupError=" + cleanupErrorOrNull.getMessage() : "")
            + "}";
    }
}
