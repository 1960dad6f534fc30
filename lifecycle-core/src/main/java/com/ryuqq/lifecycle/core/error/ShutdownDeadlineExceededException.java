package com.ryuqq.lifecycle.core.error;

import com.ryuqq.lifecycle.core.reason.RunnerFailure;
import com.ryuqq.lifecycle.core.reason.ShutdownReason;

/**
 * 취소 이후 Runner 종료 대기가 shutdown timeout을 초과함 (강제 종료).
 *
 * <p>항상 치명적이며, 보고 시 다른 모든 사유보다 우선합니다.
 * 원래의 종료 사유는 {@link #getReason()}으로 보존됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ShutdownDeadlineExceededException extends LifecycleException {

    private final long shutdownTimeoutMs;
    private final int pendingRunners;
    private final transient ShutdownReason reason;

    /**
     * 생성자.
     *
     * @param shutdownTimeoutMs 적용된 shutdown timeout (밀리초)
     * @param pendingRunners timeout 시점에 아직 반환하지 않은 Runner 수
     * @param reason 종료를 유발한 원래 사유
     */
    public ShutdownDeadlineExceededException(long shutdownTimeoutMs, int pendingRunners, ShutdownReason reason) {
        super(String.format("shutdown deadline exceeded after %dms: %d runner(s) still running (reason: %s)",
            shutdownTimeoutMs, pendingRunners, reason), reasonError(reason));
        this.shutdownTimeoutMs = shutdownTimeoutMs;
        this.pendingRunners = pendingRunners;
        this.reason = reason;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public int getPendingRunners() {
        return pendingRunners;
    }

    public ShutdownReason getReason() {
        return reason;
    }

    private static Throwable reasonError(ShutdownReason reason) {
        if (reason instanceof RunnerFailure failure) {
            return failure.error();
        }
        return null;
    }
}
