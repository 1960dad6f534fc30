package com.ryuqq.lifecycle.core.error;

/**
 * Cleanup hook이 오류를 반환함.
 *
 * <p>다른 오류가 우선하더라도 항상 기록되며, 나머지가 모두 성공한 경우에만
 * 최상위 실패 사유가 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CleanupFailureException extends LifecycleException {

    /**
     * 생성자.
     *
     * @param cause cleanup hook이 던진 오류
     */
    public CleanupFailureException(Throwable cause) {
        super("cleanup failed: " + cause.getMessage(), cause);
    }
}
