package com.ryuqq.lifecycle.core.runner;

/**
 * Runner 로컬 오류 처리기.
 *
 * <p>Runner가 반환하기 전에 자신의 오류를 복구할 기회를 제공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RunnerErrorHandler {

    /**
     * 오류 처리.
     *
     * @param error Runner가 던지거나 Failure로 반환한 오류
     * @return 복구한 경우 null, 실패를 유지하려면 보고할 오류
     */
    Throwable handle(Throwable error);
}
