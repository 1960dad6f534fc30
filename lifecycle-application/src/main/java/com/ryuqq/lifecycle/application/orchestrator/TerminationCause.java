package com.ryuqq.lifecycle.application.orchestrator;

/**
 * 종료를 결정한 원인.
 *
 * <p>운영자가 "정상적인 신호 종료"와 "의존성 장애"를 구분할 수 있도록
 * 최종 결과에 어떤 범주가 작용했는지 나타냅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TerminationCause {

    /**
     * 모든 Runner가 반환함.
     */
    ALL_COMPLETED(TerminationCategory.SUCCESS),

    /**
     * 외부 종료 신호.
     */
    EXTERNAL_SIGNAL(TerminationCategory.SUCCESS),

    /**
     * Runner 실패.
     */
    RUNNER_FAILURE(TerminationCategory.GRACEFUL_FAILURE),

    /**
     * Cleanup hook 실패 (다른 오류가 없을 때만 원인이 됨).
     */
    CLEANUP_FAILURE(TerminationCategory.GRACEFUL_FAILURE),

    /**
     * Shutdown timeout 초과.
     */
    SHUTDOWN_DEADLINE_EXCEEDED(TerminationCategory.FORCED);

    private final TerminationCategory category;

    TerminationCause(TerminationCategory category) {
        this.category = category;
    }

    public TerminationCategory category() {
        return category;
    }
}
