package com.ryuqq.lifecycle.core.reason;

/**
 * 모든 Runner가 정상(또는 취소) 반환하여 종료.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AllCompleted() implements ShutdownReason {

    private static final AllCompleted INSTANCE = new AllCompleted();

    /**
     * 공유 인스턴스 조회.
     *
     * @return AllCompleted 인스턴스
     */
    public static AllCompleted instance() {
        return INSTANCE;
    }
}
