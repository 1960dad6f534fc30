package com.ryuqq.lifecycle.application.orchestrator;

/**
 * 호출 프로세스가 종료 상태로 변환할 3단계 결과 분류.
 *
 * <ul>
 *   <li>SUCCESS (exit 0): 전체 완료 또는 외부 신호에 의한 정상 종료</li>
 *   <li>GRACEFUL_FAILURE (exit 1): Runner 또는 cleanup 오류, 종료 자체는 제한 시간 내 완료</li>
 *   <li>FORCED (exit 2): shutdown timeout 초과로 대기 중단</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TerminationCategory {

    SUCCESS(0),
    GRACEFUL_FAILURE(1),
    FORCED(2);

    private final int exitCode;

    TerminationCategory(int exitCode) {
        this.exitCode = exitCode;
    }

    /**
     * 프로세스 종료 코드.
     *
     * @return 0 (성공) 또는 0이 아닌 값
     */
    public int exitCode() {
        return exitCode;
    }
}
