package com.ryuqq.lifecycle.core.statemachine;

/**
 * Orchestrator 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE
 *    │
 *    ▼ (run 호출, 모든 Runner 시작)
 * RUNNING
 *    │
 *    ▼ (첫 번째 트리거: 외부 신호 / Runner 실패 / 전체 완료)
 * SHUTTING_DOWN
 *    │
 *    ▼ (drain 완료 또는 shutdown timeout, cleanup 실행)
 * TERMINATED
 *
 * 금지된 전이:
 * - 역방향 전이 ❌
 * - 단계 건너뛰기 (예: IDLE → SHUTTING_DOWN) ❌
 * - TERMINATED → * ❌
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum OrchestratorState {

    /**
     * 시작 전 (Runner 목록과 cleanup hook은 이미 바인딩됨).
     */
    IDLE,

    /**
     * Runner 실행 중, 첫 번째 트리거 대기.
     */
    RUNNING,

    /**
     * 취소 전파 후 Runner 종료 대기 중.
     */
    SHUTTING_DOWN,

    /**
     * 종료 완료.
     */
    TERMINATED;

    /**
     * 종료 상태인지 확인.
     *
     * @return TERMINATED인 경우 true
     */
    public boolean isTerminal() {
        return this == TERMINATED;
    }
}
