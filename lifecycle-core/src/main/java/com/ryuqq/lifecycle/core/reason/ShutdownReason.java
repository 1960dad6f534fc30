package com.ryuqq.lifecycle.core.reason;

/**
 * RUNNING 상태를 끝낸 분류된 종료 사유.
 *
 * <p>한 번의 orchestration 실행마다 정확히 하나만 생성되며, 생성 후 변경되지 않습니다.
 * 가장 먼저 발생한 트리거가 사유가 되고, 이후 트리거는 무시됩니다.</p>
 *
 * <ul>
 *   <li>{@link ExternalSignal}: 운영자/OS가 요청한 종료 (그 자체로는 오류 아님)</li>
 *   <li>{@link RunnerFailure}: Runner가 오류로 종료</li>
 *   <li>{@link AllCompleted}: 모든 Runner가 정상 반환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ShutdownReason permits ExternalSignal, RunnerFailure, AllCompleted {

    /**
     * 이 사유가 오류인지 확인.
     *
     * @return RunnerFailure인 경우 true
     */
    default boolean isFailure() {
        return this instanceof RunnerFailure;
    }
}
