package com.ryuqq.lifecycle.core.runner;

import com.ryuqq.lifecycle.core.outcome.Outcome;
import com.ryuqq.lifecycle.core.signal.CancellationSignal;

/**
 * Orchestrator가 관리하는 독립 실행 작업 단위.
 *
 * <p>Orchestrator는 모든 Runner를 각자의 스레드에서 정확히 한 번, 동시에 호출합니다.
 * Runner는 전달된 신호를 관찰하다가 취소되면 신속히 반환해야 합니다.
 * 취소를 관찰하지 않는 Runner는 느린 Runner와 구분되지 않으며 shutdown timeout의 적용을 받습니다.</p>
 *
 * <p><strong>예외 처리 규칙:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.signal.CancelledException} → Cancelled</li>
 *   <li>취소 이후 발생한 {@link InterruptedException} → Cancelled</li>
 *   <li>그 밖의 예외 → Failure</li>
 *   <li>null 반환 → Failure</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Runner {

    /**
     * 작업 실행.
     *
     * @param signal 공유 취소 신호 (읽기 전용)
     * @return 종료 결과
     * @throws Exception 복구하지 못한 오류
     */
    Outcome run(CancellationSignal signal) throws Exception;
}
