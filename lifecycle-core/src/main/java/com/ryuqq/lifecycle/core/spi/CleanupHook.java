package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.signal.CancellationSignal;

/**
 * 모든 Runner가 멈춘 뒤 한 번 호출되는 정리 콜백.
 *
 * <p>Runner 외부에서 소유한 리소스(DB 커넥션, 파일 핸들 등)를 해제합니다.
 * 전달되는 신호는 cleanup timeout 경과 시 취소되며, 구현체는 이를 존중해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CleanupHook cleanup = signal -&gt; {
 *     dataSource.close();
 *     if (!flusher.awaitFlushed(signal)) {
 *         throw new IllegalStateException("flush did not finish before cleanup deadline");
 *     }
 * };
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CleanupHook {

    /**
     * 정리 수행.
     *
     * @param signal cleanup timeout으로 제한된 신호
     * @throws Exception 정리 실패 시 (CleanupFailure로 기록됨)
     */
    void cleanup(CancellationSignal signal) throws Exception;
}
