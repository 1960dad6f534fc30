package com.ryuqq.lifecycle.core.signal;

/**
 * 취소 신호를 관찰한 Runner가 작업을 중단할 때 던지는 예외.
 *
 * <p>오류가 아니라 협조적 종료를 나타냅니다. Orchestrator는 Runner가 이 예외를 던지면
 * {@link com.ryuqq.lifecycle.core.outcome.Cancelled} 결과로 취급합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CancelledException extends RuntimeException {

    private final CancellationCause cancellationCause;

    /**
     * 생성자.
     *
     * @param cancellationCause 취소 원인
     */
    public CancelledException(CancellationCause cancellationCause) {
        super("operation cancelled (" + cancellationCause + ")");
        this.cancellationCause = cancellationCause;
    }

    /**
     * 취소 원인 조회.
     *
     * @return 취소 원인
     */
    public CancellationCause getCancellationCause() {
        return cancellationCause;
    }
}
