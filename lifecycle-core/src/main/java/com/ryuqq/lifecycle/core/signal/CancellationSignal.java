package com.ryuqq.lifecycle.core.signal;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 읽기 전용 취소 신호.
 *
 * <p>한 번 취소되면 영구히 취소 상태로 남는 단방향 broadcast 플래그입니다.
 * 모든 Runner가 같은 신호를 공유하며, 취소 이후의 모든 관찰은 취소 상태를 봅니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>단조성: isCancelled()가 한 번 true를 반환하면 이후 항상 true</li>
 *   <li>관찰자는 취소할 수 없음 (취소 권한은 {@link CancellationSource} 소유자에게만 있음)</li>
 *   <li>onCancel 콜백은 등록당 최대 한 번 실행</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Runner runner = signal -&gt; {
 *     while (!signal.isCancelled()) {
 *         pollOnce();
 *     }
 *     return Outcome.cancelled();
 * };
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CancellationSignal {

    /**
     * 취소 여부 확인 (non-blocking).
     *
     * @return 취소되었거나 deadline이 지난 경우 true
     */
    boolean isCancelled();

    /**
     * 취소 원인 조회.
     *
     * @return 취소 원인, 아직 취소되지 않았으면 empty
     */
    Optional<CancellationCause> cause();

    /**
     * deadline 조회.
     *
     * @return deadline, 설정되지 않았으면 empty
     */
    Optional<Instant> deadline();

    /**
     * 취소될 때까지 대기.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void await() throws InterruptedException;

    /**
     * 최대 timeout 동안 취소를 대기.
     *
     * @param timeout 최대 대기 시간
     * @return timeout 이전에 취소된 경우 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    boolean await(Duration timeout) throws InterruptedException;

    /**
     * 취소 시 실행할 콜백 등록.
     *
     * <p>이미 취소된 상태라면 호출 스레드에서 즉시 실행합니다.
     * 콜백은 짧고 non-blocking 이어야 합니다.</p>
     *
     * @param callback 취소 시 실행할 콜백
     * @return 등록 해제 핸들
     * @throws IllegalArgumentException callback이 null인 경우
     */
    CancellationRegistration onCancel(Runnable callback);

    /**
     * 취소된 경우 {@link CancelledException}을 던짐.
     *
     * @throws CancelledException 취소된 경우
     */
    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancelledException(cause().orElse(CancellationCause.CANCELLED));
        }
    }
}
