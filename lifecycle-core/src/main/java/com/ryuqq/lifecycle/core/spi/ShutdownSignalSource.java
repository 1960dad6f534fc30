package com.ryuqq.lifecycle.core.spi;

import java.util.function.Consumer;

/**
 * 외부 종료 신호 공급자.
 *
 * <p>OS 종료 요청(SIGINT, SIGTERM 등)이나 프로그램적 트리거를 하나의 "외부 신호"로 변환합니다.
 * 구독당 listener는 최대 한 번 호출되며, 첫 번째 신호 이후의 신호는 무시됩니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>listener 호출은 non-blocking 이어야 함 (Orchestrator는 신호를 트리거로만 기록)</li>
 *   <li>{@link SignalSubscription#close()} 호출 시 모든 구독 리소스 해제</li>
 *   <li>close()는 멱등해야 하며 모든 종료 경로(정상, 오류, 강제 종료)에서 호출됨</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ShutdownSignalSource {

    /**
     * 종료 신호 구독.
     *
     * @param listener 신호 수신 시 호출될 listener (인자: 신호 출처)
     * @return 구독 해제 핸들
     * @throws IllegalArgumentException listener가 null인 경우
     */
    SignalSubscription subscribe(Consumer<String> listener);
}
