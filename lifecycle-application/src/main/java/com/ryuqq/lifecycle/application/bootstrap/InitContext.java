package com.ryuqq.lifecycle.application.bootstrap;

import com.ryuqq.lifecycle.core.signal.CancellationSignal;
import org.slf4j.Logger;

/**
 * Initializer에 전달되는 초기화 컨텍스트.
 *
 * <p>애플리케이션 조립에 필요한 자원을 담습니다. startupSignal은 startup timeout 경과 시
 * 취소되므로, 초기화 중 외부 연결 등은 이 신호를 존중해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param <C> 호출자가 준비한 설정 타입
 * @param startupSignal startup timeout으로 제한된 신호
 * @param logger 애플리케이션 로거
 * @param config 호출자가 준비한 설정 값 (null 가능)
 */
public record InitContext<C>(CancellationSignal startupSignal, Logger logger, C config) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException startupSignal 또는 logger가 null인 경우
     */
    public InitContext {
        if (startupSignal == null) {
            throw new IllegalArgumentException("startupSignal cannot be null");
        }
        if (logger == null) {
            throw new IllegalArgumentException("logger cannot be null");
        }
    }
}
