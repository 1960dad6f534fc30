package com.ryuqq.lifecycle.core.runner;

import com.ryuqq.lifecycle.core.signal.CancellationSignal;

/**
 * start/stop 쌍으로 제어되는 장기 실행 컴포넌트 (HTTP 서버, 컨슈머 등).
 *
 * <p>{@link Runners#fromService(Service, java.time.Duration)}로 Runner로 변환할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Service {

    /**
     * 서비스 시작. 서비스가 멈출 때까지 블로킹합니다.
     *
     * <p>의존성 장애 등 애플리케이션에 영향을 주는 예외 상황에서만 예외를 던져야 합니다.</p>
     *
     * @throws Exception 서비스 실행 실패 시
     */
    void start() throws Exception;

    /**
     * 서비스 정지. {@link #start()}가 반환하도록 만듭니다.
     *
     * @param signal stop timeout으로 제한된 신호
     * @throws Exception 정지 실패 시
     */
    void stop(CancellationSignal signal) throws Exception;
}
