package com.ryuqq.lifecycle.adapter.runner;

import java.time.Duration;

/**
 * ConcurrentOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>shutdownTimeoutMs: 취소 전파 후 Runner 종료를 기다리는 최대 시간 (기본 15000ms)</li>
 *   <li>cleanupTimeoutMs: cleanup hook에 전달되는 신호의 제한 시간 (기본 15000ms)</li>
 *   <li>startupTimeoutMs: Initializer에 전달되는 신호의 제한 시간 (기본 15000ms)</li>
 * </ul>
 *
 * <p><strong>타임아웃 설정 가이드:</strong></p>
 * <ul>
 *   <li>shutdownTimeoutMs는 가장 느린 Runner의 정상 종료 시간보다 길게 설정</li>
 *   <li>컨테이너 환경에서는 shutdownTimeoutMs + cleanupTimeoutMs가
 *       오케스트레이터의 grace period(예: Kubernetes 30초)보다 짧아야 함</li>
 * </ul>
 *
 * <p>shutdown timeout은 대기 상한일 뿐 강제 종료 수단이 아닙니다.
 * 제한 시간을 넘긴 Runner 스레드는 중단되지 않고 단지 더 이상 기다리지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param shutdownTimeoutMs shutdown drain 제한 시간 (밀리초, 양수여야 함)
 * @param cleanupTimeoutMs cleanup 제한 시간 (밀리초, 양수여야 함)
 * @param startupTimeoutMs startup 제한 시간 (밀리초, 양수여야 함)
 */
public record OrchestratorConfig(
    long shutdownTimeoutMs,
    long cleanupTimeoutMs,
    long startupTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: shutdownTimeoutMs=15000ms, cleanupTimeoutMs=15000ms, startupTimeoutMs=15000ms</p>
     */
    public OrchestratorConfig() {
        this(15000, 15000, 15000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorConfig {
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
        if (cleanupTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "cleanupTimeoutMs must be positive (current: " + cleanupTimeoutMs + ")"
            );
        }
        if (startupTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "startupTimeoutMs must be positive (current: " + startupTimeoutMs + ")"
            );
        }
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new OrchestratorConfig(shutdownTimeoutMs, cleanupTimeoutMs, startupTimeoutMs);
    }

    /**
     * cleanupTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withCleanupTimeoutMs(long cleanupTimeoutMs) {
        return new OrchestratorConfig(shutdownTimeoutMs, cleanupTimeoutMs, startupTimeoutMs);
    }

    /**
     * startupTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withStartupTimeoutMs(long startupTimeoutMs) {
        return new OrchestratorConfig(shutdownTimeoutMs, cleanupTimeoutMs, startupTimeoutMs);
    }

    public Duration shutdownTimeout() {
        return Duration.ofMillis(shutdownTimeoutMs);
    }

    public Duration cleanupTimeout() {
        return Duration.ofMillis(cleanupTimeoutMs);
    }

    public Duration startupTimeout() {
        return Duration.ofMillis(startupTimeoutMs);
    }
}
