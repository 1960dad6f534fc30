package com.ryuqq.lifecycle.core.reason;

/**
 * 외부 종료 요청 (SIGINT, SIGTERM, 프로그램적 트리거 등).
 *
 * @param source 신호 출처 (예: "jvm-shutdown-hook", "interrupt")
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExternalSignal(String source) implements ShutdownReason {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException source가 null이거나 빈 문자열인 경우
     */
    public ExternalSignal {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
    }
}
