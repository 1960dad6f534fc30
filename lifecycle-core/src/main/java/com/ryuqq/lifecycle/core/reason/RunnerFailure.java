package com.ryuqq.lifecycle.core.reason;

/**
 * Runner 실패로 인한 종료.
 *
 * @param runnerLabel 실패한 Runner의 라벨 (예: "http-server", "runner-2")
 * @param error 실패 원인
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunnerFailure(String runnerLabel, Throwable error) implements ShutdownReason {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException runnerLabel이 blank이거나 error가 null인 경우
     */
    public RunnerFailure {
        if (runnerLabel == null || runnerLabel.isBlank()) {
            throw new IllegalArgumentException("runnerLabel cannot be null or blank");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }
}
