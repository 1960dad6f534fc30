package com.ryuqq.lifecycle.core.error;

/**
 * 애플리케이션 초기화 실패 (Runner 시작 전).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InitializationException extends LifecycleException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param cause 원인 (null 가능)
     */
    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
