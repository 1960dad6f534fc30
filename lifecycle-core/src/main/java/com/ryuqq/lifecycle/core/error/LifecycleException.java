package com.ryuqq.lifecycle.core.error;

/**
 * Lifecycle 오류의 최상위 예외.
 *
 * <p>Orchestration 결과로 노출되는 모든 오류는 이 타입의 하위 타입입니다.
 * 하나의 실행에서 최상위 오류는 하나만 노출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class LifecycleException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param cause 원인 (null 가능)
     */
    protected LifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
