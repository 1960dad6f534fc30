package com.ryuqq.lifecycle.core.signal;

/**
 * 취소가 발생한 원인.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CancellationCause {

    /**
     * 소유자가 명시적으로 cancel()을 호출함.
     */
    CANCELLED,

    /**
     * 설정된 deadline이 지남.
     */
    DEADLINE_EXCEEDED
}
