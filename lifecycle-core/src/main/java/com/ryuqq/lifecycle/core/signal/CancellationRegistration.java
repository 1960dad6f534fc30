package com.ryuqq.lifecycle.core.signal;

/**
 * {@link CancellationSignal#onCancel(Runnable)} 등록 해제 핸들.
 *
 * <p>close()는 멱등하며, 이미 실행된 콜백에 대해 호출해도 안전합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CancellationRegistration extends AutoCloseable {

    /**
     * 콜백 등록 해제.
     */
    @Override
    void close();
}
