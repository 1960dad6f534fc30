package com.ryuqq.lifecycle.core.spi;

/**
 * {@link ShutdownSignalSource} 구독 핸들.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SignalSubscription extends AutoCloseable {

    /**
     * 구독 해제 (멱등).
     */
    @Override
    void close();
}
