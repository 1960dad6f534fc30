package com.ryuqq.lifecycle.adapter.runner;

import com.ryuqq.lifecycle.core.spi.ShutdownSignalSource;
import com.ryuqq.lifecycle.core.spi.SignalSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * JVM shutdown hook 기반 종료 신호 출처.
 *
 * <p>SIGINT, SIGTERM, {@code System.exit} 모두 JVM shutdown sequence를 시작하며,
 * 이때 등록된 hook이 listener를 한 번 호출합니다.</p>
 *
 * <p><strong>Hold:</strong> JVM은 모든 hook 스레드가 끝나면 종료되므로, hook 스레드는
 * 구독이 해제될 때까지 (최대 holdTimeout) 대기하여 orchestrated shutdown과 cleanup이
 * 끝날 시간을 확보합니다.</p>
 *
 * <p><strong>구독 해제:</strong> JVM이 종료 중이 아니면 hook을 제거하고, 대기 중인 hook 스레드를 풀어줍니다.
 * 이후 도착하는 신호는 무시됩니다. JVM은 shutdown sequence 시작 후 반복 신호를 처리하지 않으므로
 * 두 번째 신호로 즉시 종료하는 동작은 제공하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JvmShutdownSignalSource implements ShutdownSignalSource {

    static final String SOURCE = "jvm-shutdown";

    private static final Logger log = LoggerFactory.getLogger(JvmShutdownSignalSource.class);

    private final ShutdownHookRegistry registry;
    private final Duration holdTimeout;

    /**
     * 생성자.
     *
     * @param holdTimeout hook 스레드가 구독 해제를 기다리는 최대 시간
     * @throws IllegalArgumentException holdTimeout이 null이거나 음수인 경우
     */
    public JvmShutdownSignalSource(Duration holdTimeout) {
        this(ShutdownHookRegistry.RUNTIME, holdTimeout);
    }

    JvmShutdownSignalSource(ShutdownHookRegistry registry, Duration holdTimeout) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (holdTimeout == null) {
            throw new IllegalArgumentException("holdTimeout cannot be null");
        }
        if (holdTimeout.isNegative()) {
            throw new IllegalArgumentException("holdTimeout must not be negative (current: " + holdTimeout + ")");
        }
        this.registry = registry;
        this.holdTimeout = holdTimeout;
    }

    @Override
    public SignalSubscription subscribe(Consumer<String> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        HookSubscription subscription = new HookSubscription(listener);
        registry.add(subscription.hook);
        return subscription;
    }

    private final class HookSubscription implements SignalSubscription {

        private final Consumer<String> listener;
        private final Thread hook;
        private final AtomicBoolean fired = new AtomicBoolean();
        private final AtomicBoolean closed = new AtomicBoolean();
        private final CountDownLatch released = new CountDownLatch(1);

        HookSubscription(Consumer<String> listener) {
            this.listener = listener;
            this.hook = new Thread(this::onShutdown, "lifecycle-shutdown-hook");
        }

        private void onShutdown() {
            if (closed.get() || !fired.compareAndSet(false, true)) {
                return;
            }

            log.info("JVM shutdown requested, triggering orchestrated shutdown");
            listener.accept(SOURCE);

            try {
                if (!released.await(holdTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Orchestrated shutdown still running after {}ms, releasing JVM shutdown",
                        holdTimeout.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown hook interrupted while waiting for orchestrated shutdown");
            }
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            released.countDown();
            if (fired.get()) {
                return;
            }
            try {
                registry.remove(hook);
            } catch (IllegalStateException e) {
                // JVM 종료가 이미 시작되어 hook 제거 불가
                log.debug("JVM shutdown in progress, shutdown hook left registered", e);
            }
        }
    }
}
