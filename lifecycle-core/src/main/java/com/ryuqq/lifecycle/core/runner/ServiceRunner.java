package com.ryuqq.lifecycle.core.runner;

import com.ryuqq.lifecycle.core.outcome.Outcome;
import com.ryuqq.lifecycle.core.signal.CancellationRegistration;
import com.ryuqq.lifecycle.core.signal.CancellationSignal;
import com.ryuqq.lifecycle.core.signal.CancellationSource;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link Service}를 Runner 계약에 맞추는 어댑터.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>Runner 스레드에서 service.start() 호출 (블로킹)</li>
 *   <li>취소 신호 수신 시 별도 daemon 스레드에서 service.stop(bounded) 호출</li>
 *   <li>start() 반환 후 stop 스레드 종료를 stopTimeout 동안 대기</li>
 *   <li>취소 이후 반환: stop 실패가 있으면 Failure, 없으면 Cancelled</li>
 *   <li>취소 없이 반환: Success</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ServiceRunner implements Runner {

    private final Service service;
    private final Duration stopTimeout;

    ServiceRunner(Service service, Duration stopTimeout) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (stopTimeout == null || stopTimeout.isNegative() || stopTimeout.isZero()) {
            throw new IllegalArgumentException("stopTimeout must be positive (current: " + stopTimeout + ")");
        }
        this.service = service;
        this.stopTimeout = stopTimeout;
    }

    @Override
    public Outcome run(CancellationSignal signal) throws Exception {
        if (signal.isCancelled()) {
            return Outcome.cancelled();
        }

        AtomicReference<Throwable> stopError = new AtomicReference<>();
        AtomicReference<Thread> stopper = new AtomicReference<>();

        try (CancellationRegistration ignored = signal.onCancel(() -> {
            Thread thread = newStopper(stopError);
            stopper.set(thread);
            thread.start();
        })) {
            service.start();
        }

        if (!signal.isCancelled()) {
            return Outcome.success();
        }

        Thread stopThread = stopper.get();
        if (stopThread != null) {
            stopThread.join(stopTimeout.toMillis());
        }
        Throwable error = stopError.get();
        return error == null ? Outcome.cancelled() : Outcome.failure(error);
    }

    private Thread newStopper(AtomicReference<Throwable> stopError) {
        Thread thread = new Thread(() -> {
            try (CancellationSource bounded = CancellationSource.withTimeout(stopTimeout)) {
                service.stop(bounded.signal());
            } catch (Exception e) {
                stopError.set(e);
            }
        }, "lifecycle-service-stop-" + service.getClass().getSimpleName());
        thread.setDaemon(true);
        return thread;
    }

    @Override
    public String toString() {
        return "ServiceRunner{" + service + "}";
    }
}
