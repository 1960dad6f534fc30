package com.ryuqq.lifecycle.core.signal;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 취소 신호의 소유자 (mutate 핸들).
 *
 * <p>{@link #cancel()}은 단 한 번만 상태를 전이시키는 broadcast 연산이며,
 * 이후 호출은 no-op 입니다. Runner에게는 {@link #signal()}이 반환하는
 * 읽기 전용 뷰만 전달합니다.</p>
 *
 * <p><strong>계층 구조:</strong></p>
 * <pre>
 * root (Orchestrator 소유)
 *   ├─► child A  : root 취소 시 함께 취소
 *   └─► child B  : B 단독 취소는 root에 영향 없음
 * </pre>
 *
 * <p><strong>Deadline:</strong> {@link #withTimeout(Duration)}로 생성하면 deadline 도달 시
 * {@link CancellationCause#DEADLINE_EXCEEDED} 원인으로 자동 취소됩니다.
 * 자식은 부모의 deadline보다 늦은 deadline을 가질 수 없습니다.</p>
 *
 * <p><strong>리소스:</strong> deadline 타이머와 부모 연결은 {@link #close()}에서 해제됩니다.
 * close()는 취소를 수행하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellationSource implements AutoCloseable {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final AtomicReference<CancellationCause> cause = new AtomicReference<>();
    private final CopyOnWriteArrayList<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private final Set<CancellationSource> children = ConcurrentHashMap.newKeySet();
    private final CancellationSource parent;
    private final Instant deadline;
    private final ScheduledFuture<?> deadlineTimer;
    private final CancellationSignal view = new View();

    /**
     * deadline 없는 root 소스 생성.
     */
    public CancellationSource() {
        this(null, null);
    }

    private CancellationSource(CancellationSource parent, Instant deadline) {
        this.parent = parent;
        this.deadline = deadline;
        this.deadlineTimer = deadline == null ? null : DeadlineTimer.schedule(this, deadline);
    }

    /**
     * timeout 이후 자동 취소되는 root 소스 생성.
     *
     * @param timeout deadline까지의 시간
     * @return 새 CancellationSource
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    public static CancellationSource withTimeout(Duration timeout) {
        validateTimeout(timeout);
        return new CancellationSource(null, Instant.now().plus(timeout));
    }

    /**
     * 부모의 취소를 따르는 자식 소스 생성.
     *
     * @return 새 자식 CancellationSource (부모 deadline 상속)
     */
    public CancellationSource child() {
        return attach(new CancellationSource(this, deadline));
    }

    /**
     * 부모의 취소를 따르며 자체 timeout을 갖는 자식 소스 생성.
     *
     * @param timeout deadline까지의 시간 (부모 deadline이 더 이르면 부모 deadline 적용)
     * @return 새 자식 CancellationSource
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    public CancellationSource childWithTimeout(Duration timeout) {
        validateTimeout(timeout);
        Instant own = Instant.now().plus(timeout);
        Instant effective = deadline != null && deadline.isBefore(own) ? deadline : own;
        return attach(new CancellationSource(this, effective));
    }

    /**
     * 읽기 전용 신호 뷰 조회.
     *
     * @return 이 소스의 CancellationSignal
     */
    public CancellationSignal signal() {
        return view;
    }

    /**
     * 취소 (멱등).
     *
     * <p>대기 중인 모든 관찰자를 깨우고, 자식에게 전파하며, 등록된 콜백을 한 번씩 실행합니다.</p>
     *
     * @return 이 호출이 상태를 전이시킨 경우 true, 이미 취소된 경우 false
     * @throws RuntimeException 콜백이 예외를 던진 경우 (나머지 콜백은 모두 실행된 뒤,
     *                          첫 예외에 이후 예외가 suppressed로 첨부되어 던져짐)
     */
    public boolean cancel() {
        return cancel(CancellationCause.CANCELLED);
    }

    /**
     * 취소 여부 확인.
     *
     * @return 취소된 경우 true
     */
    public boolean isCancelled() {
        return view.isCancelled();
    }

    /**
     * deadline 타이머와 부모 연결 해제.
     */
    @Override
    public void close() {
        if (deadlineTimer != null) {
            deadlineTimer.cancel(false);
        }
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    boolean cancel(CancellationCause reason) {
        if (!cause.compareAndSet(null, reason)) {
            return false;
        }
        cancelled.countDown();
        if (deadlineTimer != null) {
            deadlineTimer.cancel(false);
        }

        RuntimeException failure = null;
        for (CancellationSource child : children) {
            failure = runGuarded(() -> child.cancel(reason), failure);
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                failure = runGuarded(callback, failure);
            }
        }
        if (failure != null) {
            throw failure;
        }
        return true;
    }

    private CancellationSource attach(CancellationSource child) {
        children.add(child);
        CancellationCause parentCause = cause.get();
        if (parentCause != null) {
            child.cancel(parentCause);
        }
        return child;
    }

    private static RuntimeException runGuarded(Runnable action, RuntimeException failure) {
        try {
            action.run();
            return failure;
        } catch (RuntimeException e) {
            if (failure == null) {
                return e;
            }
            failure.addSuppressed(e);
            return failure;
        }
    }

    private static void validateTimeout(Duration timeout) {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative (current: " + timeout + ")");
        }
    }

    @Override
    public String toString() {
        return "CancellationSource{cause=" + cause.get() + ", deadline=" + deadline + "}";
    }

    /**
     * 읽기 전용 뷰. 소유자 외에는 취소할 수 없도록 mutate 메서드를 노출하지 않습니다.
     */
    private final class View implements CancellationSignal {

        @Override
        public boolean isCancelled() {
            return cause.get() != null || deadlinePassed();
        }

        @Override
        public Optional<CancellationCause> cause() {
            CancellationCause current = cause.get();
            if (current == null && deadlinePassed()) {
                current = CancellationCause.DEADLINE_EXCEEDED;
            }
            return Optional.ofNullable(current);
        }

        // 조회만 수행: 상태 전이와 콜백 실행은 deadline 타이머 스레드 담당
        private boolean deadlinePassed() {
            return deadline != null && !Instant.now().isBefore(deadline);
        }

        @Override
        public Optional<Instant> deadline() {
            return Optional.ofNullable(deadline);
        }

        @Override
        public void await() throws InterruptedException {
            cancelled.await();
        }

        @Override
        public boolean await(Duration timeout) throws InterruptedException {
            if (timeout == null) {
                throw new IllegalArgumentException("timeout cannot be null");
            }
            return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS) || isCancelled();
        }

        @Override
        public CancellationRegistration onCancel(Runnable callback) {
            if (callback == null) {
                throw new IllegalArgumentException("callback cannot be null");
            }
            callbacks.add(callback);
            if (isCancelled() && callbacks.remove(callback)) {
                callback.run();
            }
            return () -> callbacks.remove(callback);
        }

        @Override
        public String toString() {
            return "CancellationSignal{cancelled=" + (cause.get() != null) + ", deadline=" + deadline + "}";
        }
    }

    /**
     * 모든 deadline 소스가 공유하는 단일 daemon 타이머.
     */
    private static final class DeadlineTimer {

        private static final ScheduledExecutorService SCHEDULER = createScheduler();

        private DeadlineTimer() {
        }

        static ScheduledFuture<?> schedule(CancellationSource source, Instant deadline) {
            long delayNanos = Math.max(0L, Duration.between(Instant.now(), deadline).toNanos());
            return SCHEDULER.schedule(() -> expire(source), delayNanos, TimeUnit.NANOSECONDS);
        }

        private static void expire(CancellationSource source) {
            try {
                source.cancel(CancellationCause.DEADLINE_EXCEEDED);
            } catch (RuntimeException e) {
                // ScheduledFuture에 묻히지 않도록 타이머 스레드의 핸들러로 전달
                Thread timer = Thread.currentThread();
                timer.getUncaughtExceptionHandler().uncaughtException(timer, e);
            }
        }

        private static ScheduledExecutorService createScheduler() {
            ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
                Thread thread = new Thread(runnable, "lifecycle-deadline-timer");
                thread.setDaemon(true);
                return thread;
            });
            executor.setRemoveOnCancelPolicy(true);
            return executor;
        }
    }
}
