package com.ryuqq.lifecycle.adapter.inmemory.signal;

import com.ryuqq.lifecycle.core.spi.ShutdownSignalSource;
import com.ryuqq.lifecycle.core.spi.SignalSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link ShutdownSignalSource} for embedding and testing purposes.
 *
 * <p>Shutdown signals are raised programmatically through {@link #trigger(String)} instead of
 * by the operating system.</p>
 *
 * <p><strong>Semantics:</strong></p>
 * <ul>
 *   <li>Each subscription is notified at most once, by the first trigger after it subscribed</li>
 *   <li>Closed subscriptions are never notified</li>
 *   <li>Listeners run on the triggering thread</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ManualShutdownSignalSource signals = new ManualShutdownSignalSource();
 * Orchestrator orchestrator = new ConcurrentOrchestrator(runners, cleanup, config, signals);
 *
 * // from another thread
 * signals.trigger("admin-endpoint");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ManualShutdownSignalSource implements ShutdownSignalSource {

    private static final Logger log = LoggerFactory.getLogger(ManualShutdownSignalSource.class);

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    @Override
    public SignalSubscription subscribe(Consumer<String> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        Subscription subscription = new Subscription(listener);
        subscriptions.add(subscription);
        return subscription;
    }

    /**
     * Raises a shutdown signal.
     *
     * @param source the signal origin passed to listeners (e.g., "SIGTERM")
     * @return the number of subscriptions notified by this call
     * @throws IllegalArgumentException if source is null or blank
     */
    public int trigger(String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }

        int notified = 0;
        for (Subscription subscription : subscriptions) {
            if (subscription.fire(source)) {
                notified++;
            }
        }
        log.debug("Shutdown signal '{}' delivered to {} subscription(s)", source, notified);
        return notified;
    }

    /**
     * Returns the number of open subscriptions.
     *
     * @return open subscription count
     */
    public int activeSubscriptions() {
        return subscriptions.size();
    }

    private final class Subscription implements SignalSubscription {

        private final Consumer<String> listener;
        private final AtomicBoolean done = new AtomicBoolean();

        Subscription(Consumer<String> listener) {
            this.listener = listener;
        }

        boolean fire(String source) {
            if (!done.compareAndSet(false, true)) {
                return false;
            }
            listener.accept(source);
            return true;
        }

        @Override
        public void close() {
            done.set(true);
            subscriptions.remove(this);
        }
    }
}
