package com.ryuqq.lifecycle.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runner 실행용 daemon 스레드 팩토리.
 *
 * <p>강제 종료 이후에도 반환하지 않는 Runner가 JVM 종료를 막지 않도록 daemon 스레드를 생성합니다.
 * 스레드 이름은 "{prefix}-{n}" 형식입니다 (기본 "lifecycle-runner-1", ...).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunnerThreadFactory implements ThreadFactory {

    private static final Logger log = LoggerFactory.getLogger(RunnerThreadFactory.class);

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger();

    /**
     * 기본 prefix("lifecycle-runner") 생성자.
     */
    public RunnerThreadFactory() {
        this("lifecycle-runner");
    }

    /**
     * 생성자.
     *
     * @param prefix 스레드 이름 prefix
     * @throws IllegalArgumentException prefix가 null이거나 빈 문자열인 경우
     */
    public RunnerThreadFactory(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, prefix + "-" + counter.incrementAndGet());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) -> log.error("Uncaught exception in {}", t.getName(), e));
        return thread;
    }
}
