package com.ryuqq.lifecycle.adapter.runner;

import com.ryuqq.lifecycle.core.reason.RunnerFailure;
import com.ryuqq.lifecycle.core.reason.ShutdownReason;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;

/**
 * 첫 번째 종료 트리거를 기록하는 single-writer-wins 슬롯.
 *
 * <p>외부 신호, Runner 실패, 전체 완료가 경쟁적으로 {@link #fire}를 호출하며,
 * 가장 먼저 도착한 사유만 채택됩니다. 이후 호출은 블로킹 없이 버려지되,
 * Runner 실패는 {@link #discardedFailures()}에 남겨 관찰 가능하게 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ShutdownTrigger {

    private final CompletableFuture<ShutdownReason> reason = new CompletableFuture<>();
    private final ConcurrentLinkedQueue<RunnerFailure> discarded = new ConcurrentLinkedQueue<>();

    /**
     * 종료 사유 제출.
     *
     * @param candidate 제출할 사유
     * @return 이 사유가 채택된 경우 true
     * @throws IllegalArgumentException candidate가 null인 경우
     */
    public boolean fire(ShutdownReason candidate) {
        if (candidate == null) {
            throw new IllegalArgumentException("candidate cannot be null");
        }
        boolean won = reason.complete(candidate);
        if (!won && candidate instanceof RunnerFailure failure) {
            discarded.add(failure);
        }
        return won;
    }

    /**
     * 첫 번째 사유가 제출될 때까지 대기.
     *
     * @return 채택된 사유
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public ShutdownReason await() throws InterruptedException {
        try {
            return reason.get();
        } catch (ExecutionException e) {
            // fire()는 complete()만 사용하므로 도달하지 않음
            throw new IllegalStateException("shutdown trigger completed exceptionally", e.getCause());
        }
    }

    /**
     * 채택된 사유 조회 (non-blocking).
     *
     * @return 채택된 사유, 아직 없으면 empty
     */
    public Optional<ShutdownReason> reason() {
        return Optional.ofNullable(reason.getNow(null));
    }

    /**
     * 사유로 채택되지 못한 Runner 실패 조회.
     *
     * @return 현재까지 버려진 실패의 스냅샷 (관찰 순서)
     */
    public List<RunnerFailure> discardedFailures() {
        return new ArrayList<>(discarded);
    }
}
