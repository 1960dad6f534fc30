package com.ryuqq.lifecycle.core.runner;

import com.ryuqq.lifecycle.core.outcome.Outcome;
import com.ryuqq.lifecycle.core.signal.CancellationSignal;

/**
 * 라벨이 붙은 Runner.
 *
 * <p>라벨은 실패 보고 시 어떤 하위 시스템이 실패했는지 나타내는 데만 사용됩니다.</p>
 *
 * @param name Runner 라벨
 * @param delegate 실제 Runner
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record NamedRunner(String name, Runner delegate) implements Runner {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 blank이거나 delegate가 null인 경우
     */
    public NamedRunner {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
    }

    @Override
    public Outcome run(CancellationSignal signal) throws Exception {
        return delegate.run(signal);
    }

    @Override
    public String toString() {
        return name;
    }
}
