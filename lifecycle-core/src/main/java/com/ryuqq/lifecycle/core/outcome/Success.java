package com.ryuqq.lifecycle.core.outcome;

/**
 * 성공 결과.
 *
 * <p>Runner가 맡은 작업을 끝까지 수행하고 정상 반환했음을 나타냅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Success() implements Outcome {

    static final Success INSTANCE = new Success();

    @Override
    public String toString() {
        return "Success";
    }
}
