package com.ryuqq.lifecycle.core.outcome;

/**
 * 취소 결과.
 *
 * <p>Runner가 취소 신호를 관찰하고 협조적으로 종료했음을 나타냅니다.
 * Orchestrator는 이 결과를 오류로 취급하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Cancelled() implements Outcome {

    static final Cancelled INSTANCE = new Cancelled();

    @Override
    public String toString() {
        return "Cancelled";
    }
}
