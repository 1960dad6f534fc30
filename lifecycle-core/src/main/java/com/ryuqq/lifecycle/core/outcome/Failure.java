package com.ryuqq.lifecycle.core.outcome;

/**
 * 실패 결과.
 *
 * <p>Runner가 복구하지 못한 오류로 종료했음을 나타냅니다.
 * 첫 번째 Failure는 종료 사유가 되어 나머지 Runner 전체에 취소를 전파합니다.</p>
 *
 * <p>Runner가 자체적으로 오류를 복구하려면 반환하기 전에 처리해야 합니다.
 * Orchestrator는 재시도하지 않습니다.</p>
 *
 * @param error 실패 원인 (null 불가)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Failure(Throwable error) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Failure {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    /**
     * Failure 생성.
     *
     * @param error 실패 원인
     * @return Failure 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static Failure of(Throwable error) {
        return new Failure(error);
    }
}
