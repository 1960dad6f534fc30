package com.ryuqq.lifecycle.core.outcome;

/**
 * Runner 실행 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 정상 종료</li>
 *   <li>{@link Cancelled}: 취소 신호를 관찰하고 종료 (치명적이지 않음)</li>
 *   <li>{@link Failure}: 오류로 종료, 나머지 Runner 전체의 종료를 유발</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 허용된 구현체가 컴파일 타임에 고정됩니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Failure failure) {
 *     log.error("runner failed", failure.error());
 * } else if (outcome.isCancelled()) {
 *     log.debug("runner observed cancellation");
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Success, Cancelled, Failure {

    /**
     * 성공 결과.
     *
     * @return Success 인스턴스
     */
    static Outcome success() {
        return Success.INSTANCE;
    }

    /**
     * 취소 결과.
     *
     * @return Cancelled 인스턴스
     */
    static Outcome cancelled() {
        return Cancelled.INSTANCE;
    }

    /**
     * 실패 결과.
     *
     * @param error 실패 원인
     * @return Failure 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static Outcome failure(Throwable error) {
        return new Failure(error);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 결과가 취소인지 확인.
     *
     * @return 취소 여부
     */
    default boolean isCancelled() {
        return this instanceof Cancelled;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return this instanceof Failure;
    }
}
