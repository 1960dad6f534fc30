package com.ryuqq.lifecycle.core.error;

/**
 * Runner가 취소가 아닌 오류로 종료되어 전체 종료를 유발함.
 *
 * <p>원래 오류는 {@link #getCause()}로 보존되며, 메시지는 실패한 Runner를 가리킵니다.
 * 첫 번째 실패 이후 관찰된 실패들은 suppressed 예외로 첨부됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RunnerFailureException extends LifecycleException {

    private final String runnerLabel;

    /**
     * 생성자.
     *
     * @param runnerLabel 실패한 Runner 라벨
     * @param cause 원래 오류
     */
    public RunnerFailureException(String runnerLabel, Throwable cause) {
        super("runner '" + runnerLabel + "' failed: " + cause.getMessage(), cause);
        this.runnerLabel = runnerLabel;
    }

    /**
     * 실패한 Runner 라벨 조회.
     *
     * @return Runner 라벨
     */
    public String getRunnerLabel() {
        return runnerLabel;
    }
}
