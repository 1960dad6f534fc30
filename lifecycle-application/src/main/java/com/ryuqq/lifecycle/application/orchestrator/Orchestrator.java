package com.ryuqq.lifecycle.application.orchestrator;

/**
 * Runner 집합의 생명주기 조정자.
 *
 * <p>바인딩된 모든 Runner를 동시에 시작하고, 첫 번째 종료 트리거를 기다린 뒤,
 * 취소를 전파하고 제한된 시간 동안 Runner 종료를 대기하며, cleanup hook을 실행하고
 * 최종 결과를 집계합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RunResult result = orchestrator.run();
 *
 * if (result.isSuccess()) {
 *     // 정상 종료 (전체 완료 또는 외부 신호)
 * } else {
 *     log.error("terminated by {}", result.getCause(), result.getErrorOrNull());
 * }
 * System.exit(result.getExitCode());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Orchestrator {

    /**
     * Orchestration 실행 (블로킹).
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>IDLE → RUNNING: 모든 Runner를 각자의 스레드에서 시작</li>
     *   <li>첫 번째 트리거 대기: 외부 신호 / Runner 실패 / 전체 완료</li>
     *   <li>RUNNING → SHUTTING_DOWN: 취소 전파, shutdown timeout 동안 drain</li>
     *   <li>SHUTTING_DOWN → TERMINATED: cleanup hook 실행 (최대 한 번)</li>
     *   <li>오류 우선순위에 따라 RunResult 집계</li>
     * </ol>
     *
     * <p>shutdown timeout 이후에도 반환하지 않는 Runner를 기다리지 않으므로,
     * 이 메서드는 무한히 블로킹하지 않습니다 (Runner와 cleanup hook이 각자의 제한을 존중하는 한).</p>
     *
     * @return 집계된 실행 결과
     * @throws IllegalStateException 이미 실행된 Orchestrator에서 다시 호출한 경우
     */
    RunResult run();
}
