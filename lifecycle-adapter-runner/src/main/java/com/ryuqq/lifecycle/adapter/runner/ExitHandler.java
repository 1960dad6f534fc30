package com.ryuqq.lifecycle.adapter.runner;

/**
 * 프로세스 종료 처리기.
 *
 * <p>기본 구현은 {@code System::exit}이며, 테스트나 임베딩 환경에서는 종료 코드만 기록하는 구현으로 대체합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExitHandler {

    /**
     * 프로세스 종료.
     *
     * @param status 종료 코드 (0: 성공, 1: graceful 실패, 2: forced)
     */
    void exit(int status);
}
