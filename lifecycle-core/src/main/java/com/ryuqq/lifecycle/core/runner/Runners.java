package com.ryuqq.lifecycle.core.runner;

import com.ryuqq.lifecycle.core.outcome.Failure;
import com.ryuqq.lifecycle.core.outcome.Outcome;
import com.ryuqq.lifecycle.core.signal.CancellationSignal;
import com.ryuqq.lifecycle.core.signal.CancelledException;

import java.time.Duration;

/**
 * Runner 유틸리티 (호출 정규화 및 데코레이터).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Runners {

    // Utility class - prevent instantiation
    private Runners() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Runner를 호출하고 결과를 Outcome으로 정규화.
     *
     * <p>이 메서드는 예외를 던지지 않습니다. {@link Error}를 포함한 모든 throwable은
     * Failure로 변환되며, 취소 이후의 인터럽트는 인터럽트 플래그를 복원한 뒤 Cancelled로 변환됩니다.</p>
     *
     * @param runner 호출할 Runner
     * @param signal 공유 취소 신호
     * @return 정규화된 Outcome (non-null)
     */
    public static Outcome invoke(Runner runner, CancellationSignal signal) {
        try {
            Outcome outcome = runner.run(signal);
            if (outcome == null) {
                return Outcome.failure(new IllegalStateException("runner '" + runner + "' returned null outcome"));
            }
            return outcome;
        } catch (CancelledException e) {
            return Outcome.cancelled();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return signal.isCancelled() ? Outcome.cancelled() : Outcome.failure(e);
        } catch (Throwable t) {
            return Outcome.failure(t);
        }
    }

    /**
     * Runner에 라벨 부여.
     *
     * @param name 라벨
     * @param runner 실제 Runner
     * @return NamedRunner
     * @throws IllegalArgumentException name이 blank이거나 runner가 null인 경우
     */
    public static Runner named(String name, Runner runner) {
        return new NamedRunner(name, runner);
    }

    /**
     * Runner 라벨 조회.
     *
     * @param runner Runner
     * @param index Runner 목록 내 위치
     * @return NamedRunner면 이름, 아니면 "runner-{index}"
     */
    public static String labelOf(Runner runner, int index) {
        if (runner instanceof NamedRunner named) {
            return named.name();
        }
        return "runner-" + index;
    }

    /**
     * 오류 처리기를 적용한 Runner 생성.
     *
     * <p>delegate가 Failure를 반환하거나 예외를 던지면 handler가 호출됩니다.
     * handler가 null을 반환하면 Success로, 오류를 반환하면 그 오류의 Failure로 종료합니다.
     * 취소(Cancelled)는 handler를 거치지 않습니다.</p>
     *
     * @param runner 실제 Runner
     * @param handler 오류 처리기
     * @return 오류 처리기가 적용된 Runner (라벨 유지)
     * @throws IllegalArgumentException runner 또는 handler가 null인 경우
     */
    public static Runner withErrorHandler(Runner runner, RunnerErrorHandler handler) {
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        Runner handled = signal -> {
            Outcome outcome = invoke(runner, signal);
            if (!(outcome instanceof Failure failure)) {
                return outcome;
            }
            Throwable remaining = handler.handle(failure.error());
            return remaining == null ? Outcome.success() : Outcome.failure(remaining);
        };
        if (runner instanceof NamedRunner named) {
            return new NamedRunner(named.name(), handled);
        }
        return handled;
    }

    /**
     * {@link Service}를 Runner로 변환.
     *
     * @param service 변환할 서비스
     * @param stopTimeout stop()에 허용할 최대 시간
     * @return 서비스 Runner
     * @throws IllegalArgumentException service가 null이거나 stopTimeout이 양수가 아닌 경우
     */
    public static Runner fromService(Service service, Duration stopTimeout) {
        return new ServiceRunner(service, stopTimeout);
    }
}
