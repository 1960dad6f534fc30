package com.ryuqq.lifecycle.application.bootstrap;

import com.ryuqq.lifecycle.core.runner.Runner;
import com.ryuqq.lifecycle.core.spi.CleanupHook;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Initializer가 조립한 애플리케이션 구성 (불변 record).
 *
 * <p>동시에 실행될 Runner 목록과 선택적 cleanup hook을 담습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * return AppContext.of(server::serve, consumer::consume)
 *     .withCleanup(signal -&gt; dataSource.close());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param runners 실행할 Runner 목록 (순서 유지, 불변)
 * @param cleanupOrNull cleanup hook (없으면 null)
 */
public record AppContext(List<Runner> runners, CleanupHook cleanupOrNull) {

    /**
     * Compact constructor (유효성 검증 및 방어적 복사).
     *
     * @throws IllegalArgumentException runners가 null이거나 null 요소를 포함한 경우
     */
    public AppContext {
        if (runners == null) {
            throw new IllegalArgumentException("runners cannot be null");
        }
        for (Runner runner : runners) {
            if (runner == null) {
                throw new IllegalArgumentException("runners cannot contain null");
            }
        }
        runners = List.copyOf(runners);
    }

    /**
     * Runner 목록으로 생성 (cleanup 없음).
     *
     * @param runners 실행할 Runner
     * @return AppContext
     */
    public static AppContext of(Runner... runners) {
        return new AppContext(Arrays.asList(runners), null);
    }

    /**
     * Runner를 추가한 새 인스턴스 생성.
     */
    public AppContext withRunners(Runner... additional) {
        List<Runner> merged = new ArrayList<>(runners);
        merged.addAll(Arrays.asList(additional));
        return new AppContext(merged, cleanupOrNull);
    }

    /**
     * cleanup hook만 변경한 새 인스턴스 생성.
     */
    public AppContext withCleanup(CleanupHook cleanup) {
        return new AppContext(runners, cleanup);
    }

    /**
     * cleanup hook 조회.
     *
     * @return cleanup hook (없으면 empty)
     */
    public Optional<CleanupHook> cleanup() {
        return Optional.ofNullable(cleanupOrNull);
    }
}
