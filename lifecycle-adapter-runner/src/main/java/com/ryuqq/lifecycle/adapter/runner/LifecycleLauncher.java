package com.ryuqq.lifecycle.adapter.runner;

import com.ryuqq.lifecycle.application.bootstrap.AppContext;
import com.ryuqq.lifecycle.application.bootstrap.InitContext;
import com.ryuqq.lifecycle.application.bootstrap.Initializer;
import com.ryuqq.lifecycle.application.orchestrator.RunResult;
import com.ryuqq.lifecycle.core.error.InitializationException;
import com.ryuqq.lifecycle.core.signal.CancellationSource;
import com.ryuqq.lifecycle.core.spi.ShutdownSignalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 애플리케이션 진입점 (main 메서드용).
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>startupTimeoutMs로 제한된 신호와 함께 InitContext 생성</li>
 *   <li>Initializer 호출 → AppContext (Runner 목록 + cleanup hook)</li>
 *   <li>ConcurrentOrchestrator 실행 (JVM shutdown 신호 구독)</li>
 *   <li>결과 분류별 로그 기록 후 ExitHandler에 종료 코드 전달</li>
 * </ol>
 *
 * <p>초기화 실패 시 Runner를 시작하지 않고 종료 코드 1로 종료합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * public static void main(String[] args) {
 *     new LifecycleLauncher(new OrchestratorConfig())
 *         .launch(ServerConfig.defaults(), ctx -&gt; AppContext.of(server::serve));
 * }
 * </pre>
 *
 * <p><strong>주의:</strong> JVM shutdown 신호로 종료되는 경우 JVM이 이미 종료 중이므로
 * 프로세스 종료 코드는 JVM이 결정합니다 (예: SIGTERM → 143).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LifecycleLauncher {

    static final int INITIALIZATION_FAILURE_EXIT_CODE = 1;

    private static final long HOLD_MARGIN_MS = 1000;

    private static final Logger log = LoggerFactory.getLogger(LifecycleLauncher.class);

    private final OrchestratorConfig config;
    private final ShutdownSignalSource signalSource;
    private final ExitHandler exitHandler;

    /**
     * 생성자 (JVM shutdown hook 신호, System.exit 사용).
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public LifecycleLauncher(OrchestratorConfig config) {
        this(config, jvmSignalSource(config), System::exit);
    }

    /**
     * 생성자 (신호 출처, 종료 처리기 주입).
     *
     * @param config 설정
     * @param signalSource 외부 종료 신호 출처
     * @param exitHandler 프로세스 종료 처리기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LifecycleLauncher(OrchestratorConfig config, ShutdownSignalSource signalSource, ExitHandler exitHandler) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (signalSource == null) {
            throw new IllegalArgumentException("signalSource cannot be null");
        }
        if (exitHandler == null) {
            throw new IllegalArgumentException("exitHandler cannot be null");
        }
        this.config = config;
        this.signalSource = signalSource;
        this.exitHandler = exitHandler;
    }

    /**
     * 애플리케이션 실행 (블로킹).
     *
     * @param appConfig 호출자가 준비한 설정 값 (Initializer에 전달, null 가능)
     * @param initializer 애플리케이션 조립 함수
     * @param <C> 설정 타입
     * @return ExitHandler에 전달한 종료 코드
     * @throws IllegalArgumentException initializer가 null인 경우
     */
    public <C> int launch(C appConfig, Initializer<C> initializer) {
        if (initializer == null) {
            throw new IllegalArgumentException("initializer cannot be null");
        }

        AppContext app;
        try {
            app = initialize(appConfig, initializer);
        } catch (InitializationException e) {
            log.error("Initialization failed", e);
            return exit(INITIALIZATION_FAILURE_EXIT_CODE);
        }

        RunResult result = new ConcurrentOrchestrator(app.runners(), app.cleanupOrNull(), config, signalSource).run();
        report(result);
        return exit(result.getExitCode());
    }

    /**
     * 설정 값 없이 실행.
     *
     * @param initializer 애플리케이션 조립 함수
     * @return ExitHandler에 전달한 종료 코드
     */
    public int launch(Initializer<Void> initializer) {
        return launch(null, initializer);
    }

    private <C> AppContext initialize(C appConfig, Initializer<C> initializer) {
        try (CancellationSource startup = CancellationSource.withTimeout(config.startupTimeout())) {
            Logger appLogger = LoggerFactory.getLogger(initializer.getClass());
            AppContext app = initializer.initialize(new InitContext<>(startup.signal(), appLogger, appConfig));
            if (app == null) {
                throw new InitializationException("initializer returned null", null);
            }
            if (startup.isCancelled()) {
                log.warn("Initialization exceeded startup timeout of {}ms", config.startupTimeoutMs());
            }
            return app;
        } catch (InitializationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InitializationException("initialization interrupted", e);
        } catch (Exception e) {
            throw new InitializationException("initialization failed: " + e.getMessage(), e);
        }
    }

    private void report(RunResult result) {
        switch (result.getCategory()) {
            case SUCCESS -> log.info("Application stopped ({}) in {}ms",
                result.getCause(), result.getElapsed().toMillis());
            case GRACEFUL_FAILURE -> log.error("Application failed ({})",
                result.getCause(), result.getErrorOrNull());
            case FORCED -> log.error("Application shutdown forced ({})",
                result.getCause(), result.getErrorOrNull());
        }
        if (result.getCleanupErrorOrNull() != null && result.getCleanupErrorOrNull() != result.getErrorOrNull()) {
            log.error("Cleanup failed", result.getCleanupErrorOrNull());
        }
    }

    private int exit(int status) {
        exitHandler.exit(status);
        return status;
    }

    private static ShutdownSignalSource jvmSignalSource(OrchestratorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        long holdMs = config.shutdownTimeoutMs() + config.cleanupTimeoutMs() + HOLD_MARGIN_MS;
        return new JvmShutdownSignalSource(Duration.ofMillis(holdMs));
    }
}
