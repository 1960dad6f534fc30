package com.ryuqq.lifecycle.application.bootstrap;

/**
 * 애플리케이션 조립 진입점.
 *
 * <p>의존성을 명시적으로 생성자에 전달하여 연결하고, 실행할 Runner와 cleanup hook을 반환합니다.</p>
 *
 * <pre>
 * Initializer&lt;ServerConfig&gt; initializer = ctx -&gt; {
 *     HttpServer server = new HttpServer(ctx.config().port(), ctx.logger());
 *     return AppContext.of(Runners.named("http", server::serve));
 * };
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param <C> 설정 타입
 */
@FunctionalInterface
public interface Initializer<C> {

    /**
     * 애플리케이션 조립.
     *
     * @param context 초기화 컨텍스트
     * @return 실행할 Runner와 cleanup hook
     * @throws Exception 초기화 실패 시 (Runner는 시작되지 않음)
     */
    AppContext initialize(InitContext<C> context) throws Exception;
}
