package com.ryuqq.lifecycle.adapter.runner;

/**
 * JVM shutdown hook 등록 창구.
 *
 * <p>기본 구현은 {@link Runtime#getRuntime()}에 위임하며, 테스트에서는 기록용 구현으로 대체합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
interface ShutdownHookRegistry {

    ShutdownHookRegistry RUNTIME = new ShutdownHookRegistry() {
        @Override
        public void add(Thread hook) {
            Runtime.getRuntime().addShutdownHook(hook);
        }

        @Override
        public boolean remove(Thread hook) {
            return Runtime.getRuntime().removeShutdownHook(hook);
        }
    };

    /**
     * @throws IllegalStateException JVM이 이미 종료 중인 경우
     */
    void add(Thread hook);

    /**
     * @return hook이 등록되어 있었던 경우 true
     * @throws IllegalStateException JVM이 이미 종료 중인 경우
     */
    boolean remove(Thread hook);
}
