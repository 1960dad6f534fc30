package com.ryuqq.lifecycle.application.bootstrap;

import com.ryuqq.lifecycle.core.outcome.Outcome;
import com.ryuqq.lifecycle.core.runner.Runner;
import com.ryuqq.lifecycle.core.signal.CancellationSource;
import com.ryuqq.lifecycle.core.spi.CleanupHook;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AppContext / InitContext 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AppContextTest {

    private final Runner first = signal -> Outcome.success();
    private final Runner second = signal -> Outcome.cancelled();

    @Test
    void of는_순서를_유지하고_cleanup이_없다() {
        AppContext app = AppContext.of(first, second);

        assertThat(app.runners()).containsExactly(first, second);
        assertThat(app.cleanup()).isEmpty();
    }

    @Test
    void with_메서드는_새_인스턴스를_반환한다() {
        // given
        CleanupHook cleanup = signal -> { };
        AppContext original = AppContext.of(first);

        // when
        AppContext extended = original.withRunners(second).withCleanup(cleanup);

        // then
        assertThat(original.runners()).containsExactly(first);
        assertThat(original.cleanupOrNull()).isNull();
        assertThat(extended.runners()).containsExactly(first, second);
        assertThat(extended.cleanup()).contains(cleanup);
    }

    @Test
    void Runner_목록은_방어적으로_복사된다() {
        List<Runner> runners = new ArrayList<>(List.of(first));
        AppContext app = new AppContext(runners, null);

        runners.add(second);

        assertThat(app.runners()).containsExactly(first);
        assertThatThrownBy(() -> app.runners().add(second)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void null_Runner는_거부된다() {
        assertThatThrownBy(() -> new AppContext(null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("runners cannot be null");
        assertThatThrownBy(() -> AppContext.of(first, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("runners cannot contain null");
    }

    @Test
    void InitContext는_신호와_로거를_요구한다() {
        CancellationSource startup = new CancellationSource();

        InitContext<String> ctx = new InitContext<>(startup.signal(), LoggerFactory.getLogger("app"), null);

        assertThat(ctx.config()).isNull();
        assertThatThrownBy(() -> new InitContext<>(null, LoggerFactory.getLogger("app"), "x"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InitContext<>(startup.signal(), null, "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
