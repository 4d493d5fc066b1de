package com.ryuqq.router.adapter.runner;

import com.ryuqq.router.core.spi.Routing;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ParallelRouterConfig / SequentialRouterConfig 테스트.
 *
 * @author Router Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ParallelRouterConfigTest {

    @Mock
    private Routing router;

    @Test
    void of_기본값은_실패_무시_안함_지연_없음() {
        // when
        ParallelRouterConfig config = ParallelRouterConfig.of(router, Duration.ofSeconds(1));

        // then
        assertThat(config.router()).isSameAs(router);
        assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.ignoreError()).isFalse();
        assertThat(config.executeAfter()).isEqualTo(Duration.ZERO);
    }

    @Test
    void withX_메서드는_해당_값만_바꾼_새_인스턴스를_반환한다() {
        // given
        ParallelRouterConfig base = ParallelRouterConfig.of(router, Duration.ofSeconds(1));

        // when
        ParallelRouterConfig changed = base
            .withTimeout(Duration.ofSeconds(3))
            .withIgnoreError(true)
            .withExecuteAfter(Duration.ofMillis(500));

        // then
        assertThat(changed.timeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(changed.ignoreError()).isTrue();
        assertThat(changed.executeAfter()).isEqualTo(Duration.ofMillis(500));
        assertThat(base.ignoreError()).isFalse();
    }

    @Test
    void timeout은_양수여야_한다() {
        assertThatThrownBy(() -> ParallelRouterConfig.of(router, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeout must be positive");
        assertThatThrownBy(() -> ParallelRouterConfig.of(router, Duration.ofMillis(-5)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ParallelRouterConfig.of(router, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
    }

    @Test
    void executeAfter는_음수일_수_없다() {
        ParallelRouterConfig base = ParallelRouterConfig.of(router, Duration.ofSeconds(1));

        assertThatThrownBy(() -> base.withExecuteAfter(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("executeAfter cannot be negative");
        assertThatThrownBy(() -> base.withExecuteAfter(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void router는_null일_수_없다() {
        assertThatThrownBy(() -> ParallelRouterConfig.of(null, Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("router cannot be null");
        assertThatThrownBy(() -> SequentialRouterConfig.of(null, Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 순차_정책도_timeout을_검증한다() {
        assertThatThrownBy(() -> SequentialRouterConfig.of(router, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);

        SequentialRouterConfig config = SequentialRouterConfig.of(router, Duration.ofSeconds(2)).withIgnoreError(true);
        assertThat(config.ignoreError()).isTrue();
        assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(2));
    }
}
