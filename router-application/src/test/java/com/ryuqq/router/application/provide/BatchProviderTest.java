package com.ryuqq.router.application.provide;

import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.exception.RoutingCancelledException;
import com.ryuqq.router.core.model.ContentId;
import com.ryuqq.router.core.model.Multihash;
import com.ryuqq.router.core.spi.ProvideManyRouting;
import com.ryuqq.router.core.spi.Routing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * BatchProvider 테스트.
 *
 * <p>일괄 광고 지원 여부와 준비 상태에 따른 광고 방식 선택을 검증합니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class BatchProviderTest {

    @Mock
    private Routing plainRouting;

    private RoutingContext ctx;
    private List<Multihash> keys;

    @BeforeEach
    void setUp() {
        ctx = RoutingContext.background();
        keys = List.of(
            Multihash.sha256("first".getBytes(StandardCharsets.UTF_8)),
            Multihash.sha256("second".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void 일괄_광고를_지원하고_준비된_경우_provideMany를_사용한다() {
        // given
        Routing batchRouting = mock(Routing.class, withSettings().extraInterfaces(ProvideManyRouting.class));
        when(((ProvideManyRouting) batchRouting).isReady()).thenReturn(true);

        // when
        BatchProvider.Mode mode = new BatchProvider(batchRouting).provide(ctx, keys);

        // then
        assertThat(mode).isEqualTo(BatchProvider.Mode.PROVIDE_MANY);
        verify((ProvideManyRouting) batchRouting).provideMany(ctx, keys);
        verify(batchRouting, never()).provide(any(), any(), anyBoolean());
    }

    @Test
    void 준비되지_않은_경우_개별_광고로_대체한다() {
        // given
        Routing batchRouting = mock(Routing.class, withSettings().extraInterfaces(ProvideManyRouting.class));
        when(((ProvideManyRouting) batchRouting).isReady()).thenReturn(false);

        // when
        BatchProvider.Mode mode = new BatchProvider(batchRouting).provide(ctx, keys);

        // then
        assertThat(mode).isEqualTo(BatchProvider.Mode.INDIVIDUAL);
        verify(batchRouting).provide(ctx, ContentId.of(keys.get(0)), true);
        verify(batchRouting).provide(ctx, ContentId.of(keys.get(1)), true);
        verify((ProvideManyRouting) batchRouting, never()).provideMany(any(), any());
    }

    @Test
    void 일괄_광고를_지원하지_않으면_키마다_provide를_호출한다() {
        // when
        BatchProvider.Mode mode = new BatchProvider(plainRouting).provide(ctx, keys);

        // then
        assertThat(mode).isEqualTo(BatchProvider.Mode.INDIVIDUAL);
        verify(plainRouting, times(2)).provide(eq(ctx), any(ContentId.class), eq(true));
    }

    @Test
    void 개별_광고_중_scope가_완료되면_중단한다() {
        // given
        RoutingContext cancellable = RoutingContext.background().withCancel();
        doAnswer(invocation -> {
            cancellable.cancel();
            return null;
        }).when(plainRouting).provide(eq(cancellable), any(ContentId.class), eq(true));

        // when & then
        assertThatThrownBy(() -> new BatchProvider(plainRouting).provide(cancellable, keys))
            .isInstanceOf(RoutingCancelledException.class);
        verify(plainRouting, times(1)).provide(eq(cancellable), any(ContentId.class), eq(true));
    }

    @Test
    void null_인자는_거부된다() {
        assertThatThrownBy(() -> new BatchProvider(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
        assertThatThrownBy(() -> new BatchProvider(plainRouting).provide(ctx, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
