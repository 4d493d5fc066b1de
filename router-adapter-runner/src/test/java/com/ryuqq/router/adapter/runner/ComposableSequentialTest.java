package com.ryuqq.router.adapter.runner;

import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.exception.NotFoundException;
import com.ryuqq.router.core.model.AddrInfo;
import com.ryuqq.router.core.model.ContentId;
import com.ryuqq.router.core.model.Multihash;
import com.ryuqq.router.core.model.PeerId;
import com.ryuqq.router.core.model.RoutingOptions;
import com.ryuqq.router.core.spi.ProvideManyRouting;
import com.ryuqq.router.core.spi.Routing;
import com.ryuqq.router.core.stream.ResultChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * ComposableSequential 유닛 테스트.
 *
 * @author Router Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ComposableSequentialTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private Routing first;

    @Mock
    private Routing second;

    private RoutingContext ctx;

    @BeforeEach
    void setUp() {
        ctx = RoutingContext.background().withTimeout(Duration.ofSeconds(30));
    }

    @AfterEach
    void tearDown() {
        ctx.cancel();
    }

    @Test
    void findPeer_NotFound는_다음_Backend로_넘어간다() {
        // given
        AddrInfo expected = AddrInfo.of(PeerId.of("peer-1"));
        when(first.findPeer(any(RoutingContext.class), any(PeerId.class))).thenThrow(new NotFoundException());
        when(second.findPeer(any(RoutingContext.class), any(PeerId.class))).thenReturn(expected);
        ComposableSequential router = new ComposableSequential(List.of(
            SequentialRouterConfig.of(first, TIMEOUT),
            SequentialRouterConfig.of(second, TIMEOUT)));

        // when
        AddrInfo found = router.findPeer(ctx, PeerId.of("peer-1"));

        // then
        assertThat(found).isEqualTo(expected);
        InOrder inOrder = inOrder(first, second);
        inOrder.verify(first).findPeer(any(RoutingContext.class), any(PeerId.class));
        inOrder.verify(second).findPeer(any(RoutingContext.class), any(PeerId.class));
    }

    @Test
    void putValue_NotFound는_실패로_보지_않는다() {
        // given
        doThrow(new NotFoundException()).when(first)
            .putValue(any(RoutingContext.class), eq("/v/key"), any(byte[].class), any(RoutingOptions.class));
        ComposableSequential router = new ComposableSequential(List.of(
            SequentialRouterConfig.of(first, TIMEOUT),
            SequentialRouterConfig.of(second, TIMEOUT)));

        // when
        router.putValue(ctx, "/v/key", bytes("value"));

        // then
        verify(second).putValue(any(RoutingContext.class), eq("/v/key"), any(byte[].class), any(RoutingOptions.class));
    }

    @Test
    void provideMany는_일괄_광고_Backend에만_순서대로_전달된다() {
        // given
        Routing batchA = mock(Routing.class, withSettings().extraInterfaces(ProvideManyRouting.class));
        Routing batchB = mock(Routing.class, withSettings().extraInterfaces(ProvideManyRouting.class));
        ComposableSequential router = new ComposableSequential(List.of(
            SequentialRouterConfig.of(batchA, TIMEOUT),
            SequentialRouterConfig.of(first, TIMEOUT),
            SequentialRouterConfig.of(batchB, TIMEOUT)));
        List<Multihash> keys = List.of(Multihash.sha256(bytes("a")));

        // when
        router.provideMany(ctx, keys);

        // then
        InOrder inOrder = inOrder(batchA, batchB);
        inOrder.verify((ProvideManyRouting) batchA).provideMany(any(RoutingContext.class), eq(keys));
        inOrder.verify((ProvideManyRouting) batchB).provideMany(any(RoutingContext.class), eq(keys));
        verifyNoInteractions(first);
    }

    @Test
    void searchValue_NotFound로_열기_실패한_Backend는_건너뛴다() {
        // given
        when(first.searchValue(any(RoutingContext.class), eq("/v/key"), any(RoutingOptions.class)))
            .thenThrow(new NotFoundException());
        when(second.searchValue(any(RoutingContext.class), eq("/v/key"), any(RoutingOptions.class)))
            .thenReturn(ResultChannel.of(List.of(bytes("v"))));
        ComposableSequential router = new ComposableSequential(List.of(
            SequentialRouterConfig.of(first, TIMEOUT),
            SequentialRouterConfig.of(second, TIMEOUT)));

        // when
        List<byte[]> values = router.searchValue(ctx, "/v/key").drain();

        // then
        assertThat(values).hasSize(1);
    }

    @Test
    void findProviders_열기_실패는_무시하고_다음_Backend를_읽는다() {
        // given
        AddrInfo provider = AddrInfo.of(PeerId.of("provider-1"));
        when(first.findProvidersAsync(any(RoutingContext.class), any(), eq(0)))
            .thenThrow(new IllegalStateException("boom"));
        when(second.findProvidersAsync(any(RoutingContext.class), any(), eq(0)))
            .thenReturn(ResultChannel.of(List.of(provider)));
        ComposableSequential router = new ComposableSequential(List.of(
            SequentialRouterConfig.of(first, TIMEOUT),
            SequentialRouterConfig.of(second, TIMEOUT)));

        // when
        List<AddrInfo> providers = router.findProvidersAsync(
            ctx, ContentId.of(bytes("data")), 0).drain();

        // then
        assertThat(providers).containsExactly(provider);
    }

    @Test
    void isReady는_일괄_광고_Backend_상태를_따른다() {
        // given
        Routing batch = mock(Routing.class, withSettings().extraInterfaces(ProvideManyRouting.class));
        when(((ProvideManyRouting) batch).isReady()).thenReturn(false);
        ComposableSequential router = new ComposableSequential(List.of(
            SequentialRouterConfig.of(first, TIMEOUT),
            SequentialRouterConfig.of(batch, TIMEOUT)));

        // then
        assertThat(router.isReady()).isFalse();
        assertThat(router.routers()).containsExactly(first, batch);
    }

    @Test
    void 잘못된_구성은_거부된다() {
        assertThatThrownBy(() -> new ComposableSequential(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("routers cannot be null");
        assertThatThrownBy(() -> new ComposableSequential(List.of(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
