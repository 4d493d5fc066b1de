package com.ryuqq.router.adapter.runner;

import com.ryuqq.router.application.composition.ComposableRouter;
import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.model.AddrInfo;
import com.ryuqq.router.core.model.ContentId;
import com.ryuqq.router.core.model.Multihash;
import com.ryuqq.router.core.model.PeerId;
import com.ryuqq.router.core.model.RoutingOptions;
import com.ryuqq.router.core.spi.ProvideManyRouting;
import com.ryuqq.router.core.spi.Routing;
import com.ryuqq.router.core.stream.ResultStream;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * 병렬 합성 Router 구현체.
 *
 * <p>하나의 논리적 호출을 구성된 모든 Backend에 동시에 보내고,
 * Backend별 지연/timeout/실패 무시 정책을 적용한 뒤 결과를 하나로 합칩니다.</p>
 *
 * <p><strong>연산별 합성 전략:</strong></p>
 * <ul>
 *   <li>provide, putValue, bootstrap, provideMany → require-all ({@link RequireAllReducer})</li>
 *   <li>findPeer, getValue → race ({@link RaceReducer})</li>
 *   <li>findProvidersAsync → 스트림 병합 + 근사 결과 수 제한 ({@link StreamFanIn})</li>
 *   <li>searchValue → 스트림 병합 + 열기 실패 시 종료 실패 ({@link StreamFanIn})</li>
 * </ul>
 *
 * <p><strong>timeout 적용 방식:</strong> Backend별 timeout은 executeAfter 대기가
 * 끝난 시점부터 계산됩니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>Backend 구성은 생성 후 변경되지 않으며, 여러 호출이 동시에 공유할 수 있음 (thread-safe)</li>
 *   <li>호출별 상태(scope, 결과 채널, 카운터)는 호출마다 새로 만들어지고 호출 종료 시 버려짐</li>
 *   <li>Backend 작업은 주어진 {@link Executor}에서 실행됨 (기본: 공유 cached daemon pool)</li>
 * </ul>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class ComposableParallel implements ComposableRouter {

    private final List<ParallelRouterConfig> routers;
    private final RequireAllReducer requireAll;
    private final RaceReducer race;
    private final StreamFanIn fanIn;

    /**
     * 생성자 (공유 작업 풀 사용).
     *
     * @param routers Backend 실행 정책 목록
     * @throws IllegalArgumentException routers가 null이거나 null 원소를 포함하는 경우
     */
    public ComposableParallel(List<ParallelRouterConfig> routers) {
        this(routers, RouterThreads.sharedPool());
    }

    /**
     * 생성자 (작업 실행자 주입).
     *
     * <p>실행자는 Backend 수만큼의 작업을 동시에 실행할 수 있어야 합니다.
     * 크기가 제한된 풀을 사용하면 race 손실 작업이 취소를 관찰할 때까지 스레드를 점유할 수 있습니다.</p>
     *
     * @param routers Backend 실행 정책 목록
     * @param executor Backend 작업 실행자
     * @throws IllegalArgumentException routers 또는 executor가 null인 경우
     */
    public ComposableParallel(List<ParallelRouterConfig> routers, Executor executor) {
        if (routers == null) {
            throw new IllegalArgumentException("routers cannot be null");
        }
        for (ParallelRouterConfig router : routers) {
            if (router == null) {
                throw new IllegalArgumentException("routers cannot contain null");
            }
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.routers = List.copyOf(routers);
        this.requireAll = new RequireAllReducer(executor);
        this.race = new RaceReducer(executor);
        this.fanIn = new StreamFanIn(executor);
    }

    /**
     * 모든 Backend에 광고. 무시하지 않는 Backend의 실패가 하나라도 있으면 실패합니다.
     *
     * <p>일부 Backend의 광고는 실패가 보고되더라도 이미 완료되었을 수 있습니다.</p>
     */
    @Override
    public void provide(RoutingContext ctx, ContentId cid, boolean announce) {
        requireContext(ctx);
        requireArgument(cid, "cid");
        requireAll.execute(ctx, routers, (c, r) -> r.provide(c, cid, announce));
    }

    /**
     * 모든 Backend에서 Provider를 조회하여 하나의 스트림으로 반환합니다.
     *
     * <p>count가 양수이면 그 수만큼만 반환하며, 어느 Backend의 결과인지는 보장하지 않습니다.
     * 특정 Backend의 결과를 먼저 모으려면 다른 Backend에 executeAfter를 설정합니다.</p>
     */
    @Override
    public ResultStream<AddrInfo> findProvidersAsync(RoutingContext ctx, ContentId cid, int count) {
        requireContext(ctx);
        requireArgument(cid, "cid");
        return fanIn.merge(ctx, routers, (c, r) -> r.findProvidersAsync(c, cid, count), count, false);
    }

    /**
     * 가장 먼저 찾은 Peer 주소를 반환하고 나머지 Backend 호출을 취소합니다.
     */
    @Override
    public AddrInfo findPeer(RoutingContext ctx, PeerId id) {
        requireContext(ctx);
        requireArgument(id, "id");
        return race.getValueOrError(ctx, routers, (c, r) -> r.findPeer(c, id), AddrInfo::isEmpty);
    }

    /**
     * 모든 Backend에 저장. 무시하지 않는 Backend의 실패가 하나라도 있으면 실패합니다.
     *
     * <p>실패가 보고되더라도 일부 Backend에는 저장되었을 수 있습니다.</p>
     */
    @Override
    public void putValue(RoutingContext ctx, String key, byte[] value, RoutingOptions options) {
        requireContext(ctx);
        requireArgument(key, "key");
        requireArgument(value, "value");
        RoutingOptions resolved = options != null ? options : RoutingOptions.defaults();
        requireAll.execute(ctx, routers, (c, r) -> r.putValue(c, key, value, resolved));
    }

    /**
     * 가장 먼저 찾은 값을 반환하고 나머지 Backend 호출을 취소합니다.
     */
    @Override
    public byte[] getValue(RoutingContext ctx, String key, RoutingOptions options) {
        requireContext(ctx);
        requireArgument(key, "key");
        RoutingOptions resolved = options != null ? options : RoutingOptions.defaults();
        return race.getValueOrError(ctx, routers, (c, r) -> r.getValue(c, key, resolved), v -> v.length == 0);
    }

    /**
     * 모든 Backend의 탐색 결과를 하나의 스트림으로 반환합니다.
     *
     * <p>호출 시점에 ctx가 이미 완료되었으면 스트림 대신 취소 사유를 던집니다.
     * 무시하지 않는 Backend가 탐색 시작에 실패하면 그 실패가 스트림의 종료 실패가 됩니다.</p>
     *
     * @throws com.ryuqq.router.core.exception.RoutingCancelledException 호출 시점에 ctx가 완료된 경우
     */
    @Override
    public ResultStream<byte[]> searchValue(RoutingContext ctx, String key, RoutingOptions options) {
        requireContext(ctx);
        requireArgument(key, "key");
        ctx.throwIfDone();
        RoutingOptions resolved = options != null ? options : RoutingOptions.defaults();
        return fanIn.merge(ctx, routers, (c, r) -> r.searchValue(c, key, resolved), 0, true);
    }

    @Override
    public void bootstrap(RoutingContext ctx) {
        requireContext(ctx);
        requireAll.execute(ctx, routers, (c, r) -> r.bootstrap(c));
    }

    /**
     * {@link ProvideManyRouting}을 구현한 Backend에만 일괄 광고합니다 (require-all).
     */
    @Override
    public void provideMany(RoutingContext ctx, List<Multihash> keys) {
        requireContext(ctx);
        requireArgument(keys, "keys");
        List<Multihash> snapshot = List.copyOf(keys);
        requireAll.execute(ctx, routers, (c, r) -> {
            if (r instanceof ProvideManyRouting) {
                ((ProvideManyRouting) r).provideMany(c, snapshot);
            }
        });
    }

    /**
     * {@link ProvideManyRouting}을 구현한 모든 Backend가 준비되었는지 확인합니다.
     *
     * @return 해당 Backend가 없거나 모두 준비된 경우 true
     */
    @Override
    public boolean isReady() {
        for (ParallelRouterConfig config : routers) {
            if (config.router() instanceof ProvideManyRouting
                && !((ProvideManyRouting) config.router()).isReady()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public List<Routing> routers() {
        List<Routing> result = new ArrayList<>(routers.size());
        for (ParallelRouterConfig config : routers) {
            result.add(config.router());
        }
        return List.copyOf(result);
    }

    /**
     * Backend 실행 정책 목록 조회.
     *
     * @return 구성 순서대로의 불변 목록
     */
    public List<ParallelRouterConfig> getRouterConfigs() {
        return routers;
    }

    private static void requireContext(RoutingContext ctx) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
    }

    private static void requireArgument(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    @Override
    public String toString() {
        return "ComposableParallel{routers=" + routers.size() + '}';
    }
}
