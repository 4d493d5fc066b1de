package com.ryuqq.router.adapter.runner;

import com.ryuqq.router.application.composition.ComposableRouter;
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
import com.ryuqq.router.core.stream.ResultStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * 순차 합성 Router 구현체.
 *
 * <p>Backend를 구성 순서대로 하나씩 호출하며, 각 Backend는 자신의 timeout 안에서 실행됩니다.</p>
 *
 * <p><strong>연산별 동작:</strong></p>
 * <ul>
 *   <li>provide, putValue, bootstrap, provideMany: 모든 Backend를 순서대로 호출,
 *       무시하지 않는 Backend의 첫 실패({@link NotFoundException} 제외)에서 중단</li>
 *   <li>findPeer, getValue: 첫 번째 비어있지 않은 값을 반환, 모두 없으면 {@link NotFoundException}</li>
 *   <li>findProvidersAsync: Backend 스트림을 순서대로 이어붙임, count에서 정확히 중단</li>
 *   <li>searchValue: Backend 스트림을 순서대로 이어붙임, 열기 실패 시 종료 실패</li>
 * </ul>
 *
 * <p>각 Backend 호출 전에 호출자 scope를 확인하며, 완료되었으면 취소 사유를 던집니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class ComposableSequential implements ComposableRouter {

    private static final Logger log = LoggerFactory.getLogger(ComposableSequential.class);

    private final List<SequentialRouterConfig> routers;
    private final Executor executor;

    /**
     * 생성자 (공유 작업 풀 사용, 스트림 연산에만 사용).
     *
     * @param routers Backend 실행 정책 목록
     * @throws IllegalArgumentException routers가 null이거나 null 원소를 포함하는 경우
     */
    public ComposableSequential(List<SequentialRouterConfig> routers) {
        this(routers, RouterThreads.sharedPool());
    }

    /**
     * 생성자 (작업 실행자 주입).
     *
     * @param routers Backend 실행 정책 목록
     * @param executor 스트림 전달 작업 실행자
     * @throws IllegalArgumentException routers 또는 executor가 null인 경우
     */
    public ComposableSequential(List<SequentialRouterConfig> routers, Executor executor) {
        if (routers == null) {
            throw new IllegalArgumentException("routers cannot be null");
        }
        for (SequentialRouterConfig router : routers) {
            if (router == null) {
                throw new IllegalArgumentException("routers cannot contain null");
            }
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.routers = List.copyOf(routers);
        this.executor = executor;
    }

    @Override
    public void provide(RoutingContext ctx, ContentId cid, boolean announce) {
        requireArgument(ctx, "ctx");
        requireArgument(cid, "cid");
        executeSequential(ctx, (c, r) -> r.provide(c, cid, announce));
    }

    @Override
    public ResultStream<AddrInfo> findProvidersAsync(RoutingContext ctx, ContentId cid, int count) {
        requireArgument(ctx, "ctx");
        requireArgument(cid, "cid");
        return concatenate(ctx, (c, r) -> r.findProvidersAsync(c, cid, count), count, false);
    }

    @Override
    public AddrInfo findPeer(RoutingContext ctx, PeerId id) {
        requireArgument(ctx, "ctx");
        requireArgument(id, "id");
        return getValueOrErrorSequential(ctx, (c, r) -> r.findPeer(c, id), AddrInfo::isEmpty);
    }

    @Override
    public void putValue(RoutingContext ctx, String key, byte[] value, RoutingOptions options) {
        requireArgument(ctx, "ctx");
        requireArgument(key, "key");
        requireArgument(value, "value");
        RoutingOptions resolved = options != null ? options : RoutingOptions.defaults();
        executeSequential(ctx, (c, r) -> r.putValue(c, key, value, resolved));
    }

    @Override
    public byte[] getValue(RoutingContext ctx, String key, RoutingOptions options) {
        requireArgument(ctx, "ctx");
        requireArgument(key, "key");
        RoutingOptions resolved = options != null ? options : RoutingOptions.defaults();
        return getValueOrErrorSequential(ctx, (c, r) -> r.getValue(c, key, resolved), v -> v.length == 0);
    }

    @Override
    public ResultStream<byte[]> searchValue(RoutingContext ctx, String key, RoutingOptions options) {
        requireArgument(ctx, "ctx");
        requireArgument(key, "key");
        ctx.throwIfDone();
        RoutingOptions resolved = options != null ? options : RoutingOptions.defaults();
        return concatenate(ctx, (c, r) -> r.searchValue(c, key, resolved), 0, true);
    }

    @Override
    public void bootstrap(RoutingContext ctx) {
        requireArgument(ctx, "ctx");
        executeSequential(ctx, (c, r) -> r.bootstrap(c));
    }

    @Override
    public void provideMany(RoutingContext ctx, List<Multihash> keys) {
        requireArgument(ctx, "ctx");
        requireArgument(keys, "keys");
        List<Multihash> snapshot = List.copyOf(keys);
        executeSequential(ctx, (c, r) -> {
            if (r instanceof ProvideManyRouting) {
                ((ProvideManyRouting) r).provideMany(c, snapshot);
            }
        });
    }

    @Override
    public boolean isReady() {
        for (SequentialRouterConfig config : routers) {
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
        for (SequentialRouterConfig config : routers) {
            result.add(config.router());
        }
        return List.copyOf(result);
    }

    /**
     * Backend 실행 정책 목록 조회.
     *
     * @return 구성 순서대로의 불변 목록
     */
    public List<SequentialRouterConfig> getRouterConfigs() {
        return routers;
    }

    private void executeSequential(RoutingContext ctx, RoutingAction action) {
        for (SequentialRouterConfig entry : routers) {
            ctx.throwIfDone();
            RoutingContext entryCtx = ctx.withTimeout(entry.timeout());
            try {
                action.run(entryCtx, entry.router());
            } catch (NotFoundException e) {
                log.debug("Router {} reported not found", FanOut.nameOf(entry.router()));
            } catch (RuntimeException e) {
                if (!entry.ignoreError()) {
                    throw e;
                }
                log.debug("Ignoring failure from router {}: {}", FanOut.nameOf(entry.router()), e.toString());
            } finally {
                entryCtx.cancel();
            }
        }
    }

    private <T> T getValueOrErrorSequential(RoutingContext ctx, RoutingCall<T> call, Predicate<T> isEmpty) {
        for (SequentialRouterConfig entry : routers) {
            ctx.throwIfDone();
            RoutingContext entryCtx = ctx.withTimeout(entry.timeout());
            T value;
            try {
                value = call.call(entryCtx, entry.router());
            } catch (NotFoundException e) {
                continue;
            } catch (RuntimeException e) {
                if (!entry.ignoreError()) {
                    throw e;
                }
                log.debug("Ignoring failure from router {}: {}", FanOut.nameOf(entry.router()), e.toString());
                continue;
            } finally {
                entryCtx.cancel();
            }
            if (value != null && !isEmpty.test(value)) {
                return value;
            }
        }
        ctx.throwIfDone();
        throw new NotFoundException();
    }

    private <T> ResultStream<T> concatenate(RoutingContext ctx, RoutingCall<ResultStream<T>> opener,
                                            long limit, boolean failOnOpenError) {
        ResultChannel<T> out = new ResultChannel<>();
        RoutingContext.Registration closeOnCallerDone = ctx.onDone(out::close);
        RoutingContext callCtx = ctx.withCancel();
        out.onClose(callCtx::cancel);

        CompletableFuture.runAsync(() -> {
            try {
                drainInOrder(callCtx, opener, limit, failOnOpenError, out);
            } finally {
                closeOnCallerDone.remove();
                out.complete();
                callCtx.cancel();
            }
        }, executor);
        return out;
    }

    private <T> void drainInOrder(RoutingContext callCtx, RoutingCall<ResultStream<T>> opener,
                                  long limit, boolean failOnOpenError, ResultChannel<T> out) {
        AtomicLong delivered = new AtomicLong();
        for (SequentialRouterConfig entry : routers) {
            if (callCtx.isDone()) {
                return;
            }
            String name = FanOut.nameOf(entry.router());
            RoutingContext entryCtx = callCtx.withTimeout(entry.timeout());
            try {
                ResultStream<T> in;
                try {
                    in = opener.call(entryCtx, entry.router());
                } catch (NotFoundException e) {
                    continue;
                } catch (RuntimeException e) {
                    if (entry.ignoreError() || !failOnOpenError) {
                        log.debug("Skipping router {} after failure: {}", name, e.toString());
                        continue;
                    }
                    out.fail(e);
                    return;
                }
                if (in != null && !StreamFanIn.forward(name, in, entryCtx, out, limit, delivered)) {
                    return;
                }
            } finally {
                entryCtx.cancel();
            }
        }
    }

    private static void requireArgument(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    @Override
    public String toString() {
        return "ComposableSequential{routers=" + routers.size() + '}';
    }
}
