package com.ryuqq.router.adapter.runner;

import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * race 병렬 조회 (findPeer, getValue).
 *
 * <p>모든 Backend에 조회를 동시에 보내고, 가장 먼저 도착한 비어있지 않은 값을 반환합니다.
 * 결과가 정해지면 race scope를 취소하여 나머지 Backend 작업을 중단시킵니다.</p>
 *
 * <p><strong>Backend 결과 분류:</strong></p>
 * <ul>
 *   <li>비어있지 않은 값 → 승자, race 종료</li>
 *   <li>{@link NotFoundException} 또는 빈 값 → soft miss, race 계속</li>
 *   <li>그 외 실패 (ignoreError=false) → race 종료, 실패 전달</li>
 *   <li>그 외 실패 (ignoreError=true) → 무시, race 계속</li>
 * </ul>
 *
 * <p><strong>종료 조건:</strong></p>
 * <ul>
 *   <li>호출자 scope 완료 → 호출자 취소 사유</li>
 *   <li>모든 Backend가 soft miss → {@link NotFoundException}</li>
 * </ul>
 *
 * <p>race 방식이므로 여러 Backend가 실패하더라도 최대 하나의 실패만 보고됩니다.</p>
 */
final class RaceReducer {

    private static final Logger log = LoggerFactory.getLogger(RaceReducer.class);

    private final Executor executor;

    RaceReducer(Executor executor) {
        this.executor = executor;
    }

    /**
     * 첫 번째 유효한 값 조회.
     *
     * @param ctx 호출자 scope
     * @param routers Backend 실행 정책 목록
     * @param call 조회 연산
     * @param isEmpty 값이 비어있는지 판단 (null은 항상 빈 값)
     * @param <T> 값 타입
     * @return 첫 번째 유효한 값
     * @throws NotFoundException 어떤 Backend도 값을 찾지 못한 경우
     * @throws com.ryuqq.router.core.exception.RoutingCancelledException 호출자 scope가 완료된 경우
     */
    <T> T getValueOrError(RoutingContext ctx, List<ParallelRouterConfig> routers,
                          RoutingCall<T> call, Predicate<T> isEmpty) {
        CompletableFuture<T> result = new CompletableFuture<>();
        RoutingContext raceCtx = ctx.withCancel();
        RoutingContext.Registration callerCancel = ctx.onDone(() -> result.completeExceptionally(ctx.error()));
        try {
            if (routers.isEmpty()) {
                ctx.throwIfDone();
                throw new NotFoundException();
            }
            AtomicInteger remaining = new AtomicInteger(routers.size());
            for (ParallelRouterConfig entry : routers) {
                CompletableFuture.runAsync(() -> {
                    try {
                        runEntry(raceCtx, entry, call, isEmpty, result);
                    } finally {
                        if (remaining.decrementAndGet() == 0) {
                            result.completeExceptionally(ctx.isDone() ? ctx.error() : new NotFoundException());
                        }
                    }
                }, executor);
            }
            return FanOut.await(result, raceCtx);
        } finally {
            callerCancel.remove();
            raceCtx.cancel();
        }
    }

    private <T> void runEntry(RoutingContext raceCtx, ParallelRouterConfig entry, RoutingCall<T> call,
                              Predicate<T> isEmpty, CompletableFuture<T> result) {
        String name = FanOut.nameOf(entry.router());
        if (!raceCtx.sleep(entry.executeAfter())) {
            if (!entry.ignoreError()) {
                result.completeExceptionally(FanOut.cancellationCause(raceCtx));
            }
            return;
        }

        RoutingContext entryCtx = raceCtx.withTimeout(entry.timeout());
        T value;
        try {
            value = call.call(entryCtx, entry.router());
        } catch (NotFoundException e) {
            log.debug("Router {} reported not found", name);
            return;
        } catch (RuntimeException e) {
            if (entry.ignoreError()) {
                log.debug("Ignoring failure from router {}: {}", name, e.toString());
            } else if (!raceCtx.isDone()) {
                result.completeExceptionally(e);
            }
            return;
        } finally {
            entryCtx.cancel();
        }

        if (value == null || isEmpty.test(value)) {
            log.debug("Router {} returned an empty value", name);
            return;
        }
        if (!raceCtx.isDone() && result.complete(value)) {
            log.debug("Router {} won the race", name);
        }
    }
}
