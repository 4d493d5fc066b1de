package com.ryuqq.router.adapter.runner;

import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.exception.AggregateRoutingException;
import com.ryuqq.router.core.exception.RoutingCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;

/**
 * require-all 병렬 실행 (provide, putValue, bootstrap, provideMany).
 *
 * <p>모든 Backend에 연산을 동시에 적용하고, 모든 Backend가 끝날 때까지 기다린 뒤
 * 무시하지 않는 Backend의 실패를 하나의 {@link AggregateRoutingException}으로 묶습니다.</p>
 *
 * <p><strong>Backend별 처리 흐름:</strong></p>
 * <pre>
 * 1. executeAfter 대기
 *    - 호출 scope가 먼저 완료 → 취소 사유 기록 (ignoreError면 기록 안 함), 종료
 * 2. timeout deadline을 가진 하위 scope에서 연산 실행
 * 3. 실패 &amp;&amp; !ignoreError → 실패 기록 (도착 순서)
 * </pre>
 *
 * <p>한 Backend가 실패해도 다른 Backend를 조기 취소하지 않습니다.
 * 일부 Backend가 이미 성공했더라도 롤백하지 않습니다.</p>
 */
final class RequireAllReducer {

    private static final Logger log = LoggerFactory.getLogger(RequireAllReducer.class);

    private final Executor executor;

    RequireAllReducer(Executor executor) {
        this.executor = executor;
    }

    /**
     * 모든 Backend에 연산 적용.
     *
     * @param ctx 호출자 scope
     * @param routers Backend 실행 정책 목록
     * @param action 적용할 연산
     * @throws AggregateRoutingException 하나 이상의 실패가 기록된 경우
     */
    void execute(RoutingContext ctx, List<ParallelRouterConfig> routers, RoutingAction action) {
        Queue<RuntimeException> errors = new ConcurrentLinkedQueue<>();
        RoutingContext callCtx = ctx.withCancel();
        try {
            CompletableFuture<?>[] tasks = new CompletableFuture<?>[routers.size()];
            for (int i = 0; i < tasks.length; i++) {
                ParallelRouterConfig entry = routers.get(i);
                tasks[i] = CompletableFuture.runAsync(() -> runEntry(callCtx, entry, action, errors), executor);
            }
            FanOut.await(CompletableFuture.allOf(tasks), callCtx);
        } finally {
            callCtx.cancel();
        }

        // 같은 취소 사유 인스턴스는 한 번만 보고 (도착 순서 유지)
        Set<RuntimeException> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<RuntimeException> recorded = new ArrayList<>();
        for (RuntimeException error : errors) {
            if (seen.add(error)) {
                recorded.add(error);
            }
        }
        // 호출자 취소는 Backend 설정과 관계없이 항상 보고
        RoutingCancelledException callerCause = ctx.error();
        if (callerCause != null && seen.add(callerCause)) {
            recorded.add(callerCause);
        }
        if (!recorded.isEmpty()) {
            throw new AggregateRoutingException(recorded);
        }
    }

    private void runEntry(RoutingContext callCtx, ParallelRouterConfig entry,
                          RoutingAction action, Queue<RuntimeException> errors) {
        String name = FanOut.nameOf(entry.router());
        if (!callCtx.sleep(entry.executeAfter())) {
            log.debug("Router {} abandoned before start (ignoreError={})", name, entry.ignoreError());
            if (!entry.ignoreError()) {
                errors.add(FanOut.cancellationCause(callCtx));
            }
            return;
        }

        RoutingContext entryCtx = callCtx.withTimeout(entry.timeout());
        try {
            action.run(entryCtx, entry.router());
        } catch (RuntimeException e) {
            if (entry.ignoreError()) {
                log.debug("Ignoring failure from router {}: {}", name, e.toString());
            } else {
                errors.add(e);
            }
        } finally {
            entryCtx.cancel();
        }
    }
}
