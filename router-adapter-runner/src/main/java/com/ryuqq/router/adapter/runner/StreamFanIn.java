package com.ryuqq.router.adapter.runner;

import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.exception.NotFoundException;
import com.ryuqq.router.core.stream.ResultChannel;
import com.ryuqq.router.core.stream.ResultStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 다중 결과 스트림 병합 (findProvidersAsync, searchValue).
 *
 * <p>각 Backend의 결과 스트림을 하나의 스트림으로 합칩니다.
 * Backend 간 항목 순서는 정해져 있지 않습니다.</p>
 *
 * <p><strong>결과 수 제한 (limit &gt; 0):</strong> 모든 Backend가 공유하는 카운터를
 * 전달 전에 증가시키고, 제한을 넘으면 해당 Backend는 읽기를 멈춥니다.
 * 카운터 증가와 전달은 원자적으로 묶여 있지 않으므로 제한은 근사값입니다.</p>
 *
 * <p><strong>종료 조건:</strong></p>
 * <ul>
 *   <li>모든 Backend 스트림 종료 → 정상 종료</li>
 *   <li>호출자 scope 완료 → 버퍼를 버리고 즉시 종료 (스트림에 오류를 남기지 않음)</li>
 *   <li>소비자가 close() → 모든 Backend 작업 취소</li>
 *   <li>failOnOpenError=true이고 무시하지 않는 Backend가 스트림 열기에 실패 → 남은 항목 전달 후 그 실패로 종료</li>
 * </ul>
 */
final class StreamFanIn {

    private static final Logger log = LoggerFactory.getLogger(StreamFanIn.class);

    private final Executor executor;

    StreamFanIn(Executor executor) {
        this.executor = executor;
    }

    /**
     * Backend 스트림 병합.
     *
     * @param ctx 호출자 scope
     * @param routers Backend 실행 정책 목록
     * @param opener Backend 스트림 열기 연산
     * @param limit 전체 결과 수 제한 (0 이하면 제한 없음)
     * @param failOnOpenError 스트림 열기 실패를 병합 스트림의 종료 실패로 전달할지 여부
     * @param <T> 항목 타입
     * @return 병합 스트림 (즉시 반환)
     */
    <T> ResultStream<T> merge(RoutingContext ctx, List<ParallelRouterConfig> routers,
                              RoutingCall<ResultStream<T>> opener, long limit, boolean failOnOpenError) {
        ResultChannel<T> out = new ResultChannel<>();
        RoutingContext.Registration closeOnCallerDone = ctx.onDone(out::close);
        RoutingContext callCtx = ctx.withCancel();
        out.onClose(callCtx::cancel);

        AtomicLong delivered = new AtomicLong();
        CompletableFuture<?>[] tasks = new CompletableFuture<?>[routers.size()];
        for (int i = 0; i < tasks.length; i++) {
            ParallelRouterConfig entry = routers.get(i);
            tasks[i] = CompletableFuture.runAsync(
                () -> pump(callCtx, entry, opener, limit, delivered, out, failOnOpenError), executor);
        }

        CompletableFuture.allOf(tasks).whenComplete((ignored, error) -> {
            closeOnCallerDone.remove();
            out.complete();
            callCtx.cancel();
        });
        return out;
    }

    private <T> void pump(RoutingContext callCtx, ParallelRouterConfig entry, RoutingCall<ResultStream<T>> opener,
                          long limit, AtomicLong delivered, ResultChannel<T> out, boolean failOnOpenError) {
        String name = FanOut.nameOf(entry.router());
        if (!callCtx.sleep(entry.executeAfter())) {
            return;
        }

        RoutingContext entryCtx = callCtx.withTimeout(entry.timeout());
        try {
            ResultStream<T> in;
            try {
                in = opener.call(entryCtx, entry.router());
            } catch (NotFoundException e) {
                log.debug("Router {} reported not found", name);
                return;
            } catch (RuntimeException e) {
                handleOpenFailure(callCtx, entry, out, failOnOpenError, e);
                return;
            }
            if (in != null) {
                forward(name, in, entryCtx, out, limit, delivered);
            }
        } finally {
            entryCtx.cancel();
        }
    }

    private <T> void handleOpenFailure(RoutingContext callCtx, ParallelRouterConfig entry, ResultChannel<T> out,
                                       boolean failOnOpenError, RuntimeException e) {
        String name = FanOut.nameOf(entry.router());
        if (entry.ignoreError()) {
            log.debug("Ignoring failure from router {}: {}", name, e.toString());
            return;
        }
        if (!failOnOpenError) {
            log.warn("Dropping failure from router {}: {}", name, e.toString());
            return;
        }
        if (!callCtx.isDone() && out.fail(e)) {
            log.debug("Router {} failed, terminating merged stream", name);
            callCtx.cancel();
        }
    }

    /**
     * Backend 스트림 하나를 병합 스트림으로 전달.
     *
     * <p>entryCtx가 완료되면 입력 스트림을 닫아 블로킹된 수신을 깨웁니다.
     * 입력 스트림의 종료 실패는 버립니다.</p>
     *
     * @return 입력 스트림을 끝까지 읽은 경우 true, 제한 도달 또는 전달 불가로 중단한 경우 false
     */
    static <T> boolean forward(String name, ResultStream<T> in, RoutingContext entryCtx,
                               ResultChannel<T> out, long limit, AtomicLong delivered) {
        RoutingContext.Registration closeInput = entryCtx.onDone(in::close);
        try {
            Optional<T> item;
            while ((item = in.next()).isPresent()) {
                if (limit > 0 && delivered.incrementAndGet() > limit) {
                    return false;
                }
                if (!out.send(item.get(), entryCtx)) {
                    return false;
                }
            }
            return true;
        } catch (RuntimeException e) {
            log.debug("Stream from router {} ended with failure: {}", name, e.toString());
            return true;
        } finally {
            closeInput.remove();
            in.close();
        }
    }
}
