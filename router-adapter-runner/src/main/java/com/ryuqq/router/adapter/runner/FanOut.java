package com.ryuqq.router.adapter.runner;

import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.exception.RoutingCancelledException;
import com.ryuqq.router.core.exception.RoutingException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Reducer 공통 도우미.
 */
final class FanOut {

    private FanOut() {
    }

    /**
     * 시작 전에 포기한 Backend가 기록할 취소 사유.
     *
     * <p>scope가 완료되지 않았는데 대기가 끝난 경우는 작업 스레드 인터럽트뿐입니다.</p>
     *
     * @param callCtx 호출 scope
     * @return 취소 사유 (non-null)
     */
    static RoutingCancelledException cancellationCause(RoutingContext callCtx) {
        RoutingCancelledException cause = callCtx.error();
        if (cause != null) {
            return cause;
        }
        return new RoutingCancelledException(
            RoutingCancelledException.Kind.CANCELLED, "router task interrupted before start");
    }

    /**
     * 호출 스레드에서 결과 대기.
     *
     * <p>인터럽트 발생 시 호출 scope를 취소하고, 인터럽트 플래그를 복원한 뒤
     * {@link RoutingCancelledException}을 던집니다.</p>
     *
     * @param future 대기할 결과
     * @param callCtx 호출 scope
     * @param <T> 결과 타입
     * @return 결과 값
     */
    static <T> T await(CompletableFuture<T> future, RoutingContext callCtx) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            callCtx.cancel();
            Thread.currentThread().interrupt();
            throw new RoutingCancelledException(
                RoutingCancelledException.Kind.CANCELLED, "interrupted while waiting for routers");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new RoutingException("router task failed", cause);
        }
    }

    /**
     * 로그용 Backend 이름.
     *
     * @param router Backend
     * @return 클래스 단순 이름
     */
    static String nameOf(Object router) {
        String name = router.getClass().getSimpleName();
        return name.isEmpty() ? router.getClass().getName() : name;
    }
}
