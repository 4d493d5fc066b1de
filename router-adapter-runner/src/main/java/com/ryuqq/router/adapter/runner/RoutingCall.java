package com.ryuqq.router.adapter.runner;

import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.spi.Routing;

/**
 * 값을 반환하며 Backend 하나에 적용되는 연산 (findPeer, getValue, 스트림 열기 등).
 *
 * @param <T> 결과 타입
 */
@FunctionalInterface
interface RoutingCall<T> {

    T call(RoutingContext ctx, Routing router);
}
