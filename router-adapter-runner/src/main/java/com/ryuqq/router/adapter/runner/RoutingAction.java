package com.ryuqq.router.adapter.runner;

import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.spi.Routing;

/**
 * 결과 없이 Backend 하나에 적용되는 연산 (provide, putValue, bootstrap 등).
 */
@FunctionalInterface
interface RoutingAction {

    void run(RoutingContext ctx, Routing router);
}
