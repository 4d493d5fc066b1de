package com.ryuqq.router.application.composition;

import com.ryuqq.router.core.spi.ProvideManyRouting;
import com.ryuqq.router.core.spi.Routing;

import java.util.List;

/**
 * 여러 Backend를 하나의 {@link Routing}으로 합성하는 Router.
 *
 * <p>합성 전략(병렬 / 순차)에 관계없이 같은 기능 계약을 노출하므로,
 * Composite를 다른 Composite의 Backend로 중첩할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ComposableRouter router = new ComposableParallel(List.of(
 *     ParallelRouterConfig.of(dht, Duration.ofSeconds(30)),
 *     ParallelRouterConfig.of(httpRouter, Duration.ofSeconds(5))
 *         .withExecuteAfter(Duration.ofMillis(200))
 *         .withIgnoreError(true)
 * ));
 *
 * byte[] record = router.getValue(ctx, "/ipns/k51...");
 * </pre>
 *
 * <p><strong>불변성:</strong> 구현체는 생성 후 Backend 구성을 변경하지 않으며,
 * 여러 호출이 동시에 공유할 수 있어야 합니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public interface ComposableRouter extends Routing, ProvideManyRouting {

    /**
     * 구성된 Backend 목록 조회.
     *
     * @return 구성 순서대로의 불변 목록
     */
    List<Routing> routers();
}
