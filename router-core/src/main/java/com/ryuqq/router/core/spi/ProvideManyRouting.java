package com.ryuqq.router.core.spi;

import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.model.Multihash;

import java.util.List;

/**
 * 일괄 광고 확장 SPI (선택).
 *
 * <p>많은 키를 개별 {@link Routing#provide} 호출 N번 없이 한 번에 광고할 수 있는
 * Backend가 추가로 구현합니다. 라우팅 코어는 이 기능을 직접 호출하지 않으며,
 * 외부 호출자가 {@link #isReady()}를 확인한 후 선택적으로 사용합니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public interface ProvideManyRouting {

    /**
     * 여러 키를 한 번에 광고.
     *
     * @param ctx 호출 scope
     * @param keys 광고할 키 목록
     */
    void provideMany(RoutingContext ctx, List<Multihash> keys);

    /**
     * 일괄 광고 가능 여부.
     *
     * @return 준비되었으면 true
     */
    boolean isReady();
}
