package com.ryuqq.router.application.provide;

import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.model.ContentId;
import com.ryuqq.router.core.model.Multihash;
import com.ryuqq.router.core.spi.ProvideManyRouting;
import com.ryuqq.router.core.spi.Routing;

import java.util.List;

/**
 * 여러 키 일괄 광고 도우미.
 *
 * <p>Router가 {@link ProvideManyRouting}을 구현하고 준비된 상태이면 한 번의
 * {@code provideMany} 호출로 광고하고, 그렇지 않으면 키마다 {@code provide}를 호출합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * provide(ctx, keys)
 *   ├─ routing instanceof ProvideManyRouting &amp;&amp; isReady()
 *   │     → provideMany(ctx, keys)                  [Mode.PROVIDE_MANY]
 *   └─ 그 외
 *         → for each key: provide(ctx, ContentId.of(key), true)   [Mode.INDIVIDUAL]
 *           (키 사이마다 ctx 완료 여부 확인, 첫 실패에서 중단)
 * </pre>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class BatchProvider {

    /**
     * 사용된 광고 방식.
     */
    public enum Mode {
        /** 일괄 광고 한 번. */
        PROVIDE_MANY,
        /** 키마다 개별 광고. */
        INDIVIDUAL
    }

    private final Routing routing;

    /**
     * 생성자.
     *
     * @param routing 광고 대상 Router
     * @throws IllegalArgumentException routing이 null인 경우
     */
    public BatchProvider(Routing routing) {
        if (routing == null) {
            throw new IllegalArgumentException("routing cannot be null");
        }
        this.routing = routing;
    }

    /**
     * 키 목록 광고.
     *
     * @param ctx 호출 scope
     * @param keys 광고할 키 목록
     * @return 사용된 광고 방식
     * @throws IllegalArgumentException ctx 또는 keys가 null인 경우
     * @throws com.ryuqq.router.core.exception.RoutingCancelledException 개별 광고 중 ctx가 완료된 경우
     */
    public Mode provide(RoutingContext ctx, List<Multihash> keys) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        if (routing instanceof ProvideManyRouting) {
            ProvideManyRouting batch = (ProvideManyRouting) routing;
            if (batch.isReady()) {
                batch.provideMany(ctx, List.copyOf(keys));
                return Mode.PROVIDE_MANY;
            }
        }
        for (Multihash key : keys) {
            ctx.throwIfDone();
            routing.provide(ctx, ContentId.of(key), true);
        }
        return Mode.INDIVIDUAL;
    }
}
