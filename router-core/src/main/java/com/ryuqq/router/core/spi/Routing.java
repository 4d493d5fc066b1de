package com.ryuqq.router.core.spi;

import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.model.AddrInfo;
import com.ryuqq.router.core.model.ContentId;
import com.ryuqq.router.core.model.PeerId;
import com.ryuqq.router.core.model.RoutingOptions;
import com.ryuqq.router.core.stream.ResultStream;

/**
 * 라우팅 Backend 기능 계약 SPI.
 *
 * <p>DHT, HTTP 미러, 레지스트리 등 모든 라우팅 Backend가 구현해야 하는 연산 집합입니다.
 * Composite Router도 이 인터페이스를 구현하므로, Composite를 다른 Composite의
 * Backend로 중첩할 수 있습니다.</p>
 *
 * <p><strong>오류 규약:</strong></p>
 * <ul>
 *   <li>항목이 없으면 {@link com.ryuqq.router.core.exception.NotFoundException}</li>
 *   <li>ctx가 완료되면 {@link com.ryuqq.router.core.exception.RoutingCancelledException} (권장)</li>
 *   <li>그 외 모든 {@link RuntimeException}은 hard error</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 구현체는 thread-safe해야 하며,
 * 여러 호출이 동시에 진행될 수 있습니다. ctx 완료 시 가능한 한 빨리 반환해야 합니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public interface Routing {

    /**
     * 콘텐츠 제공 광고.
     *
     * @param ctx 호출 scope
     * @param cid 콘텐츠 식별자
     * @param announce true면 네트워크에 광고, false면 로컬에만 기록
     */
    void provide(RoutingContext ctx, ContentId cid, boolean announce);

    /**
     * 콘텐츠 Provider 비동기 조회.
     *
     * @param ctx 호출 scope, 완료되면 스트림도 종료
     * @param cid 콘텐츠 식별자
     * @param count 최대 결과 수 (0 이하면 제한 없음)
     * @return Provider 스트림
     */
    ResultStream<AddrInfo> findProvidersAsync(RoutingContext ctx, ContentId cid, int count);

    /**
     * Peer 주소 조회.
     *
     * @param ctx 호출 scope
     * @param id Peer 식별자
     * @return Peer 주소 정보
     * @throws com.ryuqq.router.core.exception.NotFoundException Peer를 찾지 못한 경우
     */
    AddrInfo findPeer(RoutingContext ctx, PeerId id);

    /**
     * Key-Value 저장.
     *
     * @param ctx 호출 scope
     * @param key 키
     * @param value 값
     * @param options 호출 옵션
     */
    void putValue(RoutingContext ctx, String key, byte[] value, RoutingOptions options);

    /**
     * Key-Value 조회.
     *
     * @param ctx 호출 scope
     * @param key 키
     * @param options 호출 옵션
     * @return 값
     * @throws com.ryuqq.router.core.exception.NotFoundException 키가 없는 경우
     */
    byte[] getValue(RoutingContext ctx, String key, RoutingOptions options);

    /**
     * Key-Value 탐색 (점점 더 나은 값을 스트림으로 반환).
     *
     * @param ctx 호출 scope, 완료되면 스트림도 종료
     * @param key 키
     * @param options 호출 옵션
     * @return 값 스트림
     */
    ResultStream<byte[]> searchValue(RoutingContext ctx, String key, RoutingOptions options);

    /**
     * Backend 초기화 (라우팅 테이블 채우기 등).
     *
     * @param ctx 호출 scope
     */
    void bootstrap(RoutingContext ctx);

    default void putValue(RoutingContext ctx, String key, byte[] value) {
        putValue(ctx, key, value, RoutingOptions.defaults());
    }

    default byte[] getValue(RoutingContext ctx, String key) {
        return getValue(ctx, key, RoutingOptions.defaults());
    }

    default ResultStream<byte[]> searchValue(RoutingContext ctx, String key) {
        return searchValue(ctx, key, RoutingOptions.defaults());
    }
}
