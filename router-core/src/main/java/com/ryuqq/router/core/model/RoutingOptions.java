package com.ryuqq.router.core.model;

/**
 * Key-Value 라우팅 호출 옵션 (불변 record).
 *
 * <p>Composite Router는 옵션을 해석하지 않고 각 Backend에 그대로 전달합니다.</p>
 *
 * <p><strong>옵션 항목:</strong></p>
 * <ul>
 *   <li>expired: 만료된 레코드도 반환 허용 (기본 false)</li>
 *   <li>offline: 네트워크 조회 없이 로컬 데이터만 사용 (기본 false)</li>
 * </ul>
 *
 * @param expired 만료 레코드 허용 여부
 * @param offline 오프라인 조회 여부
 *
 * @author Router Team
 * @since 1.0.0
 */
public record RoutingOptions(boolean expired, boolean offline) {

    private static final RoutingOptions DEFAULTS = new RoutingOptions(false, false);

    /**
     * 기본 옵션.
     *
     * @return expired=false, offline=false
     */
    public static RoutingOptions defaults() {
        return DEFAULTS;
    }

    public RoutingOptions withExpired(boolean expired) {
        return new RoutingOptions(expired, this.offline);
    }

    public RoutingOptions withOffline(boolean offline) {
        return new RoutingOptions(this.expired, offline);
    }
}
