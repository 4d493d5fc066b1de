package com.ryuqq.router.adapter.runner;

import com.ryuqq.router.core.spi.Routing;

import java.time.Duration;

/**
 * 순차 합성에서 Backend 하나의 실행 정책 (불변 record).
 *
 * <p>순차 합성은 시작 지연이 없으며, 앞 Backend가 끝난 뒤 다음 Backend가 시작됩니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 * @param router 실행할 Backend (null 불가)
 * @param timeout Backend 시작 후 허용 시간 (양수여야 함)
 * @param ignoreError 실패 무시 여부
 */
public record SequentialRouterConfig(Routing router, Duration timeout, boolean ignoreError) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SequentialRouterConfig {
        if (router == null) {
            throw new IllegalArgumentException("router cannot be null");
        }
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException(
                "timeout must be positive (current: " + timeout + ")"
            );
        }
    }

    /**
     * 기본 정책으로 생성 (ignoreError=false).
     *
     * @param router 실행할 Backend
     * @param timeout Backend 시작 후 허용 시간
     * @return 새 SequentialRouterConfig 인스턴스
     */
    public static SequentialRouterConfig of(Routing router, Duration timeout) {
        return new SequentialRouterConfig(router, timeout, false);
    }

    /**
     * ignoreError만 변경한 새 인스턴스 생성.
     *
     * @param ignoreError 새로운 실패 무시 여부
     * @return 새 SequentialRouterConfig 인스턴스
     */
    public SequentialRouterConfig withIgnoreError(boolean ignoreError) {
        return new SequentialRouterConfig(this.router, this.timeout, ignoreError);
    }
}
