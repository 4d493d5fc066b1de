package com.ryuqq.router.adapter.runner;

import com.ryuqq.router.core.spi.Routing;

import java.time.Duration;

/**
 * 병렬 합성에서 Backend 하나의 실행 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>router: 실행할 Backend</li>
 *   <li>timeout: Backend 시작 후 허용 시간. 내부 작업을 강제 종료하지 않고 deadline으로 전달됨</li>
 *   <li>ignoreError: true면 이 Backend의 실패와 대기 중 취소가 전체 결과에 영향을 주지 않음</li>
 *   <li>executeAfter: 호출 시작 후 이 Backend를 실행하기까지의 지연 (기본 0)</li>
 * </ul>
 *
 * <p><strong>타임라인:</strong></p>
 * <pre>
 * t=0              t=executeAfter                 t=executeAfter+timeout
 *  |── 대기 ─────────|── Backend 실행 (deadline) ──|
 * </pre>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>빠르지만 불완전한 Backend(캐시, HTTP 미러)는 지연 0, 짧은 timeout</li>
 *   <li>느리지만 완전한 Backend(DHT)는 executeAfter로 늦게 시작하여 불필요한 조회를 줄임</li>
 *   <li>보조 Backend는 ignoreError=true로 설정하여 장애가 전체 호출을 실패시키지 않도록 함</li>
 * </ul>
 *
 * @author Router Team
 * @since 1.0.0
 * @param router 실행할 Backend (null 불가)
 * @param timeout Backend 시작 후 허용 시간 (양수여야 함)
 * @param ignoreError 실패 무시 여부
 * @param executeAfter 시작 지연 (0 이상이어야 함)
 */
public record ParallelRouterConfig(
    Routing router,
    Duration timeout,
    boolean ignoreError,
    Duration executeAfter
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ParallelRouterConfig {
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
        if (executeAfter == null) {
            throw new IllegalArgumentException("executeAfter cannot be null");
        }
        if (executeAfter.isNegative()) {
            throw new IllegalArgumentException(
                "executeAfter cannot be negative (current: " + executeAfter + ")"
            );
        }
    }

    /**
     * 기본 정책으로 생성 (ignoreError=false, executeAfter=0).
     *
     * @param router 실행할 Backend
     * @param timeout Backend 시작 후 허용 시간
     * @return 새 ParallelRouterConfig 인스턴스
     */
    public static ParallelRouterConfig of(Routing router, Duration timeout) {
        return new ParallelRouterConfig(router, timeout, false, Duration.ZERO);
    }

    /**
     * timeout만 변경한 새 인스턴스 생성.
     *
     * @param timeout 새로운 허용 시간
     * @return 새 ParallelRouterConfig 인스턴스
     */
    public ParallelRouterConfig withTimeout(Duration timeout) {
        return new ParallelRouterConfig(this.router, timeout, this.ignoreError, this.executeAfter);
    }

    /**
     * ignoreError만 변경한 새 인스턴스 생성.
     *
     * @param ignoreError 새로운 실패 무시 여부
     * @return 새 ParallelRouterConfig 인스턴스
     */
    public ParallelRouterConfig withIgnoreError(boolean ignoreError) {
        return new ParallelRouterConfig(this.router, this.timeout, ignoreError, this.executeAfter);
    }

    /**
     * executeAfter만 변경한 새 인스턴스 생성.
     *
     * @param executeAfter 새로운 시작 지연
     * @return 새 ParallelRouterConfig 인스턴스
     */
    public ParallelRouterConfig withExecuteAfter(Duration executeAfter) {
        return new ParallelRouterConfig(this.router, this.timeout, this.ignoreError, executeAfter);
    }
}
