package com.ryuqq.router.core.exception;

/**
 * 라우팅 실패의 기본 예외.
 *
 * <p>Backend가 던지는 모든 {@link RuntimeException}은 실패로 취급되지만,
 * 라우팅 계층이 직접 만드는 실패는 이 타입의 하위 클래스로 표현됩니다.</p>
 *
 * <ul>
 *   <li>{@link NotFoundException}: soft miss, 다른 Backend의 실행을 중단시키지 않음</li>
 *   <li>{@link RoutingCancelledException}: 호출자 취소 또는 deadline 초과</li>
 *   <li>{@link AggregateRoutingException}: require-all 호출에서 수집된 모든 실패</li>
 * </ul>
 *
 * @author Router Team
 * @since 1.0.0
 */
public class RoutingException extends RuntimeException {

    public RoutingException(String message) {
        super(message);
    }

    public RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
