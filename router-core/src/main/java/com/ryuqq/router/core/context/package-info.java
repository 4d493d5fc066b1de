/**
 * 호출 취소 범위.
 *
 * <p>{@link com.ryuqq.router.core.context.RoutingContext}는 호출자의 취소와 deadline을
 * Backend 호출까지 전파합니다. 모든 대기 지점(시작 지연, 결과 전달, 스트림 수신)은
 * scope 완료 시 즉시 깨어납니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
package com.ryuqq.router.core.context;
