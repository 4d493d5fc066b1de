/**
 * 라우팅 예외 분류.
 *
 * <ul>
 *   <li>{@link com.ryuqq.router.core.exception.NotFoundException} - soft miss</li>
 *   <li>{@link com.ryuqq.router.core.exception.RoutingCancelledException} - 취소 / deadline 초과</li>
 *   <li>{@link com.ryuqq.router.core.exception.AggregateRoutingException} - require-all 실패 묶음</li>
 * </ul>
 *
 * <p>모든 예외는 unchecked이며, 그 외의 {@link java.lang.RuntimeException}은
 * hard error로 취급됩니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
package com.ryuqq.router.core.exception;
