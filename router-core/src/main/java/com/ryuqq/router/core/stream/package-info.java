/**
 * 다중 결과 스트림.
 *
 * <ul>
 *   <li>{@link com.ryuqq.router.core.stream.ResultStream} - 소비자 측 인터페이스</li>
 *   <li>{@link com.ryuqq.router.core.stream.ResultChannel} - bounded 생산자/소비자 채널</li>
 * </ul>
 *
 * @author Router Team
 * @since 1.0.0
 */
package com.ryuqq.router.core.stream;
