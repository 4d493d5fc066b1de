/**
 * 라우팅 값 객체.
 *
 * <ul>
 *   <li>{@link com.ryuqq.router.core.model.ContentId} / {@link com.ryuqq.router.core.model.Multihash} - 콘텐츠 식별</li>
 *   <li>{@link com.ryuqq.router.core.model.PeerId} / {@link com.ryuqq.router.core.model.AddrInfo} - Peer 식별 및 주소</li>
 *   <li>{@link com.ryuqq.router.core.model.RoutingOptions} - Key-Value 호출 옵션</li>
 * </ul>
 *
 * <p>모든 값 객체는 불변이며 동시 접근에 안전합니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
package com.ryuqq.router.core.model;
