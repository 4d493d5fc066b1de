/**
 * Runner Adapter Layer - 합성 Router 구현체.
 *
 * <p>이 패키지는 {@link com.ryuqq.router.application.composition.ComposableRouter}의
 * 구체적인 구현체와 Backend별 실행 정책을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.router.adapter.runner.ComposableParallel} - 모든 Backend 동시 호출</li>
 *   <li>{@link com.ryuqq.router.adapter.runner.ComposableSequential} - Backend 순차 호출</li>
 * </ul>
 *
 * <h2>실행 정책</h2>
 * <ul>
 *   <li>{@link com.ryuqq.router.adapter.runner.ParallelRouterConfig} - timeout, ignoreError, executeAfter</li>
 *   <li>{@link com.ryuqq.router.adapter.runner.SequentialRouterConfig} - timeout, ignoreError</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ComposableParallel, ComposableSequential)
 *   ↓ implements
 * application (ComposableRouter)
 *   ↓ depends on
 * core (Routing, RoutingContext, ResultStream, exceptions)
 * </pre>
 *
 * @author Router Team
 * @since 1.0.0
 */
package com.ryuqq.router.adapter.runner;
