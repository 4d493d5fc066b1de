/**
 * Contract test support for routing composites.
 *
 * <p>This package provides a scriptable backend double and a JUnit base class
 * shared by contract tests of {@code Routing} composites.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.router.testkit.contract.ScriptedRouting}:
 *       backend with scripted delay, result and failure, counting calls and cancellations</li>
 *   <li>{@link com.ryuqq.router.testkit.contract.AbstractRoutingContractTest}:
 *       per-test call scope, call journal and assertion helpers</li>
 * </ul>
 *
 * @author Router Team
 * @since 1.0.0
 */
package com.ryuqq.router.testkit.contract;
