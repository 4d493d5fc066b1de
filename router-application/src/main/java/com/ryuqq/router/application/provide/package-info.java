/**
 * 일괄 광고 지원.
 *
 * @author Router Team
 * @since 1.0.0
 */
package com.ryuqq.router.application.provide;
