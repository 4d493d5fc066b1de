package com.ryuqq.router.testkit.contract;

import com.ryuqq.router.adapter.runner.ComposableParallel;
import com.ryuqq.router.adapter.runner.ParallelRouterConfig;
import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.exception.AggregateRoutingException;
import com.ryuqq.router.core.exception.RoutingCancelledException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: require-all composition (provide, putValue, bootstrap).
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>All backends succeed → no error</li>
 *   <li>One hard failure → aggregate with exactly that failure</li>
 *   <li>Ignored failure → no error</li>
 *   <li>Start delay beyond the caller deadline → aggregate with deadline exceeded</li>
 *   <li>Caller cancellation → always reported</li>
 * </ul>
 *
 * @author Router Team
 * @since 1.0.0
 */
class RequireAllContractTest extends AbstractRoutingContractTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Test
    void testRequireAll_AllBackendsSucceed_NoError() {
        // Given
        ScriptedRouting a = scripted("a");
        ScriptedRouting b = scripted("b").withDelay(Duration.ofMillis(50));
        ComposableParallel router = new ComposableParallel(List.of(
                ParallelRouterConfig.of(a, TIMEOUT),
                ParallelRouterConfig.of(b, TIMEOUT)));

        // When
        assertDoesNotThrow(() -> router.putValue(ctx, "/v/key", bytes("value")));

        // Then: every backend ran to completion before the call returned
        assertEquals(1, a.getCompletedCount());
        assertEquals(1, b.getCompletedCount());
        assertJournalContains("a:putValue");
        assertJournalContains("b:putValue");
    }

    @Test
    void testRequireAll_SingleHardFailure_AggregatesThatFailure() {
        // Given
        IllegalStateException boom = new IllegalStateException("boom");
        ScriptedRouting a = scripted("a");
        ScriptedRouting b = scripted("b").failingWith(boom);
        ComposableParallel router = new ComposableParallel(List.of(
                ParallelRouterConfig.of(a, TIMEOUT),
                ParallelRouterConfig.of(b, TIMEOUT)));

        // When
        AggregateRoutingException error = assertThrows(AggregateRoutingException.class,
                () -> router.provide(ctx, contentId("hello"), true));

        // Then
        assertEquals(List.of(boom), error.getErrors());
        assertEquals(1, a.getCompletedCount(), "Other backends must not be rolled back or cancelled");
    }

    @Test
    void testRequireAll_IgnoredFailure_NoError() {
        // Given
        ScriptedRouting a = scripted("a");
        ScriptedRouting b = scripted("b").failingWith(new IllegalStateException("ignored"));
        ComposableParallel router = new ComposableParallel(List.of(
                ParallelRouterConfig.of(a, TIMEOUT),
                ParallelRouterConfig.of(b, TIMEOUT).withIgnoreError(true)));

        // When & Then
        assertDoesNotThrow(() -> router.bootstrap(ctx));
        assertJournalContains("b:bootstrap");
    }

    @Test
    void testRequireAll_MultipleFailures_AllReported() {
        // Given
        ScriptedRouting a = scripted("a").failingWith(new IllegalStateException("a failed"));
        ScriptedRouting b = scripted("b").failingWith(new IllegalArgumentException("b failed"));
        ComposableParallel router = new ComposableParallel(List.of(
                ParallelRouterConfig.of(a, TIMEOUT),
                ParallelRouterConfig.of(b, TIMEOUT)));

        // When
        AggregateRoutingException error = assertThrows(AggregateRoutingException.class,
                () -> router.putValue(ctx, "/v/key", bytes("value")));

        // Then
        assertEquals(2, error.getErrors().size());
        assertTrue(error.contains(IllegalStateException.class));
        assertTrue(error.contains(IllegalArgumentException.class));
    }

    @Test
    void testRequireAll_StartDelayBeyondDeadline_ReportsDeadlineExceeded() {
        // Given: caller deadline of 200ms, second backend starts after 2s
        RoutingContext bounded = ctx.withTimeout(Duration.ofMillis(200));
        ScriptedRouting a = scripted("a");
        ScriptedRouting b = scripted("b");
        ComposableParallel router = new ComposableParallel(List.of(
                ParallelRouterConfig.of(a, TIMEOUT),
                ParallelRouterConfig.of(b, TIMEOUT).withExecuteAfter(Duration.ofSeconds(2))));

        // When
        AggregateRoutingException error = assertThrows(AggregateRoutingException.class,
                () -> router.putValue(bounded, "/v/key", bytes("value")));

        // Then
        assertContainsCancellation(error, RoutingCancelledException.Kind.DEADLINE_EXCEEDED);
        assertEquals(1, error.getErrors().size(), "Caller cause must not be reported twice");
        assertEquals(0, b.getInvocationCount(), "Backend must not start after the caller deadline");
        assertEquals(1, a.getCompletedCount());
    }

    @Test
    void testRequireAll_SeveralBackendsAbandonedAtDeadline_CauseReportedOnce() {
        // Given: both backends start only after the caller deadline
        RoutingContext bounded = ctx.withTimeout(Duration.ofMillis(150));
        ScriptedRouting a = scripted("a");
        ScriptedRouting b = scripted("b");
        ComposableParallel router = new ComposableParallel(List.of(
                ParallelRouterConfig.of(a, TIMEOUT).withExecuteAfter(Duration.ofSeconds(2)),
                ParallelRouterConfig.of(b, TIMEOUT).withExecuteAfter(Duration.ofSeconds(2))));

        // When
        AggregateRoutingException error = assertThrows(AggregateRoutingException.class,
                () -> router.provide(bounded, contentId("data"), true));

        // Then
        assertEquals(List.of(bounded.error()), error.getErrors());
        assertContainsCancellation(error, RoutingCancelledException.Kind.DEADLINE_EXCEEDED);
        assertEquals(0, a.getInvocationCount());
        assertEquals(0, b.getInvocationCount());
    }

    @Test
    void testRequireAll_BackendTimeout_ReportsDeadlineExceeded() {
        // Given: slow backend with a short per-backend timeout
        ScriptedRouting slow = scripted("slow").withDelay(Duration.ofSeconds(5));
        ComposableParallel router = new ComposableParallel(List.of(
                ParallelRouterConfig.of(slow, Duration.ofMillis(100))));

        // When
        long elapsed = elapsedMillis(() -> {
            AggregateRoutingException error = assertThrows(AggregateRoutingException.class,
                    () -> router.bootstrap(ctx));
            assertContainsCancellation(error, RoutingCancelledException.Kind.DEADLINE_EXCEEDED);
        });

        // Then
        assertTrue(elapsed < 2000, "Backend timeout should end the call promptly, took " + elapsed + "ms");
        assertEquals(1, slow.getCancelledCount());
    }

    @Test
    void testRequireAll_CallerCancelled_AlwaysReportedEvenWhenIgnoring() {
        // Given: every backend ignores errors and runs long
        RoutingContext cancellable = ctx.withCancel();
        ScriptedRouting a = scripted("a").withDelay(Duration.ofSeconds(5));
        ScriptedRouting b = scripted("b").withDelay(Duration.ofSeconds(5));
        ComposableParallel router = new ComposableParallel(List.of(
                ParallelRouterConfig.of(a, TIMEOUT).withIgnoreError(true),
                ParallelRouterConfig.of(b, TIMEOUT).withIgnoreError(true)));

        // When: caller cancels while backends are running
        CompletableFuture.runAsync(() -> {
            sleep(100);
            cancellable.cancel();
        });
        AggregateRoutingException error = assertThrows(AggregateRoutingException.class,
                () -> router.putValue(cancellable, "/v/key", bytes("value")));

        // Then
        assertContainsCancellation(error, RoutingCancelledException.Kind.CANCELLED);
        assertEquals(1, error.getErrors().size());
    }

    @Test
    void testRequireAll_NoBackends_NoError() {
        // Given
        ComposableParallel router = new ComposableParallel(List.of());

        // When & Then
        assertDoesNotThrow(() -> router.provide(ctx, contentId("empty"), true));
    }
}
