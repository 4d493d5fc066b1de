package com.ryuqq.router.core.context;

import com.ryuqq.router.core.exception.RoutingCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 라우팅 호출의 취소 범위(cancellation scope).
 *
 * <p>호출자의 취소와 deadline을 표현하며, 모든 라우팅 호출의 첫 번째 인자로 전달됩니다.
 * 하위 scope는 다음 중 하나가 먼저 일어나면 완료됩니다:</p>
 * <ul>
 *   <li>상위 scope 완료 (상위의 완료 사유를 그대로 전파)</li>
 *   <li>자신의 deadline 경과 ({@link RoutingCancelledException.Kind#DEADLINE_EXCEEDED})</li>
 *   <li>{@link #cancel()} 호출 ({@link RoutingCancelledException.Kind#CANCELLED})</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RoutingContext ctx = RoutingContext.background().withTimeout(Duration.ofSeconds(5));
 * try {
 *     AddrInfo peer = router.findPeer(ctx, peerId);
 * } finally {
 *     ctx.cancel(); // 리소스 정리
 * }
 * }</pre>
 *
 * <p><strong>동시성:</strong> 모든 메서드는 thread-safe합니다.
 * 완료는 한 번만 일어나며, 이후 사유는 변하지 않습니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class RoutingContext {

    private static final Logger log = LoggerFactory.getLogger(RoutingContext.class);

    private static final ScheduledThreadPoolExecutor TIMER = createTimer();
    private static final Registration NO_OP = () -> { };
    private static final RoutingContext BACKGROUND = new RoutingContext(null, false, 0L, true);

    private final RoutingContext parent;
    private final boolean hasDeadline;
    private final long deadlineNanos;
    private final boolean root;
    private final CountDownLatch doneLatch = new CountDownLatch(1);
    private final Object lock = new Object();

    private volatile RoutingCancelledException error;
    private List<Runnable> listeners = new ArrayList<>();
    private Registration parentRegistration;
    private ScheduledFuture<?> deadlineTimer;

    private RoutingContext(RoutingContext parent, boolean hasDeadline, long deadlineNanos, boolean root) {
        this.parent = parent;
        this.hasDeadline = hasDeadline;
        this.deadlineNanos = deadlineNanos;
        this.root = root;
    }

    /**
     * 최상위 scope.
     *
     * <p>절대 완료되지 않으며, {@link #cancel()}은 아무 효과가 없습니다.</p>
     *
     * @return 공유 root scope
     */
    public static RoutingContext background() {
        return BACKGROUND;
    }

    /**
     * 취소 가능한 하위 scope 생성.
     *
     * <p>상위 scope의 deadline을 그대로 상속합니다.</p>
     *
     * @return 하위 scope
     */
    public RoutingContext withCancel() {
        return child(hasDeadline, deadlineNanos);
    }

    /**
     * deadline이 있는 하위 scope 생성.
     *
     * <p>deadline은 현재 시각 + timeout과 상위 deadline 중 이른 쪽입니다.</p>
     *
     * @param timeout 현재 시각 기준 허용 시간
     * @return 하위 scope
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    public RoutingContext withTimeout(Duration timeout) {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be negative (current: " + timeout + ")");
        }
        long candidate = System.nanoTime() + saturatedNanos(timeout);
        if (hasDeadline && deadlineNanos - candidate <= 0) {
            return child(true, deadlineNanos);
        }
        return child(true, candidate);
    }

    /**
     * scope 취소.
     *
     * <p>이미 완료된 경우 아무 효과가 없습니다. 하위 scope에도 전파됩니다.</p>
     */
    public void cancel() {
        if (root) {
            return;
        }
        complete(RoutingCancelledException.cancelled());
    }

    /**
     * 완료 여부 확인.
     *
     * @return 취소되었거나 deadline이 지난 경우 true
     */
    public boolean isDone() {
        return error != null;
    }

    /**
     * 완료 사유 조회.
     *
     * @return 완료 사유, 아직 완료되지 않았으면 null
     */
    public RoutingCancelledException error() {
        return error;
    }

    /**
     * 완료된 경우 완료 사유를 던짐.
     *
     * @throws RoutingCancelledException scope가 완료된 경우
     */
    public void throwIfDone() {
        RoutingCancelledException cause = error;
        if (cause != null) {
            throw cause;
        }
    }

    /**
     * deadline까지 남은 시간.
     *
     * @return 남은 시간 (이미 지났으면 0), deadline이 없으면 empty
     */
    public Optional<Duration> remaining() {
        if (!hasDeadline) {
            return Optional.empty();
        }
        long left = deadlineNanos - System.nanoTime();
        return Optional.of(Duration.ofNanos(Math.max(0L, left)));
    }

    /**
     * 지정한 시간 동안 대기 (scope 완료 시 조기 반환).
     *
     * <p>인터럽트 발생 시 인터럽트 플래그를 복원하고 false를 반환합니다.</p>
     *
     * @param duration 대기 시간
     * @return 대기 시간을 모두 채운 경우 true, scope가 먼저 완료되었거나 인터럽트된 경우 false
     */
    public boolean sleep(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return !isDone();
        }
        try {
            return !doneLatch.await(saturatedNanos(duration), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * scope 완료까지 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 시간 내에 완료된 경우 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean awaitDone(Duration timeout) throws InterruptedException {
        return doneLatch.await(saturatedNanos(timeout), TimeUnit.NANOSECONDS);
    }

    /**
     * 완료 리스너 등록.
     *
     * <p>이미 완료된 경우 호출 스레드에서 즉시 실행합니다.
     * 리스너는 완료시키는 스레드(취소 호출자 또는 timer)에서 실행되므로 짧아야 합니다.</p>
     *
     * @param listener 완료 시 실행할 작업
     * @return 등록 해제 핸들
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public Registration onDone(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (root) {
            return NO_OP;
        }
        synchronized (lock) {
            if (error == null) {
                Runnable entry = listener::run;
                listeners.add(entry);
                return () -> removeListener(entry);
            }
        }
        runListener(listener);
        return NO_OP;
    }

    private RoutingContext child(boolean childHasDeadline, long childDeadlineNanos) {
        RoutingContext child = new RoutingContext(this, childHasDeadline, childDeadlineNanos, false);
        child.start();
        return child;
    }

    private void start() {
        Registration registration = parent.onDone(() -> complete(parent.error));
        synchronized (lock) {
            if (error == null) {
                parentRegistration = registration;
            }
        }
        if (isDone()) {
            registration.remove();
            return;
        }
        boolean inheritsDeadline = parent.hasDeadline && parent.deadlineNanos == deadlineNanos;
        if (!hasDeadline || inheritsDeadline) {
            return;
        }
        long delay = deadlineNanos - System.nanoTime();
        if (delay <= 0) {
            complete(RoutingCancelledException.deadlineExceeded());
            return;
        }
        ScheduledFuture<?> timer = TIMER.schedule(
            () -> complete(RoutingCancelledException.deadlineExceeded()), delay, TimeUnit.NANOSECONDS);
        synchronized (lock) {
            if (error == null) {
                deadlineTimer = timer;
                return;
            }
        }
        timer.cancel(false);
    }

    private void complete(RoutingCancelledException cause) {
        List<Runnable> toRun;
        Registration registration;
        ScheduledFuture<?> timer;
        synchronized (lock) {
            if (error != null) {
                return;
            }
            error = cause;
            toRun = listeners;
            listeners = null;
            registration = parentRegistration;
            parentRegistration = null;
            timer = deadlineTimer;
            deadlineTimer = null;
        }
        doneLatch.countDown();
        if (timer != null) {
            timer.cancel(false);
        }
        if (registration != null) {
            registration.remove();
        }
        for (Runnable listener : toRun) {
            runListener(listener);
        }
    }

    private void removeListener(Runnable entry) {
        synchronized (lock) {
            if (listeners != null) {
                listeners.remove(entry);
            }
        }
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("RoutingContext listener failed", e);
        }
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE / 2;
        }
    }

    private static ScheduledThreadPoolExecutor createTimer() {
        AtomicInteger sequence = new AtomicInteger();
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = Executors.defaultThreadFactory().newThread(runnable);
            thread.setName("routing-context-timer-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    @Override
    public String toString() {
        RoutingCancelledException cause = error;
        return "RoutingContext{done=" + (cause != null)
            + (cause != null ? ", cause=" + cause.getKind() : "")
            + (hasDeadline ? ", remaining=" + remaining().orElse(Duration.ZERO) : "")
            + '}';
    }

    /**
     * 리스너 등록 해제 핸들.
     */
    @FunctionalInterface
    public interface Registration {

        /**
         * 리스너 등록 해제. 이미 실행되었거나 해제된 경우 아무 효과가 없습니다.
         */
        void remove();
    }
}
