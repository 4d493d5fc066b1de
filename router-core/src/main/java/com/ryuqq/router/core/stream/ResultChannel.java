package com.ryuqq.router.core.stream;

import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.exception.RoutingCancelledException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 생산자와 소비자를 잇는 bounded 결과 채널.
 *
 * <p>소비자 측은 {@link ResultStream}으로 노출되고, 생산자 측은
 * {@link #send(Object, RoutingContext)}, {@link #complete()}, {@link #fail(RuntimeException)}을 사용합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * OPEN ──complete()──→ COMPLETED (버퍼 소진 후 empty)
 *   │  ──fail(e)─────→ COMPLETED (버퍼 소진 후 e를 던짐)
 *   └──close()───────→ CLOSED    (버퍼 폐기, 즉시 empty, 생산자 해제)
 * </pre>
 *
 * <p><strong>동시성:</strong> 여러 생산자가 동시에 send할 수 있습니다.
 * 버퍼가 가득 차면 send는 공간이 생기거나, 채널이 닫히거나, 전달받은 scope가 완료될 때까지 블로킹합니다.</p>
 *
 * @param <T> 항목 타입
 * @author Router Team
 * @since 1.0.0
 */
public final class ResultChannel<T> implements ResultStream<T> {

    /** 기본 버퍼 크기. */
    public static final int DEFAULT_CAPACITY = 1;

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final ArrayDeque<T> buffer = new ArrayDeque<>();
    private final List<Runnable> closeListeners = new ArrayList<>();

    private boolean completed;
    private boolean closed;
    private RuntimeException failure;

    /**
     * 기본 버퍼 크기로 생성.
     */
    public ResultChannel() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * 생성자.
     *
     * @param capacity 버퍼 크기
     * @throws IllegalArgumentException capacity가 양수가 아닌 경우
     */
    public ResultChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.capacity = capacity;
    }

    /**
     * 주어진 항목을 담고 이미 완료된 채널 생성.
     *
     * @param items 항목 목록
     * @param <T> 항목 타입
     * @return 완료된 채널
     * @throws IllegalArgumentException items가 null이거나 null 원소를 포함하는 경우
     */
    public static <T> ResultChannel<T> of(List<? extends T> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        ResultChannel<T> channel = new ResultChannel<>(Math.max(1, items.size()));
        for (T item : items) {
            if (item == null) {
                throw new IllegalArgumentException("items cannot contain null");
            }
            channel.buffer.addLast(item);
        }
        channel.completed = true;
        return channel;
    }

    /**
     * 비어있는 완료된 채널 생성.
     *
     * @param <T> 항목 타입
     * @return 빈 채널
     */
    public static <T> ResultChannel<T> empty() {
        return of(List.of());
    }

    /**
     * 항목 전송 (블로킹).
     *
     * @param item 전송할 항목
     * @param ctx 생산자의 scope, 완료되면 대기를 중단
     * @return 전달 성공 시 true, 채널이 닫혔거나 완료되었거나 scope가 완료된 경우 false
     * @throws IllegalArgumentException item 또는 ctx가 null인 경우
     */
    public boolean send(T item, RoutingContext ctx) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        RoutingContext.Registration registration = ctx.onDone(this::wakeProducers);
        lock.lock();
        try {
            while (buffer.size() >= capacity && !closed && !completed && !ctx.isDone()) {
                notFull.await();
            }
            if (closed || completed || ctx.isDone()) {
                return false;
            }
            buffer.addLast(item);
            notEmpty.signal();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
            registration.remove();
        }
    }

    /**
     * 정상 종료. 소비자는 버퍼에 남은 항목을 받은 후 empty를 받습니다.
     */
    public void complete() {
        lock.lock();
        try {
            completed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 실패 종료. 소비자는 버퍼에 남은 항목을 받은 후 failure를 받습니다.
     *
     * @param failure 종료 사유
     * @return 기록된 경우 true, 이미 완료되었거나 닫힌 경우 false
     * @throws IllegalArgumentException failure가 null인 경우
     */
    public boolean fail(RuntimeException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        lock.lock();
        try {
            if (completed || closed) {
                return false;
            }
            this.failure = failure;
            completed = true;
            notEmpty.signalAll();
            notFull.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> next() {
        lock.lock();
        try {
            while (buffer.isEmpty() && !completed && !closed) {
                notEmpty.await();
            }
            if (closed) {
                return Optional.empty();
            }
            T item = buffer.pollFirst();
            if (item != null) {
                notFull.signal();
                return Optional.of(item);
            }
            if (failure != null) {
                throw failure;
            }
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoutingCancelledException(
                RoutingCancelledException.Kind.CANCELLED, "interrupted while waiting for results");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        List<Runnable> toRun;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            buffer.clear();
            notEmpty.signalAll();
            notFull.signalAll();
            toRun = new ArrayList<>(closeListeners);
            closeListeners.clear();
        } finally {
            lock.unlock();
        }
        for (Runnable listener : toRun) {
            listener.run();
        }
    }

    /**
     * 소비자가 채널을 닫을 때 실행할 작업 등록.
     *
     * <p>이미 닫힌 경우 즉시 실행합니다.</p>
     *
     * @param listener 실행할 작업
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public void onClose(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        lock.lock();
        try {
            if (!closed) {
                closeListeners.add(listener);
                return;
            }
        } finally {
            lock.unlock();
        }
        listener.run();
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public boolean isCompleted() {
        lock.lock();
        try {
            return completed;
        } finally {
            lock.unlock();
        }
    }

    private void wakeProducers() {
        lock.lock();
        try {
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
