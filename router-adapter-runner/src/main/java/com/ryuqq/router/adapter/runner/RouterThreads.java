package com.ryuqq.router.adapter.runner;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Backend 작업 실행용 기본 스레드 풀.
 *
 * <p>Backend 하나당 작업 하나가 동시에 실행되어야 하고, 중첩된 Composite가
 * 서로의 작업을 기다릴 수 있으므로 크기 제한이 없는 cached pool을 사용합니다.
 * 스레드는 daemon이며 이름은 {@code router-worker-N}입니다.</p>
 */
final class RouterThreads {

    private static final ExecutorService SHARED = Executors.newCachedThreadPool(newThreadFactory("router-worker-"));

    private RouterThreads() {
    }

    /**
     * 공유 작업 풀.
     *
     * @return 프로세스 전역 공유 풀 (종료하지 않음)
     */
    static ExecutorService sharedPool() {
        return SHARED;
    }

    static ThreadFactory newThreadFactory(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory delegate = Executors.defaultThreadFactory();
        return runnable -> {
            Thread thread = delegate.newThread(runnable);
            thread.setName(prefix + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
