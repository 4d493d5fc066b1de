package com.ryuqq.router.core.stream;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 여러 결과를 순차적으로 전달하는 수신 전용 스트림.
 *
 * <p>{@link #next()}는 다음 중 하나가 될 때까지 블로킹합니다:</p>
 * <ul>
 *   <li>다음 항목 도착 → {@code Optional.of(item)}</li>
 *   <li>스트림 종료 → {@code Optional.empty()} (이후 호출도 계속 empty)</li>
 *   <li>종료 실패 → 생산자가 기록한 예외를 던짐 (버퍼에 남은 항목을 모두 전달한 후)</li>
 * </ul>
 *
 * <p>소비자가 더 이상 결과를 원하지 않으면 {@link #close()}를 호출해야 하며,
 * 그러면 생산자 측 작업도 중단됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (ResultStream<AddrInfo> providers = router.findProvidersAsync(ctx, cid, 20)) {
 *     Optional<AddrInfo> next;
 *     while ((next = providers.next()).isPresent()) {
 *         connect(next.get());
 *     }
 * }
 * }</pre>
 *
 * @param <T> 항목 타입
 * @author Router Team
 * @since 1.0.0
 */
public interface ResultStream<T> extends AutoCloseable {

    /**
     * 다음 항목 수신 (블로킹).
     *
     * @return 다음 항목, 스트림이 끝났으면 empty
     * @throws RuntimeException 생산자가 스트림을 실패로 종료한 경우
     */
    Optional<T> next();

    /**
     * 소비 중단. 남은 항목은 버려지며, 여러 번 호출해도 안전합니다.
     */
    @Override
    void close();

    /**
     * 남은 항목을 모두 소비.
     *
     * @param action 각 항목에 적용할 작업
     */
    default void forEachRemaining(Consumer<? super T> action) {
        Optional<T> item;
        while ((item = next()).isPresent()) {
            action.accept(item.get());
        }
    }

    /**
     * 남은 항목을 모두 목록으로 수집.
     *
     * @return 수신 순서대로의 항목 목록
     */
    default List<T> drain() {
        List<T> items = new ArrayList<>();
        forEachRemaining(items::add);
        return items;
    }
}
