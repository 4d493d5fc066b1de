package com.ryuqq.router.core.exception;

import java.util.List;

/**
 * require-all 호출에서 관찰된 모든 실패의 묶음.
 *
 * <p>실패는 관찰된 순서대로 보관되며, 호출자는 {@link #getErrors()}로
 * 개별 실패를 검사할 수 있습니다. 각 실패는 suppressed 예외로도 연결되어
 * 스택 트레이스 출력 시 함께 표시됩니다.</p>
 *
 * <p>일부 Backend는 이미 성공했을 수 있으며, 롤백은 수행되지 않습니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public class AggregateRoutingException extends RoutingException {

    private final List<RuntimeException> errors;

    /**
     * 생성자.
     *
     * @param errors 관찰된 실패 목록 (관찰 순서)
     * @throws IllegalArgumentException errors가 null이거나 비어있는 경우
     */
    public AggregateRoutingException(List<? extends RuntimeException> errors) {
        super(formatMessage(errors));
        this.errors = List.copyOf(errors);
        for (RuntimeException error : this.errors) {
            addSuppressed(error);
        }
    }

    /**
     * 관찰된 실패 목록 조회.
     *
     * @return 불변 목록 (관찰 순서)
     */
    public List<RuntimeException> getErrors() {
        return errors;
    }

    /**
     * 특정 타입의 실패가 포함되어 있는지 확인.
     *
     * @param type 예외 타입
     * @return 하나라도 해당 타입이면 true
     */
    public boolean contains(Class<? extends Throwable> type) {
        for (RuntimeException error : errors) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    private static String formatMessage(List<? extends RuntimeException> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("errors cannot be null or empty");
        }
        StringBuilder sb = new StringBuilder();
        sb.append(errors.size()).append(errors.size() == 1 ? " error occurred:" : " errors occurred:");
        for (RuntimeException error : errors) {
            sb.append("\n\t* ").append(error);
        }
        return sb.toString();
    }
}
