package com.ryuqq.router.core.exception;

/**
 * 취소 또는 deadline 초과로 중단된 호출.
 *
 * <p>{@link com.ryuqq.router.core.context.RoutingContext}가 완료될 때
 * 완료 사유로 생성되며, 하위 scope에는 같은 인스턴스가 전파됩니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public class RoutingCancelledException extends RoutingException {

    /**
     * 완료 사유.
     */
    public enum Kind {
        /** 명시적 취소. */
        CANCELLED,
        /** deadline 경과. */
        DEADLINE_EXCEEDED
    }

    private final Kind kind;

    public RoutingCancelledException(Kind kind, String message) {
        super(message);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    /**
     * 명시적 취소 예외 생성.
     *
     * @return kind=CANCELLED
     */
    public static RoutingCancelledException cancelled() {
        return new RoutingCancelledException(Kind.CANCELLED, "context canceled");
    }

    /**
     * deadline 초과 예외 생성.
     *
     * @return kind=DEADLINE_EXCEEDED
     */
    public static RoutingCancelledException deadlineExceeded() {
        return new RoutingCancelledException(Kind.DEADLINE_EXCEEDED, "context deadline exceeded");
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isDeadlineExceeded() {
        return kind == Kind.DEADLINE_EXCEEDED;
    }
}
