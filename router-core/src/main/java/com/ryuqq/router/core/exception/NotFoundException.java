package com.ryuqq.router.core.exception;

/**
 * Backend가 요청한 항목을 가지고 있지 않음 (soft miss).
 *
 * <p>race 방식 조회에서는 다른 Backend의 실행을 중단시키지 않으며,
 * 모든 Backend가 답을 내지 못한 경우에만 최종 결과가 됩니다.</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public class NotFoundException extends RoutingException {

    public NotFoundException() {
        super("routing: not found");
    }

    public NotFoundException(String message) {
        super(message);
    }
}
