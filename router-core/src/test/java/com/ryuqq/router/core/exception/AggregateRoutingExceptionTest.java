package com.ryuqq.router.core.exception;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AggregateRoutingException 테스트.
 *
 * @author Router Team
 * @since 1.0.0
 */
class AggregateRoutingExceptionTest {

    @Test
    void 실패_목록은_관찰_순서대로_보존된다() {
        // given
        IllegalStateException first = new IllegalStateException("first");
        RoutingCancelledException second = RoutingCancelledException.deadlineExceeded();

        // when
        AggregateRoutingException error = new AggregateRoutingException(List.of(first, second));

        // then
        assertThat(error.getErrors()).containsExactly(first, second);
        assertThat(error.getSuppressed()).containsExactly(first, second);
        assertThat(error.contains(RoutingCancelledException.class)).isTrue();
        assertThat(error.contains(NotFoundException.class)).isFalse();
    }

    @Test
    void 메시지에_모든_실패가_나열된다() {
        // given
        AggregateRoutingException error = new AggregateRoutingException(List.of(
            new IllegalStateException("backend a down"),
            new IllegalArgumentException("backend b rejected")));

        // then
        assertThat(error.getMessage())
            .startsWith("2 errors occurred:")
            .contains("backend a down")
            .contains("backend b rejected");
    }

    @Test
    void 원본_목록을_변경해도_영향이_없다() {
        // given
        List<RuntimeException> source = new ArrayList<>();
        source.add(new IllegalStateException("only"));
        AggregateRoutingException error = new AggregateRoutingException(source);

        // when
        source.clear();

        // then
        assertThat(error.getErrors()).hasSize(1);
        assertThat(error.getMessage()).startsWith("1 error occurred:");
    }

    @Test
    void 빈_목록은_허용되지_않는다() {
        assertThatThrownBy(() -> new AggregateRoutingException(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 취소_사유_종류를_구분한다() {
        assertThat(RoutingCancelledException.cancelled().isDeadlineExceeded()).isFalse();
        assertThat(RoutingCancelledException.deadlineExceeded().getKind())
            .isEqualTo(RoutingCancelledException.Kind.DEADLINE_EXCEEDED);
        assertThat(new NotFoundException().getMessage()).isEqualTo("routing: not found");
    }
}
