package com.tessera.search.context;

import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.SearchTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeadlineTest {

    @Test
    @DisplayName("Should never expire without a time budget")
    void shouldNeverExpire() {
        Deadline deadline = Deadline.after(Duration.ZERO);

        assertThat(deadline.isExceeded()).isFalse();
        assertThatCode(deadline::check).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should expire once the time budget elapsed")
    void shouldExpire() throws InterruptedException {
        Deadline deadline = Deadline.after(Duration.ofMillis(1));
        Thread.sleep(5);

        assertThat(deadline.isExceeded()).isTrue();
        assertThatThrownBy(deadline::check)
            .isInstanceOf(SearchTimeoutException.class)
            .satisfies(e -> assertThat(((SearchTimeoutException) e).code()).isEqualTo(ErrorCode.SEARCH_TIMED_OUT));
    }

    @Test
    @DisplayName("Should accept time budgets too long to count in nanoseconds")
    void shouldAcceptHugeBudgets() {
        Deadline centuries = Deadline.after(Duration.ofDays(365L * 250));
        Deadline forever = Deadline.after(Duration.ofSeconds(Long.MAX_VALUE));

        assertThat(centuries.isExceeded()).isFalse();
        assertThat(forever.isExceeded()).isFalse();
        assertThatCode(forever::check).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should be exceeded at once for a negative time budget")
    void shouldExpireNegativeBudget() {
        assertThat(Deadline.after(Duration.ofMillis(-5)).isExceeded()).isTrue();
    }

    @Test
    @DisplayName("Should fail the next check after cancellation")
    void shouldCancel() {
        Deadline deadline = Deadline.never();
        deadline.cancel();

        assertThat(deadline.isCancelled()).isTrue();
        assertThatThrownBy(deadline::check)
            .isInstanceOf(SearchTimeoutException.class)
            .hasMessageContaining("cancelled");
    }
}
