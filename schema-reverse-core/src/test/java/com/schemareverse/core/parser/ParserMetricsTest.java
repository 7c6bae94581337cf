package com.schemareverse.core.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ParserMetrics}.
 */
class ParserMetricsTest {

    @Test
    void successRate_withNoAttempts_isZero() {
        assertThat(ParserMetrics.empty().successRate()).isEqualTo(0.0);
    }

    @Test
    void successRate_dividesSuccessesByAttempts() {
        ParserMetrics metrics = ParserMetrics.empty()
            .recordAttempt().recordSuccess()
            .recordAttempt().recordFailure()
            .recordAttempt().recordSuccess()
            .recordAttempt().recordSuccess();

        assertThat(metrics.attempts()).isEqualTo(4);
        assertThat(metrics.successRate()).isEqualTo(0.75);
    }

    @Test
    void constructor_withMoreOutcomesThanAttempts_throws() {
        assertThatThrownBy(() -> new ParserMetrics(1, 1, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ParserMetrics(-1, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
