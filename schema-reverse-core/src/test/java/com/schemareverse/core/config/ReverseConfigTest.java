package com.schemareverse.core.config;

import com.schemareverse.core.parser.ConstructKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ReverseConfig}.
 */
class ReverseConfigTest {

    @Test
    void defaults_haveDocumentedValues() {
        ReverseConfig config = ReverseConfig.defaults();

        assertThat(config.confidence().minimum()).isEqualTo(0.80);
        assertThat(config.confidence().actionBaseline()).isEqualTo(0.70);
        assertThat(config.parsers().disabled()).isEmpty();
        assertThat(config.classification().tablePrefixes()).containsExactly("tb_", "tv_");
    }

    @Test
    void withMinimumConfidence_keepsOtherSettings() {
        ReverseConfig config = new ReverseConfig(null, new ReverseConfig.ParserConfig(List.of("cte")), null)
            .withMinimumConfidence(0.5);

        assertThat(config.confidence().minimum()).isEqualTo(0.5);
        assertThat(config.parsers().enabledKinds()).doesNotContain(ConstructKind.CTE);
    }

    @Test
    void withMinimumConfidence_outOfRange_throws() {
        assertThatThrownBy(() -> ReverseConfig.defaults().withMinimumConfidence(-0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("confidence.minimum");
    }

    @Test
    void enabledKinds_ignoresUnknownIds() {
        ReverseConfig.ParserConfig parsers = new ReverseConfig.ParserConfig(List.of("WINDOW", "no_such_parser"));

        assertThat(parsers.enabledKinds())
            .doesNotContain(ConstructKind.WINDOW_FUNCTION)
            .hasSize(ConstructKind.values().length - 1);
    }
}
