package com.schemareverse.core.parser;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConstructStep}.
 */
class ConstructStepTest {

    @Test
    void constructor_dropsNullAttributeValues() {
        Map<String, String> attributes = new HashMap<>();
        attributes.put("condition", "x > 0");
        attributes.put("iterator", null);

        ConstructStep step = ConstructStep.of(ConstructStep.STATEMENT, null, attributes);

        assertThat(step.attributes()).containsOnlyKeys("condition");
        assertThat(step.attribute("iterator")).isNull();
        assertThat(step.rawText()).isEmpty();
    }

    @Test
    void depth_countsNestedBranchesAndLoops() {
        ConstructStep leaf = ConstructStep.of(ConstructStep.STATEMENT, "PERFORM 1;");
        ConstructStep loop = ConstructStep.loop("LOOP", Map.of("loop_type", "loop"), List.of(leaf));
        ConstructStep branch = ConstructStep.branch("IF", Map.of("condition", "a"), List.of(loop), List.of(leaf));

        assertThat(leaf.depth()).isEqualTo(1);
        assertThat(leaf.hasChildren()).isFalse();
        assertThat(loop.depth()).isEqualTo(2);
        assertThat(branch.depth()).isEqualTo(3);
        assertThat(branch.hasChildren()).isTrue();
    }
}
