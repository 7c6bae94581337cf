package com.schemareverse.core.model;

import java.util.List;

/**
 * Baseline structural confidence of a table.
 *
 * @param score baseline in [0, 1]
 * @param patterns recognized conventions (e.g. {@code trinity}, {@code audit_trail})
 *
 * @since 1.0.0
 */
public record StructuralAssessment(double score, List<String> patterns) {

    public StructuralAssessment {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within [0, 1]: " + score);
        }
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    public boolean hasPattern(String pattern) {
        return patterns.contains(pattern);
    }
}
