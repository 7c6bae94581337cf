package com.schemareverse.core.parser;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one specialized parser invocation.
 *
 * <p>A failed result never carries steps; the compact constructor rejects the combination.
 * The confidence delta is not bounded to [0, 1] and may be negative.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * List<ParserResult> results = coordinator.parseWithBestParsers(body);
 * double delta = ParserResult.totalDelta(results);
 * }</pre>
 *
 * @param steps ordered steps (empty when the parser produced nothing)
 * @param confidenceDelta signed adjustment to the entity or action confidence
 * @param parserId construct whose parser produced the result
 * @param metadata auxiliary facts (e.g. {@code is_recursive}, {@code cte_count})
 * @param succeeded whether the parser produced at least one step
 *
 * @since 1.0.0
 */
public record ParserResult(
    List<ConstructStep> steps,
    double confidenceDelta,
    ConstructKind parserId,
    Map<String, Object> metadata,
    boolean succeeded
) {
    /**
     * Compact constructor with validation.
     */
    public ParserResult {
        Objects.requireNonNull(parserId, "parserId must not be null");
        steps = steps == null ? List.of() : List.copyOf(steps);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        if (!succeeded && !steps.isEmpty()) {
            throw new IllegalArgumentException("A failed result must not carry steps");
        }
    }

    /**
     * Creates a successful result.
     *
     * @param parserId producing construct
     * @param steps parsed steps
     * @param confidenceDelta computed delta
     * @param metadata discriminating facts
     * @return successful result
     */
    public static ParserResult success(ConstructKind parserId, List<ConstructStep> steps,
                                       double confidenceDelta, Map<String, Object> metadata) {
        return new ParserResult(steps, confidenceDelta, parserId, metadata, true);
    }

    /**
     * Creates a failed result with no steps and a zero delta.
     *
     * @param parserId construct whose parser failed or found nothing
     * @return failed result
     */
    public static ParserResult failed(ConstructKind parserId) {
        return new ParserResult(List.of(), 0.0, parserId, Map.of(), false);
    }

    /**
     * Sums the deltas of successful results.
     *
     * @param results parser results
     * @return total delta (0.0 for an empty list)
     */
    public static double totalDelta(List<ParserResult> results) {
        return results.stream()
            .filter(ParserResult::succeeded)
            .mapToDouble(ParserResult::confidenceDelta)
            .sum();
    }
}
