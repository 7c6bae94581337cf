package com.schemareverse.core.model;

import com.schemareverse.core.parser.ParserResult;

import java.util.List;
import java.util.Objects;

/**
 * A function or procedure with its recognized constructs.
 *
 * @param function parsed routine
 * @param results successful parser results in dispatch order
 * @param confidence action baseline plus summed deltas, clamped to [0, 1]
 *
 * @since 1.0.0
 */
public record ActionCandidate(FunctionDefinition function, List<ParserResult> results, double confidence) {

    public ActionCandidate {
        Objects.requireNonNull(function, "function must not be null");
        results = results == null ? List.of() : List.copyOf(results);
    }

    /**
     * Returns the summed confidence delta of the recognized constructs.
     *
     * @return signed delta
     */
    public double constructDelta() {
        return ParserResult.totalDelta(results);
    }
}
