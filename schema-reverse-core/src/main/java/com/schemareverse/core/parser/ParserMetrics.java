package com.schemareverse.core.parser;

/**
 * Attempt, success and failure counters for one construct parser.
 *
 * <p>Instances are immutable; the coordinator replaces them as counters move, so a
 * snapshot handed to a caller never changes underneath it.
 *
 * @param attempts parser invocations
 * @param successes invocations that produced steps
 * @param failures invocations that produced nothing or failed
 *
 * @since 1.0.0
 */
public record ParserMetrics(int attempts, int successes, int failures) {

    /**
     * Compact constructor with validation.
     */
    public ParserMetrics {
        if (attempts < 0 || successes < 0 || failures < 0) {
            throw new IllegalArgumentException("Counters must be non-negative");
        }
        if (successes + failures > attempts) {
            throw new IllegalArgumentException(
                "successes + failures must not exceed attempts: " + successes + " + " + failures + " > " + attempts);
        }
    }

    /**
     * Returns zeroed counters.
     *
     * @return empty metrics
     */
    public static ParserMetrics empty() {
        return new ParserMetrics(0, 0, 0);
    }

    public ParserMetrics recordAttempt() {
        return new ParserMetrics(attempts + 1, successes, failures);
    }

    public ParserMetrics recordSuccess() {
        return new ParserMetrics(attempts, successes + 1, failures);
    }

    public ParserMetrics recordFailure() {
        return new ParserMetrics(attempts, successes, failures + 1);
    }

    /**
     * Calculates the success rate.
     *
     * @return successes / attempts, or exactly 0.0 when nothing was attempted
     */
    public double successRate() {
        if (attempts == 0) {
            return 0.0;
        }
        return (double) successes / attempts;
    }
}
