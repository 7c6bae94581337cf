package com.schemareverse.core.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Routes procedural SQL text to the specialized construct parsers and keeps per-parser metrics.
 *
 * <p>The coordinator is the isolation boundary of the parser layer: whatever a parser does
 * wrong (a {@link ConstructParseException}, or a stray runtime failure from a custom
 * implementation) is logged at WARN, tallied, and turned into a failed outcome. Callers
 * only ever see {@link ParserResult}s.
 *
 * <p><b>Dispatch:</b> {@link #parseWithBestParsers(String)} walks {@link ConstructKind#values()}
 * in declaration order. A construct whose {@link SignalDetector} cue is absent is skipped
 * without counting an attempt. {@link #parse(ConstructKind, String)} bypasses the detector
 * and always counts an attempt.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ParserCoordinator coordinator = new ParserCoordinator();
 * List<ParserResult> results = coordinator.parseWithBestParsers(functionBody);
 * double delta = ParserResult.totalDelta(results);
 * System.out.println(coordinator.getMetricsSummary());
 * }</pre>
 *
 * <p>Instances are not thread-safe. Use one coordinator per thread, or synchronize
 * externally.
 *
 * @see SignalDetector
 * @see ConfidencePolicy
 * @since 1.0.0
 */
public class ParserCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ParserCoordinator.class);

    private final Map<ConstructKind, ConstructParser> parsers;
    private final Set<ConstructKind> enabled;
    private final Map<ConstructKind, ParserMetrics> metrics = new EnumMap<>(ConstructKind.class);
    private final Map<ParseErrorKind, Integer> errorCounts = new EnumMap<>(ParseErrorKind.class);

    /**
     * Creates a coordinator with every built-in parser enabled.
     */
    public ParserCoordinator() {
        this(ConstructParsers.defaults(), EnumSet.allOf(ConstructKind.class));
    }

    /**
     * Creates a coordinator with explicit parsers.
     *
     * @param parsers parser per construct; constructs without a parser are never run
     * @param enabled constructs considered by {@link #parseWithBestParsers(String)}
     */
    public ParserCoordinator(Map<ConstructKind, ConstructParser> parsers, Set<ConstructKind> enabled) {
        Objects.requireNonNull(parsers, "parsers must not be null");
        Objects.requireNonNull(enabled, "enabled must not be null");
        this.parsers = new EnumMap<>(ConstructKind.class);
        this.parsers.putAll(parsers);
        this.enabled = enabled.isEmpty() ? EnumSet.noneOf(ConstructKind.class) : EnumSet.copyOf(enabled);
        resetMetrics();
    }

    // ==================== Dispatch ====================

    /**
     * Returns true if the construct is enabled, has a parser and its cue is present.
     *
     * @param kind construct
     * @param text candidate text
     * @return true if {@link #parseWithBestParsers(String)} would invoke the parser
     */
    public boolean shouldUse(ConstructKind kind, String text) {
        return enabled.contains(kind) && parsers.containsKey(kind) && SignalDetector.detects(kind, text);
    }

    /**
     * Runs every applicable parser in dispatch order.
     *
     * @param text function or procedure body
     * @return successful results only, in dispatch order (possibly empty)
     */
    public List<ParserResult> parseWithBestParsers(String text) {
        List<ParserResult> results = new ArrayList<>();
        for (ConstructKind kind : ConstructKind.values()) {
            if (!shouldUse(kind, text)) {
                continue;
            }
            ParserResult result = parse(kind, text);
            if (result.succeeded()) {
                results.add(result);
            }
        }
        log.debug("{} construct(s) recognized", results.size());
        return results;
    }

    /**
     * Runs a single parser, bypassing its signal detector.
     *
     * <p>Always counts one attempt, then exactly one success or one failure.
     *
     * @param kind construct to parse
     * @param text function or procedure body
     * @return successful result with steps, or a failed result
     */
    public ParserResult parse(ConstructKind kind, String text) {
        Objects.requireNonNull(kind, "kind must not be null");
        metrics.compute(kind, (k, current) -> current.recordAttempt());

        ConstructParser parser = parsers.get(kind);
        if (parser == null) {
            log.warn("No parser registered for construct '{}'", kind.getId());
            return fail(kind);
        }

        List<ConstructStep> steps;
        try {
            steps = parser.parse(text);
        } catch (ConstructParseException e) {
            log.warn("{} parser failed ({}): {}", kind.getId(), describe(e.getErrorKind()), e.getMessage());
            tally(e.getErrorKind());
            return fail(kind);
        } catch (RuntimeException e) {
            log.warn("{} parser failed unexpectedly: {}", kind.getId(), e.getMessage(), e);
            tally(ParseErrorKind.INTERNAL_ERROR);
            return fail(kind);
        }

        if (steps == null || steps.isEmpty()) {
            log.debug("{} parser found no steps", kind.getId());
            return fail(kind);
        }

        Map<String, Object> metadata;
        try {
            metadata = parser.describe(text, steps);
        } catch (RuntimeException e) {
            log.warn("{} parser could not describe its result: {}", kind.getId(), e.getMessage(), e);
            tally(ParseErrorKind.INTERNAL_ERROR);
            return fail(kind);
        }

        metrics.compute(kind, (k, current) -> current.recordSuccess());
        double delta = ConfidencePolicy.delta(kind, metadata == null ? Map.of() : metadata);
        log.debug("{} parser produced {} step(s), delta {}", kind.getId(), steps.size(), delta);
        return ParserResult.success(kind, steps, delta, metadata);
    }

    private ParserResult fail(ConstructKind kind) {
        metrics.compute(kind, (k, current) -> current.recordFailure());
        return ParserResult.failed(kind);
    }

    private void tally(ParseErrorKind errorKind) {
        errorCounts.merge(errorKind, 1, Integer::sum);
    }

    private static String describe(ParseErrorKind errorKind) {
        return switch (errorKind) {
            case INVALID_INPUT -> "invalid input";
            case UNBALANCED_PARENTHESES -> "unbalanced parentheses";
            case UNTERMINATED_BLOCK -> "unterminated block";
            case MALFORMED_CONSTRUCT -> "malformed construct";
            case NESTING_TOO_DEEP -> "nesting too deep";
            case INTERNAL_ERROR -> "internal error";
        };
    }

    // ==================== Metrics ====================

    /**
     * Returns a snapshot of the counters of every construct.
     *
     * @return unmodifiable map in dispatch order
     */
    public Map<ConstructKind, ParserMetrics> getMetrics() {
        return Collections.unmodifiableMap(new EnumMap<>(metrics));
    }

    /**
     * Returns the success rate of every construct (0.0 when nothing was attempted).
     *
     * @return unmodifiable map in dispatch order
     */
    public Map<ConstructKind, Double> getSuccessRates() {
        Map<ConstructKind, Double> rates = new EnumMap<>(ConstructKind.class);
        metrics.forEach((kind, counters) -> rates.put(kind, counters.successRate()));
        return Collections.unmodifiableMap(rates);
    }

    /**
     * Returns how often each error kind was raised since the last reset.
     *
     * @return unmodifiable map of non-zero tallies
     */
    public Map<ParseErrorKind, Integer> getErrorCounts() {
        return Collections.unmodifiableMap(new EnumMap<>(errorCounts));
    }

    /**
     * Zeroes every counter and error tally.
     */
    public void resetMetrics() {
        for (ConstructKind kind : ConstructKind.values()) {
            metrics.put(kind, ParserMetrics.empty());
        }
        errorCounts.clear();
    }

    /**
     * Formats the success rates of the constructs that were attempted.
     *
     * <p>Example:
     * <pre>
     * Parser Success Rates:
     *   cte            :  50.0% (2 attempts)
     * </pre>
     *
     * @return multi-line summary, sorted by construct id
     */
    public String getMetricsSummary() {
        StringBuilder summary = new StringBuilder("Parser Success Rates:");
        Arrays.stream(ConstructKind.values())
            .filter(kind -> metrics.get(kind).attempts() > 0)
            .sorted(Comparator.comparing(ConstructKind::getId))
            .forEach(kind -> {
                ParserMetrics counters = metrics.get(kind);
                summary.append('\n').append(String.format(Locale.ROOT, "  %-15s: %5.1f%% (%d attempts)",
                    kind.getId(), counters.successRate() * 100, counters.attempts()));
            });
        return summary.toString();
    }
}
