package com.schemareverse.core.parser;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of procedural-SQL constructs handled by a specialized parser.
 *
 * <p>Declaration order is the coordinator's dispatch order and therefore the order of
 * {@link ParserResult} entries returned by {@link ParserCoordinator#parseWithBestParsers(String)}.
 *
 * <p>Each constant carries its stable identifier (used in metrics, configuration and
 * summaries) and the base confidence delta applied when the construct is recognized.
 * Construct-specific adjustments live in {@link ConfidencePolicy}.
 *
 * @since 1.0.0
 */
public enum ConstructKind {

    /** Common table expressions ({@code WITH name AS (...)}). */
    CTE("cte", "Common Table Expression", 0.10),

    /** {@code EXCEPTION WHEN ... THEN ...} handler blocks. */
    EXCEPTION_HANDLER("exception", "Exception Handler", 0.05),

    /** {@code EXECUTE} of a computed statement; harder to verify statically. */
    DYNAMIC_SQL("dynamic_sql", "Dynamic SQL", -0.10),

    /** IF / FOR / WHILE / LOOP blocks. */
    CONTROL_FLOW("control_flow", "Control Flow", 0.08),

    /** {@code OVER (...)} window functions. */
    WINDOW_FUNCTION("window", "Window Function", 0.08),

    /** {@code agg(...) FILTER (WHERE ...)} filtered aggregates. */
    AGGREGATE_FILTER("aggregate", "Aggregate Filter", 0.07),

    /** Cursor declarations and OPEN / FETCH / MOVE / CLOSE. */
    CURSOR_OPERATIONS("cursor", "Cursor Operations", 0.08);

    private final String id;
    private final String displayName;
    private final double baseDelta;

    ConstructKind(String id, String displayName, double baseDelta) {
        this.id = id;
        this.displayName = displayName;
        this.baseDelta = baseDelta;
    }

    /**
     * Returns the stable identifier (e.g. {@code "cte"}, {@code "dynamic_sql"}).
     *
     * @return identifier used in metrics and configuration
     */
    public String getId() {
        return id;
    }

    /**
     * Returns a human-readable name for CLI output.
     *
     * @return display name
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Returns the confidence delta applied before construct-specific adjustments.
     *
     * @return signed base delta
     */
    public double getBaseDelta() {
        return baseDelta;
    }

    /**
     * Looks up a construct by identifier, ignoring case.
     *
     * @param id identifier such as {@code "cte"}
     * @return matching construct, or empty if unknown
     */
    public static Optional<ConstructKind> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String wanted = id.trim();
        return Arrays.stream(values())
            .filter(kind -> kind.id.equalsIgnoreCase(wanted))
            .findFirst();
    }
}
