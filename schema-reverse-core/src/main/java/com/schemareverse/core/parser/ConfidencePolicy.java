package com.schemareverse.core.parser;

import java.util.Map;

/**
 * Fixed confidence-delta policy applied by the coordinator.
 *
 * <p>Every construct contributes its {@link ConstructKind#getBaseDelta() base delta}.
 * Only CTEs are adjusted:
 * <ul>
 *   <li>a recursive CTE replaces the base with {@value #RECURSIVE_CTE_DELTA}</li>
 *   <li>more than {@value #MULTI_CTE_THRESHOLD} named CTEs add {@value #MULTI_CTE_BONUS}</li>
 * </ul>
 *
 * <p>Dynamic SQL is the only negative contribution.
 *
 * @since 1.0.0
 */
public final class ConfidencePolicy {

    public static final double RECURSIVE_CTE_DELTA = 0.15;
    public static final double MULTI_CTE_BONUS = 0.05;
    public static final int MULTI_CTE_THRESHOLD = 2;

    public static final String IS_RECURSIVE = "is_recursive";
    public static final String CTE_COUNT = "cte_count";

    private ConfidencePolicy() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Computes the delta for a successful parse.
     *
     * @param kind construct that was parsed
     * @param metadata metadata reported by the parser
     * @return signed confidence delta
     */
    public static double delta(ConstructKind kind, Map<String, Object> metadata) {
        if (kind != ConstructKind.CTE) {
            return kind.getBaseDelta();
        }
        double delta = Boolean.TRUE.equals(metadata.get(IS_RECURSIVE))
            ? RECURSIVE_CTE_DELTA
            : kind.getBaseDelta();
        Object count = metadata.get(CTE_COUNT);
        if (count instanceof Integer cteCount && cteCount > MULTI_CTE_THRESHOLD) {
            delta += MULTI_CTE_BONUS;
        }
        return delta;
    }
}
