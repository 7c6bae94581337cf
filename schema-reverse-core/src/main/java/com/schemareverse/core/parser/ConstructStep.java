package com.schemareverse.core.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One node of the step tree produced by a construct parser.
 *
 * <p>Steps are immutable. Conditional steps ({@link #BRANCH}) carry their nested steps
 * in {@code thenBranch} and {@code elseBranch}; loops carry theirs in {@code body}. For
 * every other kind these lists are empty.
 *
 * @param kind step tag such as {@link #TRY_EXCEPT}, {@link #LOOP} or {@link #BRANCH}
 * @param rawText source fragment the step was built from
 * @param attributes small string facts about the step (names, conditions)
 * @param thenBranch steps executed when a branch condition holds
 * @param elseBranch steps executed otherwise (an ELSIF chain nests here)
 * @param body steps inside a loop
 *
 * @since 1.0.0
 */
public record ConstructStep(
    String kind,
    String rawText,
    Map<String, String> attributes,
    List<ConstructStep> thenBranch,
    List<ConstructStep> elseBranch,
    List<ConstructStep> body
) {
    public static final String CTE = "cte";
    public static final String TRY_EXCEPT = "try-except";
    public static final String DYNAMIC_SQL = "dynamic_sql";
    public static final String BRANCH = "branch";
    public static final String LOOP = "loop";
    public static final String STATEMENT = "statement";
    public static final String WINDOW_FUNCTION = "window_function";
    public static final String AGGREGATE_FILTER = "aggregate_filter";
    public static final String CURSOR_DECLARE = "cursor_declare";
    public static final String CURSOR_OPEN = "cursor_open";
    public static final String CURSOR_FETCH = "cursor_fetch";
    public static final String CURSOR_MOVE = "cursor_move";
    public static final String CURSOR_CLOSE = "cursor_close";

    /**
     * Compact constructor; null collections become empty and null attribute values are dropped.
     */
    public ConstructStep {
        Objects.requireNonNull(kind, "kind must not be null");
        if (rawText == null) {
            rawText = "";
        }
        attributes = copyWithoutNulls(attributes);
        thenBranch = thenBranch == null ? List.of() : List.copyOf(thenBranch);
        elseBranch = elseBranch == null ? List.of() : List.copyOf(elseBranch);
        body = body == null ? List.of() : List.copyOf(body);
    }

    /**
     * Creates a leaf step.
     *
     * @param kind step tag
     * @param rawText source fragment
     * @return step without attributes or children
     */
    public static ConstructStep of(String kind, String rawText) {
        return new ConstructStep(kind, rawText, Map.of(), List.of(), List.of(), List.of());
    }

    /**
     * Creates a leaf step with attributes.
     *
     * @param kind step tag
     * @param rawText source fragment
     * @param attributes step facts
     * @return step without children
     */
    public static ConstructStep of(String kind, String rawText, Map<String, String> attributes) {
        return new ConstructStep(kind, rawText, attributes, List.of(), List.of(), List.of());
    }

    /**
     * Creates a conditional step.
     *
     * @param rawText source fragment
     * @param attributes step facts (typically the condition)
     * @param thenBranch steps for the true case
     * @param elseBranch steps for the false case
     * @return branch step
     */
    public static ConstructStep branch(String rawText, Map<String, String> attributes,
                                       List<ConstructStep> thenBranch, List<ConstructStep> elseBranch) {
        return new ConstructStep(BRANCH, rawText, attributes, thenBranch, elseBranch, List.of());
    }

    /**
     * Creates a loop step.
     *
     * @param rawText source fragment
     * @param attributes loop facts (type, iterator, condition)
     * @param body steps inside the loop
     * @return loop step
     */
    public static ConstructStep loop(String rawText, Map<String, String> attributes, List<ConstructStep> body) {
        return new ConstructStep(LOOP, rawText, attributes, List.of(), List.of(), body);
    }

    /**
     * Returns an attribute value.
     *
     * @param name attribute name
     * @return value or null when absent
     */
    public String attribute(String name) {
        return attributes.get(name);
    }

    /**
     * Returns true if this step has nested steps.
     *
     * @return true for branches and loops with content
     */
    public boolean hasChildren() {
        return !thenBranch.isEmpty() || !elseBranch.isEmpty() || !body.isEmpty();
    }

    /**
     * Depth of the tree rooted at this step (a leaf has depth 1).
     *
     * @return nesting depth
     */
    public int depth() {
        int deepest = 0;
        for (ConstructStep child : children()) {
            deepest = Math.max(deepest, child.depth());
        }
        return deepest + 1;
    }

    private List<ConstructStep> children() {
        if (!hasChildren()) {
            return List.of();
        }
        List<ConstructStep> all = new ArrayList<>(thenBranch);
        all.addAll(elseBranch);
        all.addAll(body);
        return all;
    }

    private static Map<String, String> copyWithoutNulls(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Map.copyOf(copy);
    }
}
