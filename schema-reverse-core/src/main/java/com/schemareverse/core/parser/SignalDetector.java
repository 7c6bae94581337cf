package com.schemareverse.core.parser;

import java.util.regex.Pattern;

/**
 * Cheap lexical gates deciding which construct parsers are worth invoking.
 *
 * <p>Every predicate is pure, never throws and treats {@code null} as "no signal".
 * False positives are expected: the parser behind a gate returns nothing when its
 * construct turns out to be absent. The gate only saves work.
 *
 * <p><b>Cues (case-insensitive, whole word):</b></p>
 * <ul>
 *   <li>CTE: {@code WITH}</li>
 *   <li>Exception handling: {@code EXCEPTION}</li>
 *   <li>Dynamic SQL: {@code EXECUTE}</li>
 *   <li>Control flow: {@code FOR}, {@code LOOP}, {@code WHILE}</li>
 *   <li>Window function: {@code OVER (}, {@code PARTITION BY}, {@code ROW_NUMBER}</li>
 *   <li>Aggregate filter: {@code FILTER (WHERE}</li>
 *   <li>Cursor operations: {@code CURSOR}, {@code FETCH}, {@code OPEN}, {@code CLOSE}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class SignalDetector {

    private static final Pattern WITH = Pattern.compile("\\bWITH\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXCEPTION = Pattern.compile("\\bEXCEPTION\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXECUTE = Pattern.compile("\\bEXECUTE\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTROL_FLOW = Pattern.compile("\\b(?:FOR|LOOP|WHILE)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WINDOW = Pattern.compile(
        "\\bOVER\\s*\\(|\\bPARTITION\\s+BY\\b|\\bROW_NUMBER\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern AGGREGATE_FILTER = Pattern.compile(
        "\\bFILTER\\s*\\(\\s*WHERE\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CURSOR = Pattern.compile(
        "\\b(?:CURSOR|FETCH|OPEN|CLOSE)\\b", Pattern.CASE_INSENSITIVE);

    private SignalDetector() {
        // Utility class - prevent instantiation
    }

    /**
     * Dispatches to the predicate of the given construct.
     *
     * @param kind construct
     * @param text candidate text
     * @return true if the construct's cue is present
     */
    public static boolean detects(ConstructKind kind, String text) {
        return switch (kind) {
            case CTE -> shouldUseCteParser(text);
            case EXCEPTION_HANDLER -> shouldUseExceptionParser(text);
            case DYNAMIC_SQL -> shouldUseDynamicSqlParser(text);
            case CONTROL_FLOW -> shouldUseControlFlowParser(text);
            case WINDOW_FUNCTION -> shouldUseWindowParser(text);
            case AGGREGATE_FILTER -> shouldUseAggregateParser(text);
            case CURSOR_OPERATIONS -> shouldUseCursorParser(text);
        };
    }

    public static boolean shouldUseCteParser(String text) {
        return found(WITH, text);
    }

    public static boolean shouldUseExceptionParser(String text) {
        return found(EXCEPTION, text);
    }

    public static boolean shouldUseDynamicSqlParser(String text) {
        return found(EXECUTE, text);
    }

    public static boolean shouldUseControlFlowParser(String text) {
        return found(CONTROL_FLOW, text);
    }

    public static boolean shouldUseWindowParser(String text) {
        return found(WINDOW, text);
    }

    public static boolean shouldUseAggregateParser(String text) {
        return found(AGGREGATE_FILTER, text);
    }

    public static boolean shouldUseCursorParser(String text) {
        return found(CURSOR, text);
    }

    /**
     * Describes the cue of a construct for CLI listings.
     *
     * @param kind construct
     * @return short cue description
     */
    public static String describeCue(ConstructKind kind) {
        return switch (kind) {
            case CTE -> "WITH";
            case EXCEPTION_HANDLER -> "EXCEPTION";
            case DYNAMIC_SQL -> "EXECUTE";
            case CONTROL_FLOW -> "FOR | LOOP | WHILE";
            case WINDOW_FUNCTION -> "OVER ( | PARTITION BY | ROW_NUMBER";
            case AGGREGATE_FILTER -> "FILTER (WHERE";
            case CURSOR_OPERATIONS -> "CURSOR | FETCH | OPEN | CLOSE";
        };
    }

    private static boolean found(Pattern pattern, String text) {
        return text != null && pattern.matcher(text).find();
    }
}
