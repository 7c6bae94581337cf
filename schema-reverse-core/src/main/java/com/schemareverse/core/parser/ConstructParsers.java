package com.schemareverse.core.parser;

import com.schemareverse.core.parser.impl.AggregateFilterParser;
import com.schemareverse.core.parser.impl.ControlFlowParser;
import com.schemareverse.core.parser.impl.CteParser;
import com.schemareverse.core.parser.impl.CursorOperationsParser;
import com.schemareverse.core.parser.impl.DynamicSqlParser;
import com.schemareverse.core.parser.impl.ExceptionHandlerParser;
import com.schemareverse.core.parser.impl.WindowFunctionParser;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Default registry of the seven construct parsers.
 *
 * <p>The set of constructs is closed, so parsers are wired here directly instead of
 * being discovered at runtime.
 *
 * @since 1.0.0
 */
public final class ConstructParsers {

    private ConstructParsers() {
        // Utility class - prevent instantiation
    }

    /**
     * Creates a fresh instance of every built-in parser.
     *
     * @return unmodifiable map with one parser per {@link ConstructKind}, in declaration order
     */
    public static Map<ConstructKind, ConstructParser> defaults() {
        Map<ConstructKind, ConstructParser> parsers = new EnumMap<>(ConstructKind.class);
        register(parsers, new CteParser());
        register(parsers, new ExceptionHandlerParser());
        register(parsers, new DynamicSqlParser());
        register(parsers, new ControlFlowParser());
        register(parsers, new WindowFunctionParser());
        register(parsers, new AggregateFilterParser());
        register(parsers, new CursorOperationsParser());
        return Collections.unmodifiableMap(parsers);
    }

    private static void register(Map<ConstructKind, ConstructParser> parsers, ConstructParser parser) {
        parsers.put(parser.getKind(), parser);
    }
}
