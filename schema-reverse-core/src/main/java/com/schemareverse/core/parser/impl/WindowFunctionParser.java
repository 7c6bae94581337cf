package com.schemareverse.core.parser.impl;

import com.schemareverse.core.parser.ConstructKind;
import com.schemareverse.core.parser.ConstructParseException;
import com.schemareverse.core.parser.ConstructStep;
import com.schemareverse.core.parser.ParseErrorKind;
import com.schemareverse.core.parser.base.AbstractConstructParser;
import com.schemareverse.core.util.SqlText;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for window functions ({@code func(args) OVER (spec)} and {@code func(args) OVER name}).
 *
 * <p>Every call becomes a {@link ConstructStep#WINDOW_FUNCTION} step with the attributes
 * {@code function}, {@code arguments}, {@code partition_by}, {@code order_by},
 * {@code frame} and {@code window} (named windows only). A filtered aggregate used as a
 * window function ({@code count(*) FILTER (WHERE ...) OVER (...)}) is attributed to the
 * aggregate.
 *
 * <p>Metadata: {@code function_count}, {@code functions}, {@code has_partition}.
 *
 * @since 1.0.0
 */
public class WindowFunctionParser extends AbstractConstructParser {

    public static final String FUNCTION_COUNT = "function_count";
    public static final String FUNCTIONS = "functions";
    public static final String HAS_PARTITION = "has_partition";

    private static final Pattern OVER = Pattern.compile("\\bOVER\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WINDOW_NAME = Pattern.compile("\\s*(\\w+)");
    private static final Pattern PARTITION_BY = Pattern.compile(
        "\\bPARTITION\\s+BY\\s+(.+?)(?=\\bORDER\\s+BY\\b|\\b(?:ROWS|RANGE|GROUPS)\\b|$)",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ORDER_BY = Pattern.compile(
        "\\bORDER\\s+BY\\s+(.+?)(?=\\b(?:ROWS|RANGE|GROUPS)\\b|$)",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern FRAME = Pattern.compile(
        "\\b((?:ROWS|RANGE|GROUPS)\\b.+)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    @Override
    public ConstructKind getKind() {
        return ConstructKind.WINDOW_FUNCTION;
    }

    @Override
    protected List<ConstructStep> doParse(String body) throws ConstructParseException {
        String masked = SqlText.mask(body);
        List<ConstructStep> steps = new ArrayList<>();
        Matcher over = OVER.matcher(masked);
        while (over.find()) {
            int callEnd = previousNonSpace(masked, over.start());
            if (callEnd < 0 || masked.charAt(callEnd) != ')') {
                continue;
            }
            int callOpen = SqlText.findOpeningParen(body, callEnd);
            if (callOpen < 0) {
                throw error(ParseErrorKind.UNBALANCED_PARENTHESES,
                    "Unbalanced call before OVER: " + excerpt(body.substring(0, over.start())));
            }
            String function = identifierBefore(body, callOpen);
            if ("FILTER".equalsIgnoreCase(function)) {
                int filterStart = previousNonSpace(masked, callOpen) + 1 - function.length();
                int aggregateEnd = previousNonSpace(masked, filterStart);
                if (aggregateEnd >= 0 && masked.charAt(aggregateEnd) == ')') {
                    int aggregateOpen = SqlText.findOpeningParen(body, aggregateEnd);
                    if (aggregateOpen >= 0) {
                        callOpen = aggregateOpen;
                        callEnd = aggregateEnd;
                        function = identifierBefore(body, aggregateOpen);
                    }
                }
            }
            if (function.isEmpty()) {
                continue;
            }
            steps.add(parseWindow(body, masked, over.end(), function, body.substring(callOpen + 1, callEnd)));
        }
        return steps;
    }

    private ConstructStep parseWindow(String body, String masked, int afterOver, String function, String arguments)
            throws ConstructParseException {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("function", function);
        attributes.put("arguments", SqlText.squash(arguments));

        int specStart = afterOver;
        while (specStart < masked.length() && Character.isWhitespace(masked.charAt(specStart))) {
            specStart++;
        }
        String raw;
        if (specStart < masked.length() && masked.charAt(specStart) == '(') {
            int specEnd = SqlText.findClosingParen(body, specStart);
            if (specEnd < 0) {
                throw error(ParseErrorKind.UNBALANCED_PARENTHESES,
                    "Unbalanced window specification for " + function + ": " + excerpt(body.substring(specStart)));
            }
            String spec = body.substring(specStart + 1, specEnd);
            attributes.put("partition_by", clause(PARTITION_BY, spec));
            attributes.put("order_by", clause(ORDER_BY, spec));
            attributes.put("frame", clause(FRAME, spec));
            raw = function + "(" + arguments + ") OVER (" + spec + ")";
        } else {
            Matcher name = WINDOW_NAME.matcher(masked).region(afterOver, masked.length());
            if (!name.lookingAt()) {
                throw error(ParseErrorKind.MALFORMED_CONSTRUCT, "OVER without window for " + function);
            }
            String window = body.substring(name.start(1), name.end(1));
            attributes.put("window", window);
            raw = function + "(" + arguments + ") OVER " + window;
        }
        return ConstructStep.of(ConstructStep.WINDOW_FUNCTION, SqlText.squash(raw), attributes);
    }

    private static String clause(Pattern pattern, String spec) {
        Matcher matcher = pattern.matcher(spec);
        if (!matcher.find()) {
            return null;
        }
        String value = SqlText.squash(matcher.group(1));
        return value.isEmpty() ? null : value;
    }

    private static int previousNonSpace(String text, int before) {
        int i = before - 1;
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
            i--;
        }
        return i;
    }

    @Override
    public Map<String, Object> describe(String text, List<ConstructStep> steps) {
        Set<String> functions = new LinkedHashSet<>();
        boolean partitioned = false;
        for (ConstructStep step : steps) {
            functions.add(step.attribute("function").toLowerCase(Locale.ROOT));
            partitioned |= step.attribute("partition_by") != null;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(FUNCTION_COUNT, steps.size());
        metadata.put(FUNCTIONS, List.copyOf(functions));
        metadata.put(HAS_PARTITION, partitioned);
        return metadata;
    }
}
