package com.schemareverse.core.parser.impl;

import com.schemareverse.core.parser.ConstructKind;
import com.schemareverse.core.parser.ConstructStep;
import com.schemareverse.core.parser.base.AbstractConstructParser;
import com.schemareverse.core.util.SqlText;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Parser for cursor declarations and cursor operations.
 *
 * <p>Recognized statements, reported in source order:
 * <ul>
 *   <li>{@code name [NO] [SCROLL] CURSOR [(params)] FOR|IS query;} as {@link ConstructStep#CURSOR_DECLARE}</li>
 *   <li>{@code OPEN name [(args)] [FOR [EXECUTE] query];} as {@link ConstructStep#CURSOR_OPEN}</li>
 *   <li>{@code FETCH [direction] [FROM|IN] name INTO targets;} as {@link ConstructStep#CURSOR_FETCH}</li>
 *   <li>{@code MOVE [direction] [FROM|IN] name;} as {@link ConstructStep#CURSOR_MOVE}</li>
 *   <li>{@code CLOSE name;} as {@link ConstructStep#CURSOR_CLOSE}</li>
 * </ul>
 *
 * <p>{@code FETCH FIRST n ROWS ONLY} row limiting has no {@code INTO} and is not reported.
 *
 * <p>Metadata: {@code cursor_names}, {@code declared_count}, {@code operation_count}.
 *
 * @since 1.0.0
 */
public class CursorOperationsParser extends AbstractConstructParser {

    public static final String CURSOR_NAMES = "cursor_names";
    public static final String DECLARED_COUNT = "declared_count";
    public static final String OPERATION_COUNT = "operation_count";

    private static final String DIRECTION =
        "NEXT|PRIOR|FIRST|LAST|ABSOLUTE\\s+-?\\d+|RELATIVE\\s+-?\\d+|FORWARD(?:\\s+(?:ALL|\\d+))?"
            + "|BACKWARD(?:\\s+(?:ALL|\\d+))?|ALL|\\d+";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final Pattern DECLARE = Pattern.compile(
        "\\b(\\w+)\\s+(?:NO\\s+)?(?:SCROLL\\s+)?CURSOR\\s*(?:\\(([^)]*)\\)\\s*)?(?:FOR|IS)\\s+(.+?);", FLAGS);
    private static final Pattern OPEN = Pattern.compile(
        "\\bOPEN\\s+(\\w+)\\s*(?:\\(([^)]*)\\))?\\s*(?:(?:NO\\s+)?(?:SCROLL\\s+)?FOR\\s+(?:EXECUTE\\s+)?(.+?))?\\s*;", FLAGS);
    private static final Pattern FETCH = Pattern.compile(
        "\\bFETCH\\s+(?:(" + DIRECTION + ")\\s+)?(?:(?:FROM|IN)\\s+)?(\\w+)\\s+INTO\\s+(?:STRICT\\s+)?(.+?)\\s*;", FLAGS);
    private static final Pattern MOVE = Pattern.compile(
        "\\bMOVE\\s+(?:(" + DIRECTION + ")\\s+)?(?:(?:FROM|IN)\\s+)?(\\w+)\\s*;", FLAGS);
    private static final Pattern CLOSE = Pattern.compile("\\bCLOSE\\s+(\\w+)\\s*;", FLAGS);

    private record Located(int position, ConstructStep step) {
    }

    @Override
    public ConstructKind getKind() {
        return ConstructKind.CURSOR_OPERATIONS;
    }

    @Override
    protected List<ConstructStep> doParse(String body) {
        List<Located> found = new ArrayList<>();

        for (MatchResult match : findMasked(DECLARE, body)) {
            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put("cursor", group(body, match, 1));
            attributes.put("parameters", trimmed(group(body, match, 2)));
            attributes.put("query", trimmed(group(body, match, 3)));
            found.add(located(match, body, ConstructStep.CURSOR_DECLARE, attributes));
        }
        for (MatchResult match : findMasked(OPEN, body)) {
            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put("cursor", group(body, match, 1));
            attributes.put("arguments", trimmed(group(body, match, 2)));
            attributes.put("query", trimmed(group(body, match, 3)));
            found.add(located(match, body, ConstructStep.CURSOR_OPEN, attributes));
        }
        for (MatchResult match : findMasked(FETCH, body)) {
            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put("cursor", group(body, match, 2));
            attributes.put("direction", trimmed(group(body, match, 1)));
            attributes.put("into", trimmed(group(body, match, 3)));
            found.add(located(match, body, ConstructStep.CURSOR_FETCH, attributes));
        }
        for (MatchResult match : findMasked(MOVE, body)) {
            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put("cursor", group(body, match, 2));
            attributes.put("direction", trimmed(group(body, match, 1)));
            found.add(located(match, body, ConstructStep.CURSOR_MOVE, attributes));
        }
        for (MatchResult match : findMasked(CLOSE, body)) {
            found.add(located(match, body, ConstructStep.CURSOR_CLOSE, Map.of("cursor", group(body, match, 1))));
        }

        return found.stream()
            .sorted(Comparator.comparingInt(Located::position))
            .map(Located::step)
            .toList();
    }

    private static Located located(MatchResult match, String body, String kind, Map<String, String> attributes) {
        String raw = SqlText.squash(body.substring(match.start(), match.end()));
        return new Located(match.start(), ConstructStep.of(kind, raw, attributes));
    }

    private static String trimmed(String value) {
        if (value == null) {
            return null;
        }
        String squashed = SqlText.squash(value);
        return squashed.isEmpty() ? null : squashed;
    }

    @Override
    public Map<String, Object> describe(String text, List<ConstructStep> steps) {
        Set<String> names = new LinkedHashSet<>();
        int declared = 0;
        for (ConstructStep step : steps) {
            names.add(step.attribute("cursor"));
            if (ConstructStep.CURSOR_DECLARE.equals(step.kind())) {
                declared++;
            }
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(CURSOR_NAMES, List.copyOf(names));
        metadata.put(DECLARED_COUNT, declared);
        metadata.put(OPERATION_COUNT, steps.size() - declared);
        return metadata;
    }
}
