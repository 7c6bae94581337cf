package com.schemareverse.core.parser.impl;

import com.schemareverse.core.parser.ConfidencePolicy;
import com.schemareverse.core.parser.ConstructKind;
import com.schemareverse.core.parser.ConstructParseException;
import com.schemareverse.core.parser.ConstructStep;
import com.schemareverse.core.parser.ParseErrorKind;
import com.schemareverse.core.parser.base.AbstractConstructParser;
import com.schemareverse.core.util.SqlText;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for common table expressions.
 *
 * <p>Recognizes {@code WITH [RECURSIVE] name [(columns)] AS [[NOT] MATERIALIZED] ( ... )}
 * clauses with any number of comma-separated definitions. Every definition becomes a
 * {@link ConstructStep#CTE} step with the attributes {@code name}, {@code recursive} and
 * {@code depth}. A {@code WITH} clause nested inside a definition is parsed recursively;
 * nesting deeper than {@value #MAX_NESTING} levels is rejected.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * WITH RECURSIVE tree AS (
 *     SELECT id, parent_id FROM tb_category WHERE parent_id IS NULL
 *     UNION ALL
 *     SELECT c.id, c.parent_id FROM tb_category c JOIN tree t ON c.parent_id = t.id
 * )
 * SELECT * FROM tree;
 * }</pre>
 *
 * <p>Metadata: {@code is_recursive}, {@code cte_count}, {@code cte_names}.
 *
 * @since 1.0.0
 */
public class CteParser extends AbstractConstructParser {

    /** Maximum nesting of WITH clauses inside CTE definitions. */
    public static final int MAX_NESTING = 10;

    public static final String CTE_NAMES = "cte_names";

    private static final Pattern WITH = Pattern.compile("\\bWITH\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern RECURSIVE = Pattern.compile("\\s*RECURSIVE\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEFINITION = Pattern.compile(
        "\\s*(\\w+)(?:\\s*\\([^()]*\\))?\\s+AS\\s*(?:(?:NOT\\s+)?MATERIALIZED\\s*)?\\(",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTINUATION = Pattern.compile("\\s*,");

    @Override
    public ConstructKind getKind() {
        return ConstructKind.CTE;
    }

    @Override
    protected List<ConstructStep> doParse(String body) throws ConstructParseException {
        if (!SqlText.containsWord(body, "WITH")) {
            return List.of();
        }
        List<ConstructStep> steps = new ArrayList<>();
        parseClauses(body, 0, steps);
        return steps;
    }

    private void parseClauses(String text, int depth, List<ConstructStep> steps) throws ConstructParseException {
        if (depth > MAX_NESTING) {
            throw error(ParseErrorKind.NESTING_TOO_DEEP,
                "WITH clauses nested deeper than " + MAX_NESTING + " levels");
        }
        String masked = SqlText.mask(text);
        Matcher with = WITH.matcher(masked);
        int consumed = 0;
        while (consumed < masked.length() && with.find(consumed)) {
            int position = with.end();
            boolean recursive = false;
            Matcher recursiveMatcher = RECURSIVE.matcher(masked).region(position, masked.length());
            if (recursiveMatcher.lookingAt()) {
                recursive = true;
                position = recursiveMatcher.end();
            }
            position = parseDefinitions(text, masked, position, recursive, depth, steps);
            consumed = Math.max(position, with.end());
        }
    }

    private int parseDefinitions(String text, String masked, int start, boolean recursive,
                                 int depth, List<ConstructStep> steps) throws ConstructParseException {
        int position = start;
        while (true) {
            Matcher definition = DEFINITION.matcher(masked).region(position, masked.length());
            if (!definition.lookingAt()) {
                return position;
            }
            String name = text.substring(definition.start(1), definition.end(1));
            int open = definition.end() - 1;
            int close = SqlText.findClosingParen(text, open);
            if (close < 0) {
                log.debug("CTE '{}' has no closing parenthesis, clause ignored", name);
                return masked.length();
            }
            String query = text.substring(open + 1, close);

            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put("name", name);
            attributes.put("recursive", Boolean.toString(recursive));
            attributes.put("depth", Integer.toString(depth));
            steps.add(ConstructStep.of(ConstructStep.CTE, SqlText.squash(query), attributes));

            if (SqlText.containsWord(SqlText.mask(query), "WITH")) {
                parseClauses(query, depth + 1, steps);
            }

            position = close + 1;
            Matcher continuation = CONTINUATION.matcher(masked).region(position, masked.length());
            if (!continuation.lookingAt()) {
                return position;
            }
            position = continuation.end();
        }
    }

    @Override
    public Map<String, Object> describe(String text, List<ConstructStep> steps) {
        List<String> names = steps.stream()
            .filter(step -> ConstructStep.CTE.equals(step.kind()))
            .map(step -> step.attribute("name"))
            .toList();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ConfidencePolicy.IS_RECURSIVE, SqlText.containsWord(text, "RECURSIVE"));
        metadata.put(ConfidencePolicy.CTE_COUNT, names.size());
        metadata.put(CTE_NAMES, names);
        return metadata;
    }
}
