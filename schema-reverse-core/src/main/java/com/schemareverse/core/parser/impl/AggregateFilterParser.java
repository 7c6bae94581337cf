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
 * Parser for filtered aggregates ({@code agg(args) FILTER (WHERE cond) [AS alias]}).
 *
 * <p>Each filter clause is traced back to its aggregate call and becomes an
 * {@link ConstructStep#AGGREGATE_FILTER} step with the attributes {@code function},
 * {@code argument}, {@code condition} and {@code alias}.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * SELECT count(*) FILTER (WHERE status = 'confirmed') AS confirmed_count,
 *        sum(amount) FILTER (WHERE refunded) refunded_total
 * FROM tb_booking;
 * }</pre>
 *
 * <p>Metadata: {@code aggregate_count}, {@code functions}.
 *
 * @since 1.0.0
 */
public class AggregateFilterParser extends AbstractConstructParser {

    public static final String AGGREGATE_COUNT = "aggregate_count";
    public static final String FUNCTIONS = "functions";

    private static final Pattern FILTER = Pattern.compile("\\bFILTER\\s*\\(\\s*WHERE\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ALIAS = Pattern.compile("\\s*(?:AS\\s+)?([A-Za-z_]\\w*)", Pattern.CASE_INSENSITIVE);
    private static final Set<String> NOT_ALIASES = Set.of(
        "FROM", "OVER", "WHERE", "GROUP", "ORDER", "HAVING", "LIMIT", "UNION", "INTO",
        "AND", "OR", "THEN", "ELSE", "END", "WHEN", "IS", "AS");

    @Override
    public ConstructKind getKind() {
        return ConstructKind.AGGREGATE_FILTER;
    }

    @Override
    protected List<ConstructStep> doParse(String body) throws ConstructParseException {
        String masked = SqlText.mask(body);
        List<ConstructStep> steps = new ArrayList<>();
        Matcher filter = FILTER.matcher(masked);
        while (filter.find()) {
            int callEnd = filter.start() - 1;
            while (callEnd >= 0 && Character.isWhitespace(masked.charAt(callEnd))) {
                callEnd--;
            }
            if (callEnd < 0 || masked.charAt(callEnd) != ')') {
                log.debug("FILTER clause without aggregate call at offset {}", filter.start());
                continue;
            }
            int callOpen = SqlText.findOpeningParen(body, callEnd);
            if (callOpen < 0) {
                throw error(ParseErrorKind.UNBALANCED_PARENTHESES,
                    "Unbalanced aggregate call before FILTER: " + excerpt(body.substring(0, filter.start())));
            }
            String function = identifierBefore(body, callOpen);
            if (function.isEmpty()) {
                continue;
            }

            int filterOpen = masked.indexOf('(', filter.start());
            int filterClose = SqlText.findClosingParen(body, filterOpen);
            if (filterClose < 0) {
                throw error(ParseErrorKind.UNBALANCED_PARENTHESES,
                    "Unbalanced FILTER clause for " + function + ": " + excerpt(body.substring(filterOpen)));
            }

            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put("function", function);
            attributes.put("argument", SqlText.squash(body.substring(callOpen + 1, callEnd)));
            attributes.put("condition", SqlText.squash(body.substring(filter.end(), filterClose)));
            attributes.put("alias", aliasAfter(body, masked, filterClose + 1));

            String raw = function + body.substring(callOpen, filterClose + 1);
            steps.add(ConstructStep.of(ConstructStep.AGGREGATE_FILTER, SqlText.squash(raw), attributes));
        }
        return steps;
    }

    private static String aliasAfter(String body, String masked, int from) {
        Matcher alias = ALIAS.matcher(masked).region(from, masked.length());
        if (!alias.lookingAt()) {
            return null;
        }
        String candidate = body.substring(alias.start(1), alias.end(1));
        return NOT_ALIASES.contains(candidate.toUpperCase(Locale.ROOT)) ? null : candidate;
    }

    @Override
    public Map<String, Object> describe(String text, List<ConstructStep> steps) {
        Set<String> functions = new LinkedHashSet<>();
        steps.forEach(step -> functions.add(step.attribute("function").toLowerCase(Locale.ROOT)));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(AGGREGATE_COUNT, steps.size());
        metadata.put(FUNCTIONS, List.copyOf(functions));
        return metadata;
    }
}
