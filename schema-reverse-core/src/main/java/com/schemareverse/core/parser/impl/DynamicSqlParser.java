package com.schemareverse.core.parser.impl;

import com.schemareverse.core.parser.ConstructKind;
import com.schemareverse.core.parser.ConstructStep;
import com.schemareverse.core.parser.base.AbstractConstructParser;
import com.schemareverse.core.util.SqlText;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for dynamic SQL ({@code EXECUTE expression [INTO target] [USING args];}).
 *
 * <p>Trigger declarations ({@code EXECUTE PROCEDURE} / {@code EXECUTE FUNCTION}) are not
 * dynamic SQL and are skipped. Each remaining statement becomes a
 * {@link ConstructStep#DYNAMIC_SQL} step with the attributes {@code statement},
 * {@code uses_format}, {@code into} and {@code using}.
 *
 * <p>Metadata: {@code has_format}, {@code execute_count}.
 *
 * @since 1.0.0
 */
public class DynamicSqlParser extends AbstractConstructParser {

    public static final String HAS_FORMAT = "has_format";
    public static final String EXECUTE_COUNT = "execute_count";

    private static final Pattern EXECUTE = Pattern.compile(
        "\\bEXECUTE\\s+(?!(?:PROCEDURE|FUNCTION)\\b)", Pattern.CASE_INSENSITIVE);
    private static final Pattern INTO = Pattern.compile("\\bINTO\\s+(?:STRICT\\s+)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern USING = Pattern.compile("\\bUSING\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern FORMAT_CALL = Pattern.compile("\\bformat\\s*\\(", Pattern.CASE_INSENSITIVE);

    @Override
    public ConstructKind getKind() {
        return ConstructKind.DYNAMIC_SQL;
    }

    @Override
    protected List<ConstructStep> doParse(String body) {
        String masked = SqlText.mask(body);
        List<ConstructStep> steps = new ArrayList<>();
        Matcher execute = EXECUTE.matcher(masked);
        while (execute.find()) {
            int start = execute.end();
            int semicolon = masked.indexOf(';', start);
            int end = semicolon < 0 ? masked.length() : semicolon;
            if (end > start) {
                steps.add(toStep(body.substring(start, end), masked.substring(start, end)));
            }
        }
        return steps;
    }

    private ConstructStep toStep(String statement, String maskedStatement) {
        int expressionEnd = statement.length();
        String into = null;
        String using = null;

        Matcher usingMatcher = topLevel(USING, maskedStatement);
        if (usingMatcher != null) {
            using = SqlText.squash(statement.substring(usingMatcher.end()));
            expressionEnd = usingMatcher.start();
        }
        Matcher intoMatcher = topLevel(INTO, maskedStatement.substring(0, expressionEnd));
        if (intoMatcher != null) {
            into = SqlText.squash(statement.substring(intoMatcher.end(), expressionEnd));
            expressionEnd = intoMatcher.start();
        }

        String expression = SqlText.squash(statement.substring(0, expressionEnd));
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("statement", expression);
        attributes.put("uses_format", Boolean.toString(FORMAT_CALL.matcher(expression).find()));
        attributes.put("into", into);
        attributes.put("using", using);
        return ConstructStep.of(ConstructStep.DYNAMIC_SQL, SqlText.squash(statement), attributes);
    }

    /**
     * Finds the first match that is not nested inside parentheses.
     */
    private static Matcher topLevel(Pattern pattern, String masked) {
        Matcher matcher = pattern.matcher(masked);
        while (matcher.find()) {
            if (depthAt(masked, matcher.start()) == 0) {
                return matcher;
            }
        }
        return null;
    }

    private static int depthAt(String masked, int index) {
        int depth = 0;
        for (int i = 0; i < index; i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            }
        }
        return depth;
    }

    @Override
    public Map<String, Object> describe(String text, List<ConstructStep> steps) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(HAS_FORMAT, text.toLowerCase(Locale.ROOT).contains("format("));
        metadata.put(EXECUTE_COUNT, steps.size());
        return metadata;
    }
}
