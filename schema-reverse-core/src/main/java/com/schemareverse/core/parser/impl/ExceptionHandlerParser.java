package com.schemareverse.core.parser.impl;

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
 * Parser for {@code EXCEPTION WHEN ... THEN ...} handler blocks.
 *
 * <p>The body is split once at the first {@code EXCEPTION} keyword. The trailing block is
 * cut at every {@code WHEN}; each handler must contain a {@code THEN}, otherwise the block
 * is malformed. The whole block is summarized as a single {@link ConstructStep#TRY_EXCEPT}
 * step whose raw text is {@code "EXCEPTION"} followed by the untouched remainder.
 * Individual handlers are validated but not emitted as steps.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * BEGIN
 *     INSERT INTO tb_contact (email) VALUES (p_email);
 * EXCEPTION
 *     WHEN unique_violation THEN RETURN NULL;
 *     WHEN OTHERS THEN RAISE;
 * END;
 * }</pre>
 *
 * <p>Metadata: {@code handler_count}.
 *
 * @since 1.0.0
 */
public class ExceptionHandlerParser extends AbstractConstructParser {

    /**
     * Confidence boost this parser declares for handled blocks.
     *
     * <p>Not read by the coordinator, which applies the construct's base delta instead.
     */
    public static final double DECLARED_CONFIDENCE_BOOST = 0.15;

    public static final String HANDLER_COUNT = "handler_count";

    private static final String KEYWORD = "EXCEPTION";
    private static final Pattern EXCEPTION = Pattern.compile("\\bEXCEPTION\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHEN = Pattern.compile("\\bWHEN\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern THEN = Pattern.compile("\\bTHEN\\b", Pattern.CASE_INSENSITIVE);

    /** A single {@code WHEN condition THEN action} handler. */
    record Handler(String condition, String action) {
    }

    @Override
    public ConstructKind getKind() {
        return ConstructKind.EXCEPTION_HANDLER;
    }

    /**
     * Returns the boost this parser declares.
     *
     * @return {@value #DECLARED_CONFIDENCE_BOOST}
     */
    public double getDeclaredConfidenceBoost() {
        return DECLARED_CONFIDENCE_BOOST;
    }

    /**
     * Keeps comments so the block is reported untouched; keywords are searched on masked text.
     */
    @Override
    protected String prepare(String text) {
        return SqlText.bodyOrSelf(text);
    }

    @Override
    protected List<ConstructStep> doParse(String body) throws ConstructParseException {
        Matcher keyword = EXCEPTION.matcher(SqlText.mask(body));
        if (!keyword.find()) {
            return List.of();
        }
        String remainder = body.substring(keyword.end());
        List<Handler> handlers = parseHandlers(remainder);
        log.debug("Exception block with {} handler(s)", handlers.size());
        return List.of(ConstructStep.of(ConstructStep.TRY_EXCEPT, KEYWORD + remainder));
    }

    List<Handler> parseHandlers(String block) throws ConstructParseException {
        String masked = SqlText.mask(block);
        List<Integer> cuts = new ArrayList<>();
        Matcher when = WHEN.matcher(masked);
        while (when.find()) {
            cuts.add(when.start());
        }
        List<Handler> handlers = new ArrayList<>();
        for (int i = 0; i < cuts.size(); i++) {
            int start = cuts.get(i) + 4;
            int end = i + 1 < cuts.size() ? cuts.get(i + 1) : block.length();
            String segment = block.substring(start, end);
            if (segment.isBlank()) {
                continue;
            }
            Matcher then = THEN.matcher(masked.substring(start, end));
            if (!then.find()) {
                throw error(ParseErrorKind.MALFORMED_CONSTRUCT,
                    "Exception handler without THEN: " + excerpt(segment));
            }
            handlers.add(new Handler(
                segment.substring(0, then.start()).trim(),
                segment.substring(then.end()).trim()));
        }
        return handlers;
    }

    @Override
    public Map<String, Object> describe(String text, List<ConstructStep> steps) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        int handlerCount = steps.stream()
            .mapToInt(step -> SqlText.countWord(SqlText.mask(step.rawText()), "WHEN"))
            .sum();
        metadata.put(HANDLER_COUNT, handlerCount);
        return metadata;
    }
}
