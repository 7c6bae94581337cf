package com.schemareverse.core.parser.base;

import com.schemareverse.core.parser.ConstructParseException;
import com.schemareverse.core.parser.ConstructParser;
import com.schemareverse.core.parser.ConstructStep;
import com.schemareverse.core.parser.ParseErrorKind;
import com.schemareverse.core.util.SqlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for construct parsers providing common functionality.
 *
 * <p>This class reduces duplication across the seven parsers by providing:
 * <ul>
 *   <li>Logger initialization (one logger per parser class)</li>
 *   <li>Input validation: null or blank text is rejected with {@link ParseErrorKind#INVALID_INPUT}</li>
 *   <li>Body preparation: the dollar-quoted body of a CREATE FUNCTION statement is
 *       extracted and comments are removed before {@link #doParse(String)} runs</li>
 *   <li>Failure containment: any {@link RuntimeException} thrown by a subclass is wrapped
 *       into {@link ParseErrorKind#INTERNAL_ERROR}, so only {@link ConstructParseException}
 *       leaves the parser</li>
 *   <li>Regex helpers for scanning masked text</li>
 * </ul>
 *
 * <p><b>Implementing a parser:</b></p>
 * <ol>
 *   <li>Return the construct from {@link #getKind()}</li>
 *   <li>Implement {@link #doParse(String)} against the prepared body</li>
 *   <li>Implement {@link #describe(String, List)} with the facts the coordinator needs</li>
 * </ol>
 *
 * @see ConstructParser
 * @since 1.0.0
 */
public abstract class AbstractConstructParser implements ConstructParser {

    /**
     * Logger instance for this parser.
     * Automatically initialized with the concrete parser class name.
     */
    protected final Logger log;

    protected AbstractConstructParser() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final List<ConstructStep> parse(String text) throws ConstructParseException {
        if (text == null || text.isBlank()) {
            throw error(ParseErrorKind.INVALID_INPUT, "Input must be a non-empty string");
        }
        String body = prepare(text);
        try {
            List<ConstructStep> steps = doParse(body);
            log.debug("{} parser produced {} step(s)", getKind().getId(), steps.size());
            return List.copyOf(steps);
        } catch (RuntimeException e) {
            throw new ConstructParseException(getKind(), ParseErrorKind.INTERNAL_ERROR,
                "Unexpected failure in " + getKind().getId() + " parser: " + e.getMessage(), e);
        }
    }

    /**
     * Parses the prepared body.
     *
     * @param body body returned by {@link #prepare(String)}
     * @return steps in source order (empty if the construct is absent)
     * @throws ConstructParseException if the construct cannot be interpreted
     */
    protected abstract List<ConstructStep> doParse(String body) throws ConstructParseException;

    /**
     * Extracts the function body and strips comments.
     *
     * <p>Only a full {@code CREATE FUNCTION|PROCEDURE} statement is unwrapped; a bare body
     * is used as given.
     *
     * @param text raw input
     * @return text handed to {@link #doParse(String)}
     */
    protected String prepare(String text) {
        return SqlText.stripComments(SqlText.bodyOrSelf(text));
    }

    // ==================== Error Helpers ====================

    /**
     * Creates a parse exception for this parser's construct.
     *
     * @param kind error kind
     * @param message detail message
     * @return exception to throw
     */
    protected ConstructParseException error(ParseErrorKind kind, String message) {
        return new ConstructParseException(getKind(), kind, message);
    }

    /**
     * Shortens a fragment for log and error messages.
     *
     * @param text fragment
     * @return at most 60 characters of squashed text
     */
    protected String excerpt(String text) {
        String squashed = SqlText.squash(text);
        return squashed.length() <= 60 ? squashed : squashed.substring(0, 57) + "...";
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds all match results of a pattern, searching the masked copy of the text.
     *
     * <p>Groups must be read from the original text using the returned offsets:
     * {@code text.substring(m.start(1), m.end(1))}.
     *
     * @param pattern compiled pattern
     * @param text original text
     * @return match results in order
     */
    protected List<MatchResult> findMasked(Pattern pattern, String text) {
        List<MatchResult> results = new ArrayList<>();
        Matcher matcher = pattern.matcher(SqlText.mask(text));
        while (matcher.find()) {
            results.add(matcher.toMatchResult());
        }
        return results;
    }

    /**
     * Reads a group from the original text using offsets of a masked match.
     *
     * @param text original text
     * @param match match result obtained from {@link #findMasked(Pattern, String)}
     * @param group group index
     * @return group text from the original, or null if the group did not participate
     */
    protected String group(String text, MatchResult match, int group) {
        if (group > match.groupCount() || match.start(group) < 0) {
            return null;
        }
        return text.substring(match.start(group), match.end(group));
    }

    /**
     * Returns the identifier that ends right before {@code index} (skipping whitespace).
     *
     * @param text text to look in
     * @param index exclusive end position
     * @return identifier, or empty string if none
     */
    protected String identifierBefore(String text, int index) {
        int end = index;
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && isIdentifierChar(text.charAt(start - 1))) {
            start--;
        }
        return text.substring(start, end);
    }

    protected static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
