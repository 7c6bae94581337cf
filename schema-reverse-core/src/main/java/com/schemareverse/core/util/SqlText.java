package com.schemareverse.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text utilities shared by the DDL parsers and the construct parsers.
 *
 * <p>Nothing here understands SQL grammar. The helpers only deal with the lexical
 * features that break naive regex matching:
 * <ul>
 *   <li>comments ({@code -- line} and {@code /* block *&#47;})</li>
 *   <li>single-quoted literals with {@code ''} escapes</li>
 *   <li>dollar-quoted function bodies ({@code $$ ... $$}, {@code $fn$ ... $fn$})</li>
 *   <li>balanced parentheses</li>
 * </ul>
 *
 * <p><b>Masking:</b> {@link #mask(String)} returns a copy of the text of the same length
 * in which comment and literal characters are replaced by spaces. Searching the masked
 * copy and slicing the original with the same indices keeps keywords inside strings
 * from being matched.
 *
 * @since 1.0.0
 */
public final class SqlText {

    private static final Pattern DOLLAR_TAG = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)?\\$");
    private static final Pattern ROUTINE_HEADER = Pattern.compile(
        "^\\s*CREATE\\s+(?:OR\\s+REPLACE\\s+)?(?:FUNCTION|PROCEDURE)\\b", Pattern.CASE_INSENSITIVE);

    private SqlText() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    // ==================== Comments and Literals ====================

    /**
     * Removes {@code --} line comments and {@code /* *&#47;} block comments.
     *
     * <p>Comment markers inside single-quoted literals are preserved.
     *
     * @param text SQL text
     * @return text without comments, or empty string for null input
     */
    public static String stripComments(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\'') {
                int end = skipLiteral(text, i);
                out.append(text, i, end);
                i = end;
            } else if (c == '-' && i + 1 < n && text.charAt(i + 1) == '-') {
                while (i < n && text.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                int close = text.indexOf("*/", i + 2);
                i = close < 0 ? n : close + 2;
                out.append(' ');
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Returns a same-length copy of the text with literal and comment contents blanked.
     *
     * @param text SQL text
     * @return masked copy (never null)
     */
    public static String mask(String text) {
        if (text == null) {
            return "";
        }
        char[] masked = text.toCharArray();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\'') {
                int end = skipLiteral(text, i);
                blank(masked, i, end);
                i = end;
            } else if (c == '-' && i + 1 < n && text.charAt(i + 1) == '-') {
                int end = text.indexOf('\n', i);
                end = end < 0 ? n : end;
                blank(masked, i, end);
                i = end;
            } else if (c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                int close = text.indexOf("*/", i + 2);
                int end = close < 0 ? n : close + 2;
                blank(masked, i, end);
                i = end;
            } else {
                i++;
            }
        }
        return new String(masked);
    }

    /**
     * Reads the single-quoted literal starting at {@code quoteIndex}.
     *
     * @param text SQL text
     * @param quoteIndex index of the opening quote
     * @return literal content with {@code ''} unescaped, or empty if no literal starts there
     */
    public static Optional<String> literalAt(String text, int quoteIndex) {
        if (text == null || quoteIndex < 0 || quoteIndex >= text.length() || text.charAt(quoteIndex) != '\'') {
            return Optional.empty();
        }
        int end = skipLiteral(text, quoteIndex);
        if (end - 1 <= quoteIndex || text.charAt(end - 1) != '\'') {
            return Optional.empty();
        }
        return Optional.of(text.substring(quoteIndex + 1, end - 1).replace("''", "'"));
    }

    /**
     * Returns the index just past the single-quoted literal starting at {@code quoteIndex}.
     *
     * @param text SQL text
     * @param quoteIndex index of the opening quote
     * @return end index (exclusive), or the text length if the literal is unterminated
     */
    public static int literalEnd(String text, int quoteIndex) {
        return skipLiteral(text, quoteIndex);
    }

    private static int skipLiteral(String text, int openQuote) {
        int i = openQuote + 1;
        int n = text.length();
        while (i < n) {
            if (text.charAt(i) == '\'') {
                if (i + 1 < n && text.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return n;
    }

    private static void blank(char[] chars, int start, int end) {
        for (int i = start; i < end; i++) {
            if (chars[i] != '\n') {
                chars[i] = ' ';
            }
        }
    }

    // ==================== Function Bodies ====================

    /**
     * Extracts the content between the first dollar-quote tag and its matching close tag.
     *
     * @param text full statement (e.g. a CREATE FUNCTION statement)
     * @return body text, or empty if the text has no complete dollar-quoted section
     */
    public static Optional<String> dollarQuotedBody(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher open = DOLLAR_TAG.matcher(text);
        if (!open.find()) {
            return Optional.empty();
        }
        String tag = open.group();
        int close = text.indexOf(tag, open.end());
        if (close < 0) {
            return Optional.empty();
        }
        return Optional.of(text.substring(open.end(), close));
    }

    /**
     * Returns true if the text is a {@code CREATE [OR REPLACE] FUNCTION|PROCEDURE} statement.
     *
     * <p>Leading comments and whitespace are ignored.
     *
     * @param text SQL text
     * @return true for routine definitions
     */
    public static boolean isRoutineStatement(String text) {
        return text != null && ROUTINE_HEADER.matcher(mask(text)).find();
    }

    /**
     * Returns the dollar-quoted body of a routine statement, otherwise the text itself.
     *
     * <p>A bare body is returned unchanged, so dollar-quoted literals inside it
     * (e.g. {@code EXECUTE $q$ ... $q$}) stay where they are.
     *
     * @param text statement or bare body
     * @return text the construct parsers should look at
     */
    public static String bodyOrSelf(String text) {
        if (!isRoutineStatement(text)) {
            return text;
        }
        return dollarQuotedBody(text).orElse(text);
    }

    // ==================== Parentheses ====================

    /**
     * Finds the closing parenthesis matching the opening one at {@code openIndex}.
     *
     * <p>Parentheses inside literals and comments are ignored.
     *
     * @param text SQL text
     * @param openIndex index of an opening parenthesis
     * @return index of the matching ')' or -1 if unbalanced or not an opening parenthesis
     */
    public static int findClosingParen(String text, int openIndex) {
        if (text == null || openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != '(') {
            return -1;
        }
        String masked = mask(text);
        int depth = 0;
        for (int i = openIndex; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Finds the opening parenthesis matching the closing one at {@code closeIndex}.
     *
     * @param text SQL text
     * @param closeIndex index of a closing parenthesis
     * @return index of the matching '(' or -1 if unbalanced
     */
    public static int findOpeningParen(String text, int closeIndex) {
        if (text == null || closeIndex < 0 || closeIndex >= text.length() || text.charAt(closeIndex) != ')') {
            return -1;
        }
        String masked = mask(text);
        int depth = 0;
        for (int i = closeIndex; i >= 0; i--) {
            char c = masked.charAt(i);
            if (c == ')') {
                depth++;
            } else if (c == '(') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Splits text on commas that are not nested inside parentheses or literals.
     *
     * @param text comma separated list (e.g. a CREATE TABLE body)
     * @return trimmed, non-empty parts in order
     */
    public static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        if (text == null) {
            return parts;
        }
        String masked = mask(text);
        int depth = 0;
        int start = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                addPart(parts, text.substring(start, i));
                start = i + 1;
            }
        }
        addPart(parts, text.substring(start));
        return parts;
    }

    private static void addPart(List<String> parts, String part) {
        String trimmed = part.trim();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }

    // ==================== Words ====================

    /**
     * Case-insensitive whole-word search.
     *
     * @param text text to search
     * @param word keyword (may contain regex-safe spaces, matched as {@code \s+})
     * @return true if the word occurs
     */
    public static boolean containsWord(String text, String word) {
        if (text == null || word == null || word.isBlank()) {
            return false;
        }
        return wordPattern(word).matcher(text).find();
    }

    /**
     * Counts case-insensitive whole-word occurrences.
     *
     * @param text text to search
     * @param word keyword
     * @return number of occurrences
     */
    public static int countWord(String text, String word) {
        if (text == null || word == null || word.isBlank()) {
            return 0;
        }
        Matcher matcher = wordPattern(word).matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /**
     * Builds a case-insensitive whole-word pattern; inner spaces match any whitespace run.
     *
     * @param word keyword or keyword phrase
     * @return compiled pattern
     */
    public static Pattern wordPattern(String word) {
        String[] tokens = word.trim().split("\\s+");
        StringBuilder regex = new StringBuilder("\\b");
        for (int i = 0; i < tokens.length; i++) {
            if (i > 0) {
                regex.append("\\s+");
            }
            regex.append(Pattern.quote(tokens[i]));
        }
        regex.append("\\b");
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE);
    }

    /**
     * Collapses runs of whitespace into single spaces and trims.
     *
     * @param text text to normalize
     * @return normalized text, or empty string for null
     */
    public static String squash(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim();
    }
}
