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
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for IF / FOR / FOREACH / WHILE / LOOP blocks.
 *
 * <p>Produces a tree of steps:
 * <ul>
 *   <li>{@link ConstructStep#BRANCH}: {@code IF cond THEN ... [ELSIF ...] [ELSE ...] END IF}.
 *       An {@code ELSIF} becomes a nested branch inside {@code elseBranch}.</li>
 *   <li>{@link ConstructStep#LOOP}: the loop body goes to {@code body}; attributes
 *       {@code loop_type}, {@code iterator}, {@code source}, {@code condition}.</li>
 *   <li>{@link ConstructStep#STATEMENT}: plain statements, only inside a branch or loop.</li>
 * </ul>
 *
 * <p>Statements are only inspected at their start, so keywords inside expressions
 * ({@code SELECT ... FOR UPDATE}, {@code CASE WHEN ... ELSE ... END}) are not mistaken
 * for blocks.
 *
 * <p>Metadata: {@code branch_count}, {@code loop_count}, {@code max_depth}.
 *
 * @since 1.0.0
 */
public class ControlFlowParser extends AbstractConstructParser {

    public static final String BRANCH_COUNT = "branch_count";
    public static final String LOOP_COUNT = "loop_count";
    public static final String MAX_DEPTH = "max_depth";

    static final int MAX_NESTING = 64;

    private static final Pattern END_IF = terminator("END\\s+IF");
    private static final Pattern END_LOOP = terminator("END\\s+LOOP");
    private static final Pattern END_CASE = terminator("END\\s+CASE");
    private static final Pattern ELSIF = terminator("ELSE?IF");
    private static final Pattern ELSE = terminator("ELSE");

    private static final List<Pattern> IF_TERMINATORS = List.of(END_IF, ELSIF, ELSE);
    private static final List<Pattern> ELSE_TERMINATORS = List.of(END_IF);
    private static final List<Pattern> LOOP_TERMINATORS = List.of(END_LOOP);

    private static final Pattern LOOP_HEADER = Pattern.compile(
        "(\\w+)\\s+IN\\s+(?:REVERSE\\s+)?(.+)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern FOREACH_HEADER = Pattern.compile(
        "(\\w+)(?:\\s+SLICE\\s+\\d+)?\\s+IN\\s+ARRAY\\s+(.+)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static Pattern terminator(String regex) {
        return Pattern.compile(regex + "\\b", Pattern.CASE_INSENSITIVE);
    }

    @Override
    public ConstructKind getKind() {
        return ConstructKind.CONTROL_FLOW;
    }

    @Override
    protected List<ConstructStep> doParse(String body) throws ConstructParseException {
        BlockReader reader = new BlockReader(body);
        return parseBlock(reader, List.of(), 0);
    }

    // ==================== Blocks ====================

    private List<ConstructStep> parseBlock(BlockReader reader, List<Pattern> terminators, int depth)
            throws ConstructParseException {
        if (depth > MAX_NESTING) {
            throw error(ParseErrorKind.NESTING_TOO_DEEP, "Control flow nested deeper than " + MAX_NESTING);
        }
        List<ConstructStep> steps = new ArrayList<>();
        while (true) {
            reader.skipSeparators();
            if (reader.atEnd()) {
                if (!terminators.isEmpty()) {
                    throw error(ParseErrorKind.UNTERMINATED_BLOCK,
                        "Reached end of body while looking for " + expected(terminators));
                }
                return steps;
            }
            if (reader.lookingAtAny(terminators)) {
                return steps;
            }
            if (reader.skipLabel()) {
                continue;
            }
            int start = reader.position();
            String word = reader.peekWord();
            switch (word) {
                case "IF" -> {
                    reader.consumeWord();
                    steps.add(parseIf(reader, start, depth));
                }
                case "FOR", "FOREACH", "WHILE" -> {
                    reader.consumeWord();
                    steps.add(parseLoop(reader, start, word, depth));
                }
                case "LOOP" -> {
                    reader.consumeWord();
                    steps.add(parseLoopBody(reader, start, "loop", "", depth));
                }
                case "BEGIN", "DECLARE", "EXCEPTION" -> reader.consumeWord();
                case "WHEN" -> {
                    int then = reader.findKeyword("THEN", reader.position() + 4);
                    if (then < 0) {
                        addStatement(steps, reader, depth);
                    } else {
                        reader.moveTo(then + 4);
                    }
                }
                case "CASE" -> {
                    int end = reader.find(END_CASE, reader.position() + 4);
                    if (end < 0) {
                        throw error(ParseErrorKind.UNTERMINATED_BLOCK, "CASE without END CASE");
                    }
                    reader.moveTo(end);
                    reader.consume(END_CASE);
                    if (depth > 0) {
                        steps.add(ConstructStep.of(ConstructStep.STATEMENT, reader.slice(start)));
                    }
                }
                default -> addStatement(steps, reader, depth);
            }
        }
    }

    private void addStatement(List<ConstructStep> steps, BlockReader reader, int depth) {
        int start = reader.position();
        reader.skipStatement();
        if (depth > 0) {
            String statement = reader.slice(start);
            if (!statement.isEmpty()) {
                steps.add(ConstructStep.of(ConstructStep.STATEMENT, statement));
            }
        }
    }

    private ConstructStep parseIf(BlockReader reader, int start, int depth) throws ConstructParseException {
        int then = reader.findKeyword("THEN", reader.position());
        if (then < 0) {
            throw error(ParseErrorKind.MALFORMED_CONSTRUCT,
                "IF without THEN: " + excerpt(reader.rest()));
        }
        String condition = SqlText.squash(reader.text(reader.position(), then));
        reader.moveTo(then + 4);

        List<ConstructStep> thenBranch = parseBlock(reader, IF_TERMINATORS, depth + 1);
        List<ConstructStep> elseBranch;
        if (reader.lookingAt(ELSIF)) {
            int elsifStart = reader.position();
            reader.consume(ELSIF);
            elseBranch = List.of(parseIf(reader, elsifStart, depth + 1));
        } else if (reader.lookingAt(ELSE)) {
            reader.consume(ELSE);
            elseBranch = parseBlock(reader, ELSE_TERMINATORS, depth + 1);
            reader.consume(END_IF);
        } else {
            elseBranch = List.of();
            reader.consume(END_IF);
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("condition", condition);
        return ConstructStep.branch(reader.slice(start), attributes, thenBranch, elseBranch);
    }

    private ConstructStep parseLoop(BlockReader reader, int start, String keyword, int depth)
            throws ConstructParseException {
        int loop = reader.findKeyword("LOOP", reader.position());
        if (loop < 0) {
            throw error(ParseErrorKind.MALFORMED_CONSTRUCT,
                keyword + " without LOOP: " + excerpt(reader.rest()));
        }
        String header = SqlText.squash(reader.text(reader.position(), loop));
        reader.moveTo(loop + 4);
        return parseLoopBody(reader, start, keyword.toLowerCase(Locale.ROOT), header, depth);
    }

    private ConstructStep parseLoopBody(BlockReader reader, int start, String loopType, String header, int depth)
            throws ConstructParseException {
        List<ConstructStep> body = parseBlock(reader, LOOP_TERMINATORS, depth + 1);
        reader.consume(END_LOOP);
        reader.skipIdentifier();

        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("loop_type", loopType);
        switch (loopType) {
            case "while" -> attributes.put("condition", header);
            case "for", "foreach" -> {
                Matcher matcher = ("for".equals(loopType) ? LOOP_HEADER : FOREACH_HEADER).matcher(header);
                if (matcher.matches()) {
                    attributes.put("iterator", matcher.group(1));
                    attributes.put("source", matcher.group(2).trim());
                } else {
                    attributes.put("source", header);
                }
            }
            default -> {
                // bare LOOP has no header
            }
        }
        return ConstructStep.loop(reader.slice(start), attributes, body);
    }

    private static String expected(List<Pattern> terminators) {
        return terminators.get(0) == END_LOOP ? "END LOOP" : "END IF";
    }

    // ==================== Metadata ====================

    @Override
    public Map<String, Object> describe(String text, List<ConstructStep> steps) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(BRANCH_COUNT, count(steps, ConstructStep.BRANCH));
        metadata.put(LOOP_COUNT, count(steps, ConstructStep.LOOP));
        metadata.put(MAX_DEPTH, steps.stream().mapToInt(ControlFlowParser::controlDepth).max().orElse(0));
        return metadata;
    }

    private static int count(List<ConstructStep> steps, String kind) {
        int total = 0;
        for (ConstructStep step : steps) {
            if (kind.equals(step.kind())) {
                total++;
            }
            total += count(step.thenBranch(), kind);
            total += count(step.elseBranch(), kind);
            total += count(step.body(), kind);
        }
        return total;
    }

    private static int controlDepth(ConstructStep step) {
        if (ConstructStep.STATEMENT.equals(step.kind())) {
            return 0;
        }
        int deepest = 0;
        for (List<ConstructStep> children : List.of(step.thenBranch(), step.elseBranch(), step.body())) {
            for (ConstructStep child : children) {
                deepest = Math.max(deepest, controlDepth(child));
            }
        }
        return deepest + 1;
    }

    // ==================== Reader ====================

    /**
     * Position-tracking view over a body and its masked copy.
     */
    private static final class BlockReader {

        private final String text;
        private final String masked;
        private int position;

        BlockReader(String text) {
            this.text = text;
            this.masked = SqlText.mask(text);
        }

        int position() {
            return position;
        }

        boolean atEnd() {
            return position >= masked.length();
        }

        void moveTo(int index) {
            position = Math.min(index, masked.length());
        }

        String text(int from, int to) {
            return text.substring(from, to);
        }

        String slice(int from) {
            return SqlText.squash(text.substring(from, position));
        }

        String rest() {
            return text.substring(position);
        }

        void skipSeparators() {
            while (!atEnd() && (Character.isWhitespace(masked.charAt(position)) || masked.charAt(position) == ';')) {
                position++;
            }
        }

        boolean skipLabel() {
            if (!masked.startsWith("<<", position)) {
                return false;
            }
            int close = masked.indexOf(">>", position + 2);
            moveTo(close < 0 ? masked.length() : close + 2);
            return true;
        }

        void skipIdentifier() {
            int i = position;
            while (i < masked.length() && Character.isWhitespace(masked.charAt(i))) {
                i++;
            }
            int end = i;
            while (end < masked.length() && isIdentifierChar(masked.charAt(end))) {
                end++;
            }
            if (end > i && !isKeyword(masked.substring(i, end))) {
                position = end;
            }
        }

        private boolean isKeyword(String word) {
            String upper = word.toUpperCase(Locale.ROOT);
            return switch (upper) {
                case "END", "ELSE", "ELSIF", "ELSEIF", "IF", "LOOP", "FOR", "FOREACH", "WHILE",
                     "BEGIN", "EXCEPTION", "WHEN", "RETURN" -> true;
                default -> false;
            };
        }

        String peekWord() {
            int end = position;
            while (end < masked.length() && isIdentifierChar(masked.charAt(end))) {
                end++;
            }
            return masked.substring(position, end).toUpperCase(Locale.ROOT);
        }

        void consumeWord() {
            while (!atEnd() && isIdentifierChar(masked.charAt(position))) {
                position++;
            }
        }

        void skipStatement() {
            int semicolon = masked.indexOf(';', position);
            if (semicolon < 0) {
                position = masked.length();
            } else {
                position = semicolon + 1;
            }
        }

        boolean lookingAt(Pattern pattern) {
            return pattern.matcher(masked).region(position, masked.length()).lookingAt();
        }

        boolean lookingAtAny(List<Pattern> patterns) {
            for (Pattern pattern : patterns) {
                if (lookingAt(pattern)) {
                    return true;
                }
            }
            return false;
        }

        void consume(Pattern pattern) {
            Matcher matcher = pattern.matcher(masked).region(position, masked.length());
            if (matcher.lookingAt()) {
                position = matcher.end();
            }
        }

        int find(Pattern pattern, int from) {
            Matcher matcher = pattern.matcher(masked);
            return from <= masked.length() && matcher.find(from) ? matcher.start() : -1;
        }

        /**
         * Finds a keyword outside parentheses and CASE expressions before the next semicolon.
         *
         * @return start index of the keyword, or -1
         */
        int findKeyword(String keyword, int from) {
            int parens = 0;
            int cases = 0;
            int i = from;
            while (i < masked.length()) {
                char c = masked.charAt(i);
                if (c == '(') {
                    parens++;
                } else if (c == ')') {
                    parens--;
                } else if (c == ';' && parens == 0) {
                    return -1;
                } else if (Character.isLetter(c) && (i == 0 || !isIdentifierChar(masked.charAt(i - 1)))) {
                    int end = i;
                    while (end < masked.length() && isIdentifierChar(masked.charAt(end))) {
                        end++;
                    }
                    String word = masked.substring(i, end);
                    if (parens == 0) {
                        if ("CASE".equalsIgnoreCase(word)) {
                            cases++;
                        } else if ("END".equalsIgnoreCase(word) && cases > 0) {
                            cases--;
                        } else if (cases == 0 && keyword.equalsIgnoreCase(word)) {
                            return i;
                        }
                    }
                    i = end;
                    continue;
                }
                i++;
            }
            return -1;
        }
    }
}
