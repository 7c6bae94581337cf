package com.schemareverse.core.ddl;

import com.schemareverse.core.util.SqlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a SQL script into the statements the engine cares about.
 *
 * <p><b>Extraction Strategy:</b>
 * <ol>
 *   <li>Locate {@code CREATE [OR REPLACE] FUNCTION|PROCEDURE} statements and their
 *       dollar-quoted bodies; everything inside a body is skipped by later steps</li>
 *   <li>Locate {@code CREATE TABLE} statements, using balanced parentheses to find the end
 *       of the column list</li>
 *   <li>Collect {@code COMMENT ON TABLE} and {@code COMMENT ON COLUMN} texts</li>
 *   <li>Collect {@code ALTER TABLE ... FOREIGN KEY} statements</li>
 * </ol>
 *
 * <p>Statements are returned as written (comments included); literals and comments are
 * masked while searching so keywords inside them are ignored.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * SqlScript script = new SqlScriptExtractor().extract(Files.readString(path));
 * for (String statement : script.createTables()) {
 *     ParsedTable table = tableParser.parse(statement, script.tableComment(...));
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class SqlScriptExtractor {

    private static final Logger log = LoggerFactory.getLogger(SqlScriptExtractor.class);

    private static final Pattern CREATE_ROUTINE = Pattern.compile(
        "\\bCREATE\\s+(?:OR\\s+REPLACE\\s+)?(?:FUNCTION|PROCEDURE)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CREATE_TABLE = Pattern.compile(
        "\\bCREATE\\s+(?:(?:GLOBAL|LOCAL)\\s+)?(?:(?:TEMP|TEMPORARY|UNLOGGED)\\s+)?TABLE\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern DOLLAR_TAG = Pattern.compile("\\$(?:[A-Za-z_][A-Za-z0-9_]*)?\\$");
    private static final Pattern COMMENT_ON_TABLE = Pattern.compile(
        "\\bCOMMENT\\s+ON\\s+TABLE\\s+([\\w.\"]+)\\s+IS\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMENT_ON_COLUMN = Pattern.compile(
        "\\bCOMMENT\\s+ON\\s+COLUMN\\s+([\\w.\"]+)\\.(\"?\\w+\"?)\\s+IS\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ALTER_TABLE = Pattern.compile("\\bALTER\\s+TABLE\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern FOREIGN_KEY = Pattern.compile("\\bFOREIGN\\s+KEY\\b", Pattern.CASE_INSENSITIVE);

    /**
     * Extracts statements from a script.
     *
     * @param script SQL script content
     * @return extracted statements (empty for null or blank input)
     */
    public SqlScript extract(String script) {
        if (script == null || script.isBlank()) {
            return SqlScript.empty();
        }
        String masked = SqlText.mask(script);
        List<int[]> routineRanges = new ArrayList<>();

        List<String> functions = new ArrayList<>();
        Matcher routine = CREATE_ROUTINE.matcher(masked);
        int searchFrom = 0;
        while (searchFrom < masked.length() && routine.find(searchFrom)) {
            int end = routineEnd(masked, routine.end());
            functions.add(script.substring(routine.start(), end).trim());
            routineRanges.add(new int[] {routine.start(), end});
            searchFrom = end;
        }

        List<String> tables = new ArrayList<>();
        Matcher table = CREATE_TABLE.matcher(masked);
        while (table.find()) {
            if (inside(routineRanges, table.start())) {
                continue;
            }
            int end = tableEnd(script, masked, table.end());
            tables.add(script.substring(table.start(), end).trim());
        }

        Map<String, String> tableComments = new LinkedHashMap<>();
        Matcher tableComment = COMMENT_ON_TABLE.matcher(masked);
        while (tableComment.find()) {
            if (inside(routineRanges, tableComment.start())) {
                continue;
            }
            literalAfter(script, tableComment.end())
                .ifPresent(text -> tableComments.put(SqlScript.key(tableComment.group(1)), text));
        }

        Map<String, Map<String, String>> columnComments = new LinkedHashMap<>();
        Matcher columnComment = COMMENT_ON_COLUMN.matcher(masked);
        while (columnComment.find()) {
            if (inside(routineRanges, columnComment.start())) {
                continue;
            }
            String tableName = SqlScript.key(columnComment.group(1));
            String column = columnComment.group(2).replace("\"", "");
            Optional<String> text = literalAfter(script, columnComment.end());
            text.ifPresent(value -> columnComments
                .computeIfAbsent(tableName, key -> new LinkedHashMap<>())
                .put(column, value));
        }

        List<String> alters = new ArrayList<>();
        Matcher alter = ALTER_TABLE.matcher(masked);
        while (alter.find()) {
            if (inside(routineRanges, alter.start())) {
                continue;
            }
            int end = statementEnd(masked, alter.end());
            String statement = masked.substring(alter.start(), end);
            if (FOREIGN_KEY.matcher(statement).find()) {
                alters.add(script.substring(alter.start(), end).trim());
            }
        }

        log.debug("Extracted {} table(s), {} routine(s), {} table comment(s), {} FK alteration(s)",
            tables.size(), functions.size(), tableComments.size(), alters.size());
        return new SqlScript(tables, functions, tableComments, columnComments, alters);
    }

    /**
     * Reads the literal that follows {@code from}, skipping whitespace in the unmasked script.
     */
    private static Optional<String> literalAfter(String script, int from) {
        int quote = from;
        while (quote < script.length() && Character.isWhitespace(script.charAt(quote))) {
            quote++;
        }
        return SqlText.literalAt(script, quote);
    }

    private static int routineEnd(String masked, int from) {
        Matcher open = DOLLAR_TAG.matcher(masked);
        int semicolon = masked.indexOf(';', from);
        if (open.find(from) && (semicolon < 0 || open.start() < semicolon)) {
            int close = masked.indexOf(open.group(), open.end());
            if (close < 0) {
                return masked.length();
            }
            return statementEnd(masked, close + open.group().length());
        }
        return statementEnd(masked, from);
    }

    private static int tableEnd(String script, String masked, int from) {
        int open = masked.indexOf('(', from);
        int semicolon = masked.indexOf(';', from);
        if (open < 0 || (semicolon >= 0 && semicolon < open)) {
            return statementEnd(masked, from);
        }
        int close = SqlText.findClosingParen(script, open);
        return statementEnd(masked, close < 0 ? from : close);
    }

    /**
     * Returns the index just past the next semicolon, or the text length.
     */
    private static int statementEnd(String masked, int from) {
        int semicolon = masked.indexOf(';', from);
        return semicolon < 0 ? masked.length() : semicolon + 1;
    }

    private static boolean inside(List<int[]> ranges, int index) {
        for (int[] range : ranges) {
            if (index >= range[0] && index < range[1]) {
                return true;
            }
        }
        return false;
    }
}
