package com.schemareverse.core.ddl;

import com.schemareverse.core.model.ParsedTable;
import com.schemareverse.core.util.SqlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for {@code CREATE TABLE} statements.
 *
 * <p>Extracts the schema and original-case table name, the column definitions (type,
 * nullability, default, inline primary key, inline {@code REFERENCES}) and the
 * table-level {@code PRIMARY KEY}, {@code UNIQUE} and {@code FOREIGN KEY} constraints.
 * Column definitions are split on top-level commas, so types such as
 * {@code NUMERIC(10,2)} stay intact.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * CREATE TABLE app.tb_contact (
 *     pk_contact INTEGER GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
 *     id UUID NOT NULL DEFAULT gen_random_uuid(),
 *     identifier TEXT NOT NULL UNIQUE,
 *     fk_company INTEGER REFERENCES app.tb_company(pk_company),
 *     email TEXT
 * );
 * }</pre>
 *
 * @since 1.0.0
 */
public class TableDefinitionParser {

    private static final Logger log = LoggerFactory.getLogger(TableDefinitionParser.class);

    private static final String DEFAULT_SCHEMA = "public";

    private static final Pattern HEADER = Pattern.compile(
        "^\\s*CREATE\\s+(?:(?:GLOBAL|LOCAL)\\s+)?(?:(?:TEMP|TEMPORARY|UNLOGGED)\\s+)?TABLE\\s+"
            + "(?:IF\\s+NOT\\s+EXISTS\\s+)?(?:(\"?)(\\w+)\\1\\.)?(\"?)(\\w+)\\3\\s*\\(",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern CONSTRAINT_NAME = Pattern.compile(
        "^CONSTRAINT\\s+\"?\\w+\"?\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern PRIMARY_KEY = Pattern.compile(
        "^PRIMARY\\s+KEY\\s*\\(([^)]*)\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNIQUE = Pattern.compile(
        "^UNIQUE\\s*(?:NULLS\\s+(?:NOT\\s+)?DISTINCT\\s*)?\\(([^)]*)\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FOREIGN_KEY = Pattern.compile(
        "^FOREIGN\\s+KEY\\s*\\(([^)]*)\\)\\s*REFERENCES\\s+([\\w.\"]+)\\s*(?:\\(([^)]*)\\))?",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern SKIPPED_CONSTRAINT = Pattern.compile(
        "^(?:CHECK|EXCLUDE|LIKE)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern COLUMN_NAME = Pattern.compile("^(\"[^\"]+\"|\\w+)\\s*");
    private static final Pattern COLUMN_CONSTRAINT = Pattern.compile(
        "\\b(?:NOT\\s+NULL|NULL|DEFAULT|PRIMARY\\s+KEY|UNIQUE|REFERENCES|CHECK|CONSTRAINT|GENERATED|COLLATE)\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern NOT_NULL = Pattern.compile("\\bNOT\\s+NULL\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern INLINE_PRIMARY_KEY = Pattern.compile("\\bPRIMARY\\s+KEY\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern INLINE_UNIQUE = Pattern.compile("\\bUNIQUE\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEFAULT = Pattern.compile("\\bDEFAULT\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEFAULT_END = Pattern.compile(
        "\\b(?:NOT\\s+NULL|NULL|PRIMARY\\s+KEY|UNIQUE|REFERENCES|CHECK|CONSTRAINT|GENERATED|COLLATE)\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern INLINE_REFERENCES = Pattern.compile(
        "\\bREFERENCES\\s+([\\w.\"]+)\\s*(?:\\(([^)]*)\\))?", Pattern.CASE_INSENSITIVE);
    private static final Pattern ALTER_FOREIGN_KEY = Pattern.compile(
        "^\\s*ALTER\\s+TABLE\\s+(?:ONLY\\s+)?(?:IF\\s+EXISTS\\s+)?([\\w.\"]+)\\s+ADD\\s+(?:CONSTRAINT\\s+\"?\\w+\"?\\s+)?"
            + "FOREIGN\\s+KEY\\s*\\(([^)]*)\\)\\s*REFERENCES\\s+([\\w.\"]+)\\s*(?:\\(([^)]*)\\))?",
        Pattern.CASE_INSENSITIVE);

    /**
     * Parses a {@code CREATE TABLE} statement.
     *
     * @param sql statement text
     * @param tableComment text of the table's {@code COMMENT ON TABLE}, or null
     * @return parsed table
     * @throws DdlParseException if the text is not a complete CREATE TABLE statement or declares no column
     */
    public ParsedTable parse(String sql, String tableComment) throws DdlParseException {
        if (sql == null || sql.isBlank()) {
            throw new DdlParseException("Empty statement");
        }
        String text = SqlText.stripComments(sql);
        String masked = SqlText.mask(text);
        Matcher header = HEADER.matcher(masked);
        if (!header.find()) {
            throw new DdlParseException("Not a CREATE TABLE statement: " + excerpt(text));
        }
        String schema = header.group(2) != null ? header.group(2) : DEFAULT_SCHEMA;
        String tableName = header.group(4);

        int open = header.end() - 1;
        int close = SqlText.findClosingParen(text, open);
        if (close < 0) {
            throw new DdlParseException("Unbalanced parentheses in table " + tableName);
        }

        List<ParsedTable.Column> columns = new ArrayList<>();
        List<String> primaryKey = new ArrayList<>();
        List<String> inlinePrimaryKey = new ArrayList<>();
        List<List<String>> unique = new ArrayList<>();
        List<ParsedTable.ForeignKey> foreignKeys = new ArrayList<>();

        for (String element : SqlText.splitTopLevel(text.substring(open + 1, close))) {
            String definition = CONSTRAINT_NAME.matcher(element).replaceFirst("");
            Matcher matcher;
            if ((matcher = PRIMARY_KEY.matcher(definition)).find()) {
                primaryKey.addAll(identifiers(matcher.group(1)));
            } else if ((matcher = UNIQUE.matcher(definition)).find()) {
                unique.add(identifiers(matcher.group(1)));
            } else if ((matcher = FOREIGN_KEY.matcher(definition)).find()) {
                foreignKeys.add(new ParsedTable.ForeignKey(
                    identifiers(matcher.group(1)), unquote(matcher.group(2)), identifiers(matcher.group(3))));
            } else if (SKIPPED_CONSTRAINT.matcher(definition).find()) {
                log.debug("Skipping constraint in {}: {}", tableName, excerpt(definition));
            } else {
                ParsedTable.Column column = parseColumn(tableName, element);
                columns.add(column);
                String columnMask = SqlText.mask(element);
                if (INLINE_PRIMARY_KEY.matcher(columnMask).find()) {
                    inlinePrimaryKey.add(column.name());
                }
                if (INLINE_UNIQUE.matcher(columnMask).find()) {
                    unique.add(List.of(column.name()));
                }
                Matcher references = INLINE_REFERENCES.matcher(element);
                if (references.find()) {
                    foreignKeys.add(new ParsedTable.ForeignKey(
                        List.of(column.name()), unquote(references.group(1)), identifiers(references.group(2))));
                }
            }
        }

        if (columns.isEmpty()) {
            throw new DdlParseException("Table " + tableName + " declares no columns");
        }
        if (primaryKey.isEmpty()) {
            primaryKey.addAll(inlinePrimaryKey);
        }

        log.debug("Parsed table {}.{} with {} column(s)", schema, tableName, columns.size());
        return new ParsedTable(schema, tableName, columns, primaryKey, unique, foreignKeys, tableComment, Map.of());
    }

    private ParsedTable.Column parseColumn(String tableName, String element) throws DdlParseException {
        String masked = SqlText.mask(element);
        Matcher name = COLUMN_NAME.matcher(masked);
        if (!name.find()) {
            throw new DdlParseException("Invalid column definition in " + tableName + ": " + excerpt(element));
        }
        int typeStart = name.end();
        Matcher constraint = COLUMN_CONSTRAINT.matcher(masked);
        int typeEnd = constraint.find(typeStart) ? constraint.start() : element.length();
        String type = SqlText.squash(element.substring(typeStart, typeEnd));
        if (type.isEmpty()) {
            throw new DdlParseException("Column without type in " + tableName + ": " + excerpt(element));
        }

        boolean primary = INLINE_PRIMARY_KEY.matcher(masked).find();
        boolean nullable = !primary && !NOT_NULL.matcher(masked).find();

        String defaultValue = null;
        Matcher defaultMatcher = DEFAULT.matcher(masked);
        if (defaultMatcher.find()) {
            Matcher next = DEFAULT_END.matcher(masked);
            int end = next.find(defaultMatcher.end()) ? next.start() : element.length();
            String value = SqlText.squash(element.substring(defaultMatcher.end(), end));
            defaultValue = value.isEmpty() ? null : value;
        }
        return new ParsedTable.Column(
            unquote(element.substring(name.start(1), name.end(1))),
            type.toUpperCase(Locale.ROOT),
            nullable,
            defaultValue);
    }

    /**
     * Parses {@code ALTER TABLE t ADD [CONSTRAINT c] FOREIGN KEY (...) REFERENCES ...}.
     *
     * @param sql statement text
     * @return altered table name (unqualified) and the foreign key, or empty if the statement has another shape
     */
    public Optional<Map.Entry<String, ParsedTable.ForeignKey>> parseAlterForeignKey(String sql) {
        if (sql == null) {
            return Optional.empty();
        }
        String text = SqlText.stripComments(sql);
        Matcher matcher = ALTER_FOREIGN_KEY.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String table = unquote(matcher.group(1));
        table = table.substring(table.lastIndexOf('.') + 1);
        ParsedTable.ForeignKey foreignKey = new ParsedTable.ForeignKey(
            identifiers(matcher.group(2)), unquote(matcher.group(3)), identifiers(matcher.group(4)));
        return Optional.of(Map.entry(table, foreignKey));
    }

    private static List<String> identifiers(String list) {
        if (list == null || list.isBlank()) {
            return List.of();
        }
        return Arrays.stream(list.split(","))
            .map(TableDefinitionParser::unquote)
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .toList();
    }

    private static String unquote(String identifier) {
        return identifier.replace("\"", "").trim();
    }

    private static String excerpt(String text) {
        String squashed = SqlText.squash(text);
        return squashed.length() <= 60 ? squashed : squashed.substring(0, 57) + "...";
    }
}
