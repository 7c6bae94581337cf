package com.schemareverse.core.ddl;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Statements extracted from one SQL script.
 *
 * <p>Comment maps are keyed by the lower-case, unqualified table name; column comment
 * maps are keyed by column name as written.
 *
 * @param createTables {@code CREATE TABLE} statements in source order
 * @param createFunctions {@code CREATE FUNCTION} and {@code CREATE PROCEDURE} statements
 * @param tableComments {@code COMMENT ON TABLE} texts
 * @param columnComments {@code COMMENT ON COLUMN} texts per table
 * @param alterTables {@code ALTER TABLE ... FOREIGN KEY} statements
 *
 * @since 1.0.0
 */
public record SqlScript(
    List<String> createTables,
    List<String> createFunctions,
    Map<String, String> tableComments,
    Map<String, Map<String, String>> columnComments,
    List<String> alterTables
) {
    public SqlScript {
        createTables = createTables == null ? List.of() : List.copyOf(createTables);
        createFunctions = createFunctions == null ? List.of() : List.copyOf(createFunctions);
        tableComments = tableComments == null ? Map.of() : Map.copyOf(tableComments);
        columnComments = columnComments == null ? Map.of() : Map.copyOf(columnComments);
        alterTables = alterTables == null ? List.of() : List.copyOf(alterTables);
    }

    public static SqlScript empty() {
        return new SqlScript(List.of(), List.of(), Map.of(), Map.of(), List.of());
    }

    /**
     * Returns the comment of a table.
     *
     * @param tableName table name, qualified or not
     * @return comment text, or null
     */
    public String tableComment(String tableName) {
        return tableComments.get(key(tableName));
    }

    /**
     * Returns the column comments of a table.
     *
     * @param tableName table name, qualified or not
     * @return column comments (empty if none)
     */
    public Map<String, String> columnComments(String tableName) {
        return columnComments.getOrDefault(key(tableName), Map.of());
    }

    public boolean isEmpty() {
        return createTables.isEmpty() && createFunctions.isEmpty();
    }

    static String key(String tableName) {
        String unquoted = tableName.replace("\"", "");
        int dot = unquoted.lastIndexOf('.');
        return unquoted.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
