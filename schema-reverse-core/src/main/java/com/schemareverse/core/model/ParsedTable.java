package com.schemareverse.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed {@code CREATE TABLE} statement.
 *
 * <p>The table name keeps its original case. Unqualified tables belong to schema {@code public}.
 *
 * @param schema schema name
 * @param tableName table name as written
 * @param columns columns in declaration order
 * @param primaryKey primary key columns (table-level constraint, else inline ones), empty if none
 * @param uniqueConstraints column lists of UNIQUE constraints
 * @param foreignKeys foreign keys declared inline or at table level
 * @param tableComment text of {@code COMMENT ON TABLE}, or null
 * @param columnComments column name to {@code COMMENT ON COLUMN} text
 *
 * @since 1.0.0
 */
public record ParsedTable(
    String schema,
    String tableName,
    List<Column> columns,
    List<String> primaryKey,
    List<List<String>> uniqueConstraints,
    List<ForeignKey> foreignKeys,
    String tableComment,
    Map<String, String> columnComments
) {
    /**
     * Compact constructor with validation.
     */
    public ParsedTable {
        Objects.requireNonNull(tableName, "tableName must not be null");
        if (schema == null || schema.isBlank()) {
            schema = "public";
        }
        columns = columns == null ? List.of() : List.copyOf(columns);
        primaryKey = primaryKey == null ? List.of() : List.copyOf(primaryKey);
        uniqueConstraints = uniqueConstraints == null ? List.of() : List.copyOf(uniqueConstraints);
        foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);
        columnComments = columnComments == null ? Map.of() : Map.copyOf(columnComments);
    }

    /**
     * Returns {@code schema.table}.
     *
     * @return qualified name
     */
    public String qualifiedName() {
        return schema + "." + tableName;
    }

    /**
     * Returns the column names in declaration order.
     *
     * @return column names
     */
    public List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }

    /**
     * Looks up a column ignoring case.
     *
     * @param name column name
     * @return column, or empty if absent
     */
    public Optional<Column> column(String name) {
        return columns.stream().filter(column -> column.name().equalsIgnoreCase(name)).findFirst();
    }

    public boolean hasColumn(String name) {
        return column(name).isPresent();
    }

    /**
     * Returns a copy with comments attached.
     *
     * @param comment table comment
     * @param comments column comments
     * @return new table
     */
    public ParsedTable withComments(String comment, Map<String, String> comments) {
        return new ParsedTable(schema, tableName, columns, primaryKey, uniqueConstraints, foreignKeys,
            comment, comments);
    }

    /**
     * Returns a copy with foreign keys declared by later {@code ALTER TABLE} statements.
     *
     * @param additional foreign keys to append
     * @return new table
     */
    public ParsedTable withAdditionalForeignKeys(List<ForeignKey> additional) {
        List<ForeignKey> all = new ArrayList<>(foreignKeys);
        all.addAll(additional);
        return new ParsedTable(schema, tableName, columns, primaryKey, uniqueConstraints, all,
            tableComment, columnComments);
    }

    /**
     * A table column.
     *
     * @param name column name
     * @param type declared type, upper case (e.g. {@code VARCHAR(255)})
     * @param nullable false when declared {@code NOT NULL} or part of an inline primary key
     * @param defaultValue default expression, or null
     */
    public record Column(String name, String type, boolean nullable, String defaultValue) {
        public Column {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /**
     * A foreign key.
     *
     * @param columns referencing columns
     * @param referencedTable referenced table (possibly schema qualified)
     * @param referencedColumns referenced columns, empty when implied
     */
    public record ForeignKey(List<String> columns, String referencedTable, List<String> referencedColumns) {
        public ForeignKey {
            Objects.requireNonNull(referencedTable, "referencedTable must not be null");
            columns = columns == null ? List.of() : List.copyOf(columns);
            referencedColumns = referencedColumns == null ? List.of() : List.copyOf(referencedColumns);
        }
    }
}
