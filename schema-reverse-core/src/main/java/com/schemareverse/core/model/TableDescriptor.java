package com.schemareverse.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Name and column names of a table, the input of the pairing pass.
 *
 * @param name table name
 * @param columns column names
 *
 * @since 1.0.0
 */
public record TableDescriptor(String name, List<String> columns) {

    public TableDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    /**
     * Creates a descriptor from a parsed table.
     *
     * @param table parsed table
     * @return descriptor
     */
    public static TableDescriptor of(ParsedTable table) {
        return new TableDescriptor(table.tableName(), table.columnNames());
    }
}
