package com.schemareverse.core.model;

import java.util.Objects;

/**
 * A matched vocabulary table and instance table sharing a base name.
 *
 * @param vocabularyTable vocabulary table name (e.g. {@code tb_administrative_unit_info})
 * @param instanceTable instance table name (e.g. {@code tb_administrative_unit})
 * @param baseEntityName shared base name (e.g. {@code administrative_unit})
 * @param translationTable translation table of the pair, or null
 *
 * @since 1.0.0
 */
public record InfoInstancePair(
    String vocabularyTable,
    String instanceTable,
    String baseEntityName,
    String translationTable
) {
    public InfoInstancePair {
        Objects.requireNonNull(vocabularyTable, "vocabularyTable must not be null");
        Objects.requireNonNull(instanceTable, "instanceTable must not be null");
        Objects.requireNonNull(baseEntityName, "baseEntityName must not be null");
    }
}
