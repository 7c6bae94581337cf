package com.schemareverse.core.model;

import java.util.List;

/**
 * Outcome of translation-table detection.
 *
 * @param translationTable whether the table follows the translation convention
 * @param tableName inspected table
 * @param parentTable parent name derived from the table name, null when not a translation table
 * @param fkColumn foreign key to the parent, null when not a translation table
 * @param localeColumn locale column, null when not a translation table
 * @param translatableFields columns other than the key and locale columns
 *
 * @since 1.0.0
 */
public record TranslationDetectionResult(
    boolean translationTable,
    String tableName,
    String parentTable,
    String fkColumn,
    String localeColumn,
    List<String> translatableFields
) {
    public TranslationDetectionResult {
        translatableFields = translatableFields == null ? List.of() : List.copyOf(translatableFields);
    }

    public static TranslationDetectionResult notTranslation(String tableName, List<String> translatableFields) {
        return new TranslationDetectionResult(false, tableName, null, null, null, translatableFields);
    }
}
