package com.schemareverse.core.model;

/**
 * Classification of one table against the vocabulary/instance convention.
 *
 * <p>The detector never sets both flags, but the record does not enforce it; {@link #label()}
 * reports {@code vocabulary} when both are set. For instance tables the foreign key to the
 * vocabulary table is always set; the self-referential parent key only when present.
 *
 * @param vocabularyTable table defines what an entity is ({@code tb_x_info})
 * @param instanceTable table places the entity in a hierarchy ({@code tb_x})
 * @param baseEntityName shared base name, null when neither
 * @param vocabularyFkColumn instance-side column referencing the vocabulary table
 * @param parentFkColumn instance-side self-referential column, or null
 *
 * @since 1.0.0
 */
public record InfoInstanceDetectionResult(
    boolean vocabularyTable,
    boolean instanceTable,
    String baseEntityName,
    String vocabularyFkColumn,
    String parentFkColumn
) {
    public static InfoInstanceDetectionResult vocabulary(String baseEntityName) {
        return new InfoInstanceDetectionResult(true, false, baseEntityName, null, null);
    }

    public static InfoInstanceDetectionResult instance(String baseEntityName, String vocabularyFkColumn,
                                                       String parentFkColumn) {
        return new InfoInstanceDetectionResult(false, true, baseEntityName, vocabularyFkColumn, parentFkColumn);
    }

    public static InfoInstanceDetectionResult neither() {
        return new InfoInstanceDetectionResult(false, false, null, null, null);
    }

    /**
     * Returns a short label for reports.
     *
     * @return {@code vocabulary}, {@code instance} or {@code none}
     */
    public String label() {
        if (vocabularyTable) {
            return "vocabulary";
        }
        return instanceTable ? "instance" : "none";
    }
}
