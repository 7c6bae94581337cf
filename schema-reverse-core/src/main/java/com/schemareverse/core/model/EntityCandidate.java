package com.schemareverse.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A table scored as a candidate entity.
 *
 * @param table parsed table
 * @param baseline structural baseline score
 * @param constructDelta summed deltas of the routines referencing the table
 * @param confidence final score, clamped to [0, 1]
 * @param patterns structural patterns recognized in the table
 * @param referencedBy qualified names of the routines referencing the table
 * @param classification vocabulary/instance classification (neither until classified)
 * @param translationTable translation table attached to the entity, or null
 *
 * @since 1.0.0
 */
public record EntityCandidate(
    ParsedTable table,
    double baseline,
    double constructDelta,
    double confidence,
    List<String> patterns,
    List<String> referencedBy,
    InfoInstanceDetectionResult classification,
    String translationTable
) {
    public EntityCandidate {
        Objects.requireNonNull(table, "table must not be null");
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        referencedBy = referencedBy == null ? List.of() : List.copyOf(referencedBy);
        if (classification == null) {
            classification = InfoInstanceDetectionResult.neither();
        }
    }

    public String name() {
        return table.tableName();
    }

    /**
     * Returns a copy carrying a classification and translation table.
     *
     * @param result classification
     * @param translation translation table name, or null
     * @return classified candidate
     */
    public EntityCandidate classified(InfoInstanceDetectionResult result, String translation) {
        return new EntityCandidate(table, baseline, constructDelta, confidence, patterns, referencedBy,
            result, translation);
    }
}
