package com.schemareverse.core.ddl;

import com.schemareverse.core.model.ParsedTable;
import com.schemareverse.core.model.StructuralAssessment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores how well a table follows the structural conventions of an entity table.
 *
 * <p><b>Scoring:</b></p>
 * <ul>
 *   <li>base {@value #BASE_SCORE}</li>
 *   <li>surrogate key column {@code pk_*}: {@value #SURROGATE_KEY_BONUS}
 *       (otherwise any declared primary key: {@value #DECLARED_KEY_BONUS})</li>
 *   <li>stable identifier {@code id}: {@value #STABLE_ID_BONUS}</li>
 *   <li>lookup key {@code identifier}: {@value #LOOKUP_KEY_BONUS}</li>
 *   <li>{@code tenant_id}: {@value #CONVENTION_BONUS} (pattern {@code multi_tenant})</li>
 *   <li>{@code deleted_at}: {@value #CONVENTION_BONUS} (pattern {@code soft_delete})</li>
 *   <li>{@code created_at} and {@code updated_at}: {@value #CONVENTION_BONUS} (pattern {@code audit_trail})</li>
 * </ul>
 *
 * <p>A table carrying the surrogate key, the stable identifier and the lookup key gets
 * the pattern {@code trinity}. The score is capped at 1.0.
 *
 * @since 1.0.0
 */
public class StructuralConfidenceScorer {

    public static final double BASE_SCORE = 0.40;
    public static final double SURROGATE_KEY_BONUS = 0.20;
    public static final double DECLARED_KEY_BONUS = 0.10;
    public static final double STABLE_ID_BONUS = 0.15;
    public static final double LOOKUP_KEY_BONUS = 0.10;
    public static final double CONVENTION_BONUS = 0.05;

    public static final String TRINITY = "trinity";
    public static final String MULTI_TENANT = "multi_tenant";
    public static final String SOFT_DELETE = "soft_delete";
    public static final String AUDIT_TRAIL = "audit_trail";

    /**
     * Scores a table.
     *
     * @param table parsed table
     * @return baseline score and recognized patterns
     */
    public StructuralAssessment assess(ParsedTable table) {
        double score = BASE_SCORE;
        List<String> patterns = new ArrayList<>();

        boolean surrogateKey = table.columns().stream()
            .anyMatch(column -> column.name().toLowerCase(Locale.ROOT).startsWith("pk_"));
        boolean stableId = table.hasColumn("id");
        boolean lookupKey = table.hasColumn("identifier");

        if (surrogateKey) {
            score += SURROGATE_KEY_BONUS;
        } else if (!table.primaryKey().isEmpty()) {
            score += DECLARED_KEY_BONUS;
        }
        if (stableId) {
            score += STABLE_ID_BONUS;
        }
        if (lookupKey) {
            score += LOOKUP_KEY_BONUS;
        }
        if (surrogateKey && stableId && lookupKey) {
            patterns.add(TRINITY);
        }
        if (table.hasColumn("tenant_id")) {
            score += CONVENTION_BONUS;
            patterns.add(MULTI_TENANT);
        }
        if (table.hasColumn("deleted_at")) {
            score += CONVENTION_BONUS;
            patterns.add(SOFT_DELETE);
        }
        if (table.hasColumn("created_at") && table.hasColumn("updated_at")) {
            score += CONVENTION_BONUS;
            patterns.add(AUDIT_TRAIL);
        }
        return new StructuralAssessment(Math.min(1.0, score), patterns);
    }
}
