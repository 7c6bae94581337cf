package com.schemareverse.core.engine;

import com.schemareverse.core.model.ActionCandidate;
import com.schemareverse.core.model.EntityCandidate;
import com.schemareverse.core.model.InfoInstancePair;
import com.schemareverse.core.model.TranslationDetectionResult;
import com.schemareverse.core.parser.ConstructKind;
import com.schemareverse.core.parser.ParserMetrics;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of a reverse-engineering run.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ReverseResult result = engine.analyze(List.of(script));
 * result.entities().forEach(entity -> System.out.println(entity.name() + " " + entity.confidence()));
 * System.out.println(result.getSummary());
 * }</pre>
 *
 * @param entities entities at or above the acceptance threshold, classified
 * @param rejected entities below the threshold
 * @param actions functions and procedures with their recognized constructs
 * @param pairs vocabulary/instance pairs among accepted entities
 * @param translationTables detected translation tables (not scored as entities)
 * @param warnings statements excluded as malformed, one message each
 * @param parserMetrics construct parser counters of the run
 *
 * @since 1.0.0
 */
public record ReverseResult(
    List<EntityCandidate> entities,
    List<EntityCandidate> rejected,
    List<ActionCandidate> actions,
    List<InfoInstancePair> pairs,
    List<TranslationDetectionResult> translationTables,
    List<String> warnings,
    Map<ConstructKind, ParserMetrics> parserMetrics
) {
    /**
     * Compact constructor with defaults.
     */
    public ReverseResult {
        entities = entities == null ? List.of() : List.copyOf(entities);
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
        actions = actions == null ? List.of() : List.copyOf(actions);
        pairs = pairs == null ? List.of() : List.copyOf(pairs);
        translationTables = translationTables == null ? List.of() : List.copyOf(translationTables);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        parserMetrics = parserMetrics == null ? Map.of() : Map.copyOf(parserMetrics);
    }

    public static ReverseResult empty() {
        return new ReverseResult(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), Map.of());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * Returns a one-line summary of the run.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(Locale.ROOT,
            "Entities: %d accepted, %d rejected | Actions: %d | Pairs: %d | Translation tables: %d | Warnings: %d",
            entities.size(), rejected.size(), actions.size(), pairs.size(), translationTables.size(), warnings.size());
    }
}
