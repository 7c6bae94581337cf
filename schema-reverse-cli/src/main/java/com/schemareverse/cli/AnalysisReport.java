package com.schemareverse.cli;

import com.schemareverse.core.engine.ReverseResult;
import com.schemareverse.core.model.ActionCandidate;
import com.schemareverse.core.model.EntityCandidate;
import com.schemareverse.core.model.InfoInstancePair;
import com.schemareverse.core.parser.ParserResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flat, serializable view of a {@link ReverseResult} written by {@code analyze --format json}.
 *
 * @param summary one-line summary
 * @param threshold entity acceptance threshold of the run
 * @param entities accepted entities
 * @param rejected rejected entities
 * @param actions analyzed routines
 * @param pairs vocabulary/instance pairs
 * @param translationTables translation table name to parent name
 * @param warnings excluded statements
 * @param parserMetrics construct id to counters
 */
public record AnalysisReport(
    String summary,
    double threshold,
    List<Entity> entities,
    List<Entity> rejected,
    List<Action> actions,
    List<InfoInstancePair> pairs,
    Map<String, String> translationTables,
    List<String> warnings,
    Map<String, Metrics> parserMetrics
) {
    /**
     * Builds the report from an engine result.
     *
     * @param result engine result
     * @param threshold acceptance threshold used
     * @return report
     */
    public static AnalysisReport from(ReverseResult result, double threshold) {
        Map<String, String> translations = new LinkedHashMap<>();
        result.translationTables().forEach(table -> translations.put(table.tableName(), table.parentTable()));

        Map<String, Metrics> metrics = new LinkedHashMap<>();
        result.parserMetrics().entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(entry -> metrics.put(entry.getKey().getId(), new Metrics(
                entry.getValue().attempts(),
                entry.getValue().successes(),
                entry.getValue().failures(),
                entry.getValue().successRate())));

        return new AnalysisReport(
            result.getSummary(),
            threshold,
            result.entities().stream().map(Entity::from).toList(),
            result.rejected().stream().map(Entity::from).toList(),
            result.actions().stream().map(Action::from).toList(),
            result.pairs(),
            translations,
            result.warnings(),
            metrics);
    }

    /**
     * Entity line of the report.
     */
    public record Entity(
        String schema,
        String name,
        double confidence,
        double baseline,
        double constructDelta,
        List<String> columns,
        List<String> primaryKey,
        List<String> patterns,
        List<String> referencedBy,
        String classification,
        String baseEntityName,
        String translationTable,
        String comment
    ) {
        static Entity from(EntityCandidate candidate) {
            return new Entity(
                candidate.table().schema(),
                candidate.name(),
                candidate.confidence(),
                candidate.baseline(),
                candidate.constructDelta(),
                candidate.table().columnNames(),
                candidate.table().primaryKey(),
                candidate.patterns(),
                candidate.referencedBy(),
                candidate.classification().label(),
                candidate.classification().baseEntityName(),
                candidate.translationTable(),
                candidate.table().tableComment());
        }
    }

    /**
     * Action line of the report.
     */
    public record Action(
        String schema,
        String name,
        boolean procedure,
        String language,
        double confidence,
        List<String> constructs,
        int stepCount
    ) {
        static Action from(ActionCandidate candidate) {
            List<ParserResult> results = candidate.results();
            return new Action(
                candidate.function().schema(),
                candidate.function().name(),
                candidate.function().procedure(),
                candidate.function().language(),
                candidate.confidence(),
                results.stream().map(result -> result.parserId().getId()).toList(),
                results.stream().mapToInt(result -> result.steps().size()).sum());
        }
    }

    /**
     * Parser counters.
     */
    public record Metrics(int attempts, int successes, int failures, double successRate) {
    }
}
