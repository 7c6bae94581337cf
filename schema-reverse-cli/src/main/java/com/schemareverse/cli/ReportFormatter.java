package com.schemareverse.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.schemareverse.core.engine.ReverseResult;
import com.schemareverse.core.model.ActionCandidate;
import com.schemareverse.core.model.EntityCandidate;
import com.schemareverse.core.model.InfoInstancePair;
import com.schemareverse.core.model.TranslationDetectionResult;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders engine results as text or JSON.
 */
public final class ReportFormatter {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private ReportFormatter() {
        // Utility class - prevent instantiation
    }

    /**
     * Renders a JSON report.
     *
     * @param result engine result
     * @param threshold acceptance threshold used
     * @return pretty-printed JSON
     * @throws JsonProcessingException if serialization fails
     */
    public static String json(ReverseResult result, double threshold) throws JsonProcessingException {
        return JSON_MAPPER.writeValueAsString(AnalysisReport.from(result, threshold));
    }

    /**
     * Renders a human-readable report.
     *
     * @param result engine result
     * @param threshold acceptance threshold used
     * @param metricsSummary parser metrics summary
     * @return report text
     */
    public static String text(ReverseResult result, double threshold, String metricsSummary) {
        StringBuilder out = new StringBuilder();
        out.append("Schema Reverse-Engineering Report").append('\n');
        out.append("=================================").append('\n');
        out.append(result.getSummary()).append('\n').append('\n');

        out.append(String.format(Locale.ROOT, "Entities (threshold %.2f):%n", threshold));
        if (result.entities().isEmpty()) {
            out.append("  (none)\n");
        }
        for (EntityCandidate entity : result.entities()) {
            out.append(String.format(Locale.ROOT, "  ✓ %-40s %.2f (baseline %.2f, constructs %+.2f)%s%s%n",
                entity.table().qualifiedName(), entity.confidence(), entity.baseline(), entity.constructDelta(),
                patterns(entity.patterns()), classification(entity)));
        }
        if (!result.rejected().isEmpty()) {
            out.append('\n').append("Rejected:").append('\n');
            for (EntityCandidate entity : result.rejected()) {
                out.append(String.format(Locale.ROOT, "  ✗ %-40s %.2f%s%n",
                    entity.table().qualifiedName(), entity.confidence(), patterns(entity.patterns())));
            }
        }

        out.append('\n').append("Actions:").append('\n');
        if (result.actions().isEmpty()) {
            out.append("  (none)\n");
        }
        for (ActionCandidate action : result.actions()) {
            String constructs = action.results().stream()
                .map(parserResult -> parserResult.parserId().getId())
                .collect(Collectors.joining(", "));
            out.append(String.format(Locale.ROOT, "  • %-40s %.2f %s%n",
                action.function().qualifiedName(), action.confidence(),
                constructs.isEmpty() ? "" : "[" + constructs + "]"));
        }

        if (!result.pairs().isEmpty()) {
            out.append('\n').append("Vocabulary/Instance Pairs:").append('\n');
            for (InfoInstancePair pair : result.pairs()) {
                out.append(String.format("  %s <-> %s (%s)%s%n", pair.vocabularyTable(), pair.instanceTable(),
                    pair.baseEntityName(),
                    pair.translationTable() == null ? "" : " translated by " + pair.translationTable()));
            }
        }

        if (!result.translationTables().isEmpty()) {
            out.append('\n').append("Translation Tables:").append('\n');
            for (TranslationDetectionResult translation : result.translationTables()) {
                out.append(String.format("  %s -> %s (locale column: %s, fields: %s)%n",
                    translation.tableName(), translation.parentTable(), translation.localeColumn(),
                    String.join(", ", translation.translatableFields())));
            }
        }

        if (result.hasWarnings()) {
            out.append('\n').append("Warnings:").append('\n');
            result.warnings().forEach(warning -> out.append("  ⚠ ").append(warning).append('\n'));
        }

        out.append('\n').append(metricsSummary).append('\n');
        return out.toString();
    }

    private static String patterns(List<String> patterns) {
        return patterns.isEmpty() ? "" : " [" + String.join(", ", patterns) + "]";
    }

    private static String classification(EntityCandidate entity) {
        String label = entity.classification().label();
        return "none".equals(label) ? "" : " " + label;
    }
}
