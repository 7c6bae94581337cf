package com.schemareverse.core.pattern;

import com.schemareverse.core.model.InfoInstanceDetectionResult;
import com.schemareverse.core.model.InfoInstancePair;
import com.schemareverse.core.model.TableDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Detects vocabulary/instance dual-table patterns.
 *
 * <p>The convention models hierarchical reference data with two tables:
 * <ul>
 *   <li>{@code tb_{entity}_info}: what the entity is (vocabulary: name, code, level)</li>
 *   <li>{@code tb_{entity}}: where it sits in the hierarchy (instance: parent, path,
 *       reference to the vocabulary row through {@code fk_{entity}_info})</li>
 * </ul>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * InfoInstanceDetector detector = new InfoInstanceDetector();
 * InfoInstanceDetectionResult result = detector.classify(
 *     "tb_administrative_unit",
 *     List.of("pk_administrative_unit", "fk_administrative_unit_info", "fk_parent_administrative_unit"));
 * // result.instanceTable() == true, result.parentFkColumn() == "fk_parent_administrative_unit"
 * }</pre>
 *
 * @since 1.0.0
 */
public class InfoInstanceDetector {

    private static final Logger log = LoggerFactory.getLogger(InfoInstanceDetector.class);

    public static final List<String> DEFAULT_PREFIXES = List.of("tb_", "tv_");
    public static final String DEFAULT_VOCABULARY_SUFFIX = "_info";

    private final List<String> prefixes;
    private final String vocabularySuffix;

    public InfoInstanceDetector() {
        this(DEFAULT_PREFIXES, DEFAULT_VOCABULARY_SUFFIX);
    }

    /**
     * Creates a detector with custom naming conventions.
     *
     * @param prefixes table-kind prefixes stripped before classification
     * @param vocabularySuffix suffix marking vocabulary tables
     */
    public InfoInstanceDetector(List<String> prefixes, String vocabularySuffix) {
        Objects.requireNonNull(vocabularySuffix, "vocabularySuffix must not be null");
        this.prefixes = prefixes == null ? List.of() : prefixes.stream()
            .map(prefix -> prefix.toLowerCase(Locale.ROOT))
            .toList();
        this.vocabularySuffix = vocabularySuffix.toLowerCase(Locale.ROOT);
    }

    /**
     * Classifies one table.
     *
     * @param tableName table name
     * @param columns column names
     * @return vocabulary, instance or neither
     */
    public InfoInstanceDetectionResult classify(String tableName, List<String> columns) {
        if (tableName == null || tableName.isBlank()) {
            return InfoInstanceDetectionResult.neither();
        }
        String normalized = normalize(tableName);

        if (normalized.endsWith(vocabularySuffix) && normalized.length() > vocabularySuffix.length()) {
            String base = normalized.substring(0, normalized.length() - vocabularySuffix.length());
            return InfoInstanceDetectionResult.vocabulary(base);
        }

        List<String> names = columns == null ? List.of() : columns;
        String vocabularyFk = findColumn(names, "fk_" + normalized + vocabularySuffix);
        if (vocabularyFk != null) {
            String parentFk = findColumn(names, "fk_parent_" + normalized);
            return InfoInstanceDetectionResult.instance(normalized, vocabularyFk, parentFk);
        }
        return InfoInstanceDetectionResult.neither();
    }

    /**
     * Finds vocabulary/instance pairs among tables.
     *
     * <p>Tables are bucketed by base name; on collision the later table wins. Every
     * vocabulary table with an instance table of the same base name yields a pair, in
     * the order vocabulary tables were first seen. The translation index is probed under
     * {@code {base}_info} first, then {@code {base}}.
     *
     * @param tables tables to inspect
     * @param translationIndex parent name to translation table name (may be null)
     * @return matched pairs
     */
    public List<InfoInstancePair> detectPairs(List<TableDescriptor> tables, Map<String, String> translationIndex) {
        Map<String, String> vocabularyTables = new LinkedHashMap<>();
        Map<String, String> instanceTables = new LinkedHashMap<>();

        for (TableDescriptor table : tables) {
            InfoInstanceDetectionResult result = classify(table.name(), table.columns());
            if (result.vocabularyTable()) {
                vocabularyTables.put(result.baseEntityName(), table.name());
            } else if (result.instanceTable()) {
                instanceTables.put(result.baseEntityName(), table.name());
            }
        }

        Map<String, String> index = translationIndex == null ? Map.of() : translationIndex;
        List<InfoInstancePair> pairs = new ArrayList<>();
        vocabularyTables.forEach((base, vocabularyTable) -> {
            String instanceTable = instanceTables.get(base);
            if (instanceTable == null) {
                log.debug("Vocabulary table {} has no instance table", vocabularyTable);
                return;
            }
            String translation = index.get(base + vocabularySuffix);
            if (translation == null) {
                translation = index.get(base);
            }
            pairs.add(new InfoInstancePair(vocabularyTable, instanceTable, base, translation));
        });
        return pairs;
    }

    /**
     * Lower-cases the name and strips each configured prefix in turn.
     */
    private String normalize(String tableName) {
        String normalized = tableName.toLowerCase(Locale.ROOT);
        for (String prefix : prefixes) {
            if (normalized.startsWith(prefix)) {
                normalized = normalized.substring(prefix.length());
            }
        }
        return normalized;
    }

    private static String findColumn(List<String> columns, String expected) {
        for (String column : columns) {
            if (column.equalsIgnoreCase(expected)) {
                return column;
            }
        }
        return null;
    }
}
