package com.schemareverse.core.pattern;

import com.schemareverse.core.model.ParsedTable;
import com.schemareverse.core.model.TranslationDetectionResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Detects translation tables.
 *
 * <p>A translation table is named {@code tl_*} or {@code *_translation}, carries a
 * foreign key column {@code fk_*} and a locale column, and has a two-column primary key
 * made of exactly those two columns.
 *
 * @since 1.0.0
 */
public class TranslationTableDetector {

    public static final Set<String> LOCALE_COLUMNS = Set.of("locale", "language", "lang_code", "lang");

    private static final String PREFIX = "tl_";
    private static final String SUFFIX = "_translation";

    /**
     * Inspects a table.
     *
     * @param table parsed table
     * @return detection result
     */
    public TranslationDetectionResult detect(ParsedTable table) {
        String name = table.tableName();
        if (!hasTranslationName(name)) {
            return TranslationDetectionResult.notTranslation(name, List.of());
        }
        String fkColumn = table.columnNames().stream()
            .filter(column -> column.toLowerCase(Locale.ROOT).startsWith("fk_"))
            .findFirst()
            .orElse(null);
        String localeColumn = table.columnNames().stream()
            .filter(column -> LOCALE_COLUMNS.contains(column.toLowerCase(Locale.ROOT)))
            .findFirst()
            .orElse(null);
        List<String> translatable = table.columnNames().stream()
            .filter(column -> !column.equals(fkColumn) && !column.equals(localeColumn))
            .toList();

        List<String> primaryKey = table.primaryKey();
        boolean translation = fkColumn != null
            && localeColumn != null
            && primaryKey.size() == 2
            && primaryKey.contains(fkColumn)
            && primaryKey.contains(localeColumn);
        if (!translation) {
            return TranslationDetectionResult.notTranslation(name, translatable);
        }
        return new TranslationDetectionResult(true, name, parentName(name), fkColumn, localeColumn, translatable);
    }

    /**
     * Builds the parent-name to translation-table index used by the pairing pass.
     *
     * @param tables parsed tables
     * @return index in table order (later tables win on collision)
     */
    public Map<String, String> buildIndex(List<ParsedTable> tables) {
        Map<String, String> index = new LinkedHashMap<>();
        for (ParsedTable table : tables) {
            TranslationDetectionResult result = detect(table);
            if (result.translationTable()) {
                index.put(result.parentTable(), table.tableName());
            }
        }
        return index;
    }

    /**
     * Returns true if the name follows a translation naming convention.
     *
     * @param tableName table name
     * @return true for {@code tl_*} and {@code *_translation}
     */
    public boolean hasTranslationName(String tableName) {
        String lower = tableName.toLowerCase(Locale.ROOT);
        return lower.startsWith(PREFIX) || lower.endsWith(SUFFIX);
    }

    /**
     * Derives the parent name ({@code tl_contact_info} gives {@code contact_info}).
     *
     * @param tableName translation table name
     * @return parent name in lower case
     */
    public String parentName(String tableName) {
        String parent = tableName.toLowerCase(Locale.ROOT);
        if (parent.startsWith(PREFIX)) {
            parent = parent.substring(PREFIX.length());
        } else if (parent.startsWith("tb_")) {
            parent = parent.substring(3);
        }
        if (parent.endsWith(SUFFIX)) {
            parent = parent.substring(0, parent.length() - SUFFIX.length());
        }
        return parent;
    }
}
