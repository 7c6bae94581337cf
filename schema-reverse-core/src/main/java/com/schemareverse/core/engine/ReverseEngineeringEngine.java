package com.schemareverse.core.engine;

import com.schemareverse.core.config.ReverseConfig;
import com.schemareverse.core.ddl.DdlParseException;
import com.schemareverse.core.ddl.FunctionDefinitionParser;
import com.schemareverse.core.ddl.SqlScript;
import com.schemareverse.core.ddl.SqlScriptExtractor;
import com.schemareverse.core.ddl.StructuralConfidenceScorer;
import com.schemareverse.core.ddl.TableDefinitionParser;
import com.schemareverse.core.model.ActionCandidate;
import com.schemareverse.core.model.EntityCandidate;
import com.schemareverse.core.model.FunctionDefinition;
import com.schemareverse.core.model.InfoInstanceDetectionResult;
import com.schemareverse.core.model.InfoInstancePair;
import com.schemareverse.core.model.ParsedTable;
import com.schemareverse.core.model.StructuralAssessment;
import com.schemareverse.core.model.TableDescriptor;
import com.schemareverse.core.model.TranslationDetectionResult;
import com.schemareverse.core.parser.ConstructParsers;
import com.schemareverse.core.parser.ParserCoordinator;
import com.schemareverse.core.parser.ParserResult;
import com.schemareverse.core.pattern.InfoInstanceDetector;
import com.schemareverse.core.pattern.TranslationTableDetector;
import com.schemareverse.core.util.SqlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns SQL scripts into confidence-scored entities and actions.
 *
 * <p><b>Pipeline:</b></p>
 * <ol>
 *   <li>Extract statements from every script and parse tables and routines; malformed
 *       statements are excluded with a warning</li>
 *   <li>Separate translation tables and build the translation index</li>
 *   <li>Score the remaining tables structurally (baseline)</li>
 *   <li>Run the construct parsers on every routine body; action confidence is the
 *       action baseline plus the summed deltas</li>
 *   <li>Add to every table the deltas of the routines whose body mentions it; tables
 *       below the threshold are rejected</li>
 *   <li>Classify accepted tables and pair vocabulary and instance tables</li>
 * </ol>
 *
 * <p>The engine is single-threaded; it owns one {@link ParserCoordinator} whose metrics are
 * reset at the start of every run.
 *
 * @since 1.0.0
 */
public class ReverseEngineeringEngine {

    private static final Logger log = LoggerFactory.getLogger(ReverseEngineeringEngine.class);

    private final ReverseConfig config;
    private final SqlScriptExtractor extractor = new SqlScriptExtractor();
    private final TableDefinitionParser tableParser = new TableDefinitionParser();
    private final FunctionDefinitionParser functionParser = new FunctionDefinitionParser();
    private final StructuralConfidenceScorer scorer = new StructuralConfidenceScorer();
    private final TranslationTableDetector translationDetector = new TranslationTableDetector();
    private final InfoInstanceDetector infoInstanceDetector;
    private final ParserCoordinator coordinator;

    public ReverseEngineeringEngine() {
        this(ReverseConfig.defaults());
    }

    public ReverseEngineeringEngine(ReverseConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.infoInstanceDetector = new InfoInstanceDetector(
            config.classification().tablePrefixes(), config.classification().vocabularySuffix());
        this.coordinator = new ParserCoordinator(ConstructParsers.defaults(), config.parsers().enabledKinds());
    }

    /**
     * Analyzes a single script.
     *
     * @param script SQL script content
     * @return analysis result
     */
    public ReverseResult analyze(String script) {
        return analyze(List.of(script == null ? "" : script));
    }

    /**
     * Analyzes several scripts as one schema.
     *
     * @param scripts SQL script contents
     * @return analysis result
     */
    public ReverseResult analyze(List<String> scripts) {
        coordinator.resetMetrics();
        List<String> warnings = new ArrayList<>();

        List<ParsedTable> tables = new ArrayList<>();
        List<FunctionDefinition> functions = new ArrayList<>();
        for (String content : scripts) {
            SqlScript script = extractor.extract(content);
            tables.addAll(parseTables(script, warnings));
            functions.addAll(parseFunctions(script, warnings));
        }

        List<TranslationDetectionResult> translations = new ArrayList<>();
        List<ParsedTable> entityTables = new ArrayList<>();
        for (ParsedTable table : tables) {
            TranslationDetectionResult detection = translationDetector.detect(table);
            if (detection.translationTable()) {
                translations.add(detection);
            } else {
                entityTables.add(table);
            }
        }
        Map<String, String> translationIndex = translationDetector.buildIndex(tables);

        List<ActionCandidate> actions = new ArrayList<>();
        for (FunctionDefinition function : functions) {
            List<ParserResult> results = coordinator.parseWithBestParsers(function.body());
            double confidence = clamp(config.confidence().actionBaseline() + ParserResult.totalDelta(results));
            actions.add(new ActionCandidate(function, results, confidence));
            log.debug("Action {}: {} construct(s), confidence {}", function.qualifiedName(), results.size(), confidence);
        }

        List<EntityCandidate> accepted = new ArrayList<>();
        List<EntityCandidate> rejected = new ArrayList<>();
        double minimum = config.confidence().minimum();
        for (ParsedTable table : entityTables) {
            EntityCandidate candidate = score(table, actions);
            if (candidate.confidence() >= minimum) {
                accepted.add(candidate);
            } else {
                log.debug("Rejected {} with confidence {} (minimum {})", table.tableName(), candidate.confidence(), minimum);
                rejected.add(candidate);
            }
        }

        List<EntityCandidate> classified = new ArrayList<>();
        for (EntityCandidate candidate : accepted) {
            InfoInstanceDetectionResult classification =
                infoInstanceDetector.classify(candidate.name(), candidate.table().columnNames());
            classified.add(candidate.classified(classification, translationFor(candidate.name(), translationIndex)));
        }
        List<InfoInstancePair> pairs = infoInstanceDetector.detectPairs(
            classified.stream().map(candidate -> TableDescriptor.of(candidate.table())).toList(),
            translationIndex);

        ReverseResult result = new ReverseResult(classified, rejected, actions, pairs, translations, warnings,
            coordinator.getMetrics());
        log.info(result.getSummary());
        log.info(coordinator.getMetricsSummary());
        return result;
    }

    /**
     * Returns the coordinator, whose metrics describe the last run.
     *
     * @return parser coordinator
     */
    public ParserCoordinator getCoordinator() {
        return coordinator;
    }

    // ==================== Parsing ====================

    private List<ParsedTable> parseTables(SqlScript script, List<String> warnings) {
        Map<String, List<ParsedTable.ForeignKey>> alterForeignKeys = new LinkedHashMap<>();
        for (String alter : script.alterTables()) {
            tableParser.parseAlterForeignKey(alter).ifPresent(entry -> alterForeignKeys
                .computeIfAbsent(entry.getKey().toLowerCase(Locale.ROOT), key -> new ArrayList<>())
                .add(entry.getValue()));
        }

        List<ParsedTable> tables = new ArrayList<>();
        for (String statement : script.createTables()) {
            try {
                ParsedTable table = tableParser.parse(statement, null);
                table = table.withComments(script.tableComment(table.tableName()), script.columnComments(table.tableName()));
                List<ParsedTable.ForeignKey> extra =
                    alterForeignKeys.get(table.tableName().toLowerCase(Locale.ROOT));
                if (extra != null) {
                    table = table.withAdditionalForeignKeys(extra);
                }
                tables.add(table);
            } catch (DdlParseException e) {
                log.warn("Excluding malformed table statement: {}", e.getMessage());
                warnings.add("Malformed table: " + e.getMessage());
            }
        }
        return tables;
    }

    private List<FunctionDefinition> parseFunctions(SqlScript script, List<String> warnings) {
        List<FunctionDefinition> functions = new ArrayList<>();
        for (String statement : script.createFunctions()) {
            try {
                functions.add(functionParser.parse(statement));
            } catch (DdlParseException e) {
                log.warn("Excluding malformed routine statement: {}", e.getMessage());
                warnings.add("Malformed routine: " + e.getMessage());
            }
        }
        return functions;
    }

    // ==================== Scoring ====================

    private EntityCandidate score(ParsedTable table, List<ActionCandidate> actions) {
        StructuralAssessment assessment = scorer.assess(table);
        Pattern mention = SqlText.wordPattern(table.tableName());
        double delta = 0.0;
        List<String> referencedBy = new ArrayList<>();
        for (ActionCandidate action : actions) {
            if (mention.matcher(action.function().body()).find()) {
                delta += action.constructDelta();
                referencedBy.add(action.function().qualifiedName());
            }
        }
        double confidence = clamp(assessment.score() + delta);
        return new EntityCandidate(table, assessment.score(), delta, confidence, assessment.patterns(),
            referencedBy, null, null);
    }

    private String translationFor(String tableName, Map<String, String> translationIndex) {
        String parent = translationDetector.parentName(tableName);
        return translationIndex.get(parent);
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
