package com.schemareverse.cli;

import com.schemareverse.core.config.ConfigLoader;
import com.schemareverse.core.config.ReverseConfig;
import com.schemareverse.core.engine.ReverseEngineeringEngine;
import com.schemareverse.core.engine.ReverseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * Command to analyze SQL files and report entities and actions.
 *
 * <p>Orchestrates the pipeline:
 * <ol>
 *   <li>Load configuration ({@code schema-reverse.yaml}, defaults if missing)</li>
 *   <li>Collect {@code .sql} files (directories are walked)</li>
 *   <li>Run the reverse-engineering engine over all files as one schema</li>
 *   <li>Print a text report or write JSON</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Analyze a directory
 * schema-reverse analyze db/schema
 *
 * # JSON output to a file
 * schema-reverse analyze db/schema --format json -o report.json
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze SQL files and report confidence-scored entities and actions",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Parameters(
        arity = "1..*",
        description = "SQL files or directories containing .sql files"
    )
    private List<Path> inputs;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: schema-reverse.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--min-confidence"},
        description = "Entity acceptance threshold in [0, 1] (overrides config)"
    )
    private Double minConfidence;

    @Option(
        names = {"--format"},
        description = "Output format: text or json (default: text)",
        defaultValue = "text"
    )
    private String format;

    @Option(
        names = {"-o", "--output"},
        description = "Write the report to this file instead of standard output"
    )
    private Path outputFile;

    @Override
    public Integer call() {
        String outputFormat = format.toLowerCase(Locale.ROOT);
        if (!outputFormat.equals("text") && !outputFormat.equals("json")) {
            System.err.println("✗ Unknown format: " + format + ". Use: text or json");
            return 1;
        }

        ReverseConfig config = ConfigLoader.load(configPath);
        if (minConfidence != null) {
            try {
                config = config.withMinimumConfidence(minConfidence);
            } catch (IllegalArgumentException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }
        }

        List<String> scripts = readScripts();
        if (scripts.isEmpty()) {
            System.err.println("✗ No SQL input could be read");
            return 1;
        }

        ReverseEngineeringEngine engine = new ReverseEngineeringEngine(config);
        ReverseResult result = engine.analyze(scripts);
        double threshold = config.confidence().minimum();

        try {
            String report = outputFormat.equals("json")
                ? ReportFormatter.json(result, threshold)
                : ReportFormatter.text(result, threshold, engine.getCoordinator().getMetricsSummary());
            if (outputFile != null) {
                Files.writeString(outputFile, report, StandardCharsets.UTF_8);
                System.out.println("✓ Report written to: " + outputFile.toAbsolutePath());
            } else {
                System.out.println(report);
            }
            return 0;
        } catch (IOException e) {
            log.error("Failed to write report", e);
            System.err.println("✗ Failed to write report: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Reads every SQL input, skipping unreadable ones with a warning.
     *
     * @return script contents in input order (directory contents sorted by path)
     */
    private List<String> readScripts() {
        List<String> scripts = new ArrayList<>();
        for (Path file : collectFiles()) {
            try {
                scripts.add(Files.readString(file, StandardCharsets.UTF_8));
                log.debug("Read {}", file);
            } catch (IOException e) {
                log.warn("Failed to read SQL file: {} - {}", file, e.getMessage());
            }
        }
        log.info("Read {} SQL file(s)", scripts.size());
        return scripts;
    }

    private List<Path> collectFiles() {
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> walk = Files.walk(input)) {
                    walk.filter(Files::isRegularFile)
                        .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".sql"))
                        .sorted()
                        .forEach(files::add);
                } catch (IOException e) {
                    log.warn("Failed to walk directory: {} - {}", input, e.getMessage());
                }
            } else if (Files.isRegularFile(input)) {
                files.add(input);
            } else {
                log.warn("Input not found: {}", input);
            }
        }
        return files;
    }
}
