package com.schemareverse;

import ch.qos.logback.classic.Level;
import com.schemareverse.cli.AnalyzeCommand;
import com.schemareverse.cli.ConstructsCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for schema reverse-engineering.
 *
 * <p>Reads PostgreSQL DDL and PL/pgSQL routines and reports confidence-scored entities,
 * actions and vocabulary/instance pairs.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze SQL files or directories</li>
 *   <li>{@code constructs} - List the recognized procedural constructs</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Analyze a schema directory
 * schema-reverse analyze db/schema
 *
 * # JSON report with a lower threshold
 * schema-reverse -v analyze db/schema --format json --min-confidence 0.6 -o report.json
 * }</pre>
 */
@Command(
    name = "schema-reverse",
    mixinStandardHelpOptions = true,
    version = "schema-reverse 1.0.0-SNAPSHOT",
    description = "Reverse-engineers PostgreSQL schemas into confidence-scored entities and actions",
    subcommands = {
        AnalyzeCommand.class,
        ConstructsCommand.class
    }
)
public class SchemaReverseCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SchemaReverseCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("schema-reverse - PostgreSQL schema reverse-engineering");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'schema-reverse --help' to see available commands");
        System.out.println("Use 'schema-reverse <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any command runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        SchemaReverseCLI cli = new SchemaReverseCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
