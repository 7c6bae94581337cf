package com.schemareverse.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link AnalyzeCommand}.
 */
class AnalyzeCommandTest {

    private static final String TABLES = """
        CREATE TABLE tb_unit_info (pk_unit_info BIGINT PRIMARY KEY, id UUID, identifier TEXT);
        CREATE TABLE tb_unit (pk_unit BIGINT PRIMARY KEY, id UUID, identifier TEXT, fk_unit_info BIGINT);
        CREATE TABLE audit_log (message TEXT);
        """;

    private static final String ROUTINES = """
        CREATE FUNCTION touch_units() RETURNS void AS $$
        BEGIN
            FOR r IN SELECT * FROM tb_unit LOOP
                PERFORM 1;
            END LOOP;
        END;
        $$ LANGUAGE plpgsql;
        """;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void call_withJsonOutputFile_writesReport() throws IOException {
        // Given
        Path schema = write("schema.sql", TABLES + ROUTINES);
        Path report = tempDir.resolve("report.json");

        // When
        int exitCode = execute(schema.toString(), "--format", "json", "-o", report.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).contains("✓ Report written to:");

        JsonNode root = new ObjectMapper().readTree(report.toFile());
        assertThat(root.get("threshold").asDouble()).isEqualTo(0.80);
        assertThat(root.get("entities")).hasSize(2);
        assertThat(root.get("entities").get(1).get("name").asText()).isEqualTo("tb_unit");
        assertThat(root.get("entities").get(1).get("classification").asText()).isEqualTo("instance");
        assertThat(root.get("rejected").get(0).get("name").asText()).isEqualTo("audit_log");
        assertThat(root.get("actions").get(0).get("constructs").get(0).asText()).isEqualTo("control_flow");
        assertThat(root.get("pairs").get(0).get("baseEntityName").asText()).isEqualTo("unit");
        assertThat(root.get("parserMetrics").get("control_flow").get("attempts").asInt()).isEqualTo(1);
    }

    @Test
    void call_withTextFormat_printsReport() throws IOException {
        Path schema = write("schema.sql", TABLES + ROUTINES);

        int exitCode = execute(schema.toString());

        String output = stdout.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(output)
            .contains("Entities (threshold 0.80):")
            .contains("✓ public.tb_unit")
            .contains("✗ public.audit_log")
            .contains("• public.touch_units")
            .contains("Parser Success Rates:");
    }

    @Test
    void call_withLowerThreshold_acceptsMoreEntities() throws IOException {
        Path schema = write("schema.sql", TABLES);
        Path report = tempDir.resolve("report.json");

        int exitCode = execute(schema.toString(), "--min-confidence", "0.3", "--format", "json", "-o", report.toString());

        JsonNode root = new ObjectMapper().readTree(report.toFile());
        assertThat(exitCode).isZero();
        assertThat(root.get("entities")).hasSize(3);
        assertThat(root.get("rejected")).isEmpty();
    }

    @Test
    void call_withConfigFile_appliesIt() throws IOException {
        Path schema = write("schema.sql", TABLES + ROUTINES);
        Path config = write("schema-reverse.yaml", """
            parsers:
              disabled: [control_flow]
            """);
        Path report = tempDir.resolve("report.json");

        int exitCode = execute(schema.toString(), "-c", config.toString(), "--format", "json", "-o", report.toString());

        JsonNode root = new ObjectMapper().readTree(report.toFile());
        assertThat(exitCode).isZero();
        assertThat(root.get("actions").get(0).get("constructs")).isEmpty();
    }

    @Test
    void call_withDirectory_readsSqlFilesOnly() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("db"));
        Files.writeString(dir.resolve("01_tables.SQL"), TABLES);
        Files.writeString(dir.resolve("02_routines.sql"), ROUTINES);
        Files.writeString(dir.resolve("README.md"), "CREATE TABLE not_sql (id BIGINT);");
        Path report = tempDir.resolve("report.json");

        int exitCode = execute(dir.toString(), "--format", "json", "-o", report.toString());

        JsonNode root = new ObjectMapper().readTree(report.toFile());
        assertThat(exitCode).isZero();
        assertThat(root.get("summary").asText()).startsWith("Entities: 2 accepted, 1 rejected | Actions: 1");
    }

    @Test
    void call_withMissingInput_fails() {
        int exitCode = execute(tempDir.resolve("missing.sql").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("No SQL input could be read");
    }

    @Test
    void call_withUnknownFormat_fails() throws IOException {
        Path schema = write("schema.sql", TABLES);

        int exitCode = execute(schema.toString(), "--format", "xml");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("Unknown format: xml");
    }

    @Test
    void call_withThresholdOutOfRange_fails() throws IOException {
        Path schema = write("schema.sql", TABLES);

        int exitCode = execute(schema.toString(), "--min-confidence", "2");

        assertThat(exitCode).isEqualTo(1);
    }

    private int execute(String... args) {
        String[] withConfig = args;
        if (!Arrays.asList(args).contains("-c")) {
            withConfig = new String[args.length + 2];
            System.arraycopy(args, 0, withConfig, 0, args.length);
            withConfig[args.length] = "-c";
            withConfig[args.length + 1] = tempDir.resolve("absent.yaml").toString();
        }
        return new CommandLine(new AnalyzeCommand()).execute(withConfig);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
