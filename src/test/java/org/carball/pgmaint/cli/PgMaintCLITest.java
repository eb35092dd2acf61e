package org.carball.pgmaint.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.pgmaint.catalog.CatalogSnapshot;
import org.carball.pgmaint.catalog.CatalogSnapshotExporter;
import org.carball.pgmaint.catalog.InMemoryCatalogReader;
import org.carball.pgmaint.config.OutputFormat;
import org.carball.pgmaint.execution.CancellationSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PgMaintCLITest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private PgMaintCLI cli;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new PgMaintCLI(Map.of(),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path snapshotFile() throws Exception {
        InMemoryCatalogReader catalog = new InMemoryCatalogReader()
                .index("orders", "orders_pkey", true, 300, "id")
                .index("orders", "idx_orders_status", false, 0, "status")
                .table("orders", 1000, 100)
                .tableSize("orders", 8_192L);
        CatalogSnapshot snapshot = CatalogSnapshot.capture("public", catalog, null, CancellationSignal.none());
        Path file = tempDir.resolve("catalog.json");
        new CatalogSnapshotExporter().export(snapshot, file);
        return file;
    }

    @Test
    void shouldPrintUsageForHelp() {
        int exitCode = cli.run(new String[]{"--help"});

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Usage:", "export-snapshot", "--thresholds.rebuild-ratio");
    }

    @Test
    void shouldFailWithoutArguments() {
        assertThat(cli.run(new String[0])).isEqualTo(1);
    }

    @Test
    void shouldParseSnapshotOptions() throws Exception {
        // Given
        Path snapshot = snapshotFile();

        // When
        CliOptions options = cli.parseArgs(new String[]{
                "indexes", "--snapshot", snapshot.toString(), "-f", "markdown", "--thresholds.slow-query-limit", "5"});

        // Then
        assertThat(options.getCommand()).isEqualTo(CliOptions.Command.INDEXES);
        assertThat(options.isOffline()).isTrue();
        assertThat(options.getOutputFormat()).isEqualTo(OutputFormat.MARKDOWN);
        assertThat(options.getThresholds().getSlowQueryLimit()).isEqualTo(5);
    }

    @Test
    void shouldRejectUnknownCommandAndOptions() {
        assertThatThrownBy(() -> cli.parseArgs(new String[]{"tune"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown command");
        assertThatThrownBy(() -> cli.parseArgs(new String[]{"indexes", "--verbose"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown option: --verbose");
        assertThatThrownBy(() -> cli.parseArgs(new String[]{"indexes", "--url"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing value for --url");
        assertThatThrownBy(() -> cli.parseArgs(new String[]{"indexes", "--url", "jdbc:postgresql://db/app", "-f", "xml"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid output format");
    }

    @Test
    void shouldRequireDatabaseUrlWithoutSnapshot() {
        assertThatThrownBy(() -> cli.parseArgs(new String[]{"table-stats"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Database URL required");
    }

    @Test
    void shouldRejectMaintenanceAgainstSnapshot() throws Exception {
        Path snapshot = snapshotFile();

        assertThatThrownBy(() -> cli.parseArgs(new String[]{"optimize", "--snapshot", snapshot.toString()}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("needs a live database");
    }

    @Test
    void shouldRequireOutputFileForExportAndBothFormats() {
        String url = "jdbc:postgresql://db/app";

        assertThatThrownBy(() -> cli.parseArgs(new String[]{"export-snapshot", "--url", url}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires --output");
        assertThatThrownBy(() -> cli.parseArgs(new String[]{"indexes", "--url", url, "--format", "both"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires --output");
    }

    @Test
    void shouldAnalyzeSnapshotAndPrintJson() throws Exception {
        // Given
        Path snapshot = snapshotFile();

        // When
        int exitCode = cli.run(new String[]{"indexes", "--snapshot", snapshot.toString()});

        // Then
        assertThat(exitCode).isZero();
        JsonNode report = new ObjectMapper().readTree(out.toString(StandardCharsets.UTF_8));
        assertThat(report.path("recommendations")).hasSize(1);
        assertThat(report.path("recommendations").get(0).path("index").asText()).isEqualTo("idx_orders_status");
    }

    @Test
    void shouldWriteBothReportFormats() throws Exception {
        // Given
        Path snapshot = snapshotFile();
        Path output = tempDir.resolve("report.out");

        // When
        int exitCode = cli.run(new String[]{
                "table-stats", "--snapshot", snapshot.toString(), "--format", "both", "--output", output.toString()});

        // Then
        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("report.json")).exists();
        assertThat(Files.readString(tempDir.resolve("report.md"))).contains("## Table Statistics", "| orders |");
    }

    @Test
    void shouldReportConfigurationErrorsWithExitCodeOne() {
        int exitCode = cli.run(new String[]{"slow-queries"});

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Configuration error: Database URL required");
    }

    @Test
    void shouldReportMalformedSnapshotWithExitCodeOne() throws Exception {
        // Given
        Path snapshot = tempDir.resolve("broken.json");
        Files.writeString(snapshot, """
                {"export_metadata": {"format": "PGMAINT_CATALOG_SNAPSHOT", "schema": "public",
                                     "export_timestamp": "yesterday"},
                 "indexes": []}
                """);

        // When
        int exitCode = cli.run(new String[]{"indexes", "--snapshot", snapshot.toString()});

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8))
                .contains("Invalid input: Invalid timestamp in field 'export_timestamp': yesterday");
    }

    @Test
    void shouldStripFileExtension() {
        assertThat(PgMaintCLI.removeFileExtension("reports/run.json")).isEqualTo("reports/run");
        assertThat(PgMaintCLI.removeFileExtension("reports.d/run")).isEqualTo("reports.d/run");
        assertThat(PgMaintCLI.removeFileExtension(".hidden")).isEqualTo(".hidden");
    }
}
