package org.carball.pgmaint.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgmaint.analyzer.DatabaseOptimizer;
import org.carball.pgmaint.catalog.CatalogSnapshot;
import org.carball.pgmaint.catalog.CatalogSnapshotExporter;
import org.carball.pgmaint.catalog.PostgresCatalogReader;
import org.carball.pgmaint.catalog.PostgresQueryStatisticsReader;
import org.carball.pgmaint.catalog.SnapshotCatalogReader;
import org.carball.pgmaint.config.ConfigurationLoader;
import org.carball.pgmaint.config.DatabaseConfig;
import org.carball.pgmaint.config.OutputFormat;
import org.carball.pgmaint.exception.DatabaseOptimizationException;
import org.carball.pgmaint.exception.MaintenanceException;
import org.carball.pgmaint.execution.CancellationSignal;
import org.carball.pgmaint.execution.JdbcSqlExecutor;
import org.carball.pgmaint.model.maintenance.MaintenanceResult;
import org.carball.pgmaint.model.recommendation.IndexRecommendation;
import org.carball.pgmaint.output.OptimizationReport;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;

@Slf4j
public class PgMaintCLI {

    private static final String VERSION = "1.0.0";

    private static final Set<String> VALUE_OPTIONS = Set.of(
            "--url", "--user", "--schema", "--snapshot", "--output", "-o", "--format", "-f", "--timeout",
            "--thresholds", "--thresholds.slow-query-ms", "--thresholds.slow-query-limit",
            "--thresholds.rebuild-ratio");

    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;

    public PgMaintCLI(Map<String, String> env, PrintStream out, PrintStream err) {
        this.env = env;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new PgMaintCLI(System.getenv(), System.out, System.err).run(args);
        System.exit(exitCode);
    }

    public int run(String[] args) {
        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        try {
            CliOptions options = parseArgs(args);
            CancellationSignal signal = options.getDatabase().getTimeout()
                    .map(CancellationSignal::withTimeout)
                    .orElseGet(CancellationSignal::none);
            Thread interruptHook = new Thread(signal::cancel, "pgmaint-cancel");
            Runtime.getRuntime().addShutdownHook(interruptHook);
            try {
                return execute(options, signal);
            } finally {
                removeHook(interruptHook);
            }
        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (CancellationException e) {
            err.println("Cancelled: " + e.getMessage());
            return 130;
        } catch (MaintenanceException e) {
            err.println("Maintenance failed in phase " + e.getPhase() + ": " + e.getMessage());
            log.debug("Maintenance error details", e);
            return 2;
        } catch (DatabaseOptimizationException e) {
            err.println("Database error: " + e.getMessage());
            log.debug("Database error details", e);
            return 2;
        } catch (IllegalStateException e) {
            err.println("Invalid input: " + e.getMessage());
            log.debug("Invalid input details", e);
            return 1;
        } catch (IOException e) {
            err.println("IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        }
    }

    CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();
        options.setCommand(CliOptions.Command.fromName(args[0]));

        String[] optionArgs = Arrays.copyOfRange(args, 1, args.length);
        String thresholdsFile = null;

        for (int i = 0; i < optionArgs.length; i++) {
            String arg = optionArgs[i];
            if (!VALUE_OPTIONS.contains(arg)) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            }
            if (i + 1 >= optionArgs.length) {
                throw new IllegalArgumentException("Missing value for " + arg);
            }
            String value = optionArgs[++i];

            switch (arg) {
                case "--snapshot":
                    options.setSnapshotFile(Paths.get(value));
                    break;
                case "--output":
                case "-o":
                    options.setOutputFile(value);
                    break;
                case "--format":
                case "-f":
                    try {
                        options.setOutputFormat(OutputFormat.valueOf(value.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;
                case "--thresholds":
                    thresholdsFile = value;
                    break;
                default:
                    // connection and threshold overrides are resolved by ConfigurationLoader
                    break;
            }
        }

        ConfigurationLoader loader = new ConfigurationLoader(env);
        options.setDatabase(loader.loadDatabaseConfig(optionArgs));
        options.setThresholds(loader.loadThresholds(thresholdsFile, optionArgs));

        validateOptions(options);
        return options;
    }

    private void validateOptions(CliOptions options) {
        CliOptions.Command command = options.getCommand();
        DatabaseConfig database = options.getDatabase();

        if (options.isOffline()) {
            if (!command.isReadOnly()) {
                throw new IllegalArgumentException("Command '" + command.getName() + "' needs a live database, not --snapshot");
            }
            if (!Files.exists(options.getSnapshotFile())) {
                throw new IllegalArgumentException("Snapshot file not found: " + options.getSnapshotFile());
            }
        } else if (database.getUrl() == null || database.getUrl().isBlank()) {
            throw new IllegalArgumentException("Database URL required. Use --url or set PGMAINT_DB_URL");
        }

        if (command == CliOptions.Command.EXPORT_SNAPSHOT && options.getOutputFile() == null) {
            throw new IllegalArgumentException("export-snapshot requires --output <file>");
        }
        if (options.getOutputFormat() == OutputFormat.BOTH && options.getOutputFile() == null) {
            throw new IllegalArgumentException("--format both requires --output <file>");
        }
        if (options.getOutputFile() != null) {
            Path outputDir = Paths.get(options.getOutputFile()).toAbsolutePath().getParent();
            if (outputDir != null && !Files.exists(outputDir)) {
                throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
            }
        }
    }

    private int execute(CliOptions options, CancellationSignal signal)
            throws DatabaseOptimizationException, IOException {
        DatabaseConfig database = options.getDatabase();

        if (options.getCommand() == CliOptions.Command.EXPORT_SNAPSHOT) {
            JdbcSqlExecutor executor = new JdbcSqlExecutor(database.getUrl(), database.getUser(), database.getPassword());
            CatalogSnapshot snapshot = CatalogSnapshot.capture(database.getSchema(),
                    new PostgresCatalogReader(executor, database.getSchema()),
                    new PostgresQueryStatisticsReader(executor), signal);
            new CatalogSnapshotExporter().export(snapshot, Paths.get(options.getOutputFile()));
            out.println("Snapshot written to " + options.getOutputFile());
            return 0;
        }

        DatabaseOptimizer optimizer;
        String schema;
        if (options.isOffline()) {
            SnapshotCatalogReader snapshot = new SnapshotCatalogReader(options.getSnapshotFile());
            optimizer = DatabaseOptimizer.forSnapshot(snapshot, options.getThresholds());
            schema = snapshot.getSnapshot().schema();
        } else {
            JdbcSqlExecutor executor = new JdbcSqlExecutor(database.getUrl(), database.getUser(), database.getPassword());
            optimizer = DatabaseOptimizer.forDatabase(executor, database.getSchema(), options.getThresholds());
            schema = database.getSchema();
        }

        OptimizationReport.OptimizationReportBuilder report = OptimizationReport.builder().schema(schema);
        switch (options.getCommand()) {
            case INDEXES:
                List<IndexRecommendation> recommendations = optimizer.analyzeIndexes(signal);
                report.recommendations(recommendations);
                log.info("{} index recommendations", recommendations.size());
                break;
            case SLOW_QUERIES:
                report.slowQueries(optimizer.analyzeSlowQueries(signal));
                break;
            case TABLE_STATS:
                report.tableStatistics(optimizer.getTableStats(signal));
                break;
            case DB_STATS:
                report.databaseStats(optimizer.getDatabaseStats(signal));
                break;
            case OPTIMIZE:
                MaintenanceResult result = optimizer.optimizeDatabase(signal);
                report.maintenanceResult(result);
                if (result.hasTableFailures()) {
                    err.println("Warning: " + result.failedTables().size() + " table(s) could not be reindexed");
                }
                break;
            default:
                throw new IllegalArgumentException("Unsupported command: " + options.getCommand().getName());
        }

        writeReport(report.build(), options);
        return 0;
    }

    private void writeReport(OptimizationReport report, CliOptions options) throws IOException {
        OutputFormat format = options.getOutputFormat();
        if (options.getOutputFile() == null) {
            out.println(format == OutputFormat.MARKDOWN ? report.toMarkdown() : report.toJson());
            return;
        }

        String baseFileName = removeFileExtension(options.getOutputFile());
        if (format == OutputFormat.JSON || format == OutputFormat.BOTH) {
            String jsonFile = format == OutputFormat.BOTH ? baseFileName + ".json" : options.getOutputFile();
            Files.writeString(Paths.get(jsonFile), report.toJson());
            out.println("Report written to " + jsonFile);
        }
        if (format == OutputFormat.MARKDOWN || format == OutputFormat.BOTH) {
            String markdownFile = format == OutputFormat.BOTH ? baseFileName + ".md" : options.getOutputFile();
            Files.writeString(Paths.get(markdownFile), report.toMarkdown());
            out.println("Report written to " + markdownFile);
        }
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down, keeping cancel hook");
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private void printUsage() {
        out.println("pgmaint " + VERSION + " - PostgreSQL index advisor and maintenance runner");
        out.println();
        out.println("Usage: java -jar pgmaint.jar <command> [options]");
        out.println();
        out.println("Commands:");
        for (CliOptions.Command command : CliOptions.Command.values()) {
            out.printf("  %-16s %s%n", command.getName(), command.getDescription());
        }
        out.println();
        out.println("Options:");
        out.println("  --url <jdbc-url>    JDBC URL, e.g. jdbc:postgresql://localhost:5432/app (or PGMAINT_DB_URL)");
        out.println("  --user <name>       Database user (or PGMAINT_DB_USER)");
        out.println("  --schema <name>     Schema to analyze (default: public)");
        out.println("  --snapshot <file>   Analyze a snapshot file instead of a live database (read-only commands)");
        out.println("  --output, -o        Output file (default: print to stdout)");
        out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        out.println("  --timeout <sec>     Cancel the command after this many seconds");
        out.println("  --thresholds <yml>  YAML file with custom thresholds");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(ConfigurationLoader.getThresholdHelp());
        out.println("Environment Variables:");
        out.println("  PGMAINT_DB_PASSWORD  Database password");
    }
}
