package org.carball.pgmaint.cli;

import lombok.Data;
import org.carball.pgmaint.config.DatabaseConfig;
import org.carball.pgmaint.config.OptimizerThresholds;
import org.carball.pgmaint.config.OutputFormat;

import java.nio.file.Path;

@Data
public class CliOptions {
    private Command command;
    private DatabaseConfig database;
    private OptimizerThresholds thresholds;
    private Path snapshotFile;
    private String outputFile;
    private OutputFormat outputFormat = OutputFormat.JSON;

    public boolean isOffline() {
        return snapshotFile != null;
    }

    public enum Command {
        INDEXES("indexes", "Recommend dropping unused or duplicate indexes and indexing foreign keys", true),
        SLOW_QUERIES("slow-queries", "List the slowest statements from pg_stat_statements", true),
        TABLE_STATS("table-stats", "Show per-table write activity, tuple counts and vacuum history", true),
        DB_STATS("db-stats", "Show table sizes and index scan counters", true),
        OPTIMIZE("optimize", "Run ANALYZE and VACUUM, then REINDEX bloated tables", false),
        EXPORT_SNAPSHOT("export-snapshot", "Save the catalog to a JSON file for offline analysis", false);

        private final String name;
        private final String description;
        private final boolean readOnly;

        Command(String name, String description, boolean readOnly) {
            this.name = name;
            this.description = description;
            this.readOnly = readOnly;
        }

        public String getName() {
            return name;
        }

        public String getDescription() {
            return description;
        }

        public boolean isReadOnly() {
            return readOnly;
        }

        public static Command fromName(String name) {
            for (Command command : values()) {
                if (command.name.equals(name)) {
                    return command;
                }
            }
            throw new IllegalArgumentException("Unknown command: " + name);
        }
    }
}
