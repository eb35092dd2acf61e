package org.carball.pgmaint.maintenance;

import org.carball.pgmaint.catalog.CatalogReader;
import org.carball.pgmaint.config.OptimizerThresholds;
import org.carball.pgmaint.exception.CatalogReadException;
import org.carball.pgmaint.exception.MaintenanceException;
import org.carball.pgmaint.exception.TableMaintenanceException;
import org.carball.pgmaint.execution.CancellationSignal;
import org.carball.pgmaint.execution.SqlExecutor;
import org.carball.pgmaint.execution.SqlIdentifiers;
import org.carball.pgmaint.model.catalog.TableStats;
import org.carball.pgmaint.model.maintenance.MaintenancePhase;
import org.carball.pgmaint.model.maintenance.MaintenanceResult;
import org.carball.pgmaint.model.maintenance.TableRebuildFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Runs a maintenance pass: refresh planner statistics, reclaim dead-tuple space, read table bloat and reindex
 * the tables whose dead/live tuple ratio exceeds the rebuild threshold.
 * <p>
 * The first three phases abort the run when they fail. Reindexing is applied table by table; a failing table is
 * logged and recorded, and the run moves on.
 */
public class MaintenanceOrchestrator {

    static final String REFRESH_STATISTICS = "ANALYZE";
    static final String RECLAIM_SPACE = "VACUUM";

    private final SqlExecutor executor;
    private final CatalogReader catalog;
    private final OptimizerThresholds thresholds;
    private final String schema;
    private final Logger log;
    private final Clock clock;

    public MaintenanceOrchestrator(SqlExecutor executor, CatalogReader catalog, OptimizerThresholds thresholds,
                                   String schema) {
        this(executor, catalog, thresholds, schema, LoggerFactory.getLogger(MaintenanceOrchestrator.class),
                Clock.systemUTC());
    }

    public MaintenanceOrchestrator(SqlExecutor executor, CatalogReader catalog, OptimizerThresholds thresholds,
                                   String schema, Logger log, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.schema = schema;
        this.log = Objects.requireNonNull(log, "log");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public MaintenanceResult optimizeDatabase(CancellationSignal signal) throws MaintenanceException {
        Instant started = clock.instant();
        List<MaintenancePhase> completed = new ArrayList<>();
        log.info("Starting database maintenance");

        runStatement(MaintenancePhase.REFRESH_STATISTICS, REFRESH_STATISTICS, signal);
        completed.add(MaintenancePhase.REFRESH_STATISTICS);

        runStatement(MaintenancePhase.RECLAIM_SPACE, RECLAIM_SPACE, signal);
        completed.add(MaintenancePhase.RECLAIM_SPACE);

        Map<String, TableStats> stats = readTableStatistics(signal);
        completed.add(MaintenancePhase.COMPUTE_BLOAT);

        RebuildOutcome outcome = rebuildBloatedTables(stats, signal);
        completed.add(MaintenancePhase.REBUILD_INDEXES);

        MaintenanceResult result = new MaintenanceResult(completed, outcome.rebuilt, outcome.skipped, outcome.failed,
                Duration.between(started, clock.instant()));
        log.info("Database maintenance completed in {} ms: {} tables reindexed, {} skipped, {} failed",
                result.elapsed().toMillis(), result.rebuiltTables().size(), result.skippedTables().size(),
                result.failedTables().size());
        return result;
    }

    /**
     * Tables with dead tuples whose dead/live ratio is strictly above {@code ratioThreshold}, in name order.
     * Tables without live tuples are never candidates.
     */
    public static List<String> selectRebuildCandidates(Map<String, TableStats> stats, double ratioThreshold) {
        List<String> candidates = new ArrayList<>();
        new TreeMap<>(stats).forEach((table, tableStats) -> {
            if (tableStats.deadTuples() > 0
                    && tableStats.deadTupleRatio().isPresent()
                    && tableStats.deadTupleRatio().getAsDouble() > ratioThreshold) {
                candidates.add(table);
            }
        });
        return candidates;
    }

    private void runStatement(MaintenancePhase phase, String sql, CancellationSignal signal)
            throws MaintenanceException {
        signal.throwIfCancelled(phase.getDescription());
        log.info("Phase {}: {}", phase, phase.getDescription());
        try {
            executor.executeMaintenance(sql, signal);
        } catch (SQLException e) {
            throw fatal(phase, e);
        }
    }

    private Map<String, TableStats> readTableStatistics(CancellationSignal signal) throws MaintenanceException {
        MaintenancePhase phase = MaintenancePhase.COMPUTE_BLOAT;
        signal.throwIfCancelled(phase.getDescription());
        log.info("Phase {}: {}", phase, phase.getDescription());
        try {
            return catalog.tableStatistics(signal);
        } catch (CatalogReadException e) {
            throw fatal(phase, e);
        }
    }

    private RebuildOutcome rebuildBloatedTables(Map<String, TableStats> stats, CancellationSignal signal) {
        MaintenancePhase phase = MaintenancePhase.REBUILD_INDEXES;
        log.info("Phase {}: {}", phase, phase.getDescription());

        RebuildOutcome outcome = new RebuildOutcome();
        double threshold = thresholds.getRebuildDeadTupleRatio();
        for (Map.Entry<String, TableStats> entry : new TreeMap<>(stats).entrySet()) {
            String table = entry.getKey();
            TableStats tableStats = entry.getValue();

            if (tableStats.liveTuples() <= 0) {
                if (tableStats.deadTuples() > 0) {
                    log.info("Skipping {}: {} dead tuples but no live tuples", table, tableStats.deadTuples());
                    outcome.skipped.add(table);
                }
                continue;
            }
            if (!selectRebuildCandidates(Map.of(table, tableStats), threshold).contains(table)) {
                continue;
            }

            signal.throwIfCancelled("reindexing " + table);
            log.info("Reindexing {} (dead/live ratio {})", table,
                    String.format("%.3f", tableStats.deadTupleRatio().getAsDouble()));
            try {
                rebuild(table, signal);
                outcome.rebuilt.add(table);
            } catch (TableMaintenanceException e) {
                log.warn(e.getMessage(), e);
                outcome.failed.add(new TableRebuildFailure(table, e.getCause().getMessage()));
            }
        }
        return outcome;
    }

    private void rebuild(String table, CancellationSignal signal) throws TableMaintenanceException {
        String sql = "REINDEX TABLE " + SqlIdentifiers.qualify(schema, table);
        try {
            executor.executeMaintenance(sql, signal);
        } catch (SQLException e) {
            throw new TableMaintenanceException(table, e);
        }
    }

    private MaintenanceException fatal(MaintenancePhase phase, Exception cause) {
        MaintenanceException failure = new MaintenanceException(phase, cause);
        log.error(failure.getMessage(), cause);
        return failure;
    }

    private static final class RebuildOutcome {
        private final List<String> rebuilt = new ArrayList<>();
        private final List<String> skipped = new ArrayList<>();
        private final List<TableRebuildFailure> failed = new ArrayList<>();
    }
}
