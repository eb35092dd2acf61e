package org.carball.pgmaint.analyzer;

import org.carball.pgmaint.advisor.RecommendationEngine;
import org.carball.pgmaint.catalog.CatalogReader;
import org.carball.pgmaint.catalog.PostgresCatalogReader;
import org.carball.pgmaint.catalog.PostgresQueryStatisticsReader;
import org.carball.pgmaint.catalog.QueryStatisticsSource;
import org.carball.pgmaint.catalog.SnapshotCatalogReader;
import org.carball.pgmaint.config.OptimizerThresholds;
import org.carball.pgmaint.exception.CatalogReadException;
import org.carball.pgmaint.exception.MaintenanceException;
import org.carball.pgmaint.execution.CancellationSignal;
import org.carball.pgmaint.execution.SqlExecutor;
import org.carball.pgmaint.maintenance.MaintenanceOrchestrator;
import org.carball.pgmaint.model.catalog.DatabaseStats;
import org.carball.pgmaint.model.catalog.TableStats;
import org.carball.pgmaint.model.maintenance.MaintenanceResult;
import org.carball.pgmaint.model.query.QueryStats;
import org.carball.pgmaint.model.recommendation.IndexRecommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for hosts: index recommendations, slow statements, table statistics and maintenance for one schema.
 * Holds no state between calls; every operation re-reads the catalog.
 */
public class DatabaseOptimizer {

    private final CatalogReader catalog;
    private final RecommendationEngine recommendationEngine;
    private final SlowQueryAnalyzer slowQueryAnalyzer;
    private final MaintenanceOrchestrator maintenance;
    private final Logger log;

    public DatabaseOptimizer(CatalogReader catalog, QueryStatisticsSource statements,
                             MaintenanceOrchestrator maintenance, OptimizerThresholds thresholds, String schema,
                             Logger log) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.log = Objects.requireNonNull(log, "log");
        this.recommendationEngine = new RecommendationEngine(catalog, schema, log);
        this.slowQueryAnalyzer = new SlowQueryAnalyzer(statements, thresholds, log);
        this.maintenance = maintenance;
    }

    /**
     * Optimizer over a live database reached through {@code executor}.
     */
    public static DatabaseOptimizer forDatabase(SqlExecutor executor, String schema, OptimizerThresholds thresholds) {
        Logger log = LoggerFactory.getLogger(DatabaseOptimizer.class);
        PostgresCatalogReader catalog = new PostgresCatalogReader(executor, schema);
        return new DatabaseOptimizer(catalog, new PostgresQueryStatisticsReader(executor),
                new MaintenanceOrchestrator(executor, catalog, thresholds, schema, log, Clock.systemUTC()),
                thresholds, schema, log);
    }

    /**
     * Read-only optimizer over a snapshot file; {@link #optimizeDatabase} is unavailable.
     */
    public static DatabaseOptimizer forSnapshot(SnapshotCatalogReader snapshot, OptimizerThresholds thresholds) {
        return new DatabaseOptimizer(snapshot, snapshot, null, thresholds, snapshot.getSnapshot().schema(),
                LoggerFactory.getLogger(DatabaseOptimizer.class));
    }

    public List<IndexRecommendation> analyzeIndexes(CancellationSignal signal) throws CatalogReadException {
        return recommendationEngine.analyzeIndexes(signal);
    }

    public List<QueryStats> analyzeSlowQueries(CancellationSignal signal) throws CatalogReadException {
        return slowQueryAnalyzer.analyzeSlowQueries(signal);
    }

    public Map<String, TableStats> getTableStats(CancellationSignal signal) throws CatalogReadException {
        signal.throwIfCancelled("reading table statistics");
        return catalog.tableStatistics(signal);
    }

    public DatabaseStats getDatabaseStats(CancellationSignal signal) throws CatalogReadException {
        signal.throwIfCancelled("reading database statistics");
        DatabaseStats stats = new DatabaseStats(catalog.tableSizes(signal), catalog.indexUsage(signal));
        log.info("Database statistics: {} tables, {} bytes, {} indexes with usage counters",
                stats.tableSizes().size(), stats.totalBytes(), stats.indexUsage().size());
        return stats;
    }

    public MaintenanceResult optimizeDatabase(CancellationSignal signal) throws MaintenanceException {
        if (maintenance == null) {
            throw new IllegalStateException("Maintenance requires a live database connection");
        }
        return maintenance.optimizeDatabase(signal);
    }

    public boolean supportsMaintenance() {
        return maintenance != null;
    }
}
