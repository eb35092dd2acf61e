package org.carball.pgmaint.analyzer;

import org.carball.pgmaint.catalog.QueryStatisticsSource;
import org.carball.pgmaint.config.OptimizerThresholds;
import org.carball.pgmaint.exception.CatalogReadException;
import org.carball.pgmaint.execution.CancellationSignal;
import org.carball.pgmaint.model.query.QueryStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Picks the statements whose mean execution time exceeds the slow-query threshold, slowest first.
 */
public class SlowQueryAnalyzer {

    private static final int PREVIEW_LENGTH = 80;

    private final QueryStatisticsSource source;
    private final OptimizerThresholds thresholds;
    private final Logger log;

    public SlowQueryAnalyzer(QueryStatisticsSource source, OptimizerThresholds thresholds) {
        this(source, thresholds, LoggerFactory.getLogger(SlowQueryAnalyzer.class));
    }

    public SlowQueryAnalyzer(QueryStatisticsSource source, OptimizerThresholds thresholds, Logger log) {
        this.source = Objects.requireNonNull(source, "source");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.log = Objects.requireNonNull(log, "log");
    }

    public List<QueryStats> analyzeSlowQueries(CancellationSignal signal) throws CatalogReadException {
        signal.throwIfCancelled("slow query analysis");
        double thresholdMs = thresholds.getSlowQueryThresholdMs();
        int limit = Math.max(0, thresholds.getSlowQueryLimit());

        List<QueryStats> slow = select(source.queryStatistics(thresholdMs, limit, signal), thresholdMs, limit);

        log.info("Found {} statements slower than {} ms", slow.size(), thresholdMs);
        if (!slow.isEmpty() && log.isDebugEnabled()) {
            QueryStats slowest = slow.get(0);
            log.debug("Slowest statement: {} ms over {} calls: {}",
                    slowest.meanDurationMs(), slowest.totalCalls(), slowest.preview(PREVIEW_LENGTH));
        }
        return slow;
    }

    /**
     * Filters to mean durations strictly above {@code thresholdMs}, sorts descending and keeps at most {@code limit}.
     */
    static List<QueryStats> select(List<QueryStats> statistics, double thresholdMs, int limit) {
        return statistics.stream()
                .filter(stats -> stats.meanDurationMs() > thresholdMs)
                .sorted(QueryStats.BY_MEAN_DURATION_DESC)
                .limit(limit)
                .toList();
    }
}
