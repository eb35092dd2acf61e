package org.carball.pgmaint.catalog;

import org.carball.pgmaint.exception.CatalogReadException;
import org.carball.pgmaint.execution.CancellationSignal;
import org.carball.pgmaint.model.query.QueryStats;

import java.util.List;

/**
 * Aggregated per-statement execution statistics.
 */
public interface QueryStatisticsSource {

    /**
     * Returns statements whose mean duration exceeds {@code minMeanDurationMs}. Sources may already sort and cap the
     * result at {@code limit}; callers must not rely on it.
     */
    List<QueryStats> queryStatistics(double minMeanDurationMs, int limit, CancellationSignal signal)
            throws CatalogReadException;
}
