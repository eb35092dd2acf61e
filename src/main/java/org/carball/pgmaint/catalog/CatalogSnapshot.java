package org.carball.pgmaint.catalog;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgmaint.exception.CatalogReadException;
import org.carball.pgmaint.execution.CancellationSignal;
import org.carball.pgmaint.model.catalog.ForeignKeyColumn;
import org.carball.pgmaint.model.catalog.IndexInfo;
import org.carball.pgmaint.model.catalog.IndexUsage;
import org.carball.pgmaint.model.catalog.TableStats;
import org.carball.pgmaint.model.query.QueryStats;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of everything the advisors read, used to analyze a database offline.
 * {@code queries} is empty when statement statistics were unavailable at capture time.
 */
@Slf4j
public record CatalogSnapshot(
        String schema,
        OffsetDateTime capturedAt,
        boolean statementStatisticsAvailable,
        List<IndexInfo> indexes,
        IndexUsage indexUsage,
        List<ForeignKeyColumn> foreignKeys,
        Map<String, TableStats> tableStatistics,
        Map<String, Long> tableSizes,
        List<QueryStats> queries
) {

    public CatalogSnapshot {
        indexes = List.copyOf(indexes);
        indexUsage = indexUsage == null ? IndexUsage.empty() : indexUsage;
        foreignKeys = List.copyOf(foreignKeys);
        tableStatistics = Map.copyOf(tableStatistics);
        tableSizes = Map.copyOf(tableSizes);
        queries = List.copyOf(queries);
    }

    /**
     * Reads the full catalog of one schema. Statement statistics are optional: if the source cannot provide them the
     * snapshot is still taken and marked accordingly.
     */
    public static CatalogSnapshot capture(String schema, CatalogReader reader, QueryStatisticsSource statements,
                                          CancellationSignal signal) throws CatalogReadException {
        List<QueryStats> queries = List.of();
        boolean statementsAvailable = false;
        if (statements != null) {
            try {
                queries = statements.queryStatistics(0d, Integer.MAX_VALUE, signal);
                statementsAvailable = true;
            } catch (CatalogReadException e) {
                log.warn("Capturing snapshot without statement statistics: {}", e.getMessage());
            }
        }

        return new CatalogSnapshot(
                schema,
                OffsetDateTime.now(ZoneOffset.UTC),
                statementsAvailable,
                reader.listIndexes(signal),
                reader.indexUsage(signal),
                reader.foreignKeyColumns(signal),
                reader.tableStatistics(signal),
                reader.tableSizes(signal),
                queries);
    }
}
