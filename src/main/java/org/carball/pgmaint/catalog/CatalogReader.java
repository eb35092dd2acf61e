package org.carball.pgmaint.catalog;

import org.carball.pgmaint.exception.CatalogReadException;
import org.carball.pgmaint.execution.CancellationSignal;
import org.carball.pgmaint.model.catalog.ForeignKeyColumn;
import org.carball.pgmaint.model.catalog.IndexInfo;
import org.carball.pgmaint.model.catalog.IndexUsage;
import org.carball.pgmaint.model.catalog.TableStats;

import java.util.List;
import java.util.Map;

/**
 * Read-only access to index, constraint and table statistics metadata of one schema.
 * Every call re-reads current catalog data; implementations hold no state between calls.
 */
public interface CatalogReader {

    /**
     * Indexes on user tables of the schema, ordered by table and index name.
     */
    List<IndexInfo> listIndexes(CancellationSignal signal) throws CatalogReadException;

    IndexUsage indexUsage(CancellationSignal signal) throws CatalogReadException;

    /**
     * Statistics keyed by table name.
     */
    Map<String, TableStats> tableStatistics(CancellationSignal signal) throws CatalogReadException;

    /**
     * Foreign-key columns ordered by table, constraint and column position.
     */
    List<ForeignKeyColumn> foreignKeyColumns(CancellationSignal signal) throws CatalogReadException;

    /**
     * True when some index on {@code table} has {@code columns} as the prefix of its key.
     */
    boolean indexCoversColumns(String table, List<String> columns, CancellationSignal signal)
            throws CatalogReadException;

    default boolean indexExistsOnColumn(String table, String column, CancellationSignal signal)
            throws CatalogReadException {
        return indexCoversColumns(table, List.of(column), signal);
    }

    /**
     * Total on-disk size in bytes per table, indexes and TOAST included.
     */
    Map<String, Long> tableSizes(CancellationSignal signal) throws CatalogReadException;
}
