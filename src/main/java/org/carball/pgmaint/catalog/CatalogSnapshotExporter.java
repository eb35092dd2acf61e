package org.carball.pgmaint.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.pgmaint.model.catalog.ForeignKeyColumn;
import org.carball.pgmaint.model.catalog.IndexInfo;
import org.carball.pgmaint.model.catalog.IndexKey;
import org.carball.pgmaint.model.catalog.TableStats;
import org.carball.pgmaint.model.query.QueryStats;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link CatalogSnapshot} to a JSON file that {@link SnapshotCatalogReader} can load again.
 */
@Slf4j
public class CatalogSnapshotExporter {

    static final String FORMAT = "PGMAINT_CATALOG_SNAPSHOT";

    private final ObjectMapper objectMapper;

    public CatalogSnapshotExporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void export(CatalogSnapshot snapshot, Path outputPath) throws IOException {
        Map<String, Object> exportData = new LinkedHashMap<>();
        exportData.put("export_metadata", metadata(snapshot));
        exportData.put("indexes", snapshot.indexes().stream().map(this::index).toList());
        exportData.put("index_usage", usage(snapshot));
        exportData.put("foreign_keys", snapshot.foreignKeys().stream().map(this::foreignKey).toList());
        exportData.put("table_statistics", tableStatistics(snapshot));
        exportData.put("table_sizes", new LinkedHashMap<>(snapshot.tableSizes()));
        exportData.put("queries", snapshot.queries().stream().map(this::query).toList());

        objectMapper.writeValue(outputPath.toFile(), exportData);
        log.info("Exported catalog snapshot of schema {} ({} indexes, {} tables, {} statements) to {}",
                snapshot.schema(), snapshot.indexes().size(), snapshot.tableStatistics().size(),
                snapshot.queries().size(), outputPath);
    }

    private Map<String, Object> metadata(CatalogSnapshot snapshot) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("format", FORMAT);
        metadata.put("schema", snapshot.schema());
        metadata.put("export_timestamp", snapshot.capturedAt());
        metadata.put("statement_statistics_available", snapshot.statementStatisticsAvailable());
        return metadata;
    }

    private Map<String, Object> index(IndexInfo index) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("table", index.tableName());
        node.put("name", index.indexName());
        node.put("columns", index.columns());
        node.put("type", index.indexType());
        node.put("unique", index.unique());
        node.put("primary", index.primary());
        node.put("size_bytes", index.sizeBytes());
        node.put("last_used", index.lastUsed());
        return node;
    }

    private List<Map<String, Object>> usage(CatalogSnapshot snapshot) {
        List<Map<String, Object>> entries = new ArrayList<>();
        snapshot.indexUsage().scans().entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator.comparing(IndexKey::toString)))
                .forEach(entry -> {
                    IndexKey key = entry.getKey();
                    Map<String, Object> node = new LinkedHashMap<>();
                    node.put("table", key.table());
                    node.put("index", key.index());
                    node.put("scans", entry.getValue());
                    entries.add(node);
                });
        return entries;
    }

    private Map<String, Object> foreignKey(ForeignKeyColumn fk) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("constraint", fk.constraintName());
        node.put("table", fk.table());
        node.put("column", fk.column());
        node.put("referenced_table", fk.referencedTable());
        node.put("referenced_column", fk.referencedColumn());
        node.put("position", fk.position());
        return node;
    }

    private Map<String, Object> tableStatistics(CatalogSnapshot snapshot) {
        Map<String, Object> tables = new LinkedHashMap<>();
        snapshot.tableStatistics().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> {
                    TableStats stats = entry.getValue();
                    Map<String, Object> node = new LinkedHashMap<>();
                    node.put("inserts", stats.inserts());
                    node.put("updates", stats.updates());
                    node.put("deletes", stats.deletes());
                    node.put("live_tuples", stats.liveTuples());
                    node.put("dead_tuples", stats.deadTuples());
                    node.put("last_vacuum", stats.lastVacuum());
                    node.put("last_autovacuum", stats.lastAutovacuum());
                    node.put("last_analyze", stats.lastAnalyze());
                    node.put("last_autoanalyze", stats.lastAutoanalyze());
                    tables.put(entry.getKey(), node);
                });
        return tables;
    }

    private Map<String, Object> query(QueryStats stats) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("query", stats.query());
        node.put("mean_duration_ms", stats.meanDurationMs());
        node.put("total_calls", stats.totalCalls());
        node.put("rows_returned", stats.rowsReturned());
        node.put("last_executed", stats.lastExecuted());
        return node;
    }
}
