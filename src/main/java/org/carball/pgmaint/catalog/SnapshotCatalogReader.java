package org.carball.pgmaint.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.pgmaint.execution.CancellationSignal;
import org.carball.pgmaint.model.catalog.ForeignKeyColumn;
import org.carball.pgmaint.model.catalog.IndexInfo;
import org.carball.pgmaint.model.catalog.IndexKey;
import org.carball.pgmaint.model.catalog.IndexUsage;
import org.carball.pgmaint.model.catalog.TableStats;
import org.carball.pgmaint.model.query.QueryStats;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves catalog data from a snapshot file written by {@link CatalogSnapshotExporter} instead of a live database.
 */
public class SnapshotCatalogReader implements CatalogReader, QueryStatisticsSource {

    private final CatalogSnapshot snapshot;

    public SnapshotCatalogReader(CatalogSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    public SnapshotCatalogReader(Path filePath) throws IOException {
        this(load(filePath));
    }

    public CatalogSnapshot getSnapshot() {
        return snapshot;
    }

    /**
     * Parses and validates a snapshot file.
     */
    public static CatalogSnapshot load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Catalog snapshot file not found: " + path);
        }

        JsonNode root = new ObjectMapper().readTree(Files.readString(path));
        validateExportFormat(root);

        JsonNode metadata = root.get("export_metadata");
        return new CatalogSnapshot(
                metadata.get("schema").asText(),
                timestamp(metadata, "export_timestamp"),
                metadata.path("statement_statistics_available").asBoolean(false),
                parseIndexes(root.get("indexes")),
                parseUsage(root.path("index_usage")),
                parseForeignKeys(root.path("foreign_keys")),
                parseTableStatistics(root.path("table_statistics")),
                parseTableSizes(root.path("table_sizes")),
                parseQueries(root.path("queries")));
    }

    @Override
    public List<IndexInfo> listIndexes(CancellationSignal signal) {
        signal.throwIfCancelled("listing indexes");
        return snapshot.indexes();
    }

    @Override
    public IndexUsage indexUsage(CancellationSignal signal) {
        signal.throwIfCancelled("reading index usage");
        return snapshot.indexUsage();
    }

    @Override
    public Map<String, TableStats> tableStatistics(CancellationSignal signal) {
        signal.throwIfCancelled("reading table statistics");
        return snapshot.tableStatistics();
    }

    @Override
    public List<ForeignKeyColumn> foreignKeyColumns(CancellationSignal signal) {
        signal.throwIfCancelled("reading foreign keys");
        return snapshot.foreignKeys();
    }

    @Override
    public boolean indexCoversColumns(String table, List<String> columns, CancellationSignal signal) {
        signal.throwIfCancelled("checking indexes of " + table);
        return snapshot.indexes().stream()
                .filter(index -> index.tableName().equals(table))
                .anyMatch(index -> index.coversAsPrefix(columns));
    }

    @Override
    public Map<String, Long> tableSizes(CancellationSignal signal) {
        signal.throwIfCancelled("reading table sizes");
        return snapshot.tableSizes();
    }

    @Override
    public List<QueryStats> queryStatistics(double minMeanDurationMs, int limit, CancellationSignal signal) {
        signal.throwIfCancelled("reading statement statistics");
        return snapshot.queries().stream()
                .filter(query -> query.meanDurationMs() > minMeanDurationMs)
                .sorted(QueryStats.BY_MEAN_DURATION_DESC)
                .limit(limit)
                .toList();
    }

    private static void validateExportFormat(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Invalid JSON format in snapshot file");
        }

        JsonNode metadata = root.get("export_metadata");
        if (metadata == null) {
            throw new IllegalStateException("Missing export_metadata section in snapshot file");
        }
        if (!CatalogSnapshotExporter.FORMAT.equals(metadata.path("format").asText())) {
            throw new IllegalStateException("Not a catalog snapshot: format is '" + metadata.path("format").asText() + "'");
        }
        for (String field : new String[]{"schema", "export_timestamp"}) {
            if (!metadata.hasNonNull(field)) {
                throw new IllegalStateException("Missing required metadata field: " + field);
            }
        }

        JsonNode indexes = root.get("indexes");
        if (indexes == null || !indexes.isArray()) {
            throw new IllegalStateException("Missing or invalid indexes section in snapshot file");
        }
    }

    private static List<IndexInfo> parseIndexes(JsonNode indexes) {
        List<IndexInfo> results = new ArrayList<>();
        for (JsonNode node : indexes) {
            results.add(new IndexInfo(
                    required(node, "table"),
                    required(node, "name"),
                    strings(node.path("columns")),
                    node.path("type").asText(null),
                    node.path("unique").asBoolean(),
                    node.path("primary").asBoolean(),
                    node.path("size_bytes").asLong(),
                    timestamp(node, "last_used")));
        }
        return results;
    }

    private static IndexUsage parseUsage(JsonNode usage) {
        Map<IndexKey, Long> scans = new LinkedHashMap<>();
        for (JsonNode node : usage) {
            scans.put(new IndexKey(required(node, "table"), required(node, "index")), node.path("scans").asLong());
        }
        return new IndexUsage(scans);
    }

    private static List<ForeignKeyColumn> parseForeignKeys(JsonNode foreignKeys) {
        List<ForeignKeyColumn> results = new ArrayList<>();
        for (JsonNode node : foreignKeys) {
            results.add(new ForeignKeyColumn(
                    required(node, "constraint"),
                    required(node, "table"),
                    required(node, "column"),
                    required(node, "referenced_table"),
                    required(node, "referenced_column"),
                    node.path("position").asInt(1)));
        }
        return results;
    }

    private static Map<String, TableStats> parseTableStatistics(JsonNode tables) {
        Map<String, TableStats> results = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = tables.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode node = entry.getValue();
            results.put(entry.getKey(), new TableStats(
                    node.path("inserts").asLong(),
                    node.path("updates").asLong(),
                    node.path("deletes").asLong(),
                    node.path("live_tuples").asLong(),
                    node.path("dead_tuples").asLong(),
                    timestamp(node, "last_vacuum"),
                    timestamp(node, "last_autovacuum"),
                    timestamp(node, "last_analyze"),
                    timestamp(node, "last_autoanalyze")));
        }
        return results;
    }

    private static Map<String, Long> parseTableSizes(JsonNode sizes) {
        Map<String, Long> results = new LinkedHashMap<>();
        sizes.fields().forEachRemaining(entry -> results.put(entry.getKey(), entry.getValue().asLong()));
        return results;
    }

    private static List<QueryStats> parseQueries(JsonNode queries) {
        List<QueryStats> results = new ArrayList<>();
        for (JsonNode node : queries) {
            results.add(new QueryStats(
                    node.path("query").asText(),
                    node.path("mean_duration_ms").asDouble(),
                    node.path("total_calls").asLong(),
                    node.path("rows_returned").asLong(),
                    timestamp(node, "last_executed")));
        }
        return results;
    }

    private static String required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalStateException("Missing required field '" + field + "' in snapshot entry " + node);
        }
        return value.asText();
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(element -> values.add(element.asText()));
        return values;
    }

    private static OffsetDateTime timestamp(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.asText());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Invalid timestamp in field '" + field + "': " + value.asText(), e);
        }
    }
}
