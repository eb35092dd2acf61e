package org.carball.pgmaint.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.carball.pgmaint.model.catalog.DatabaseStats;
import org.carball.pgmaint.model.catalog.IndexKey;
import org.carball.pgmaint.model.catalog.TableStats;
import org.carball.pgmaint.model.maintenance.MaintenanceResult;
import org.carball.pgmaint.model.maintenance.TableRebuildFailure;
import org.carball.pgmaint.model.query.QueryStats;
import org.carball.pgmaint.model.recommendation.IndexRecommendation;
import org.carball.pgmaint.model.recommendation.Severity;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Renders the results of one CLI command as JSON or Markdown. Sections that were not produced are left out.
 */
@Slf4j
public class OptimizationReport {

    private static final int QUERY_PREVIEW_LENGTH = 120;

    private final String schema;
    private final OffsetDateTime timestamp;
    private final List<IndexRecommendation> recommendations;
    private final List<QueryStats> slowQueries;
    private final Map<String, TableStats> tableStatistics;
    private final DatabaseStats databaseStats;
    private final MaintenanceResult maintenanceResult;
    private final ObjectMapper objectMapper;

    @Builder
    public OptimizationReport(String schema, OffsetDateTime timestamp, List<IndexRecommendation> recommendations,
                              List<QueryStats> slowQueries, Map<String, TableStats> tableStatistics,
                              DatabaseStats databaseStats, MaintenanceResult maintenanceResult) {
        this.schema = schema;
        this.timestamp = timestamp != null ? timestamp : OffsetDateTime.now(ZoneOffset.UTC);
        this.recommendations = recommendations;
        this.slowQueries = slowQueries;
        this.tableStatistics = tableStatistics == null ? null : new TreeMap<>(tableStatistics);
        this.databaseStats = databaseStats;
        this.maintenanceResult = maintenanceResult;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# PostgreSQL Optimization Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME)).append("  \n");
        md.append("**Schema:** ").append(schema).append("  \n\n");

        if (recommendations != null) {
            appendRecommendations(md);
        }
        if (slowQueries != null) {
            appendSlowQueries(md);
        }
        if (tableStatistics != null) {
            appendTableStatistics(md);
        }
        if (databaseStats != null) {
            appendDatabaseStats(md);
        }
        if (maintenanceResult != null) {
            appendMaintenance(md);
        }

        md.append("---\n\n");
        md.append("*Generated by pgmaint*\n");
        return md.toString();
    }

    private void appendRecommendations(StringBuilder md) {
        md.append("## Index Recommendations\n\n");
        if (recommendations.isEmpty()) {
            md.append("No index issues found.\n\n");
            return;
        }

        Map<Severity, Long> bySeverity = recommendations.stream()
                .collect(Collectors.groupingBy(IndexRecommendation::getSeverity, TreeMap::new, Collectors.counting()));
        md.append("| Severity | Count |\n");
        md.append("|----------|-------|\n");
        bySeverity.entrySet().stream()
                .sorted(Map.Entry.<Severity, Long>comparingByKey().reversed())
                .forEach(entry -> md.append("| ").append(entry.getKey().getWireName())
                        .append(" | ").append(entry.getValue()).append(" |\n"));
        md.append("\n");

        int recNum = 1;
        List<IndexRecommendation> ordered = recommendations.stream()
                .sorted(Comparator.comparing(IndexRecommendation::getSeverity).reversed())
                .toList();
        for (IndexRecommendation rec : ordered) {
            md.append("### ").append(recNum++).append(". ").append(rec.getType().getWireName())
                    .append(" on `").append(rec.getTable()).append("`\n\n");
            md.append("- **Severity:** ").append(rec.getSeverity().getWireName()).append("\n");
            if (rec.getIndex() != null) {
                md.append("- **Index:** `").append(rec.getIndex()).append("`");
                if (rec.getRelatedIndex() != null) {
                    md.append(", `").append(rec.getRelatedIndex()).append("`");
                }
                md.append("\n");
            }
            if (rec.getColumn() != null && !rec.getColumn().isEmpty()) {
                md.append("- **Columns:** ").append(rec.getColumn()).append("\n");
            }
            md.append("- **Finding:** ").append(rec.getDescription()).append("\n");
            md.append("- **Action:** ").append(rec.getAction()).append("\n\n");
            rec.maintenanceStatement().ifPresent(sql ->
                    md.append("```sql\n").append(sql).append(";\n```\n\n"));
        }
    }

    private void appendSlowQueries(StringBuilder md) {
        md.append("## Slow Queries\n\n");
        if (slowQueries.isEmpty()) {
            md.append("No statements above the slow-query threshold.\n\n");
            return;
        }

        md.append("| # | Mean (ms) | Calls | Rows | Query |\n");
        md.append("|---|-----------|-------|------|-------|\n");
        int rank = 1;
        for (QueryStats query : slowQueries) {
            md.append("| ").append(rank++)
                    .append(" | ").append(String.format(Locale.ROOT, "%.1f", query.meanDurationMs()))
                    .append(" | ").append(query.totalCalls())
                    .append(" | ").append(query.rowsReturned())
                    .append(" | `").append(query.preview(QUERY_PREVIEW_LENGTH).replace("|", "\\|")).append("` |\n");
        }
        md.append("\n");
    }

    private void appendTableStatistics(StringBuilder md) {
        md.append("## Table Statistics\n\n");
        md.append("| Table | Inserts | Updates | Deletes | Live | Dead | Dead/Live | Last vacuum | Last analyze |\n");
        md.append("|-------|---------|---------|---------|------|------|-----------|-------------|--------------|\n");
        tableStatistics.forEach((table, stats) -> md.append("| ").append(table)
                .append(" | ").append(stats.inserts())
                .append(" | ").append(stats.updates())
                .append(" | ").append(stats.deletes())
                .append(" | ").append(stats.liveTuples())
                .append(" | ").append(stats.deadTuples())
                .append(" | ").append(stats.deadTupleRatio().isPresent()
                        ? String.format(Locale.ROOT, "%.2f", stats.deadTupleRatio().getAsDouble()) : "n/a")
                .append(" | ").append(latest(stats.lastVacuum(), stats.lastAutovacuum()))
                .append(" | ").append(latest(stats.lastAnalyze(), stats.lastAutoanalyze()))
                .append(" |\n"));
        md.append("\n");
    }

    private void appendDatabaseStats(StringBuilder md) {
        md.append("## Database Statistics\n\n");
        md.append("**Total size:** ").append(humanBytes(databaseStats.totalBytes())).append("\n\n");
        md.append("| Table | Size |\n");
        md.append("|-------|------|\n");
        databaseStats.tableSizes().entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .forEach(entry -> md.append("| ").append(entry.getKey())
                        .append(" | ").append(humanBytes(entry.getValue())).append(" |\n"));
        md.append("\n");

        md.append("| Index | Scans |\n");
        md.append("|-------|-------|\n");
        databaseStats.indexUsage().scans().entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator.comparing(IndexKey::toString)))
                .forEach(entry -> md.append("| ").append(entry.getKey())
                        .append(" | ").append(entry.getValue()).append(" |\n"));
        md.append("\n");
    }

    private void appendMaintenance(StringBuilder md) {
        md.append("## Maintenance\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Completed phases | ").append(maintenanceResult.completedPhases().size()).append(" |\n");
        md.append("| Tables reindexed | ").append(maintenanceResult.rebuiltTables().size()).append(" |\n");
        md.append("| Tables skipped | ").append(maintenanceResult.skippedTables().size()).append(" |\n");
        md.append("| Tables failed | ").append(maintenanceResult.failedTables().size()).append(" |\n");
        md.append("| Elapsed | ").append(maintenanceResult.elapsed().toMillis()).append(" ms |\n\n");

        if (!maintenanceResult.rebuiltTables().isEmpty()) {
            md.append("**Reindexed:** ").append(String.join(", ", maintenanceResult.rebuiltTables())).append("\n\n");
        }
        if (!maintenanceResult.skippedTables().isEmpty()) {
            md.append("**Skipped (no live tuples):** ")
                    .append(String.join(", ", maintenanceResult.skippedTables())).append("\n\n");
        }
        for (TableRebuildFailure failure : maintenanceResult.failedTables()) {
            md.append("- ⚠️ `").append(failure.table()).append("`: ").append(failure.message()).append("\n");
        }
        if (maintenanceResult.hasTableFailures()) {
            md.append("\n");
        }
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setMetadata(new ReportMetadata(timestamp, schema));
        report.setRecommendations(recommendations);
        report.setSlowQueries(slowQueries);
        report.setTableStatistics(tableStatistics);

        if (databaseStats != null) {
            DatabaseSection section = new DatabaseSection();
            section.setTotalBytes(databaseStats.totalBytes());
            section.setTableSizes(new TreeMap<>(databaseStats.tableSizes()));
            Map<String, Long> usage = new LinkedHashMap<>();
            databaseStats.indexUsage().scans().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey(Comparator.comparing(IndexKey::toString)))
                    .forEach(entry -> usage.put(entry.getKey().toString(), entry.getValue()));
            section.setIndexUsage(usage);
            report.setDatabaseStats(section);
        }

        if (maintenanceResult != null) {
            MaintenanceSection section = new MaintenanceSection();
            section.setCompletedPhases(maintenanceResult.completedPhases().stream().map(Enum::name).toList());
            section.setRebuiltTables(maintenanceResult.rebuiltTables());
            section.setSkippedTables(maintenanceResult.skippedTables());
            section.setFailedTables(maintenanceResult.failedTables());
            section.setElapsedMs(maintenanceResult.elapsed().toMillis());
            report.setMaintenance(section);
        }

        return report;
    }

    private static String latest(OffsetDateTime manual, OffsetDateTime automatic) {
        OffsetDateTime latest = manual == null ? automatic
                : automatic == null ? manual
                : manual.isAfter(automatic) ? manual : automatic;
        return latest == null ? "never" : latest.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    static String humanBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        String[] units = {"kB", "MB", "GB", "TB"};
        double value = bytes;
        int unit = -1;
        while (value >= 1024 && unit < units.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, units[unit]);
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private ReportMetadata metadata;
        private List<IndexRecommendation> recommendations;
        private List<QueryStats> slowQueries;
        private Map<String, TableStats> tableStatistics;
        private DatabaseSection databaseStats;
        private MaintenanceSection maintenance;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class ReportMetadata {
        private OffsetDateTime generatedAt;
        private String schema;
    }

    @lombok.Data
    private static class DatabaseSection {
        private long totalBytes;
        private Map<String, Long> tableSizes;
        private Map<String, Long> indexUsage;
    }

    @lombok.Data
    private static class MaintenanceSection {
        private List<String> completedPhases;
        private List<String> rebuiltTables;
        private List<String> skippedTables;
        private List<TableRebuildFailure> failedTables;
        private long elapsedMs;
    }
}
