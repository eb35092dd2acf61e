package org.carball.pgmaint.advisor;

import org.carball.pgmaint.catalog.CatalogReader;
import org.carball.pgmaint.exception.CatalogReadException;
import org.carball.pgmaint.exception.DatabaseOptimizationException;
import org.carball.pgmaint.exception.RecommendationPassException;
import org.carball.pgmaint.execution.CancellationSignal;
import org.carball.pgmaint.execution.SqlIdentifiers;
import org.carball.pgmaint.model.catalog.ForeignKeyColumn;
import org.carball.pgmaint.model.catalog.IndexInfo;
import org.carball.pgmaint.model.catalog.IndexUsage;
import org.carball.pgmaint.model.recommendation.IndexRecommendation;
import org.carball.pgmaint.model.recommendation.RecommendationPass;
import org.carball.pgmaint.model.recommendation.RecommendationType;
import org.carball.pgmaint.model.recommendation.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;

/**
 * Derives index recommendations from catalog metadata: unused indexes, foreign keys without a supporting index
 * and indexes that duplicate each other.
 */
public class RecommendationEngine {

    private final CatalogReader catalog;
    private final String schema;
    private final Logger log;

    public RecommendationEngine(CatalogReader catalog, String schema) {
        this(catalog, schema, LoggerFactory.getLogger(RecommendationEngine.class));
    }

    public RecommendationEngine(CatalogReader catalog, String schema, Logger log) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.schema = schema;
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Runs all passes over the current catalog. Failing to read the index list or its usage counters aborts the
     * call; a failing foreign-key or duplicate pass is logged and left out of the result.
     */
    public List<IndexRecommendation> analyzeIndexes(CancellationSignal signal) throws CatalogReadException {
        signal.throwIfCancelled("index analysis");

        List<IndexInfo> indexes = catalog.listIndexes(signal);
        IndexUsage usage = catalog.indexUsage(signal);
        log.info("Analyzing {} indexes ({} with usage statistics)", indexes.size(), usage.size());

        List<IndexRecommendation> recommendations = new ArrayList<>(findUnusedIndexes(indexes, usage));
        recommendations.addAll(runPass(RecommendationPass.MISSING_FK_INDEX, () -> findMissingForeignKeyIndexes(signal)));
        recommendations.addAll(runPass(RecommendationPass.DUPLICATE_INDEX, () -> findDuplicateIndexes(indexes)));

        log.info("Index analysis produced {} recommendations", recommendations.size());
        return recommendations;
    }

    /**
     * Non-primary indexes that have never been scanned. An index without a usage row counts as never scanned.
     */
    List<IndexRecommendation> findUnusedIndexes(List<IndexInfo> indexes, IndexUsage usage) {
        List<IndexRecommendation> recommendations = new ArrayList<>();
        for (IndexInfo index : indexes) {
            if (index.primary() || usage.scansFor(index.key()) != 0) {
                continue;
            }
            recommendations.add(IndexRecommendation.builder()
                    .type(RecommendationType.UNUSED_INDEX)
                    .severity(Severity.MEDIUM)
                    .table(index.tableName())
                    .index(index.indexName())
                    .column(String.join(", ", index.columns()))
                    .description(String.format("Index %s on table %s is not being used",
                            index.indexName(), index.tableName()))
                    .action(String.format("Consider dropping index %s", index.indexName()))
                    .build());
        }
        log.debug("Unused-index pass found {} candidates", recommendations.size());
        return recommendations;
    }

    /**
     * Foreign-key constraints whose columns are not the leading columns of any index on the referencing table.
     * A constraint whose coverage cannot be checked is logged and skipped.
     */
    List<IndexRecommendation> findMissingForeignKeyIndexes(CancellationSignal signal) throws CatalogReadException {
        Map<String, List<ForeignKeyColumn>> constraints = new LinkedHashMap<>();
        for (ForeignKeyColumn fk : catalog.foreignKeyColumns(signal)) {
            constraints.computeIfAbsent(fk.table() + "." + fk.constraintName(), key -> new ArrayList<>()).add(fk);
        }

        List<IndexRecommendation> recommendations = new ArrayList<>();
        for (List<ForeignKeyColumn> constraint : constraints.values()) {
            constraint.sort(Comparator.comparingInt(ForeignKeyColumn::position));
            ForeignKeyColumn first = constraint.get(0);
            List<String> columns = constraint.stream().map(ForeignKeyColumn::column).toList();

            signal.throwIfCancelled("checking foreign key " + first.constraintName());
            boolean covered;
            try {
                covered = columns.size() == 1
                        ? catalog.indexExistsOnColumn(first.table(), columns.get(0), signal)
                        : catalog.indexCoversColumns(first.table(), columns, signal);
            } catch (CatalogReadException e) {
                log.warn("Failed to check index for foreign key {}.{}: {}",
                        first.table(), String.join(", ", columns), e.getMessage());
                continue;
            }

            if (!covered) {
                recommendations.add(missingForeignKeyIndex(constraint, columns));
            }
        }
        log.debug("Missing-FK-index pass checked {} constraints, found {} without index",
                constraints.size(), recommendations.size());
        return recommendations;
    }

    private IndexRecommendation missingForeignKeyIndex(List<ForeignKeyColumn> constraint, List<String> columns) {
        ForeignKeyColumn first = constraint.get(0);
        String table = first.table();
        List<String> referencedColumns = constraint.stream().map(ForeignKeyColumn::referencedColumn).toList();

        String description;
        String action;
        if (columns.size() == 1) {
            description = String.format("Foreign key %s.%s references %s.%s but has no index",
                    table, columns.get(0), first.referencedTable(), referencedColumns.get(0));
            action = String.format("Create index on %s.%s", table, columns.get(0));
        } else {
            description = String.format("Foreign key %s on %s (%s) references %s (%s) but has no covering index",
                    first.constraintName(), table, String.join(", ", columns),
                    first.referencedTable(), String.join(", ", referencedColumns));
            action = String.format("Create index on %s (%s)", table, String.join(", ", columns));
        }

        String statement = String.format("CREATE INDEX %s ON %s (%s)",
                SqlIdentifiers.quote(SqlIdentifiers.indexName(table, columns)),
                SqlIdentifiers.qualify(schema, table),
                SqlIdentifiers.columnList(columns));

        return IndexRecommendation.builder()
                .type(RecommendationType.MISSING_FK_INDEX)
                .severity(Severity.HIGH)
                .table(table)
                .column(String.join(", ", columns))
                .description(description)
                .action(action)
                .statement(statement)
                .build();
    }

    /**
     * Pairs of indexes on the same table with the same ordered key columns, each unordered pair reported once.
     * Expression keys compare by their definition text. An index without any key entries is never compared.
     */
    List<IndexRecommendation> findDuplicateIndexes(List<IndexInfo> indexes) {
        Map<String, Map<List<String>, List<IndexInfo>>> byTable = new TreeMap<>();
        for (IndexInfo index : indexes) {
            if (index.columns().isEmpty()) {
                continue;
            }
            byTable.computeIfAbsent(index.tableName(), table -> new LinkedHashMap<>())
                    .computeIfAbsent(index.columns(), columns -> new ArrayList<>())
                    .add(index);
        }

        List<IndexRecommendation> recommendations = new ArrayList<>();
        byTable.forEach((table, groups) -> groups.forEach((columns, group) -> {
            if (group.size() < 2) {
                return;
            }
            List<IndexInfo> sorted = group.stream().sorted(Comparator.comparing(IndexInfo::indexName)).toList();
            for (int i = 0; i < sorted.size(); i++) {
                for (int j = i + 1; j < sorted.size(); j++) {
                    recommendations.add(duplicatePair(table, columns, sorted.get(i), sorted.get(j)));
                }
            }
        }));
        log.debug("Duplicate-index pass found {} pairs", recommendations.size());
        return recommendations;
    }

    private IndexRecommendation duplicatePair(String table, List<String> columns, IndexInfo first, IndexInfo second) {
        return IndexRecommendation.builder()
                .type(RecommendationType.DUPLICATE_INDEX)
                .severity(Severity.MEDIUM)
                .table(table)
                .index(first.indexName())
                .relatedIndex(second.indexName())
                .column(String.join(", ", columns))
                .description(String.format("Indexes %s and %s on table %s have identical columns",
                        first.indexName(), second.indexName(), table))
                .action(String.format("Consider dropping one of the duplicate indexes: %s or %s",
                        first.indexName(), second.indexName()))
                .build();
    }

    private List<IndexRecommendation> runPass(RecommendationPass pass, Pass body) {
        try {
            return body.run();
        } catch (CancellationException e) {
            throw e;
        } catch (DatabaseOptimizationException | RuntimeException e) {
            RecommendationPassException failure = new RecommendationPassException(pass, e);
            log.warn("{}; its recommendations are omitted", failure.getMessage(), failure);
            return List.of();
        }
    }

    @FunctionalInterface
    private interface Pass {
        List<IndexRecommendation> run() throws DatabaseOptimizationException;
    }
}
