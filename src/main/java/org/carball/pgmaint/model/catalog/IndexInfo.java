package org.carball.pgmaint.model.catalog;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * An index on a user table as read from the system catalog.
 * Column order is the order of the index key, which is what duplicate and prefix checks compare.
 * An expression key appears as its definition text, e.g. {@code lower(email)}.
 */
public record IndexInfo(
        String tableName,
        String indexName,
        List<String> columns,
        String indexType,
        boolean unique,
        boolean primary,
        long sizeBytes,
        OffsetDateTime lastUsed
) {

    public IndexInfo {
        Objects.requireNonNull(tableName, "tableName");
        Objects.requireNonNull(indexName, "indexName");
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public IndexKey key() {
        return new IndexKey(tableName, indexName);
    }

    /**
     * True when the first {@code required.size()} key columns are exactly the required columns, in any order.
     */
    public boolean coversAsPrefix(List<String> required) {
        if (required.isEmpty() || required.size() > columns.size()) {
            return false;
        }
        return columns.subList(0, required.size()).containsAll(required);
    }
}
