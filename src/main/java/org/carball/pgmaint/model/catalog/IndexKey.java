package org.carball.pgmaint.model.catalog;

import java.util.Objects;

/**
 * Identifies an index by its owning table and its name, so equally named indexes on different tables stay apart.
 */
public record IndexKey(String table, String index) {

    public IndexKey {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(index, "index");
    }

    @Override
    public String toString() {
        return table + "." + index;
    }
}
