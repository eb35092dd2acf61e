package org.carball.pgmaint.model.catalog;

/**
 * One column of a foreign-key constraint. Multi-column constraints produce one entry per column,
 * ordered by {@code position} starting at 1.
 */
public record ForeignKeyColumn(
        String constraintName,
        String table,
        String column,
        String referencedTable,
        String referencedColumn,
        int position
) {}
