package org.carball.pgmaint.exception;

/**
 * Rebuilding the indexes of a single table failed.
 */
public class TableMaintenanceException extends DatabaseOptimizationException {

    private final String table;

    public TableMaintenanceException(String table, Throwable cause) {
        super("Failed to rebuild indexes of table " + table + ": " + cause.getMessage(), cause);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
