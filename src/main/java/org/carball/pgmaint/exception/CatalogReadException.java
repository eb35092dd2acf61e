package org.carball.pgmaint.exception;

/**
 * Index, usage, table statistics or constraint metadata could not be read.
 */
public class CatalogReadException extends DatabaseOptimizationException {

    public CatalogReadException(String message) {
        super(message);
    }

    public CatalogReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
