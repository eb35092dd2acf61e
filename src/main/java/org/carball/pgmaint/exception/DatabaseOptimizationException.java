package org.carball.pgmaint.exception;

/**
 * Base type for failures raised while reading catalog data or running maintenance.
 */
public class DatabaseOptimizationException extends Exception {

    public DatabaseOptimizationException(String message) {
        super(message);
    }

    public DatabaseOptimizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
