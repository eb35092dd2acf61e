package org.carball.pgmaint.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
