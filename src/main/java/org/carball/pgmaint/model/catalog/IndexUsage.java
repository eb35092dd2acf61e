package org.carball.pgmaint.model.catalog;

import java.util.Map;

/**
 * Scan counters per index since the last statistics reset.
 */
public record IndexUsage(Map<IndexKey, Long> scans) {

    public IndexUsage {
        scans = scans == null ? Map.of() : Map.copyOf(scans);
    }

    public static IndexUsage empty() {
        return new IndexUsage(Map.of());
    }

    /**
     * Returns the scan count for the index; an index without a statistics row counts as never scanned.
     */
    public long scansFor(IndexKey key) {
        return scans.getOrDefault(key, 0L);
    }

    public int size() {
        return scans.size();
    }
}
