package org.carball.pgmaint.model.catalog;

import java.util.Map;

/**
 * Storage footprint per table together with the current index usage counters.
 */
public record DatabaseStats(
        Map<String, Long> tableSizes,
        IndexUsage indexUsage
) {

    public DatabaseStats {
        tableSizes = tableSizes == null ? Map.of() : Map.copyOf(tableSizes);
        indexUsage = indexUsage == null ? IndexUsage.empty() : indexUsage;
    }

    public long totalBytes() {
        return tableSizes.values().stream().mapToLong(Long::longValue).sum();
    }
}
