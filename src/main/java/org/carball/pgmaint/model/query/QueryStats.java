package org.carball.pgmaint.model.query;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Comparator;

/**
 * Aggregated execution statistics for one normalized statement.
 */
public record QueryStats(
        String query,
        double meanDurationMs,
        long totalCalls,
        long rowsReturned,
        OffsetDateTime lastExecuted
) {

    public static final Comparator<QueryStats> BY_MEAN_DURATION_DESC =
            Comparator.comparingDouble(QueryStats::meanDurationMs).reversed();

    public Duration meanDuration() {
        return Duration.ofNanos(Math.round(meanDurationMs * 1_000_000d));
    }

    public String preview(int maxLength) {
        String flat = query == null ? "" : query.replaceAll("\\s+", " ").trim();
        return flat.length() > maxLength ? flat.substring(0, maxLength) + "..." : flat;
    }
}
