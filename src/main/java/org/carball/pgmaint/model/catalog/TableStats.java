package org.carball.pgmaint.model.catalog;

import java.time.OffsetDateTime;
import java.util.OptionalDouble;

/**
 * Write activity, tuple counts and vacuum/analyze history for one table.
 */
public record TableStats(
        long inserts,
        long updates,
        long deletes,
        long liveTuples,
        long deadTuples,
        OffsetDateTime lastVacuum,
        OffsetDateTime lastAutovacuum,
        OffsetDateTime lastAnalyze,
        OffsetDateTime lastAutoanalyze
) {

    /**
     * Dead tuples per live tuple. Empty when the table has no live tuples.
     */
    public OptionalDouble deadTupleRatio() {
        if (liveTuples <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) deadTuples / liveTuples);
    }
}
