package org.carball.pgmaint.model.maintenance;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a maintenance run that got through all fatal phases.
 * Tables that could not be rebuilt are listed in {@code failedTables}; they do not make the run fail.
 */
public record MaintenanceResult(
        List<MaintenancePhase> completedPhases,
        List<String> rebuiltTables,
        List<String> skippedTables,
        List<TableRebuildFailure> failedTables,
        Duration elapsed
) {

    public MaintenanceResult {
        completedPhases = List.copyOf(completedPhases);
        rebuiltTables = List.copyOf(rebuiltTables);
        skippedTables = List.copyOf(skippedTables);
        failedTables = List.copyOf(failedTables);
    }

    public boolean hasTableFailures() {
        return !failedTables.isEmpty();
    }
}
