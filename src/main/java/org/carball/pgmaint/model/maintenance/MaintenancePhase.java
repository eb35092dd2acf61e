package org.carball.pgmaint.model.maintenance;

/**
 * Phases of a maintenance run, in execution order. A failure in any phase before
 * {@link #REBUILD_INDEXES} aborts the run.
 */
public enum MaintenancePhase {
    REFRESH_STATISTICS("refresh planner statistics"),
    RECLAIM_SPACE("reclaim dead-tuple space"),
    COMPUTE_BLOAT("compute table bloat"),
    REBUILD_INDEXES("rebuild bloated indexes");

    private final String description;

    MaintenancePhase(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
