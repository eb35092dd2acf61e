package org.carball.pgmaint.exception;

import org.carball.pgmaint.model.maintenance.MaintenancePhase;

/**
 * A fatal maintenance phase failed and the run was aborted.
 */
public class MaintenanceException extends DatabaseOptimizationException {

    private final MaintenancePhase phase;

    public MaintenanceException(MaintenancePhase phase, Throwable cause) {
        super("Maintenance aborted in phase '" + phase.getDescription() + "': " + cause.getMessage(), cause);
        this.phase = phase;
    }

    public MaintenancePhase getPhase() {
        return phase;
    }
}
