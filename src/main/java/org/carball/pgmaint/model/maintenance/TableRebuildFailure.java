package org.carball.pgmaint.model.maintenance;

public record TableRebuildFailure(String table, String message) {}
