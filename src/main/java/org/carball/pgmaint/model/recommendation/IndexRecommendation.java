package org.carball.pgmaint.model.recommendation;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * A single finding about an index, with the action a DBA should consider.
 * {@code relatedIndex} is only set for duplicate pairs; {@code statement} only when a ready-to-run command exists.
 */
@Value
@Builder
public class IndexRecommendation {
    RecommendationType type;
    Severity severity;
    String table;
    String index;
    String relatedIndex;
    String column;
    String description;
    String action;
    String statement;

    public Optional<String> maintenanceStatement() {
        return Optional.ofNullable(statement);
    }
}
