package org.carball.pgmaint.model.recommendation;

/**
 * The independent analyses that make up one index review.
 */
public enum RecommendationPass {
    UNUSED_INDEX("unused-index"),
    MISSING_FK_INDEX("missing-fk-index"),
    DUPLICATE_INDEX("duplicate-index");

    private final String displayName;

    RecommendationPass(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
