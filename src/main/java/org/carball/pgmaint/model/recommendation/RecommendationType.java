package org.carball.pgmaint.model.recommendation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationType {
    UNUSED_INDEX("unused_index"),
    MISSING_FK_INDEX("missing_fk_index"),
    DUPLICATE_INDEX("duplicate_index");

    private final String wireName;

    RecommendationType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
