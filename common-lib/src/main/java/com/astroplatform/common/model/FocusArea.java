package com.astroplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse focus resolved by the mode router once a reading is possible.
 * Declaration order is the tie-break order for keyword scoring.
 */
public enum FocusArea {
    CAREER,
    RELATIONSHIP,
    HEALTH,
    FINANCE,
    SPIRITUALITY;

    @JsonValue
    public String wireId() {
        return name().toLowerCase();
    }
}
