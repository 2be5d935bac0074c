package com.astroplatform.common.chart;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Dignity {
    EXALTED,
    OWN,
    NEUTRAL,
    DEBILITATED;

    @JsonValue
    public String wireId() {
        return name().toLowerCase();
    }

    /** Exalted or own-sign placement. */
    public boolean isDignified() {
        return this == EXALTED || this == OWN;
    }
}
