package com.astroplatform.common.chart;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TransitNature {
    BENEFIC,
    MALEFIC,
    NEUTRAL;

    @JsonValue
    public String wireId() {
        return name().toLowerCase();
    }
}
