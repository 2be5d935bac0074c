package com.astroplatform.common.classifier;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TimeframeType {
    DAYS,
    WEEKS,
    MONTHS,
    YEARS,
    DEFAULT;

    @JsonValue
    public String wireId() {
        return name().toLowerCase();
    }
}
