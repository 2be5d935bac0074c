package com.astroplatform.common.chart;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative strength shared by transits, yogas and firing rules.
 */
public enum Strength {
    STRONG,
    MEDIUM,
    WEAK;

    @JsonValue
    public String wireId() {
        return name().toLowerCase();
    }
}
