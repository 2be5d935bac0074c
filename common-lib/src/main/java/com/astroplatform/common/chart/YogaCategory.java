package com.astroplatform.common.chart;

import com.fasterxml.jackson.annotation.JsonValue;

public enum YogaCategory {
    RAJA,
    DHANA,
    PANCHA_MAHAPURUSHA,
    RELATIONSHIP,
    ARISHTA,
    SANNYASA,
    MOKSHA,
    OTHER;

    @JsonValue
    public String wireId() {
        return name().toLowerCase();
    }

    /** Raja and dhana yogas surface for every topic. */
    public boolean isGenerallyPositive() {
        return this == RAJA || this == DHANA;
    }
}
