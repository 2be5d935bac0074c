package com.astroplatform.common.chart;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TransitEventType {
    INGRESS,
    RETROGRADE_START,
    RETROGRADE_END,
    CONJUNCTION,
    ASPECT;

    @JsonValue
    public String wireId() {
        return name().toLowerCase();
    }
}
