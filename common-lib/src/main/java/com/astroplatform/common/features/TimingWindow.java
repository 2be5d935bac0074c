package com.astroplatform.common.features;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * An upcoming period worth planning around.
 *
 * @param withinRequestedHorizon true when the window opens inside the horizon the user
 *                               asked about
 */
public record TimingWindow(
    String  period,
    Nature  nature,
    String  trigger,
    Integer house,
    String  activity,
    boolean withinRequestedHorizon
) {
    public enum Nature {
        FAVORABLE,
        CHALLENGING,
        MIXED,
        ONGOING;

        @JsonValue
        public String wireId() {
            return name().toLowerCase();
        }
    }
}
