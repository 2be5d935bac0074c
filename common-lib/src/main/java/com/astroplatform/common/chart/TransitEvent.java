package com.astroplatform.common.chart;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;

/**
 * A time-bounded transit evaluated against the natal chart.
 *
 * <p>{@code fromSign}, {@code toSign}, {@code affectedHouse} and {@code endDate} are
 * nullable: retrograde stations carry no sign change and ingresses are open-ended.
 */
public record TransitEvent(
    Planet           planet,
    TransitEventType eventType,
    ZodiacSign       fromSign,
    ZodiacSign       toSign,
    Integer          affectedHouse,
    LocalDate        startDate,
    LocalDate        endDate,
    Strength         strength,
    TransitNature    nature,
    String           description
) {
    @JsonIgnore
    public boolean isStrong() {
        return strength == Strength.STRONG;
    }

    /** Planet, event type and start date present; anything else cannot be placed in time. */
    @JsonIgnore
    public boolean isWellFormed() {
        return planet != null && eventType != null && startDate != null;
    }

    /** True when the start date lies in {@code [from, to]}, both ends inclusive. */
    public boolean startsWithin(LocalDate from, LocalDate to) {
        return !startDate.isBefore(from) && !startDate.isAfter(to);
    }
}
