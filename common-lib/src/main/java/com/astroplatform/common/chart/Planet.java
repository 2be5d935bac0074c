package com.astroplatform.common.chart;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The nine grahas used by the chart contract, in Vedic listing order.
 */
public enum Planet {
    SUN("Sun"),
    MOON("Moon"),
    MARS("Mars"),
    MERCURY("Mercury"),
    JUPITER("Jupiter"),
    VENUS("Venus"),
    SATURN("Saturn"),
    RAHU("Rahu"),
    KETU("Ketu");

    private final String displayName;

    Planet(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    /**
     * Case-insensitive lookup by display name ("Saturn", "saturn").
     *
     * @return the planet, or empty when the name is not one of the nine grahas
     */
    public static Optional<Planet> fromName(String name) {
        if (name == null) return Optional.empty();
        String trimmed = name.trim();
        for (Planet p : values()) {
            if (p.displayName.equalsIgnoreCase(trimmed)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
