package com.astroplatform.common.chart;

import java.util.List;

/**
 * One bhava of the natal chart: its sign, ruling planet and occupants.
 */
public record HouseData(
    int          house,
    ZodiacSign   sign,
    Planet       lord,
    List<Planet> occupants
) {
    public HouseData {
        occupants = occupants == null ? List.of() : List.copyOf(occupants);
    }
}
