package com.astroplatform.common.chart;

/**
 * Natal placement of a single planet.
 *
 * @param strengthScore normalized strength in [0.0, 1.0]
 */
public record PlanetPosition(
    Planet     planet,
    ZodiacSign sign,
    double     degree,
    int        house,
    String     nakshatra,
    Planet     nakshatraLord,
    int        pada,
    boolean    retrograde,
    boolean    combust,
    Dignity    dignity,
    double     strengthScore
) {}
