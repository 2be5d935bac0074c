package com.astroplatform.common.features;

import com.astroplatform.common.chart.Dignity;
import com.astroplatform.common.chart.Planet;
import com.astroplatform.common.chart.ZodiacSign;

public record PlanetStrength(
    Planet     planet,
    ZodiacSign sign,
    Dignity    dignity,
    double     strengthScore,
    boolean    retrograde,
    String     nakshatra
) {}
