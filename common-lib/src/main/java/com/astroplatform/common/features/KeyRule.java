package com.astroplatform.common.features;

import com.astroplatform.common.chart.Planet;
import com.astroplatform.common.chart.Strength;
import com.astroplatform.common.chart.TransitNature;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A named astrological condition that currently holds for the chart.
 * Optional fields are left out of the JSON form when null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeyRule(
    String        id,
    String        meaning,
    Strength      strength,
    List<Planet>  planets,
    Integer       house,
    TransitNature nature,
    Double        yearsRemaining,
    String        timeWindow,
    String        recommendation
) {
    public KeyRule {
        planets = planets == null ? List.of() : List.copyOf(planets);
    }
}
