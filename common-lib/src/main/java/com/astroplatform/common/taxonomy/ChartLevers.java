package com.astroplatform.common.taxonomy;

import java.util.List;

/**
 * Chart levers of a topic: the curated houses, planets and factors a reading on that
 * topic may draw on.
 *
 * @param houses           house numbers 1 to 12, most relevant first
 * @param planets          planet names or relative references ("10th Lord", "Lagna Lord",
 *                         "Transit planets")
 * @param divisionalCharts varga identifiers such as {@code D1}, {@code D10}
 * @param keyFactors       labels of the sub-factors a reading should weigh
 */
public record ChartLevers(
    List<Integer> houses,
    List<String>  planets,
    List<String>  divisionalCharts,
    List<String>  keyFactors
) {
    public ChartLevers {
        houses           = List.copyOf(houses);
        planets          = List.copyOf(planets);
        divisionalCharts = List.copyOf(divisionalCharts);
        keyFactors       = List.copyOf(keyFactors);
    }

    public boolean coversHouse(Integer house) {
        return house != null && houses.contains(house);
    }
}
