package com.astroplatform.common.chart;

import com.astroplatform.common.model.BirthDetails;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Natal chart snapshot as delivered by a chart data provider.
 *
 * <p>The pipeline only filters and reshapes this data. It never recomputes positions,
 * so any provider that fills these fields (including the deterministic stub) is valid.
 * {@code mahadasha} and {@code antardasha} are nullable.
 */
public record AstroProfile(
    BirthDetails      birthDetails,
    ZodiacSign        ascendant,
    double            ascendantDegree,
    String            ascendantNakshatra,
    ZodiacSign        moonSign,
    String            moonNakshatra,
    ZodiacSign        sunSign,
    List<PlanetPosition> planets,
    List<HouseData>   houses,
    DashaPeriod       mahadasha,
    DashaPeriod       antardasha,
    List<DashaPeriod> dashaTimeline,
    List<YogaRecord>  yogas,
    Instant           computedAt
) {
    public AstroProfile {
        planets       = planets       == null ? List.of() : List.copyOf(planets);
        houses        = houses        == null ? List.of() : List.copyOf(houses);
        dashaTimeline = dashaTimeline == null ? List.of() : List.copyOf(dashaTimeline);
        yogas         = yogas         == null ? List.of() : List.copyOf(yogas);
    }

    public Optional<PlanetPosition> planet(Planet planet) {
        return planets.stream().filter(p -> p.planet() == planet).findFirst();
    }

    public Optional<HouseData> house(int houseNumber) {
        return houses.stream().filter(h -> h.house() == houseNumber).findFirst();
    }

    /** Ruler of the given house, when that house is present in the chart data. */
    public Optional<Planet> houseLord(int houseNumber) {
        return house(houseNumber).map(HouseData::lord);
    }
}
