package com.astroplatform.common.features;

import com.astroplatform.common.chart.ZodiacSign;
import com.astroplatform.common.classifier.TimeframeResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Topic-scoped, size-bounded chart context handed to the text generator.
 *
 * <p>Built by {@link AstroFeatureBuilder}; every list is capped by a constant on that
 * class. {@link #empty()} stands in when no chart is available (birth details missing or
 * the chart provider failed), so downstream code never has to null-check the bundle.
 *
 * <p>Nullable: {@code birth}, the chart fields, {@code mahadasha}, {@code antardasha},
 * {@code timeframe}.
 */
public record AstroFeatures(
    @JsonProperty("birth")              BirthSummary         birth,
    @JsonProperty("ascendant")          ZodiacSign           ascendant,
    @JsonProperty("ascendantNakshatra") String               ascendantNakshatra,
    @JsonProperty("moonSign")           ZodiacSign           moonSign,
    @JsonProperty("moonNakshatra")      String               moonNakshatra,
    @JsonProperty("sunSign")            ZodiacSign           sunSign,
    @JsonProperty("mahadasha")          DashaSummary         mahadasha,
    @JsonProperty("antardasha")         DashaSummary         antardasha,
    @JsonProperty("focusFactors")       List<FocusFactor>    focusFactors,
    @JsonProperty("keyRules")           List<KeyRule>        keyRules,
    @JsonProperty("transits")           List<TransitSummary> transits,
    @JsonProperty("planetaryStrengths") List<PlanetStrength> planetaryStrengths,
    @JsonProperty("yogas")              List<YogaSummary>    yogas,
    @JsonProperty("pastEvents")         List<PastEvent>      pastEvents,
    @JsonProperty("timingWindows")      List<TimingWindow>   timingWindows,
    @JsonProperty("timeframe")          TimeframeResult      timeframe
) {
    public AstroFeatures {
        focusFactors       = List.copyOf(focusFactors);
        keyRules           = List.copyOf(keyRules);
        transits           = List.copyOf(transits);
        planetaryStrengths = List.copyOf(planetaryStrengths);
        yogas              = List.copyOf(yogas);
        pastEvents         = List.copyOf(pastEvents);
        timingWindows      = List.copyOf(timingWindows);
    }

    public static AstroFeatures empty() {
        return new AstroFeatures(null, null, null, null, null, null, null, null,
            List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), null);
    }

    /** True when no chart data backs this bundle. */
    @JsonIgnore
    public boolean isEmpty() {
        return ascendant == null && focusFactors.isEmpty() && transits.isEmpty();
    }
}
