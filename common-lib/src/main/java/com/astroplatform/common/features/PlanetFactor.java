package com.astroplatform.common.features;

import com.astroplatform.common.chart.Dignity;
import com.astroplatform.common.chart.Planet;
import com.astroplatform.common.chart.ZodiacSign;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Planet-level focus factor.
 *
 * @param reference the lever entry that resolved to this planet ("10th Lord", "Sun")
 */
@JsonPropertyOrder({"type", "planet", "reference", "sign", "house", "nakshatra", "dignity",
                    "retrograde", "combust", "strengthScore", "significance"})
public record PlanetFactor(
    Planet     planet,
    String     reference,
    ZodiacSign sign,
    int        house,
    String     nakshatra,
    Dignity    dignity,
    boolean    retrograde,
    boolean    combust,
    double     strengthScore,
    String     significance
) implements FocusFactor {

    @Override
    @JsonProperty("type")
    public String type() {
        return "planet";
    }
}
