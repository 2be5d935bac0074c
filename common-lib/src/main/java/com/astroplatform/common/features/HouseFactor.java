package com.astroplatform.common.features;

import com.astroplatform.common.chart.Dignity;
import com.astroplatform.common.chart.Planet;
import com.astroplatform.common.chart.ZodiacSign;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * House-level focus factor. The lord fields are null when the ruling planet is missing
 * from the chart data.
 */
@JsonPropertyOrder({"type", "house", "sign", "lord", "lordHouse", "lordSign", "lordDignity",
                    "occupants", "significance"})
public record HouseFactor(
    int          house,
    ZodiacSign   sign,
    Planet       lord,
    Integer      lordHouse,
    ZodiacSign   lordSign,
    Dignity      lordDignity,
    List<Planet> occupants,
    String       significance
) implements FocusFactor {

    @Override
    @JsonProperty("type")
    public String type() {
        return "house";
    }
}
