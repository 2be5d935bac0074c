package com.astroplatform.common.features;

import com.astroplatform.common.chart.Planet;
import com.astroplatform.common.chart.Strength;
import com.astroplatform.common.chart.TransitEventType;
import com.astroplatform.common.chart.TransitNature;
import com.astroplatform.common.chart.ZodiacSign;

import java.time.LocalDate;

public record TransitSummary(
    Planet           planet,
    TransitEventType eventType,
    ZodiacSign       sign,
    Integer          affectedHouse,
    LocalDate        startDate,
    LocalDate        endDate,
    TransitNature    nature,
    Strength         strength
) {}
