package com.astroplatform.common.features;

import com.astroplatform.common.chart.Planet;
import com.astroplatform.common.chart.Strength;
import com.astroplatform.common.chart.YogaCategory;

import java.util.List;

public record YogaSummary(
    String       name,
    YogaCategory category,
    Strength     strength,
    String       effects,
    List<Planet> planetsInvolved
) {}
