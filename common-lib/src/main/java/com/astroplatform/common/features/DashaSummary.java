package com.astroplatform.common.features;

import com.astroplatform.common.chart.Planet;

import java.time.LocalDate;

/**
 * @param yearsRemaining rounded to one decimal
 */
public record DashaSummary(Planet planet, LocalDate startDate, LocalDate endDate, double yearsRemaining) {}
