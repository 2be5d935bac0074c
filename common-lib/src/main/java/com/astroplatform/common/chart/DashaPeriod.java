package com.astroplatform.common.chart;

import java.time.LocalDate;

/**
 * A Vimshottari period (mahadasha or antardasha).
 */
public record DashaPeriod(
    Planet    planet,
    LocalDate start,
    LocalDate end,
    double    yearsTotal,
    double    yearsRemaining
) {}
