package com.astroplatform.conversation.dto;

import com.astroplatform.common.chart.AstroProfile;
import com.astroplatform.common.chart.DashaPeriod;
import com.astroplatform.common.chart.Planet;
import com.astroplatform.common.chart.YogaRecord;
import com.astroplatform.common.chart.ZodiacSign;
import com.astroplatform.conversation.chart.CachedChart;

import java.time.Instant;
import java.util.List;

/**
 * Compact view of the cached chart for a session.
 */
public record ChartSummary(
    ZodiacSign   ascendant,
    String       ascendantNakshatra,
    ZodiacSign   moonSign,
    String       moonNakshatra,
    ZodiacSign   sunSign,
    Planet       mahadasha,
    Planet       antardasha,
    List<String> yogas,
    int          transitCount,
    Instant      fetchedAt
) {
    public static ChartSummary from(CachedChart chart) {
        AstroProfile p = chart.profile();
        return new ChartSummary(
            p.ascendant(), p.ascendantNakshatra(),
            p.moonSign(), p.moonNakshatra(), p.sunSign(),
            planetOf(p.mahadasha()), planetOf(p.antardasha()),
            p.yogas().stream().map(YogaRecord::name).toList(),
            chart.transits().events().size(),
            chart.fetchedAt());
    }

    private static Planet planetOf(DashaPeriod period) {
        return period != null ? period.planet() : null;
    }
}
