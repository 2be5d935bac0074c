package com.astroplatform.conversation.chart;

import com.astroplatform.common.chart.AstroProfile;
import com.astroplatform.common.chart.AstroTransits;

import java.time.Instant;

/**
 * Immutable cache entry: a chart with the transit snapshot fetched alongside it.
 * A refresh replaces the whole entry; a failed refresh leaves it untouched.
 */
public record CachedChart(
    AstroProfile  profile,
    AstroTransits transits,
    Instant       fetchedAt
) {}
