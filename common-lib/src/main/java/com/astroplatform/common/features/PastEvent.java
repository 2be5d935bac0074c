package com.astroplatform.common.features;

import com.astroplatform.common.chart.Planet;

/**
 * A topic-relevant event from the trailing two years, or the running mahadasha.
 *
 * @param period        month label ("March 2024") or "Current Period"
 * @param houseAffected null for the mahadasha entry
 * @param nature        transit nature wire id, or "ongoing" for the mahadasha entry
 */
public record PastEvent(
    String  period,
    Planet  planet,
    String  eventType,
    Integer houseAffected,
    String  theme,
    String  nature
) {}
