package com.astroplatform.common.features;

/**
 * A single chart fact surfaced because it is lever-relevant to the active topic.
 * Either a {@link HouseFactor} or a {@link PlanetFactor}.
 */
public interface FocusFactor {

    /** {@code "house"} or {@code "planet"}. */
    String type();

    String significance();
}
