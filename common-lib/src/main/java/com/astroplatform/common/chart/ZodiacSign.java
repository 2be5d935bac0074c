package com.astroplatform.common.chart;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The twelve rashis with their classical rulers.
 */
public enum ZodiacSign {
    ARIES("Aries", Planet.MARS),
    TAURUS("Taurus", Planet.VENUS),
    GEMINI("Gemini", Planet.MERCURY),
    CANCER("Cancer", Planet.MOON),
    LEO("Leo", Planet.SUN),
    VIRGO("Virgo", Planet.MERCURY),
    LIBRA("Libra", Planet.VENUS),
    SCORPIO("Scorpio", Planet.MARS),
    SAGITTARIUS("Sagittarius", Planet.JUPITER),
    CAPRICORN("Capricorn", Planet.SATURN),
    AQUARIUS("Aquarius", Planet.SATURN),
    PISCES("Pisces", Planet.JUPITER);

    private final String displayName;
    private final Planet lord;

    ZodiacSign(String displayName, Planet lord) {
        this.displayName = displayName;
        this.lord = lord;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    public Planet lord() {
        return lord;
    }

    /** Sign number 1 (Aries) to 12 (Pisces). */
    public int number() {
        return ordinal() + 1;
    }

    /** Sign at {@code offset} positions from this one, wrapping around the zodiac. */
    public ZodiacSign plus(int offset) {
        ZodiacSign[] all = values();
        return all[Math.floorMod(ordinal() + offset, all.length)];
    }
}
