package com.astroplatform.common.features;

import com.astroplatform.common.chart.Planet;

import java.util.EnumMap;
import java.util.Map;

/**
 * Static interpretation tables: house and planet significations, and tabulated themes
 * for a planet transiting a house.
 */
public final class AstroSignificance {

    private static final String[] HOUSES = {
        "",
        "Self, personality, physical body, vitality",
        "Wealth, family, speech, values",
        "Siblings, courage, short travels, communication",
        "Home, mother, emotions, inner peace, property",
        "Intelligence, children, creativity, romance, education",
        "Enemies, diseases, debts, service, daily work",
        "Marriage, partnerships, business, public dealings",
        "Longevity, transformation, hidden matters, inheritance",
        "Fortune, dharma, higher learning, father, spirituality",
        "Career, reputation, status, public image, authority",
        "Gains, income, friends, aspirations, elder siblings",
        "Losses, expenses, foreign lands, moksha, isolation"
    };

    private static final Map<Planet, String> PLANETS = new EnumMap<>(Planet.class);

    static {
        PLANETS.put(Planet.SUN,     "Soul, authority, father, vitality, ego, government");
        PLANETS.put(Planet.MOON,    "Mind, emotions, mother, nurturing, public, liquids");
        PLANETS.put(Planet.MARS,    "Energy, courage, siblings, property, aggression, blood");
        PLANETS.put(Planet.MERCURY, "Intelligence, communication, business, skin, nervous system");
        PLANETS.put(Planet.JUPITER, "Wisdom, expansion, teachers, children, dharma, wealth");
        PLANETS.put(Planet.VENUS,   "Love, beauty, luxury, spouse, arts, vehicles, pleasures");
        PLANETS.put(Planet.SATURN,  "Discipline, delays, karma, longevity, service, restrictions");
        PLANETS.put(Planet.RAHU,    "Obsession, foreign, unconventional, sudden gains, illusion");
        PLANETS.put(Planet.KETU,    "Spirituality, detachment, past karma, moksha, intuition");
    }

    private static final Map<Planet, Map<Integer, String>> TRANSIT_THEMES = new EnumMap<>(Planet.class);

    static {
        TRANSIT_THEMES.put(Planet.SATURN, Map.of(
            10, "Career restructuring, professional challenges",
            7,  "Relationship testing, commitment decisions"));
        TRANSIT_THEMES.put(Planet.JUPITER, Map.of(
            10, "Career expansion, recognition opportunities",
            2,  "Financial growth, value reassessment"));
        TRANSIT_THEMES.put(Planet.RAHU, Map.of(
            10, "Unconventional career moves, ambition surge"));
        TRANSIT_THEMES.put(Planet.MARS, Map.of(
            10, "Career drive, potential conflicts at work"));
    }

    private AstroSignificance() {}

    /** Signification of house 1 to 12; empty string outside that range. */
    public static String house(int house) {
        return house >= 1 && house <= 12 ? HOUSES[house] : "";
    }

    public static String planet(Planet planet) {
        return planet == null ? "" : PLANETS.getOrDefault(planet, "");
    }

    /**
     * Tabulated theme for {@code planet} transiting {@code house}, else
     * "&lt;Planet&gt; influence on &lt;first signification of the house&gt;".
     */
    public static String transitTheme(Planet planet, int house) {
        String theme = TRANSIT_THEMES.getOrDefault(planet, Map.of()).get(house);
        if (theme != null) {
            return theme;
        }
        String first = house(house).split(",")[0].trim();
        return planet.displayName() + " influence on " + first;
    }
}
