package com.astroplatform.common.features;

import com.astroplatform.common.chart.AstroProfile;
import com.astroplatform.common.chart.Planet;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves lever planet entries to concrete planets.
 *
 * <ul>
 *   <li>a planet name ("Saturn") resolves to itself</li>
 *   <li>"Lagna Lord" and "1st Lord" resolve to the ruler of house 1</li>
 *   <li>"&lt;N&gt;th Lord" resolves to the ruler of house N</li>
 *   <li>anything else, including "Transit planets", resolves to nothing</li>
 * </ul>
 */
public final class PlanetReferenceResolver {

    private static final Pattern HOUSE_NUMBER = Pattern.compile("(\\d{1,2})");

    private PlanetReferenceResolver() {}

    public static Optional<Planet> resolve(String reference, AstroProfile profile) {
        if (reference == null) {
            return Optional.empty();
        }
        Optional<Planet> direct = Planet.fromName(reference);
        if (direct.isPresent()) {
            return direct;
        }
        if (!reference.contains("Lord")) {
            return Optional.empty();
        }
        if (reference.contains("Lagna")) {
            return profile.houseLord(1);
        }
        Matcher m = HOUSE_NUMBER.matcher(reference);
        if (m.find()) {
            return profile.houseLord(Integer.parseInt(m.group(1)));
        }
        return Optional.empty();
    }
}
