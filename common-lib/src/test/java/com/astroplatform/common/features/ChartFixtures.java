package com.astroplatform.common.features;

import com.astroplatform.common.chart.AstroProfile;
import com.astroplatform.common.chart.AstroTransits;
import com.astroplatform.common.chart.DashaPeriod;
import com.astroplatform.common.chart.Dignity;
import com.astroplatform.common.chart.HouseData;
import com.astroplatform.common.chart.Planet;
import com.astroplatform.common.chart.PlanetPosition;
import com.astroplatform.common.chart.Strength;
import com.astroplatform.common.chart.TransitEvent;
import com.astroplatform.common.chart.TransitEventType;
import com.astroplatform.common.chart.TransitNature;
import com.astroplatform.common.chart.YogaCategory;
import com.astroplatform.common.chart.YogaRecord;
import com.astroplatform.common.chart.ZodiacSign;
import com.astroplatform.common.model.BirthDetails;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Hand-built Aries-ascendant chart.
 *
 * <pre>
 *   Sun 10, Moon 4, Mars 1, Mercury 10, Jupiter 7, Venus 2, Saturn 9, Rahu 11, Ketu 5
 *   Saturn (9) aspects house 4 → Moon; Jupiter (7) aspects house 2
 *   Mahadasha Saturn, antardasha Mercury
 * </pre>
 */
final class ChartFixtures {

    static final Instant   NOW   = Instant.parse("2024-06-01T12:00:00Z");
    static final LocalDate TODAY = LocalDate.ofInstant(NOW, ZoneOffset.UTC);

    private static final Map<Planet, Integer> HOUSES = new EnumMap<>(Planet.class);

    static {
        HOUSES.put(Planet.SUN,     10);
        HOUSES.put(Planet.MOON,    4);
        HOUSES.put(Planet.MARS,    1);
        HOUSES.put(Planet.MERCURY, 10);
        HOUSES.put(Planet.JUPITER, 7);
        HOUSES.put(Planet.VENUS,   2);
        HOUSES.put(Planet.SATURN,  9);
        HOUSES.put(Planet.RAHU,    11);
        HOUSES.put(Planet.KETU,    5);
    }

    private ChartFixtures() {}

    static AstroProfile profile() {
        List<PlanetPosition> planets = new ArrayList<>();
        HOUSES.forEach((planet, house) -> {
            ZodiacSign sign = signOfHouse(house);
            Dignity dignity = sign.lord() == planet ? Dignity.OWN : Dignity.NEUTRAL;
            planets.add(new PlanetPosition(planet, sign, 12.5, house, "Ashwini", Planet.KETU, 1,
                false, false, dignity, 0.6));
        });

        List<HouseData> houses = new ArrayList<>();
        for (int h = 1; h <= 12; h++) {
            int house = h;
            List<Planet> occupants = HOUSES.entrySet().stream()
                .filter(e -> e.getValue() == house)
                .map(Map.Entry::getKey)
                .toList();
            houses.add(new HouseData(h, signOfHouse(h), signOfHouse(h).lord(), occupants));
        }

        DashaPeriod maha  = new DashaPeriod(Planet.SATURN,  LocalDate.of(2015, 3, 1), LocalDate.of(2034, 3, 1), 19, 9.74);
        DashaPeriod antar = new DashaPeriod(Planet.MERCURY, LocalDate.of(2023, 1, 1), LocalDate.of(2025, 9, 1), 2.7, 1.25);

        List<YogaRecord> yogas = List.of(
            new YogaRecord("Kemadruma", YogaCategory.ARISHTA, List.of(Planet.MOON), List.of(4), Strength.MEDIUM, "Loneliness"),
            new YogaRecord("Gajakesari", YogaCategory.RAJA, List.of(Planet.JUPITER, Planet.MOON), List.of(4, 7),
                Strength.STRONG, "Wisdom, fame, and prosperity"),
            new YogaRecord("Hamsa", YogaCategory.PANCHA_MAHAPURUSHA, List.of(Planet.JUPITER), List.of(7),
                Strength.STRONG, "Righteousness"),
            new YogaRecord("Chandra-Mangala", YogaCategory.DHANA, List.of(Planet.MOON, Planet.MARS), List.of(1, 4),
                Strength.MEDIUM, "Earnings through enterprise"),
            new YogaRecord("Shukra-Chandra", YogaCategory.RELATIONSHIP, List.of(Planet.VENUS), List.of(2),
                Strength.WEAK, "Affectionate nature"));

        return new AstroProfile(
            BirthDetails.of(LocalDate.of(1985, 10, 10), "10:47", "Dehradun"),
            ZodiacSign.ARIES, 7.3, "Ashwini",
            ZodiacSign.CANCER, "Pushya",
            ZodiacSign.CAPRICORN,
            planets, houses, maha, antar, List.of(maha), yogas,
            NOW);
    }

    static ZodiacSign signOfHouse(int house) {
        return ZodiacSign.ARIES.plus(house - 1);
    }

    static TransitEvent transit(Planet planet, int house, int daysFromToday, Strength strength, TransitNature nature) {
        LocalDate start = TODAY.plusDays(daysFromToday);
        return new TransitEvent(planet, TransitEventType.INGRESS,
            signOfHouse(house).plus(-1), signOfHouse(house), house,
            start, start.plusDays(120), strength, nature, planet.displayName() + " ingress");
    }

    static AstroTransits transits(TransitEvent... events) {
        return new AstroTransits(TODAY.minusDays(800), TODAY.plusDays(400), NOW, List.of(events));
    }
}
