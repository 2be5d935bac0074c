package com.astroplatform.conversation.chart;

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
import com.astroplatform.common.exception.PipelineException;
import com.astroplatform.common.model.BirthDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Development stand-in for an ephemeris service.
 *
 * <p>Every value is derived from a seed computed from the birth details, so the same
 * details always produce the same chart. The numbers carry no astronomical meaning;
 * nothing downstream may depend on them beyond the {@link ChartDataProvider} contract.
 */
@Component
public class StubChartDataProvider implements ChartDataProvider {

    private static final Logger log = LoggerFactory.getLogger(StubChartDataProvider.class);

    private static final List<String> NAKSHATRAS = List.of(
        "Ashwini", "Bharani", "Krittika", "Rohini", "Mrigashira", "Ardra",
        "Punarvasu", "Pushya", "Ashlesha", "Magha", "Purva Phalguni", "Uttara Phalguni",
        "Hasta", "Chitra", "Swati", "Vishakha", "Anuradha", "Jyeshtha",
        "Mula", "Purva Ashadha", "Uttara Ashadha", "Shravana", "Dhanishta", "Shatabhisha",
        "Purva Bhadrapada", "Uttara Bhadrapada", "Revati");

    /** Vimshottari sequence; also the nakshatra lord cycle. */
    private static final List<Planet> DASHA_ORDER = List.of(
        Planet.KETU, Planet.VENUS, Planet.SUN, Planet.MOON, Planet.MARS,
        Planet.RAHU, Planet.JUPITER, Planet.SATURN, Planet.MERCURY);

    private static final Map<Planet, Integer> DASHA_YEARS = new EnumMap<>(Planet.class);
    private static final Map<Planet, ZodiacSign> EXALTATION  = new EnumMap<>(Planet.class);
    private static final Map<Planet, ZodiacSign> DEBILITATION = new EnumMap<>(Planet.class);

    static {
        DASHA_YEARS.put(Planet.KETU, 7);
        DASHA_YEARS.put(Planet.VENUS, 20);
        DASHA_YEARS.put(Planet.SUN, 6);
        DASHA_YEARS.put(Planet.MOON, 10);
        DASHA_YEARS.put(Planet.MARS, 7);
        DASHA_YEARS.put(Planet.RAHU, 18);
        DASHA_YEARS.put(Planet.JUPITER, 16);
        DASHA_YEARS.put(Planet.SATURN, 19);
        DASHA_YEARS.put(Planet.MERCURY, 17);

        EXALTATION.put(Planet.SUN, ZodiacSign.ARIES);
        EXALTATION.put(Planet.MOON, ZodiacSign.TAURUS);
        EXALTATION.put(Planet.MARS, ZodiacSign.CAPRICORN);
        EXALTATION.put(Planet.MERCURY, ZodiacSign.VIRGO);
        EXALTATION.put(Planet.JUPITER, ZodiacSign.CANCER);
        EXALTATION.put(Planet.VENUS, ZodiacSign.PISCES);
        EXALTATION.put(Planet.SATURN, ZodiacSign.LIBRA);
        EXALTATION.put(Planet.RAHU, ZodiacSign.TAURUS);
        EXALTATION.put(Planet.KETU, ZodiacSign.SCORPIO);

        DEBILITATION.put(Planet.SUN, ZodiacSign.LIBRA);
        DEBILITATION.put(Planet.MOON, ZodiacSign.SCORPIO);
        DEBILITATION.put(Planet.MARS, ZodiacSign.CANCER);
        DEBILITATION.put(Planet.MERCURY, ZodiacSign.PISCES);
        DEBILITATION.put(Planet.JUPITER, ZodiacSign.CAPRICORN);
        DEBILITATION.put(Planet.VENUS, ZodiacSign.VIRGO);
        DEBILITATION.put(Planet.SATURN, ZodiacSign.ARIES);
        DEBILITATION.put(Planet.RAHU, ZodiacSign.SCORPIO);
        DEBILITATION.put(Planet.KETU, ZodiacSign.TAURUS);
    }

    /** Transiting planet → average days per sign. */
    private static final Map<Planet, Integer> TRANSIT_SPEEDS = new LinkedHashMap<>();

    static {
        TRANSIT_SPEEDS.put(Planet.SATURN, 912);
        TRANSIT_SPEEDS.put(Planet.JUPITER, 365);
        TRANSIT_SPEEDS.put(Planet.RAHU, 548);
        TRANSIT_SPEEDS.put(Planet.MARS, 45);
    }

    private static final List<Planet> RETROGRADE_CAPABLE = List.of(
        Planet.MARS, Planet.MERCURY, Planet.JUPITER, Planet.SATURN, Planet.VENUS);

    private static final double NAKSHATRA_SPAN = 13.33;
    private static final double DAYS_PER_YEAR  = 365.25;

    private final Clock clock;

    public StubChartDataProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<AstroProfile> fetchProfile(BirthDetails birthDetails) {
        return Mono.fromCallable(() -> buildProfile(birthDetails))
            .doOnNext(p -> log.info("[StubChart] profile generated ascendant={} moon={} mahadasha={}",
                p.ascendant(), p.moonSign(), p.mahadasha() != null ? p.mahadasha().planet() : "none"));
    }

    @Override
    public Mono<AstroTransits> fetchTransits(BirthDetails birthDetails, LocalDate from, LocalDate to) {
        return Mono.fromCallable(() -> buildTransits(birthDetails, from, to))
            .doOnNext(t -> log.info("[StubChart] transits generated from={} to={} events={}",
                from, to, t.events().size()));
    }

    // ── natal chart ───────────────────────────────────────────────────────────

    AstroProfile buildProfile(BirthDetails birth) {
        long seed = seed(birth);
        Random random = new Random(seed);

        int hour = Integer.parseInt(birth.time().trim().split(":")[0]);
        int ascIndex = (int) ((seed + hour) % 12);
        ZodiacSign ascendant = ZodiacSign.values()[ascIndex];

        List<PlanetPosition> planets = new ArrayList<>();
        Planet[] all = Planet.values();
        for (int i = 0; i < all.length; i++) {
            Planet planet = all[i];
            int signIndex = (int) ((seed + i * 3L) % 12);
            ZodiacSign sign = ZodiacSign.values()[signIndex];
            double degree = Math.round(random.nextDouble() * 2999) / 100.0;
            int nakshatra = (int) ((signIndex * 30 + degree) / NAKSHATRA_SPAN) % NAKSHATRAS.size();
            int house = Math.floorMod(signIndex - ascIndex, 12) + 1;
            Dignity dignity = dignity(planet, sign);
            boolean retrograde = RETROGRADE_CAPABLE.contains(planet) && random.nextDouble() > 0.7;
            boolean combust = planet != Planet.SUN
                && Math.abs((seed + i) % 30 - 15) < 8 && random.nextDouble() > 0.8;

            planets.add(new PlanetPosition(planet, sign, degree, house,
                NAKSHATRAS.get(nakshatra), DASHA_ORDER.get(nakshatra % DASHA_ORDER.size()),
                ((int) degree % 4) + 1, retrograde, combust, dignity, strengthScore(dignity, combust)));
        }

        List<HouseData> houses = new ArrayList<>();
        for (int h = 1; h <= 12; h++) {
            ZodiacSign sign = ascendant.plus(h - 1);
            int houseNumber = h;
            List<Planet> occupants = planets.stream()
                .filter(p -> p.house() == houseNumber)
                .map(PlanetPosition::planet)
                .toList();
            houses.add(new HouseData(h, sign, sign.lord(), occupants));
        }

        PlanetPosition moon = find(planets, Planet.MOON);
        PlanetPosition sun  = find(planets, Planet.SUN);

        List<DashaPeriod> timeline = dashaTimeline(birth.date(), seed);
        DashaPeriod maha = timeline.stream().filter(this::isCurrent).findFirst().orElse(timeline.get(0));
        DashaPeriod antar = antardashas(maha).stream().filter(this::isCurrent).findFirst().orElse(null);

        return new AstroProfile(
            birth,
            ascendant,
            Math.round(random.nextDouble() * 3000) / 100.0,
            NAKSHATRAS.get((ascIndex * 2) % NAKSHATRAS.size()),
            moon.sign(),
            moon.nakshatra(),
            sun.sign(),
            planets,
            houses,
            maha,
            antar,
            timeline,
            yogas(planets, seed),
            clock.instant());
    }

    private static Dignity dignity(Planet planet, ZodiacSign sign) {
        if (EXALTATION.get(planet) == sign)   return Dignity.EXALTED;
        if (DEBILITATION.get(planet) == sign) return Dignity.DEBILITATED;
        if (sign.lord() == planet)            return Dignity.OWN;
        return Dignity.NEUTRAL;
    }

    private static double strengthScore(Dignity dignity, boolean combust) {
        double base = switch (dignity) {
            case EXALTED     -> 0.9;
            case OWN         -> 0.75;
            case NEUTRAL     -> 0.5;
            case DEBILITATED -> 0.25;
        };
        return combust ? base - 0.1 : base;
    }

    private static PlanetPosition find(List<PlanetPosition> planets, Planet planet) {
        return planets.stream().filter(p -> p.planet() == planet).findFirst()
            .orElseThrow(() -> new PipelineException("StubChart", "missing " + planet));
    }

    // ── dashas ────────────────────────────────────────────────────────────────

    private List<DashaPeriod> dashaTimeline(LocalDate birthDate, long seed) {
        int startIndex = (int) (seed % DASHA_ORDER.size());
        LocalDate today = today();
        List<DashaPeriod> timeline = new ArrayList<>();
        LocalDate start = birthDate;
        // three cycles span well past any living person's age
        for (int cycle = 0; cycle < 3; cycle++) {
            for (int i = 0; i < DASHA_ORDER.size(); i++) {
                Planet planet = DASHA_ORDER.get((startIndex + i) % DASHA_ORDER.size());
                int years = DASHA_YEARS.get(planet);
                LocalDate end = start.plusDays((long) (years * DAYS_PER_YEAR));
                timeline.add(new DashaPeriod(planet, start, end, years, remaining(start, end, years, today)));
                start = end;
            }
        }
        return timeline;
    }

    private List<DashaPeriod> antardashas(DashaPeriod maha) {
        int startIndex = DASHA_ORDER.indexOf(maha.planet());
        int mahaYears  = DASHA_YEARS.get(maha.planet());
        LocalDate today = today();
        List<DashaPeriod> periods = new ArrayList<>();
        LocalDate start = maha.start();
        for (int i = 0; i < DASHA_ORDER.size(); i++) {
            Planet planet = DASHA_ORDER.get((startIndex + i) % DASHA_ORDER.size());
            double years = mahaYears * DASHA_YEARS.get(planet) / 120.0;
            LocalDate end = start.plusDays((long) (years * DAYS_PER_YEAR));
            periods.add(new DashaPeriod(planet, start, end, Math.round(years * 100) / 100.0,
                remaining(start, end, years, today)));
            start = end;
        }
        return periods;
    }

    private static double remaining(LocalDate start, LocalDate end, double years, LocalDate today) {
        if (today.isBefore(start)) return years;
        if (today.isAfter(end))    return 0;
        return Math.round(ChronoUnit.DAYS.between(today, end) / DAYS_PER_YEAR * 100) / 100.0;
    }

    private boolean isCurrent(DashaPeriod period) {
        LocalDate today = today();
        return !today.isBefore(period.start()) && !today.isAfter(period.end());
    }

    // ── yogas ─────────────────────────────────────────────────────────────────

    private static List<YogaRecord> yogas(List<PlanetPosition> planets, long seed) {
        List<YogaRecord> yogas = new ArrayList<>();
        PlanetPosition moon    = find(planets, Planet.MOON);
        PlanetPosition jupiter = find(planets, Planet.JUPITER);
        PlanetPosition sun     = find(planets, Planet.SUN);
        PlanetPosition mercury = find(planets, Planet.MERCURY);

        List<Integer> kendrasFromMoon = List.of(1, 4, 7, 10).stream()
            .map(k -> (moon.house() + k - 2) % 12 + 1)
            .toList();
        boolean jupiterDignified = jupiter.dignity().isDignified();

        if (kendrasFromMoon.contains(jupiter.house())) {
            yogas.add(new YogaRecord("Gajakesari Yoga", YogaCategory.RAJA,
                List.of(Planet.MOON, Planet.JUPITER), List.of(moon.house(), jupiter.house()),
                jupiterDignified ? Strength.STRONG : Strength.MEDIUM,
                "Wisdom, fame, and prosperity"));
        }
        if (sun.house() == mercury.house()) {
            yogas.add(new YogaRecord("Budhaditya Yoga", YogaCategory.RAJA,
                List.of(Planet.SUN, Planet.MERCURY), List.of(sun.house()),
                Strength.MEDIUM, "Intelligence and communication skills"));
        }
        if (List.of(1, 4, 7, 10).contains(jupiter.house()) && jupiterDignified) {
            yogas.add(new YogaRecord("Hamsa Yoga", YogaCategory.PANCHA_MAHAPURUSHA,
                List.of(Planet.JUPITER), List.of(jupiter.house()),
                Strength.STRONG, "Righteous nature and spiritual wisdom"));
        }

        Random random = new Random(seed);
        Strength[] strengths = Strength.values();
        addSeeded(yogas, random, "Chandra-Mangala Yoga",    YogaCategory.DHANA, "Wealth through own efforts", strengths);
        addSeeded(yogas, random, "Shukra-Chandra Yoga",     YogaCategory.DHANA, "Material comforts and beauty", strengths);
        addSeeded(yogas, random, "Neecha Bhanga Raja Yoga", YogaCategory.RAJA,  "Success after initial struggles", strengths);
        addSeeded(yogas, random, "Viparita Raja Yoga",      YogaCategory.RAJA,  "Gains through adversity", strengths);
        return yogas;
    }

    private static void addSeeded(List<YogaRecord> yogas, Random random, String name,
                                  YogaCategory category, String effects, Strength[] strengths) {
        if (random.nextDouble() <= 0.6) {
            return;
        }
        Planet first  = Planet.values()[random.nextInt(7)];
        Planet second = Planet.values()[(first.ordinal() + 1 + random.nextInt(6)) % 7];
        int h1 = random.nextInt(12) + 1;
        int h2 = (h1 + random.nextInt(11)) % 12 + 1;
        yogas.add(new YogaRecord(name, category, List.of(first, second), List.of(h1, h2),
            strengths[random.nextInt(strengths.length)], effects));
    }

    // ── transits ──────────────────────────────────────────────────────────────

    AstroTransits buildTransits(BirthDetails birth, LocalDate from, LocalDate to) {
        long seed = seed(birth);
        int hour = Integer.parseInt(birth.time().trim().split(":")[0]);
        int ascIndex = (int) ((seed + hour) % 12);
        Random random = new Random(seed + from.toEpochDay());
        List<TransitEvent> events = new ArrayList<>();

        TRANSIT_SPEEDS.forEach((planet, daysPerSign) -> {
            int signIndex = (int) ((seed + planet.ordinal()) % 12);
            LocalDate date = from;
            while (date.isBefore(to)) {
                if (date.isAfter(from)) {
                    ZodiacSign toSign = ZodiacSign.values()[signIndex];
                    events.add(new TransitEvent(planet, TransitEventType.INGRESS,
                        toSign.plus(-1), toSign,
                        Math.floorMod(signIndex - ascIndex, 12) + 1,
                        date, null,
                        planet == Planet.SATURN || planet == Planet.JUPITER ? Strength.STRONG : Strength.MEDIUM,
                        transitNature(planet),
                        planet.displayName() + " enters " + toSign.displayName()));
                }
                date = date.plusDays(daysPerSign + random.nextInt(61) - 30);
                signIndex = (signIndex + 1) % 12;
            }
        });

        for (Planet planet : List.of(Planet.SATURN, Planet.JUPITER, Planet.MARS, Planet.MERCURY)) {
            LocalDate start = from.plusDays(30 + random.nextInt(151));
            if (start.isBefore(to)) {
                events.add(new TransitEvent(planet, TransitEventType.RETROGRADE_START,
                    null, null, null,
                    start, start.plusDays(60 + random.nextInt(81)),
                    Strength.STRONG, TransitNature.NEUTRAL,
                    planet.displayName() + " stations retrograde"));
            }
        }
        return new AstroTransits(from, to, clock.instant(), events);
    }

    private static TransitNature transitNature(Planet planet) {
        return switch (planet) {
            case SATURN  -> TransitNature.MALEFIC;
            case JUPITER -> TransitNature.BENEFIC;
            default      -> TransitNature.NEUTRAL;
        };
    }

    // ── seed ──────────────────────────────────────────────────────────────────

    /** First 32 bits of MD5("date-time-location"), as a non-negative long. */
    static long seed(BirthDetails birth) {
        String key = birth.date() + "-" + birth.time() + "-" + birth.location();
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(key.getBytes(StandardCharsets.UTF_8));
            return ((digest[0] & 0xFFL) << 24) | ((digest[1] & 0xFFL) << 16)
                 | ((digest[2] & 0xFFL) << 8)  |  (digest[3] & 0xFFL);
        } catch (NoSuchAlgorithmException e) {
            throw new PipelineException("StubChart", "MD5 unavailable", e);
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
