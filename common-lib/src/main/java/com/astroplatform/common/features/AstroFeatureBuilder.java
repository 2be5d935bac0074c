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
import com.astroplatform.common.chart.TransitNature;
import com.astroplatform.common.chart.YogaCategory;
import com.astroplatform.common.chart.YogaRecord;
import com.astroplatform.common.classifier.TimeframeResult;
import com.astroplatform.common.model.BirthDetails;
import com.astroplatform.common.model.Mode;
import com.astroplatform.common.taxonomy.ChartLeverTable;
import com.astroplatform.common.taxonomy.ChartLevers;
import com.astroplatform.common.taxonomy.Topic;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reduces a full chart and transit snapshot to the topic-scoped bundle the text
 * generator is allowed to see.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>Levers for the topic; null topic falls back to {@link Topic#GENERAL}.</li>
 *   <li>Focus factors: one per lever house present in the chart, then one per resolved
 *       lever planet.</li>
 *   <li>Key rules: Saturn aspecting the Moon, Jupiter aspecting one of the first two lever
 *       houses, the running mahadasha, strong topic transits nearest to today.</li>
 *   <li>Transits starting in {@code [today - 180d, today + 365d]} in a lever house, strong
 *       first, then nearest to today.</li>
 *   <li>Planetary strengths for the resolved lever planets.</li>
 *   <li>Yogas in the topic's categories, plus raja and dhana yogas for every topic.</li>
 *   <li>Past events (normal readings other than daily guidance): lever-house transits
 *       from the trailing two years, plus the running mahadasha.</li>
 *   <li>Timing windows: strong lever-house transits opening in the next 18 months, plus
 *       the running antardasha.</li>
 * </ol>
 *
 * <p>Every list is capped by the {@code MAX_*} constants. The result depends only on the
 * arguments: identical inputs give an identical bundle.
 *
 * <p>No Spring dependency. No I/O. Pure function.
 */
public final class AstroFeatureBuilder {

    public static final int MAX_FOCUS_FACTORS  = 10;
    public static final int MAX_KEY_RULES      = 5;
    public static final int MAX_TRANSITS       = 10;
    public static final int MAX_STRENGTHS      = 9;
    public static final int MAX_YOGAS          = 5;
    public static final int MAX_PAST_EVENTS    = 5;
    public static final int MAX_TIMING_WINDOWS = 6;

    public static final int TRAILING_WINDOW_DAYS = 180;
    public static final int LEADING_WINDOW_DAYS  = 365;
    public static final int PAST_EVENTS_DAYS     = 730;
    public static final int TIMING_WINDOW_DAYS   = 545;

    private static final int JUPITER_RULE_HOUSES = 2;

    private static final DateTimeFormatter MONTH_YEAR =
        DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);

    private static final Map<Topic, Set<YogaCategory>> TOPIC_YOGAS = new EnumMap<>(Topic.class);

    static {
        TOPIC_YOGAS.put(Topic.CAREER,                 EnumSet.of(YogaCategory.RAJA, YogaCategory.PANCHA_MAHAPURUSHA));
        TOPIC_YOGAS.put(Topic.MONEY,                  EnumSet.of(YogaCategory.DHANA));
        TOPIC_YOGAS.put(Topic.ROMANTIC_RELATIONSHIPS, EnumSet.of(YogaCategory.RELATIONSHIP));
        TOPIC_YOGAS.put(Topic.MARRIAGE_PARTNERSHIP,   EnumSet.of(YogaCategory.RELATIONSHIP, YogaCategory.RAJA));
        TOPIC_YOGAS.put(Topic.HEALTH_ENERGY,          EnumSet.of(YogaCategory.ARISHTA));
        TOPIC_YOGAS.put(Topic.SPIRITUALITY,           EnumSet.of(YogaCategory.SANNYASA, YogaCategory.MOKSHA));
    }

    private AstroFeatureBuilder() {}

    /**
     * Builds the feature bundle.
     *
     * @param profile   natal chart, required
     * @param transits  transit snapshot; null is treated as no transits
     * @param mode      conversation mode; past events are only built for {@link Mode#NORMAL_READING}
     * @param topic     active topic; null resolves to general levers
     * @param now       reference instant, "today" is its UTC date
     * @param timeframe requested horizon; null means the 12-month default
     */
    public static AstroFeatures build(AstroProfile profile,
                                      AstroTransits transits,
                                      Mode mode,
                                      Topic topic,
                                      Instant now,
                                      TimeframeResult timeframe) {
        Topic           effectiveTopic = topic == null ? Topic.GENERAL : topic;
        TimeframeResult horizon        = timeframe == null ? TimeframeResult.defaultHorizon() : timeframe;
        ChartLevers     levers         = ChartLeverTable.forTopic(effectiveTopic);
        LocalDate       today          = LocalDate.ofInstant(now, ZoneOffset.UTC);
        List<TransitEvent> events      = wellFormed(transits);

        Map<Planet, String> leverPlanets = resolvePlanets(levers, profile);
        List<TransitSummary> filtered = filterTransits(events, levers, today);

        boolean pastEventsApply = mode == Mode.NORMAL_READING && effectiveTopic != Topic.DAILY_GUIDANCE;

        return new AstroFeatures(
            birthSummary(profile.birthDetails()),
            profile.ascendant(),
            profile.ascendantNakshatra(),
            profile.moonSign(),
            profile.moonNakshatra(),
            profile.sunSign(),
            dashaSummary(profile.mahadasha()),
            dashaSummary(profile.antardasha()),
            focusFactors(profile, levers, leverPlanets),
            keyRules(profile, levers, events, today),
            filtered,
            planetaryStrengths(profile, leverPlanets),
            yogas(profile, effectiveTopic),
            pastEventsApply ? pastEvents(profile, events, levers, today) : List.of(),
            timingWindows(profile, events, levers, today, horizon),
            horizon);
    }

    // ── focus factors ─────────────────────────────────────────────────────────

    /** Lever planet entries resolved to planets, first reference wins, in lever order. */
    private static Map<Planet, String> resolvePlanets(ChartLevers levers, AstroProfile profile) {
        Map<Planet, String> resolved = new LinkedHashMap<>();
        for (String reference : levers.planets()) {
            PlanetReferenceResolver.resolve(reference, profile)
                .ifPresent(p -> resolved.putIfAbsent(p, reference));
        }
        return resolved;
    }

    private static List<FocusFactor> focusFactors(AstroProfile profile, ChartLevers levers,
                                                  Map<Planet, String> leverPlanets) {
        List<FocusFactor> factors = new ArrayList<>();
        for (int houseNumber : levers.houses()) {
            profile.house(houseNumber).ifPresent(h -> factors.add(houseFactor(profile, h)));
        }
        leverPlanets.forEach((planet, reference) ->
            profile.planet(planet).ifPresent(p -> factors.add(planetFactor(p, reference))));
        return cap(factors, MAX_FOCUS_FACTORS);
    }

    private static HouseFactor houseFactor(AstroProfile profile, HouseData house) {
        Optional<PlanetPosition> lord = Optional.ofNullable(house.lord()).flatMap(profile::planet);
        return new HouseFactor(
            house.house(),
            house.sign(),
            house.lord(),
            lord.map(PlanetPosition::house).orElse(null),
            lord.map(PlanetPosition::sign).orElse(null),
            lord.map(PlanetPosition::dignity).orElse(null),
            house.occupants(),
            AstroSignificance.house(house.house()));
    }

    private static PlanetFactor planetFactor(PlanetPosition p, String reference) {
        return new PlanetFactor(p.planet(), reference, p.sign(), p.house(), p.nakshatra(),
            p.dignity(), p.retrograde(), p.combust(), p.strengthScore(),
            AstroSignificance.planet(p.planet()));
    }

    // ── key rules ─────────────────────────────────────────────────────────────

    private static List<KeyRule> keyRules(AstroProfile profile, ChartLevers levers,
                                          List<TransitEvent> events, LocalDate today) {
        List<KeyRule> rules = new ArrayList<>();
        Optional<PlanetPosition> saturn  = profile.planet(Planet.SATURN);
        Optional<PlanetPosition> moon    = profile.planet(Planet.MOON);
        Optional<PlanetPosition> jupiter = profile.planet(Planet.JUPITER);

        if (saturn.isPresent() && moon.isPresent()
                && aspects(saturn.get().house(), moon.get().house())) {
            Strength strength = isDignified(saturn.get().dignity()) ? Strength.STRONG : Strength.MEDIUM;
            rules.add(new KeyRule("SATURN_ASPECT_MOON",
                "Saturn's aspect on Moon brings emotional discipline but can cause heaviness",
                strength, List.of(Planet.SATURN, Planet.MOON), moon.get().house(),
                null, null, null, "Practice emotional self-care; avoid overthinking"));
        }

        if (jupiter.isPresent()) {
            PlanetPosition jup = jupiter.get();
            levers.houses().stream()
                .filter(n -> profile.house(n).isPresent())
                .limit(JUPITER_RULE_HOUSES)
                .filter(n -> aspects(jup.house(), n))
                .forEach(n -> rules.add(new KeyRule(
                    "JUPITER_ASPECT_" + ordinal(n).toUpperCase(Locale.ROOT),
                    "Jupiter's aspect on " + ordinal(n) + " house brings expansion and blessings",
                    jup.dignity() == Dignity.DEBILITATED ? Strength.WEAK : Strength.STRONG,
                    List.of(Planet.JUPITER), n, null, null, null,
                    "Favorable period for growth in this area")));
        }

        DashaPeriod maha = profile.mahadasha();
        if (maha != null && maha.planet() != null) {
            profile.planet(maha.planet()).ifPresent(p -> rules.add(new KeyRule(
                "MAHADASHA_" + maha.planet().name(),
                maha.planet().displayName() + " Mahadasha emphasizes themes of "
                    + AstroSignificance.planet(maha.planet()).toLowerCase(Locale.ROOT),
                Strength.STRONG, List.of(maha.planet()), p.house(), null,
                round1(maha.yearsRemaining()), maha.start() + " to " + maha.end(), null)));
        }

        events.stream()
            .filter(TransitEvent::isStrong)
            .filter(e -> levers.coversHouse(e.affectedHouse()))
            .filter(e -> e.startsWithin(today.minusDays(TRAILING_WINDOW_DAYS), today.plusDays(LEADING_WINDOW_DAYS)))
            .sorted(Comparator.comparingLong(e -> distanceInDays(e, today)))
            .limit(MAX_KEY_RULES)
            .forEach(e -> rules.add(transitRule(e)));

        return cap(rules, MAX_KEY_RULES);
    }

    private static KeyRule transitRule(TransitEvent e) {
        String target = e.toSign() != null
            ? e.toSign().displayName()
            : "house " + e.affectedHouse();
        String window = e.endDate() != null
            ? e.startDate() + " to " + e.endDate()
            : "From " + e.startDate();
        return new KeyRule(
            "TRANSIT_" + e.planet().name() + "_" + e.eventType().name(),
            e.planet().displayName() + " " + e.eventType().wireId() + " affecting " + target,
            e.strength(), List.of(e.planet()), e.affectedHouse(), e.nature(),
            null, window, null);
    }

    /** A planet aspects the house seven positions forward from its own. */
    static boolean aspects(int fromHouse, int targetHouse) {
        return (fromHouse + 6) % 12 + 1 == targetHouse;
    }

    private static boolean isDignified(Dignity dignity) {
        return dignity != null && dignity.isDignified();
    }

    // ── transits ──────────────────────────────────────────────────────────────

    private static List<TransitSummary> filterTransits(List<TransitEvent> events, ChartLevers levers,
                                                       LocalDate today) {
        LocalDate from = today.minusDays(TRAILING_WINDOW_DAYS);
        LocalDate to   = today.plusDays(LEADING_WINDOW_DAYS);
        return events.stream()
            .filter(e -> e.startsWithin(from, to))
            .filter(e -> levers.coversHouse(e.affectedHouse()))
            .sorted(Comparator.comparing((TransitEvent e) -> !e.isStrong())
                .thenComparingLong(e -> distanceInDays(e, today)))
            .limit(MAX_TRANSITS)
            .map(e -> new TransitSummary(e.planet(), e.eventType(),
                e.toSign() != null ? e.toSign() : e.fromSign(),
                e.affectedHouse(), e.startDate(), e.endDate(), e.nature(), e.strength()))
            .toList();
    }

    private static long distanceInDays(TransitEvent e, LocalDate today) {
        return Math.abs(ChronoUnit.DAYS.between(today, e.startDate()));
    }

    // ── strengths & yogas ─────────────────────────────────────────────────────

    private static List<PlanetStrength> planetaryStrengths(AstroProfile profile,
                                                           Map<Planet, String> leverPlanets) {
        return leverPlanets.keySet().stream()
            .map(profile::planet)
            .flatMap(Optional::stream)
            .map(p -> new PlanetStrength(p.planet(), p.sign(), p.dignity(), p.strengthScore(),
                p.retrograde(), p.nakshatra()))
            .limit(MAX_STRENGTHS)
            .toList();
    }

    private static List<YogaSummary> yogas(AstroProfile profile, Topic topic) {
        Set<YogaCategory> wanted = TOPIC_YOGAS.getOrDefault(topic, Set.of());
        return profile.yogas().stream()
            .filter(y -> y.category() != null)
            .filter(y -> wanted.contains(y.category()) || y.category().isGenerallyPositive())
            .limit(MAX_YOGAS)
            .map(AstroFeatureBuilder::yogaSummary)
            .toList();
    }

    private static YogaSummary yogaSummary(YogaRecord y) {
        return new YogaSummary(y.name(), y.category(), y.strength(), y.effects(), y.planetsInvolved());
    }

    // ── past events ───────────────────────────────────────────────────────────

    private static List<PastEvent> pastEvents(AstroProfile profile, List<TransitEvent> events,
                                              ChartLevers levers, LocalDate today) {
        DashaPeriod maha = profile.mahadasha();
        int transitSlots = maha != null && maha.planet() != null ? MAX_PAST_EVENTS - 1 : MAX_PAST_EVENTS;
        LocalDate from = today.minusDays(PAST_EVENTS_DAYS);

        List<PastEvent> past = new ArrayList<>(events.stream()
            .filter(e -> !e.startDate().isBefore(from) && e.startDate().isBefore(today))
            .filter(e -> levers.coversHouse(e.affectedHouse()))
            .sorted(Comparator.comparing(TransitEvent::startDate).reversed())
            .limit(transitSlots)
            .map(e -> new PastEvent(
                e.startDate().format(MONTH_YEAR),
                e.planet(),
                e.eventType().wireId(),
                e.affectedHouse(),
                AstroSignificance.transitTheme(e.planet(), e.affectedHouse()),
                e.nature() == null ? TransitNature.NEUTRAL.wireId() : e.nature().wireId()))
            .toList());

        if (maha != null && maha.planet() != null) {
            past.add(new PastEvent("Current Period", maha.planet(), "mahadasha", null,
                maha.planet().displayName() + " period themes", "ongoing"));
        }
        return cap(past, MAX_PAST_EVENTS);
    }

    // ── timing windows ────────────────────────────────────────────────────────

    private static List<TimingWindow> timingWindows(AstroProfile profile, List<TransitEvent> events,
                                                    ChartLevers levers, LocalDate today,
                                                    TimeframeResult horizon) {
        DashaPeriod maha  = profile.mahadasha();
        DashaPeriod antar = profile.antardasha();
        boolean hasAntar  = antar != null && antar.planet() != null && maha != null && maha.planet() != null;
        LocalDate horizonEnd = today.plusDays(horizon.horizonDays());

        List<TimingWindow> windows = new ArrayList<>(events.stream()
            .filter(TransitEvent::isStrong)
            .filter(e -> e.startsWithin(today, today.plusDays(TIMING_WINDOW_DAYS)))
            .filter(e -> levers.coversHouse(e.affectedHouse()))
            .sorted(Comparator.comparing(TransitEvent::startDate))
            .map(e -> timingWindow(e, horizonEnd))
            .sorted(Comparator.comparing((TimingWindow w) -> !w.withinRequestedHorizon()))
            .limit(hasAntar ? MAX_TIMING_WINDOWS - 1 : MAX_TIMING_WINDOWS)
            .toList());

        if (hasAntar) {
            windows.add(new TimingWindow(
                "Current Antardasha (" + antar.planet().displayName() + ")",
                TimingWindow.Nature.ONGOING,
                maha.planet().displayName() + "-" + antar.planet().displayName() + " period",
                null,
                "Themes of both planets are active",
                true));
        }
        return cap(windows, MAX_TIMING_WINDOWS);
    }

    private static TimingWindow timingWindow(TransitEvent e, LocalDate horizonEnd) {
        TimingWindow.Nature nature = switch (e.nature() != null ? e.nature() : TransitNature.NEUTRAL) {
            case BENEFIC -> TimingWindow.Nature.FAVORABLE;
            case MALEFIC -> TimingWindow.Nature.CHALLENGING;
            case NEUTRAL -> TimingWindow.Nature.MIXED;
        };
        String activity = switch (nature) {
            case FAVORABLE   -> "Good time for new initiatives and decisions";
            case CHALLENGING -> "Focus on consolidation and careful planning";
            default          -> "Mixed results - proceed with awareness";
        };
        String period = e.startDate().format(MONTH_YEAR) + " - "
            + (e.endDate() != null ? e.endDate().format(MONTH_YEAR) : "ongoing");
        return new TimingWindow(period, nature,
            e.planet().displayName() + " " + e.eventType().wireId(),
            e.affectedHouse(), activity, !e.startDate().isAfter(horizonEnd));
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    /** Provider events usable downstream; malformed ones are dropped one by one. */
    private static List<TransitEvent> wellFormed(AstroTransits transits) {
        if (transits == null) {
            return List.of();
        }
        return transits.events().stream()
            .filter(TransitEvent::isWellFormed)
            .toList();
    }

    private static BirthSummary birthSummary(BirthDetails details) {
        return details == null ? null : new BirthSummary(details.date(), details.time(), details.location());
    }

    private static DashaSummary dashaSummary(DashaPeriod dasha) {
        return dasha == null ? null
            : new DashaSummary(dasha.planet(), dasha.start(), dasha.end(), round1(dasha.yearsRemaining()));
    }

    private static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }

    static String ordinal(int n) {
        if (n % 100 >= 11 && n % 100 <= 13) return n + "th";
        return n + switch (n % 10) {
            case 1  -> "st";
            case 2  -> "nd";
            case 3  -> "rd";
            default -> "th";
        };
    }

    private static <T> List<T> cap(List<T> list, int max) {
        return list.size() <= max ? List.copyOf(list) : List.copyOf(list.subList(0, max));
    }
}
