package com.astroplatform.common.features;

import com.astroplatform.common.chart.AstroProfile;
import com.astroplatform.common.chart.AstroTransits;
import com.astroplatform.common.chart.Planet;
import com.astroplatform.common.chart.Strength;
import com.astroplatform.common.chart.TransitEvent;
import com.astroplatform.common.chart.TransitEventType;
import com.astroplatform.common.chart.TransitNature;
import com.astroplatform.common.chart.ZodiacSign;
import com.astroplatform.common.classifier.TimeframeClassifier;
import com.astroplatform.common.model.Mode;
import com.astroplatform.common.taxonomy.ChartLeverTable;
import com.astroplatform.common.taxonomy.Topic;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.astroplatform.common.features.ChartFixtures.NOW;
import static com.astroplatform.common.features.ChartFixtures.TODAY;
import static com.astroplatform.common.features.ChartFixtures.profile;
import static com.astroplatform.common.features.ChartFixtures.transit;
import static com.astroplatform.common.features.ChartFixtures.transits;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link AstroFeatureBuilder} against a hand-built chart.
 */
class AstroFeatureBuilderTest {

    private static AstroFeatures career(AstroTransits transits) {
        return AstroFeatureBuilder.build(profile(), transits, Mode.NORMAL_READING, Topic.CAREER, NOW, null);
    }

    // ── transit window ────────────────────────────────────────────────────

    @Nested
    @DisplayName("transit filtering")
    class TransitFiltering {

        @Test
        @DisplayName("200 days ago → excluded, 100 days ago → included")
        void trailingBoundary() {
            AstroFeatures f = career(transits(
                transit(Planet.SATURN,  10, -200, Strength.STRONG, TransitNature.MALEFIC),
                transit(Planet.JUPITER, 10, -100, Strength.STRONG, TransitNature.BENEFIC)));

            assertEquals(1, f.transits().size());
            assertEquals(Planet.JUPITER, f.transits().get(0).planet());
            assertEquals(TODAY.minusDays(100), f.transits().get(0).startDate());
        }

        @Test
        @DisplayName("edges: −180 and +365 included, −181 and +366 excluded")
        void windowEdges() {
            AstroFeatures f = career(transits(
                transit(Planet.MARS,    10, -181, Strength.WEAK, TransitNature.NEUTRAL),
                transit(Planet.SATURN,  10, -180, Strength.WEAK, TransitNature.NEUTRAL),
                transit(Planet.JUPITER, 10,  365, Strength.WEAK, TransitNature.NEUTRAL),
                transit(Planet.RAHU,    10,  366, Strength.WEAK, TransitNature.NEUTRAL)));

            assertEquals(List.of(Planet.SATURN, Planet.JUPITER),
                f.transits().stream().map(TransitSummary::planet).toList());
        }

        @Test
        @DisplayName("house outside the topic levers → excluded")
        void nonLeverHouse() {
            AstroFeatures f = career(transits(
                transit(Planet.SATURN, 3, 10, Strength.STRONG, TransitNature.MALEFIC)));
            assertTrue(f.transits().isEmpty());
        }

        @Test
        @DisplayName("strong before weak, then nearest to today")
        void ordering() {
            AstroFeatures f = career(transits(
                transit(Planet.MARS,    10,   0, Strength.WEAK,   TransitNature.NEUTRAL),
                transit(Planet.SATURN,  10,  90, Strength.STRONG, TransitNature.MALEFIC),
                transit(Planet.JUPITER, 10, -30, Strength.STRONG, TransitNature.BENEFIC)));

            assertEquals(List.of(Planet.JUPITER, Planet.SATURN, Planet.MARS),
                f.transits().stream().map(TransitSummary::planet).toList());
        }

        @Test
        @DisplayName("malformed transit → skipped, others kept")
        void malformedSkipped() {
            TransitEvent noStart = new TransitEvent(Planet.SATURN, TransitEventType.INGRESS,
                ZodiacSign.LEO, ZodiacSign.VIRGO, 10, null, null, Strength.STRONG, TransitNature.MALEFIC, "no start");
            TransitEvent noPlanet = new TransitEvent(null, TransitEventType.INGRESS,
                ZodiacSign.LEO, ZodiacSign.VIRGO, 10, TODAY, null, Strength.STRONG, TransitNature.MALEFIC, "no planet");
            TransitEvent noType = new TransitEvent(Planet.MARS, null,
                ZodiacSign.LEO, ZodiacSign.VIRGO, 10, TODAY.minusDays(30), null, Strength.STRONG,
                TransitNature.NEUTRAL, "no type");

            AstroFeatures f = career(transits(
                transit(Planet.JUPITER, 10, 30, Strength.STRONG, TransitNature.BENEFIC),
                noStart, noPlanet, noType));

            assertFalse(f.isEmpty());
            assertEquals(List.of(Planet.JUPITER), f.transits().stream().map(TransitSummary::planet).toList());
            assertFalse(f.timingWindows().isEmpty());
            assertTrue(f.pastEvents().stream().noneMatch(e -> e.planet() == Planet.MARS));
        }
    }

    // ── caps ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("list caps")
    class Caps {

        @Test
        @DisplayName("40 eligible transits → every list within its cap")
        void capsHold() {
            List<TransitEvent> many = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                many.add(transit(Planet.SATURN, 10, -170 + i * 12, Strength.STRONG, TransitNature.MALEFIC));
                many.add(transit(Planet.JUPITER, 2, -700 + i * 10, Strength.STRONG, TransitNature.BENEFIC));
            }
            AstroFeatures f = career(transits(many.toArray(new TransitEvent[0])));

            assertEquals(AstroFeatureBuilder.MAX_TRANSITS, f.transits().size());
            assertTrue(f.keyRules().size()      <= AstroFeatureBuilder.MAX_KEY_RULES);
            assertTrue(f.focusFactors().size()  <= AstroFeatureBuilder.MAX_FOCUS_FACTORS);
            assertTrue(f.yogas().size()         <= AstroFeatureBuilder.MAX_YOGAS);
            assertTrue(f.pastEvents().size()    <= AstroFeatureBuilder.MAX_PAST_EVENTS);
            assertTrue(f.timingWindows().size() <= AstroFeatureBuilder.MAX_TIMING_WINDOWS);
            assertEquals(AstroFeatureBuilder.MAX_KEY_RULES, f.keyRules().size());
        }
    }

    // ── focus factors & strengths ─────────────────────────────────────────

    @Nested
    @DisplayName("focus factors")
    class FocusFactors {

        @Test
        @DisplayName("career → 4 house factors, then planets with the 10th lord resolved")
        void careerFactors() {
            AstroFeatures f = career(transits());

            List<FocusFactor> factors = f.focusFactors();
            assertEquals(8, factors.size());

            HouseFactor tenth = (HouseFactor) factors.get(2);
            assertEquals(10, tenth.house());
            assertEquals(ZodiacSign.CAPRICORN, tenth.sign());
            assertEquals(Planet.SATURN, tenth.lord());
            assertEquals(9, tenth.lordHouse());
            assertEquals(List.of(Planet.SUN, Planet.MERCURY), tenth.occupants());

            PlanetFactor lord = (PlanetFactor) factors.get(4);
            assertEquals(Planet.SATURN, lord.planet());
            assertEquals("10th Lord", lord.reference());
            assertEquals("planet", lord.type());
        }

        @Test
        @DisplayName("duplicate references (10th Lord, Saturn) → one strength record")
        void strengthsDeduplicated() {
            AstroFeatures f = career(transits());
            assertEquals(List.of(Planet.SATURN, Planet.SUN, Planet.RAHU, Planet.MERCURY),
                f.planetaryStrengths().stream().map(PlanetStrength::planet).toList());
        }

        @Test
        @DisplayName("null topic → general levers")
        void nullTopic() {
            AstroFeatures f = AstroFeatureBuilder.build(profile(), transits(), Mode.NORMAL_READING, null, NOW, null);
            int houses = ChartLeverTable.forTopic(Topic.GENERAL).houses().size();
            assertEquals(houses, f.focusFactors().stream().filter(HouseFactor.class::isInstance).count());
        }

        @Test
        @DisplayName("missing house data → factor omitted, no failure")
        void missingHouses() {
            AstroProfile p = profile();
            AstroProfile noHouses = new AstroProfile(p.birthDetails(), p.ascendant(), p.ascendantDegree(),
                p.ascendantNakshatra(), p.moonSign(), p.moonNakshatra(), p.sunSign(), p.planets(), List.of(),
                p.mahadasha(), p.antardasha(), p.dashaTimeline(), p.yogas(), p.computedAt());

            AstroFeatures f = AstroFeatureBuilder.build(noHouses, transits(), Mode.NORMAL_READING, Topic.CAREER, NOW, null);
            assertTrue(f.focusFactors().stream().noneMatch(HouseFactor.class::isInstance));
            // "10th Lord" cannot resolve without house data; the named planets still do
            assertEquals(List.of(Planet.SUN, Planet.SATURN, Planet.RAHU, Planet.MERCURY),
                f.planetaryStrengths().stream().map(PlanetStrength::planet).toList());
            assertTrue(f.keyRules().stream().noneMatch(r -> r.id().startsWith("JUPITER_ASPECT")));
        }
    }

    // ── key rules ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("key rules")
    class KeyRules {

        @Test
        @DisplayName("Saturn on Moon, Jupiter on 2nd, Saturn mahadasha fire in order")
        void staticRules() {
            AstroFeatures f = career(transits());
            assertEquals(List.of("SATURN_ASPECT_MOON", "JUPITER_ASPECT_2ND", "MAHADASHA_SATURN"),
                f.keyRules().stream().map(KeyRule::id).toList());

            KeyRule maha = f.keyRules().get(2);
            assertEquals(9.7, maha.yearsRemaining());
            assertEquals(Strength.STRONG, maha.strength());
        }

        @Test
        @DisplayName("strong topic transit → TRANSIT rule with time window")
        void transitRule() {
            AstroFeatures f = career(transits(
                transit(Planet.SATURN, 10, 20, Strength.STRONG, TransitNature.MALEFIC)));
            KeyRule rule = f.keyRules().get(3);
            assertEquals("TRANSIT_SATURN_INGRESS", rule.id());
            assertEquals("Saturn ingress affecting Capricorn", rule.meaning());
            assertEquals(TODAY.plusDays(20) + " to " + TODAY.plusDays(140), rule.timeWindow());
        }

        @Test
        @DisplayName("aspect = house seven positions forward")
        void aspectArithmetic() {
            assertTrue(AstroFeatureBuilder.aspects(9, 4));
            assertTrue(AstroFeatureBuilder.aspects(7, 2));
            assertTrue(AstroFeatureBuilder.aspects(12, 7));
            assertFalse(AstroFeatureBuilder.aspects(9, 5));
        }
    }

    // ── yogas ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("career yogas: raja + pancha mahapurusha + dhana, arishta dropped")
    void careerYogas() {
        assertEquals(List.of("Gajakesari", "Hamsa", "Chandra-Mangala"),
            career(transits()).yogas().stream().map(YogaSummary::name).toList());
    }

    // ── past events & timing windows ──────────────────────────────────────

    @Nested
    @DisplayName("past events")
    class PastEvents {

        @Test
        @DisplayName("tabulated theme and trailing mahadasha entry")
        void themes() {
            AstroFeatures f = career(transits(
                transit(Planet.SATURN, 10, -100, Strength.STRONG, TransitNature.MALEFIC),
                transit(Planet.MARS,    6, -400, Strength.WEAK,   TransitNature.NEUTRAL),
                transit(Planet.RAHU,   10, -800, Strength.STRONG, TransitNature.MALEFIC)));

            List<PastEvent> past = f.pastEvents();
            assertEquals(3, past.size());
            assertEquals("Career restructuring, professional challenges", past.get(0).theme());
            assertEquals("Mars influence on Enemies", past.get(1).theme());
            assertEquals("Current Period", past.get(2).period());
            assertEquals("ongoing", past.get(2).nature());
        }

        @Test
        @DisplayName("daily guidance and birth-detail collection → no past events")
        void notBuilt() {
            AstroTransits t = transits(transit(Planet.SATURN, 10, -100, Strength.STRONG, TransitNature.MALEFIC));
            assertTrue(AstroFeatureBuilder.build(profile(), t, Mode.NORMAL_READING, Topic.DAILY_GUIDANCE, NOW, null)
                .pastEvents().isEmpty());
            assertTrue(AstroFeatureBuilder.build(profile(), t, Mode.NEEDS_BIRTH_DETAILS, Topic.CAREER, NOW, null)
                .pastEvents().isEmpty());
        }
    }

    @Nested
    @DisplayName("timing windows")
    class TimingWindows {

        @Test
        @DisplayName("nature mapping, horizon flag, antardasha last")
        void windows() {
            AstroFeatures f = AstroFeatureBuilder.build(profile(), transits(
                    transit(Planet.SATURN,  10, 200, Strength.STRONG, TransitNature.MALEFIC),
                    transit(Planet.JUPITER, 10,  30, Strength.STRONG, TransitNature.BENEFIC),
                    transit(Planet.MARS,    11,  60, Strength.STRONG, TransitNature.NEUTRAL),
                    transit(Planet.RAHU,    10,  10, Strength.WEAK,   TransitNature.MALEFIC)),
                Mode.NORMAL_READING, Topic.CAREER, NOW, TimeframeClassifier.classify("next 3 months"));

            List<TimingWindow> w = f.timingWindows();
            assertEquals(4, w.size());
            assertEquals(TimingWindow.Nature.FAVORABLE, w.get(0).nature());
            assertTrue(w.get(0).withinRequestedHorizon());
            assertEquals(TimingWindow.Nature.MIXED, w.get(1).nature());
            assertEquals(TimingWindow.Nature.CHALLENGING, w.get(2).nature());
            assertFalse(w.get(2).withinRequestedHorizon());
            assertEquals(TimingWindow.Nature.ONGOING, w.get(3).nature());
            assertEquals("Saturn-Mercury period", w.get(3).trigger());
        }
    }

    // ── determinism ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("idempotence")
    class Idempotence {

        private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        @Test
        @DisplayName("same inputs twice → byte-identical JSON")
        void byteIdentical() throws Exception {
            AstroTransits t = transits(
                transit(Planet.SATURN,  10, -100, Strength.STRONG, TransitNature.MALEFIC),
                transit(Planet.JUPITER,  2,   40, Strength.STRONG, TransitNature.BENEFIC),
                transit(Planet.MARS,    11,  -20, Strength.WEAK,   TransitNature.NEUTRAL));

            AstroFeatures first  = AstroFeatureBuilder.build(profile(), t, Mode.NORMAL_READING, Topic.CAREER, NOW, null);
            AstroFeatures second = AstroFeatureBuilder.build(profile(), t, Mode.NORMAL_READING, Topic.CAREER, NOW, null);

            assertEquals(first, second);
            assertArrayEquals(mapper.writeValueAsBytes(first), mapper.writeValueAsBytes(second));
        }

        @Test
        @DisplayName("empty() carries no chart data")
        void emptyBundle() throws Exception {
            AstroFeatures empty = AstroFeatures.empty();
            assertTrue(empty.isEmpty());
            assertFalse(mapper.writeValueAsString(empty).contains("\"empty\""));
        }
    }
}
