package com.astroplatform.conversation.generator;

import com.astroplatform.common.chart.Planet;
import com.astroplatform.common.chart.ZodiacSign;
import com.astroplatform.common.features.AstroFeatures;
import com.astroplatform.common.features.DashaSummary;
import com.astroplatform.common.model.GenerationPayload;
import com.astroplatform.common.model.GeneratorReply;
import com.astroplatform.common.model.Mode;
import com.astroplatform.common.taxonomy.Topic;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StubReplyGeneratorTest {

    private final StubReplyGenerator stub = new StubReplyGenerator();

    @Test
    @DisplayName("birth details missing → asks for date, time and place")
    void needsBirthDetails() {
        GeneratorReply reply = stub.reply(
            new GenerationPayload(Mode.NEEDS_BIRTH_DETAILS, Topic.GENERAL, "hi", AstroFeatures.empty()));

        assertEquals(StubReplyGenerator.BIRTH_SUMMARY, reply.summary());
        assertEquals(2, reply.reasons().size());
        assertTrue(reply.remedies().isEmpty());
    }

    @Test
    @DisplayName("reading → summary built from ascendant, moon, topic and mahadasha")
    void reading_usesFeatures() {
        AstroFeatures f = AstroFeatures.empty();
        AstroFeatures features = new AstroFeatures(null, ZodiacSign.LEO, "Magha", ZodiacSign.PISCES, "Revati",
            ZodiacSign.ARIES,
            new DashaSummary(Planet.SATURN, LocalDate.of(2020, 1, 1), LocalDate.of(2039, 1, 1), 14.6),
            null, f.focusFactors(), f.keyRules(), f.transits(), f.planetaryStrengths(), f.yogas(),
            f.pastEvents(), f.timingWindows(), null);

        GeneratorReply reply = stub.reply(
            new GenerationPayload(Mode.NORMAL_READING, Topic.HEALTH_ENERGY, "health?", features));

        assertEquals("With Leo Ascendant and Pisces Moon, your health energy area is influenced by Saturn Mahadasha.",
                     reply.summary());
        assertEquals(List.of(
            "Leo Ascendant -> Your natural approach -> Shapes how you handle health energy",
            "Pisces Moon -> Emotional foundation -> Influences your health energy decisions",
            "Saturn Mahadasha -> Current life phase -> Brings focus to certain areas"), reply.reasons());
    }

    @Test
    @DisplayName("no chart data → unavailable notice, no invented placements")
    void emptyFeatures_chartUnavailable() {
        GeneratorReply reply = stub.reply(
            new GenerationPayload(Mode.NORMAL_READING, Topic.CAREER, "career?", AstroFeatures.empty()));

        assertEquals(StubReplyGenerator.CHART_UNAVAILABLE_SUMMARY, reply.summary());
        assertEquals(List.of(StubReplyGenerator.CHART_UNAVAILABLE_REASON), reply.reasons());
        assertFalse(reply.summary().contains("Ascendant"));
        assertFalse(reply.summary().contains("Mahadasha"));
    }

    @Test
    @DisplayName("ascendant only → mentions ascendant, no moon or dasha")
    void partialFeatures_onlyPresentPlacements() {
        AstroFeatures f = AstroFeatures.empty();
        AstroFeatures features = new AstroFeatures(null, ZodiacSign.VIRGO, null, null, null,
            null, null, null, f.focusFactors(), f.keyRules(), f.transits(), f.planetaryStrengths(), f.yogas(),
            f.pastEvents(), f.timingWindows(), null);

        GeneratorReply reply = stub.reply(
            new GenerationPayload(Mode.NORMAL_READING, Topic.CAREER, "career?", features));

        assertEquals("With Virgo Ascendant, your career area is shaped by your current chart placements.",
                     reply.summary());
        assertEquals(1, reply.reasons().size());
    }

    @Test
    @DisplayName("same payload → same reply")
    void deterministic() {
        GenerationPayload payload =
            new GenerationPayload(Mode.NORMAL_READING, Topic.CAREER, "career?", AstroFeatures.empty());

        assertEquals(stub.reply(payload), stub.reply(payload));
    }
}
