package com.astroplatform.common.classifier;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

class TimeframeClassifierTest {

    @Nested
    @DisplayName("numeric phrases")
    class Numeric {

        @Test
        @DisplayName("\"next 3 months\" → 3 months")
        void nextThreeMonths() {
            TimeframeResult r = TimeframeClassifier.classify("What happens in the next 3 months?");
            assertEquals(TimeframeType.MONTHS, r.type());
            assertEquals(3, r.value());
            assertEquals(3.0, r.horizonMonths());
            assertEquals("Next 3 months", r.description());
        }

        @Test
        @DisplayName("\"next 2 years\" → 24 months")
        void nextTwoYears() {
            TimeframeResult r = TimeframeClassifier.classify("career over the next 2 years");
            assertEquals(TimeframeType.YEARS, r.type());
            assertEquals(24.0, r.horizonMonths());
        }

        @Test
        @DisplayName("\"next 2-3 years\" → first number wins")
        void yearRange() {
            assertEquals(24.0, TimeframeClassifier.classify("the next 2-3 years").horizonMonths());
        }

        @Test
        @DisplayName("\"next 10 days\" → 0.3 months")
        void nextTenDays() {
            TimeframeResult r = TimeframeClassifier.classify("next 10 days");
            assertEquals(TimeframeType.DAYS, r.type());
            assertEquals(0.3, r.horizonMonths());
        }

        @Test
        @DisplayName("\"next 3 weeks\" → 0.7 months, not the default")
        void nextThreeWeeks() {
            TimeframeResult r = TimeframeClassifier.classify("What happens in the next 3 weeks?");
            assertEquals(TimeframeType.WEEKS, r.type());
            assertEquals(3, r.value());
            assertEquals(0.7, r.horizonMonths());
            assertEquals("Next 3 weeks", r.description());
        }

        @Test
        @DisplayName("zero is not a horizon → default")
        void zero_default() {
            assertTrue(TimeframeClassifier.classify("next 0 months").isDefault());
        }
    }

    @Nested
    @DisplayName("fixed phrases")
    class Fixed {

        @Test
        @DisplayName("\"this week\" → a quarter month")
        void thisWeek() {
            assertEquals(0.25, TimeframeClassifier.classify("How is this week?").horizonMonths());
        }

        @Test
        @DisplayName("week phrase wins over a later year phrase")
        void firstRuleWins() {
            TimeframeResult r = TimeframeClassifier.classify("this week, and then next year");
            assertEquals(TimeframeType.WEEKS, r.type());
        }

        @Test
        @DisplayName("\"long term\" → 60 months")
        void longTerm() {
            assertEquals(60.0, TimeframeClassifier.classify("long term prospects").horizonMonths());
        }

        @Test
        @DisplayName("'now' inside 'know' does not match")
        void wordBoundaries() {
            assertTrue(TimeframeClassifier.classify("I want to know about my career").isDefault());
        }
    }

    @Nested
    @DisplayName("default")
    class Default {

        @Test
        @DisplayName("no temporal phrase → 12 months")
        void noPhrase() {
            TimeframeResult r = TimeframeClassifier.classify("Will I find a good job?");
            assertEquals(TimeframeType.DEFAULT, r.type());
            assertEquals(12.0, r.horizonMonths());
            assertEquals("Next 12 months (default)", r.description());
        }

        @Test
        @DisplayName("null / blank → 12 months")
        void nullOrBlank() {
            assertEquals(12.0, TimeframeClassifier.classify(null).horizonMonths());
            assertEquals(12.0, TimeframeClassifier.classify("   ").horizonMonths());
        }

        @Test
        @DisplayName("filterDate() = now + horizon × 30 days")
        void filterDate() {
            Instant now = Instant.parse("2024-01-01T00:00:00Z");
            TimeframeResult r = TimeframeClassifier.classify("next 3 months");
            assertEquals(now.plus(90, ChronoUnit.DAYS), r.filterDate(now));
        }

        @Test
        @DisplayName("negative horizon rejected")
        void negativeHorizon() {
            assertThrows(IllegalArgumentException.class,
                () -> new TimeframeResult(TimeframeType.MONTHS, 1, -1, "bad"));
        }
    }
}
