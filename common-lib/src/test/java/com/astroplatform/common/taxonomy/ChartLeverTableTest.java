package com.astroplatform.common.taxonomy;

import com.astroplatform.common.model.Mode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class ChartLeverTableTest {

    @Nested
    @DisplayName("forTopic()")
    class ForTopic {

        @ParameterizedTest(name = "{0} → non-empty houses and planets")
        @EnumSource(Topic.class)
        void everyTopicHasLevers(Topic topic) {
            ChartLevers levers = ChartLeverTable.forTopic(topic);
            assertFalse(levers.houses().isEmpty(), "houses for " + topic);
            assertFalse(levers.planets().isEmpty(), "planets for " + topic);
            assertTrue(levers.houses().stream().allMatch(h -> h >= 1 && h <= 12));
        }

        @Test
        @DisplayName("null topic → general levers")
        void nullTopic_returnsGeneral() {
            assertEquals(ChartLeverTable.forTopic(Topic.GENERAL), ChartLeverTable.forTopic(null));
        }

        @Test
        @DisplayName("career levers lead with the 10th lord")
        void careerLevers() {
            ChartLevers career = ChartLeverTable.forTopic(Topic.CAREER);
            assertTrue(career.coversHouse(10));
            assertEquals("10th Lord", career.planets().get(0));
            assertTrue(career.divisionalCharts().contains("D10"));
        }
    }

    @Nested
    @DisplayName("forTopicId()")
    class ForTopicId {

        @Test
        @DisplayName("known wire id → that topic's levers")
        void knownId() {
            assertEquals(ChartLeverTable.forTopic(Topic.MONEY), ChartLeverTable.forTopicId("money"));
        }

        @Test
        @DisplayName("unknown wire id → general levers")
        void unknownId_returnsGeneral() {
            assertEquals(ChartLeverTable.forTopic(Topic.GENERAL), ChartLeverTable.forTopicId("astrophysics"));
            assertEquals(ChartLeverTable.forTopic(Topic.GENERAL), ChartLeverTable.forTopicId(null));
        }
    }

    @Nested
    @DisplayName("suggestedTopics()")
    class SuggestedTopics {

        @Test
        @DisplayName("no suggestions while birth details are missing")
        void needsBirthDetails_empty() {
            assertTrue(ChartLeverTable.suggestedTopics(Mode.NEEDS_BIRTH_DETAILS).isEmpty());
        }

        @Test
        @DisplayName("normal reading offers career first")
        void normalReading() {
            assertEquals(Topic.CAREER, ChartLeverTable.suggestedTopics(Mode.NORMAL_READING).get(0));
        }
    }
}
