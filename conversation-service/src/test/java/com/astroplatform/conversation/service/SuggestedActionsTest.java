package com.astroplatform.conversation.service;

import com.astroplatform.common.model.Mode;
import com.astroplatform.common.model.SuggestedAction;
import com.astroplatform.common.taxonomy.Topic;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SuggestedActionsTest {

    @ParameterizedTest(name = "NEEDS_BIRTH_DETAILS + {0} → birth collection helpers")
    @EnumSource(Topic.class)
    void needsBirthDetails_alwaysBirthHelpers(Topic topic) {
        assertEquals(SuggestedActions.BIRTH_COLLECTION,
                     SuggestedActions.forTurn(Mode.NEEDS_BIRTH_DETAILS, topic, false));
    }

    @Test
    @DisplayName("first reading → topic menu")
    void firstReading() {
        List<SuggestedAction> actions = SuggestedActions.forTurn(Mode.NORMAL_READING, Topic.CAREER, true);

        assertEquals(List.of("focus_career", "focus_relationship", "focus_money", "focus_health"),
                     actions.stream().map(SuggestedAction::id).toList());
    }

    @Test
    @DisplayName("topic-specific sets")
    void topicSets() {
        assertEquals(SuggestedActions.CAREER, SuggestedActions.forTurn(Mode.NORMAL_READING, Topic.CAREER, false));
        assertEquals(SuggestedActions.RELATIONSHIPS,
                     SuggestedActions.forTurn(Mode.NORMAL_READING, Topic.MARRIAGE_PARTNERSHIP, false));
        assertEquals(SuggestedActions.MONEY, SuggestedActions.forTurn(Mode.NORMAL_READING, Topic.MONEY, false));
        assertEquals(SuggestedActions.HEALTH,
                     SuggestedActions.forTurn(Mode.NORMAL_READING, Topic.HEALTH_ENERGY, false));
        assertEquals(SuggestedActions.DAILY,
                     SuggestedActions.forTurn(Mode.NORMAL_READING, Topic.DAILY_GUIDANCE, false));
        assertEquals(SuggestedActions.GENERAL,
                     SuggestedActions.forTurn(Mode.NORMAL_READING, Topic.TRAVEL_RELOCATION, false));
        assertEquals(SuggestedActions.GENERAL, SuggestedActions.forTurn(Mode.NORMAL_READING, null, false));
    }

    @ParameterizedTest(name = "{0} → four chips with unique ids")
    @EnumSource(Topic.class)
    void readingSets_wellFormed(Topic topic) {
        List<SuggestedAction> actions = SuggestedActions.forTurn(Mode.NORMAL_READING, topic, false);

        assertEquals(4, actions.size());
        assertEquals(4, actions.stream().map(SuggestedAction::id).distinct().count());
    }
}
