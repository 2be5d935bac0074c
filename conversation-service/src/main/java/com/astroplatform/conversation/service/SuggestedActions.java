package com.astroplatform.conversation.service;

import com.astroplatform.common.model.Mode;
import com.astroplatform.common.model.SuggestedAction;
import com.astroplatform.common.taxonomy.Topic;

import java.util.List;

/**
 * Follow-up chips returned with every reply. Ids are valid action ids for the next turn.
 *
 * <p>Selection: birth collection helpers while details are missing, the topic menu after
 * the first reading, the daily set for daily guidance, otherwise a topic-specific set.
 * No Spring dependency. No I/O. Pure function.
 */
public final class SuggestedActions {

    static final List<SuggestedAction> BIRTH_COLLECTION = List.of(
        SuggestedAction.of("help_dob",       "How to find my birth time?"),
        SuggestedAction.of("example_format", "Show example format"));

    static final List<SuggestedAction> AFTER_FIRST_READING = List.of(
        SuggestedAction.of("focus_career",       "Career insights"),
        SuggestedAction.of("focus_relationship", "Relationships"),
        SuggestedAction.of("focus_money",        "Money & finances"),
        SuggestedAction.of("focus_health",       "Health"));

    static final List<SuggestedAction> DAILY = List.of(
        SuggestedAction.of("weekly_outlook",     "This week's outlook"),
        SuggestedAction.of("focus_career",       "Career today"),
        SuggestedAction.of("focus_relationship", "Love today"),
        SuggestedAction.of("past_themes",        "Review past 2 years"));

    static final List<SuggestedAction> CAREER = List.of(
        SuggestedAction.of("ask_timing",     "Best timing for changes"),
        SuggestedAction.of("deep_dive",      "Go deeper on career"),
        SuggestedAction.of("focus_money",    "Ask about money"),
        SuggestedAction.of("daily_guidance", "Daily guidance"));

    static final List<SuggestedAction> RELATIONSHIPS = List.of(
        SuggestedAction.of("ask_timing",    "Timing for relationships"),
        SuggestedAction.of("deep_dive",     "Go deeper on love"),
        SuggestedAction.of("compatibility", "Compatibility insights"),
        SuggestedAction.of("focus_career",  "Ask about career"));

    static final List<SuggestedAction> MONEY = List.of(
        SuggestedAction.of("ask_timing",     "Best timing for investments"),
        SuggestedAction.of("deep_dive",      "Go deeper on finances"),
        SuggestedAction.of("focus_career",   "Career & income"),
        SuggestedAction.of("daily_guidance", "Daily guidance"));

    static final List<SuggestedAction> HEALTH = List.of(
        SuggestedAction.of("wellness_tips",  "Wellness recommendations"),
        SuggestedAction.of("deep_dive",      "Go deeper on health"),
        SuggestedAction.of("focus_career",   "Ask about career"),
        SuggestedAction.of("daily_guidance", "Daily guidance"));

    static final List<SuggestedAction> GENERAL = List.of(
        SuggestedAction.of("focus_career",       "Career"),
        SuggestedAction.of("focus_relationship", "Relationships"),
        SuggestedAction.of("focus_money",        "Money"),
        SuggestedAction.of("daily_guidance",     "Daily guidance"));

    private SuggestedActions() {}

    public static List<SuggestedAction> forTurn(Mode mode, Topic topic, boolean firstReading) {
        if (mode == Mode.NEEDS_BIRTH_DETAILS) {
            return BIRTH_COLLECTION;
        }
        if (firstReading) {
            return AFTER_FIRST_READING;
        }
        if (topic == null) {
            return GENERAL;
        }
        return switch (topic) {
            case DAILY_GUIDANCE                               -> DAILY;
            case CAREER                                       -> CAREER;
            case ROMANTIC_RELATIONSHIPS, MARRIAGE_PARTNERSHIP -> RELATIONSHIPS;
            case MONEY                                        -> MONEY;
            case HEALTH_ENERGY                                -> HEALTH;
            default                                           -> GENERAL;
        };
    }
}
