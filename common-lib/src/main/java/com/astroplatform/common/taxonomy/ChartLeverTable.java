package com.astroplatform.common.taxonomy;

import com.astroplatform.common.model.Mode;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static topic to {@link ChartLevers} table.
 *
 * <p>Every {@link Topic} has exactly one entry. Lookups never fail: a null or unknown
 * topic resolves to the {@link Topic#GENERAL} levers.
 *
 * <p>No Spring dependency. No I/O.
 */
public final class ChartLeverTable {

    private static final Map<Topic, ChartLevers> LEVERS = new EnumMap<>(Topic.class);

    static {
        LEVERS.put(Topic.SELF_PSYCHOLOGY, levers(
            List.of(1, 4, 5, 12),
            List.of("Lagna Lord", "Moon", "Rahu", "Ketu"),
            List.of("D1"),
            List.of("ascendant_strength", "moon_stability", "atmakaraka")));
        LEVERS.put(Topic.CAREER, levers(
            List.of(2, 6, 10, 11),
            List.of("10th Lord", "Sun", "Saturn", "Rahu", "Mercury"),
            List.of("D1", "D10"),
            List.of("10th_house_strength", "saturn_position", "career_yogas")));
        LEVERS.put(Topic.MONEY, levers(
            List.of(2, 11, 8, 5),
            List.of("Jupiter", "Venus", "2nd Lord", "11th Lord"),
            List.of("D1"),
            List.of("dhana_yogas", "2nd_11th_connection", "jupiter_strength")));
        LEVERS.put(Topic.ROMANTIC_RELATIONSHIPS, levers(
            List.of(5, 7, 8),
            List.of("Venus", "Moon", "Mars", "5th Lord"),
            List.of("D1", "D9"),
            List.of("venus_strength", "5th_house_romance", "emotional_compatibility")));
        LEVERS.put(Topic.MARRIAGE_PARTNERSHIP, levers(
            List.of(7, 8, 2, 4),
            List.of("7th Lord", "Venus", "Jupiter", "Mars"),
            List.of("D1", "D9"),
            List.of("7th_house_strength", "navamsa_7th", "manglik_dosha")));
        LEVERS.put(Topic.FAMILY_HOME, levers(
            List.of(2, 4, 8),
            List.of("Moon", "4th Lord", "Venus"),
            List.of("D1", "D4"),
            List.of("4th_house_strength", "moon_position", "ancestral_karma")));
        LEVERS.put(Topic.FRIENDS_SOCIAL, levers(
            List.of(3, 11),
            List.of("Mercury", "11th Lord", "3rd Lord"),
            List.of("D1"),
            List.of("11th_house_gains", "social_yogas")));
        LEVERS.put(Topic.LEARNING_EDUCATION, levers(
            List.of(3, 4, 5, 9),
            List.of("Mercury", "Jupiter", "5th Lord", "9th Lord"),
            List.of("D1", "D24"),
            List.of("mercury_strength", "5th_9th_axis", "vidya_yogas")));
        LEVERS.put(Topic.HEALTH_ENERGY, levers(
            List.of(1, 6, 8, 12),
            List.of("Lagna Lord", "Sun", "Mars", "Saturn"),
            List.of("D1"),
            List.of("ascendant_vitality", "6th_house_diseases", "sun_strength")));
        LEVERS.put(Topic.SPIRITUALITY, levers(
            List.of(5, 9, 12),
            List.of("Jupiter", "Ketu", "9th Lord", "12th Lord"),
            List.of("D1", "D20"),
            List.of("moksha_houses", "jupiter_ketu_connection", "dharma_trikona")));
        LEVERS.put(Topic.TRAVEL_RELOCATION, levers(
            List.of(3, 4, 9, 12),
            List.of("Rahu", "9th Lord", "12th Lord", "4th Lord"),
            List.of("D1"),
            List.of("foreign_settlement_yoga", "4th_12th_connection", "rahu_position")));
        LEVERS.put(Topic.LEGAL_CONTRACTS, levers(
            List.of(6, 7, 9),
            List.of("Mars", "Saturn", "6th Lord", "7th Lord"),
            List.of("D1"),
            List.of("6th_house_disputes", "mars_saturn_aspect", "legal_yogas")));
        LEVERS.put(Topic.DAILY_GUIDANCE, levers(
            List.of(1, 5, 9),
            List.of("Moon", "Lagna Lord", "Transit planets"),
            List.of("D1"),
            List.of("current_transits", "moon_transit", "dasha_timing")));
        LEVERS.put(Topic.GENERAL, levers(
            List.of(1, 5, 9, 10),
            List.of("Lagna Lord", "Moon", "Sun", "Jupiter"),
            List.of("D1"),
            List.of("dharma_trikona", "overall_strength")));
    }

    private ChartLeverTable() {}

    /**
     * @return levers for {@code topic}; the {@link Topic#GENERAL} levers when topic is null
     */
    public static ChartLevers forTopic(Topic topic) {
        if (topic == null) {
            return LEVERS.get(Topic.GENERAL);
        }
        return LEVERS.getOrDefault(topic, LEVERS.get(Topic.GENERAL));
    }

    /**
     * Wire-id lookup ("career", "money").
     *
     * @return levers for the topic, or the {@link Topic#GENERAL} levers for an unknown id
     */
    public static ChartLevers forTopicId(String topicId) {
        return forTopic(Topic.fromWireId(topicId).orElse(Topic.GENERAL));
    }

    /**
     * Topics worth offering as next steps in the given mode. Empty while birth details
     * are still being collected.
     */
    public static List<Topic> suggestedTopics(Mode mode) {
        if (mode == Mode.NEEDS_BIRTH_DETAILS) {
            return List.of();
        }
        return List.of(Topic.CAREER, Topic.ROMANTIC_RELATIONSHIPS, Topic.MONEY, Topic.DAILY_GUIDANCE);
    }

    private static ChartLevers levers(List<Integer> houses, List<String> planets,
                                      List<String> charts, List<String> factors) {
        return new ChartLevers(houses, planets, charts, factors);
    }
}
