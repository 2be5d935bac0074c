package com.astroplatform.common.classifier;

import com.astroplatform.common.taxonomy.Topic;
import com.astroplatform.common.taxonomy.TopicKeywords;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure stateless classifier that maps a chat message to a {@link Topic}.
 *
 * <p>Resolution order (each step short-circuits):
 * <ol>
 *   <li>explicit action id mapped through {@link #ACTION_TO_TOPIC};
 *       {@code deep_dive} / {@code go_deeper} keep the current topic</li>
 *   <li>keyword score: +1 per whole-word hit, +2 per whole-phrase hit, highest wins,
 *       ties go to the topic declared first in {@link Topic}</li>
 *   <li>the carried-over current topic</li>
 *   <li>{@link Topic#GENERAL}</li>
 * </ol>
 *
 * <p>No Spring dependency. No I/O. Pure function.
 */
public final class TopicClassifier {

    public static final Set<String> PRESERVING_ACTIONS = Set.of("deep_dive", "go_deeper", "ask_timing");

    private static final Map<String, Topic> ACTION_TO_TOPIC = Map.ofEntries(
        Map.entry("focus_career",       Topic.CAREER),
        Map.entry("focus_relationship", Topic.ROMANTIC_RELATIONSHIPS),
        Map.entry("focus_marriage",     Topic.MARRIAGE_PARTNERSHIP),
        Map.entry("focus_money",        Topic.MONEY),
        Map.entry("focus_finance",      Topic.MONEY),
        Map.entry("focus_health",       Topic.HEALTH_ENERGY),
        Map.entry("focus_family",       Topic.FAMILY_HOME),
        Map.entry("focus_education",    Topic.LEARNING_EDUCATION),
        Map.entry("focus_spirituality", Topic.SPIRITUALITY),
        Map.entry("focus_travel",       Topic.TRAVEL_RELOCATION),
        Map.entry("ask_career",         Topic.CAREER),
        Map.entry("ask_relationship",   Topic.ROMANTIC_RELATIONSHIPS),
        Map.entry("ask_money",          Topic.MONEY),
        Map.entry("ask_health",         Topic.HEALTH_ENERGY),
        Map.entry("daily_guidance",     Topic.DAILY_GUIDANCE),
        Map.entry("weekly_outlook",     Topic.DAILY_GUIDANCE),
        Map.entry("compatibility",      Topic.ROMANTIC_RELATIONSHIPS)
    );

    // hyphenated tokens ("self-esteem", "in-laws") stay one word
    private static final Pattern WORD = Pattern.compile("[a-z0-9]+(?:-[a-z0-9]+)*");

    // multi-word keywords, matched only between word boundaries ("renew jobs" is not "new job")
    private static final Map<String, Pattern> PHRASES = new HashMap<>();

    static {
        for (Topic topic : Topic.values()) {
            for (String keyword : TopicKeywords.forTopic(topic)) {
                if (keyword.indexOf(' ') >= 0) {
                    PHRASES.computeIfAbsent(keyword, k ->
                        Pattern.compile("(?<![a-z0-9])" + Pattern.quote(k) + "(?![a-z0-9])"));
                }
            }
        }
    }

    private TopicClassifier() {}

    /**
     * @param message      raw user message; null is treated as empty
     * @param actionId     nullable UI action id
     * @param currentTopic nullable topic carried over from the session
     * @return resolved topic; never null
     */
    public static Topic classify(String message, String actionId, Topic currentTopic) {
        // ── 1. explicit action ────────────────────────────────────────────
        if (actionId != null && !actionId.isBlank()) {
            Topic mapped = ACTION_TO_TOPIC.get(actionId);
            if (mapped != null) {
                return mapped;
            }
            if (PRESERVING_ACTIONS.contains(actionId) && currentTopic != null) {
                return currentTopic;
            }
        }

        // ── 2. keyword scoring ────────────────────────────────────────────
        Optional<Topic> scored = bestKeywordMatch(message);
        if (scored.isPresent()) {
            return scored.get();
        }

        // ── 3. session memory, 4. default ─────────────────────────────────
        return currentTopic != null ? currentTopic : Topic.GENERAL;
    }

    /** Topic mapped to an action id, when the id is in the action table. */
    public static Optional<Topic> topicForAction(String actionId) {
        return Optional.ofNullable(actionId).map(ACTION_TO_TOPIC::get);
    }

    /**
     * Keyword score of every topic with at least one hit.
     */
    public static Map<Topic, Integer> score(String message) {
        if (message == null || message.isBlank()) {
            return Collections.emptyMap();
        }
        String lower = message.toLowerCase();
        Set<String> words = words(lower);

        Map<Topic, Integer> scores = new HashMap<>();
        for (Topic topic : Topic.values()) {
            int score = 0;
            for (String keyword : TopicKeywords.forTopic(topic)) {
                if (keyword.indexOf(' ') < 0) {
                    if (words.contains(keyword)) score += 1;
                } else if (PHRASES.get(keyword).matcher(lower).find()) {
                    score += 2;
                }
            }
            if (score > 0) {
                scores.put(topic, score);
            }
        }
        return scores;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static Optional<Topic> bestKeywordMatch(String message) {
        Map<Topic, Integer> scores = score(message);
        Topic best = null;
        int bestScore = 0;
        // enum order walk: strictly greater keeps the earlier topic on ties
        for (Topic topic : Topic.values()) {
            int s = scores.getOrDefault(topic, 0);
            if (s > bestScore) {
                bestScore = s;
                best = topic;
            }
        }
        return Optional.ofNullable(best);
    }

    static Set<String> words(String lowerCased) {
        Set<String> words = new HashSet<>();
        Matcher m = WORD.matcher(lowerCased);
        while (m.find()) {
            words.add(m.group());
        }
        return words;
    }
}
