package com.astroplatform.common.router;

import com.astroplatform.common.model.BirthDetails;
import com.astroplatform.common.model.ConversationState;
import com.astroplatform.common.model.FocusArea;
import com.astroplatform.common.model.Mode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Two-state conversation router.
 *
 * <p>Rules (evaluated in priority order):
 * <ol>
 *   <li>birth details absent or incomplete → {@link Mode#NEEDS_BIRTH_DETAILS}, whatever
 *       the message or action id says</li>
 *   <li>otherwise {@link Mode#NORMAL_READING}, with a focus resolved from
 *       <ol type="a">
 *         <li>the action id table ({@code deep_dive} keeps the current focus)</li>
 *         <li>whole-word keyword counts, ties to the focus declared first</li>
 *         <li>the focus carried on the session</li>
 *         <li>none</li>
 *       </ol></li>
 * </ol>
 *
 * <p>Pure with respect to (state, message, action id): identical inputs always yield an
 * identical {@link RoutingDecision}. No Spring dependency. No I/O.
 */
public final class ModeRouter {

    private static final Map<FocusArea, Set<String>> FOCUS_KEYWORDS = new EnumMap<>(FocusArea.class);

    static {
        FOCUS_KEYWORDS.put(FocusArea.CAREER, Set.of(
            "job", "career", "work", "promotion", "salary", "business", "profession",
            "employment", "boss", "colleague", "office", "interview", "resign", "fired",
            "hired", "income", "earning"));
        FOCUS_KEYWORDS.put(FocusArea.RELATIONSHIP, Set.of(
            "relationship", "love", "partner", "marriage", "spouse", "husband", "wife",
            "boyfriend", "girlfriend", "dating", "romance", "divorce", "breakup",
            "engagement", "wedding", "family", "children", "kids"));
        FOCUS_KEYWORDS.put(FocusArea.HEALTH, Set.of(
            "health", "illness", "disease", "doctor", "hospital", "medicine", "surgery",
            "fitness", "wellness", "mental", "stress", "anxiety", "depression", "sleep",
            "diet", "exercise", "energy", "tired"));
        FOCUS_KEYWORDS.put(FocusArea.FINANCE, Set.of(
            "money", "finance", "investment", "property", "wealth", "debt", "loan",
            "savings", "stock", "trading", "inheritance"));
        FOCUS_KEYWORDS.put(FocusArea.SPIRITUALITY, Set.of(
            "spiritual", "meditation", "moksha", "karma", "dharma", "purpose", "meaning",
            "enlightenment", "guru", "temple", "prayer", "mantra"));
    }

    private static final Map<String, FocusArea> ACTION_TO_FOCUS;

    static {
        Map<String, FocusArea> m = new HashMap<>();
        m.put("focus_career",       FocusArea.CAREER);
        m.put("focus_relationship", FocusArea.RELATIONSHIP);
        m.put("focus_health",       FocusArea.HEALTH);
        m.put("focus_finance",      FocusArea.FINANCE);
        m.put("focus_money",        FocusArea.FINANCE);
        m.put("focus_spirituality", FocusArea.SPIRITUALITY);
        m.put("ask_career",         FocusArea.CAREER);
        m.put("ask_relationship",   FocusArea.RELATIONSHIP);
        ACTION_TO_FOCUS = Collections.unmodifiableMap(m);
    }

    private static final String DEEP_DIVE = "deep_dive";

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b");

    private ModeRouter() {}

    /**
     * @param state    session snapshot; must not be null
     * @param message  raw user message; null is treated as empty
     * @param actionId nullable UI action id
     * @return routing outcome; never null
     */
    public static RoutingDecision route(ConversationState state, String message, String actionId) {
        // ── gate: birth details ───────────────────────────────────────────
        if (!BirthDetails.isComplete(state.birthDetails())) {
            return new RoutingDecision(Mode.NEEDS_BIRTH_DETAILS, state.focus(), false);
        }

        boolean firstReading = !state.hasDoneRetrospective();

        // ── explicit action ───────────────────────────────────────────────
        if (actionId != null) {
            FocusArea mapped = ACTION_TO_FOCUS.get(actionId);
            if (mapped != null) {
                return new RoutingDecision(Mode.NORMAL_READING, mapped, firstReading);
            }
            if (DEEP_DIVE.equals(actionId) && state.focus() != null) {
                return new RoutingDecision(Mode.NORMAL_READING, state.focus(), firstReading);
            }
        }

        // ── keywords, then carried focus ──────────────────────────────────
        FocusArea inferred = inferFocus(message);
        FocusArea focus = inferred != null ? inferred : state.focus();
        return new RoutingDecision(Mode.NORMAL_READING, focus, firstReading);
    }

    /**
     * Focus with the most whole-word keyword hits, or null when nothing matches.
     */
    public static FocusArea inferFocus(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        Set<String> words = new HashSet<>();
        Matcher m = WORD.matcher(message.toLowerCase());
        while (m.find()) {
            words.add(m.group());
        }

        FocusArea best = null;
        int bestCount = 0;
        for (FocusArea focus : FocusArea.values()) {
            int count = 0;
            for (String keyword : FOCUS_KEYWORDS.get(focus)) {
                if (words.contains(keyword)) count++;
            }
            if (count > bestCount) {
                bestCount = count;
                best = focus;
            }
        }
        return best;
    }
}
