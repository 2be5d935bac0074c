package com.astroplatform.conversation.generator;

import com.astroplatform.common.features.AstroFeatures;
import com.astroplatform.common.features.DashaSummary;
import com.astroplatform.common.features.FocusFactor;
import com.astroplatform.common.features.HouseFactor;
import com.astroplatform.common.features.KeyRule;
import com.astroplatform.common.features.PlanetFactor;
import com.astroplatform.common.features.TransitSummary;
import com.astroplatform.common.model.GenerationPayload;
import com.astroplatform.common.taxonomy.Topic;

/**
 * Renders a {@link GenerationPayload} into the system and user prompts sent to an LLM.
 *
 * <p>Only a slice of the feature bundle is rendered: up to {@value #MAX_FACTORS} focus
 * factors, {@value #MAX_RULES} key rules and {@value #MAX_TRANSITS} transits.
 * No Spring dependency. No I/O. Pure function.
 */
public final class ReadingPromptBuilder {

    static final int MAX_FACTORS  = 8;
    static final int MAX_RULES    = 5;
    static final int MAX_TRANSITS = 5;

    public static final String SYSTEM_PROMPT = """
        You are a concise, insightful Vedic astrologer.

        Your purpose:
        1. Answer ONLY the user's question directly and concisely
        2. Use ONLY the astro data provided as your astrological source
        3. If data is missing or inconclusive, state uncertainty instead of guessing
        4. Never generate full reports unless explicitly asked
        5. Use the topic to scope your answer

        MANDATORY RESPONSE STRUCTURE:

        SUMMARY:
        [2-3 concise lines directly answering the user's question]

        REASONS:
        - [Chart factor] -> [Effect] -> [Interpretation]
        (2-4 bullets maximum, using ONLY the provided astro data)

        REMEDIES:
        (Only include if the chart shows a clear challenge)
        - [Simple remedy]

        RULES:
        - Use possibility language: "This phase tends to...", "You may experience..."
        - Never claim certainty
        - Stay warm, grounded and conversational""";

    private ReadingPromptBuilder() {}

    public static String userPrompt(GenerationPayload payload) {
        AstroFeatures f = payload.astroFeatures() != null ? payload.astroFeatures() : AstroFeatures.empty();
        Topic topic = payload.topic() != null ? payload.topic() : Topic.GENERAL;

        StringBuilder factors = new StringBuilder();
        f.focusFactors().stream().limit(MAX_FACTORS).forEach(factor -> factors.append(factorLine(factor)));

        StringBuilder rules = new StringBuilder();
        f.keyRules().stream().limit(MAX_RULES).forEach(rule -> rules.append(ruleLine(rule)));

        StringBuilder transits = new StringBuilder();
        f.transits().stream().limit(MAX_TRANSITS).forEach(t -> transits.append(transitLine(t)));

        String timeframe = f.timeframe() != null ? f.timeframe().description() : "Next 12 months (default)";

        return """
            CONTEXT:
            Mode: %s
            Topic: %s
            Timeframe: %s

            USER QUESTION:
            %s

            ASTRO DATA:

            Core Chart:
            - Ascendant: %s
            - Moon Sign: %s
            - Sun Sign: %s

            Current Dasha:
            - Mahadasha: %s
            - Antardasha: %s

            Topic-Specific Factors:%s

            Key Rules:%s

            Recent Transits:%s

            INSTRUCTIONS:
            - Answer ONLY the user question above
            - Use ONLY the astro data provided
            - Follow the 3-part structure: SUMMARY, REASONS, REMEDIES
            - Be concise and direct
            """.formatted(
                payload.mode(), topic.wireId(), timeframe,
                payload.userQuestion() != null ? payload.userQuestion() : "",
                orNa(f.ascendant() != null ? f.ascendant().displayName() : null),
                orNa(f.moonSign() != null ? f.moonSign().displayName() : null),
                orNa(f.sunSign() != null ? f.sunSign().displayName() : null),
                dasha(f.mahadasha()), dasha(f.antardasha()),
                factors, rules, transits);
    }

    private static String factorLine(FocusFactor factor) {
        if (factor instanceof HouseFactor h) {
            return "\n- House %d: %s sign, Lord %s".formatted(
                h.house(), h.sign().displayName(), h.lord() != null ? h.lord().displayName() : "N/A");
        }
        if (factor instanceof PlanetFactor p) {
            return "\n- %s (%s): %s in house %d, %s%s".formatted(
                p.planet().displayName(), p.reference(), p.sign().displayName(), p.house(),
                p.dignity().wireId(), p.retrograde() ? ", retrograde" : "");
        }
        return "";
    }

    private static String ruleLine(KeyRule rule) {
        String window = rule.timeWindow() != null ? " [" + rule.timeWindow() + "]" : "";
        return "\n- " + rule.meaning() + window;
    }

    private static String transitLine(TransitSummary t) {
        String house = t.affectedHouse() != null ? " affecting house " + t.affectedHouse() : "";
        return "\n- %s %s%s from %s".formatted(
            t.planet().displayName(), t.eventType().wireId(), house, t.startDate());
    }

    private static String dasha(DashaSummary dasha) {
        return dasha != null ? dasha.planet().displayName() : "N/A";
    }

    private static String orNa(String value) {
        return value != null ? value : "N/A";
    }
}
