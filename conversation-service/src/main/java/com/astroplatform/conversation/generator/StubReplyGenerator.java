package com.astroplatform.conversation.generator;

import com.astroplatform.common.features.AstroFeatures;
import com.astroplatform.common.model.GenerationPayload;
import com.astroplatform.common.model.GeneratorReply;
import com.astroplatform.common.model.Mode;
import com.astroplatform.common.taxonomy.Topic;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Last stage of the chain. Templated from the payload alone; never fails and never
 * waits, so the chain always has an answer. Only placements present in the feature
 * bundle are mentioned; with no chart at all the reply says so.
 */
@Component
public class StubReplyGenerator implements ReplyGenerator {

    public static final String BIRTH_SUMMARY =
        "To give you accurate astrological guidance, I need your birth details: date, time, and place of birth.";

    public static final String CHART_UNAVAILABLE_SUMMARY =
        "Your chart data is temporarily unavailable, so I can't give a personal reading right now. "
            + "Please ask again in a few minutes.";

    static final String CHART_UNAVAILABLE_REASON =
        "Chart service unreachable -> No placements to read -> Reading deferred";

    @Override
    public String name() {
        return "fallback";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public Duration timeout() {
        return Duration.ofSeconds(1);
    }

    @Override
    public Mono<GeneratorReply> generate(GenerationPayload payload) {
        return Mono.just(reply(payload));
    }

    GeneratorReply reply(GenerationPayload payload) {
        if (payload.mode() == Mode.NEEDS_BIRTH_DETAILS) {
            return new GeneratorReply(
                "I need your birth details to provide personalized insights.",
                BIRTH_SUMMARY,
                List.of(
                    "Ascendant calculated from birth time -> Foundation of your chart",
                    "Planetary positions from birth date -> Shape your life themes"),
                List.of());
        }

        AstroFeatures f = payload.astroFeatures() != null ? payload.astroFeatures() : AstroFeatures.empty();
        if (f.isEmpty()) {
            return new GeneratorReply(
                "Chart data unavailable; no reading generated.",
                CHART_UNAVAILABLE_SUMMARY,
                List.of(CHART_UNAVAILABLE_REASON),
                List.of());
        }

        String topic = (payload.topic() != null ? payload.topic() : Topic.GENERAL).wireId().replace('_', ' ');
        List<String> placements = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        if (f.ascendant() != null) {
            String ascendant = f.ascendant().displayName();
            placements.add(ascendant + " Ascendant");
            reasons.add("%s Ascendant -> Your natural approach -> Shapes how you handle %s".formatted(ascendant, topic));
        }
        if (f.moonSign() != null) {
            String moonSign = f.moonSign().displayName();
            placements.add(moonSign + " Moon");
            reasons.add("%s Moon -> Emotional foundation -> Influences your %s decisions".formatted(moonSign, topic));
        }
        String influence = " is shaped by your current chart placements.";
        if (f.mahadasha() != null) {
            String mahadasha = f.mahadasha().planet().displayName();
            influence = " is influenced by %s Mahadasha.".formatted(mahadasha);
            reasons.add("%s Mahadasha -> Current life phase -> Brings focus to certain areas".formatted(mahadasha));
        }
        if (reasons.isEmpty()) {
            reasons.add("Current transits -> Active houses -> Shape your %s themes".formatted(topic));
        }
        String lead = placements.isEmpty() ? "In your chart" : "With " + String.join(" and ", placements);
        String summary = lead + ", your " + topic + " area" + influence;

        String raw = "SUMMARY:\n" + summary + "\n\nREASONS:\n- " + String.join("\n- ", reasons);
        return new GeneratorReply(raw, summary, List.copyOf(reasons), List.of());
    }
}
