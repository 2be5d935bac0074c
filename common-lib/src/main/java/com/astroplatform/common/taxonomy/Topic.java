package com.astroplatform.common.taxonomy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Closed topic taxonomy for chat readings.
 *
 * <p>Declaration order is significant: keyword scoring breaks ties in favour of the
 * topic declared first. {@link #GENERAL} is the default and carries no keywords.
 */
public enum Topic {
    CAREER("career"),
    ROMANTIC_RELATIONSHIPS("romantic_relationships"),
    MARRIAGE_PARTNERSHIP("marriage_partnership"),
    MONEY("money"),
    FAMILY_HOME("family_home"),
    FRIENDS_SOCIAL("friends_social"),
    LEARNING_EDUCATION("learning_education"),
    HEALTH_ENERGY("health_energy"),
    SPIRITUALITY("spirituality"),
    TRAVEL_RELOCATION("travel_relocation"),
    LEGAL_CONTRACTS("legal_contracts"),
    SELF_PSYCHOLOGY("self_psychology"),
    DAILY_GUIDANCE("daily_guidance"),
    GENERAL("general");

    private final String wireId;

    Topic(String wireId) {
        this.wireId = wireId;
    }

    @JsonValue
    public String wireId() {
        return wireId;
    }

    public static Optional<Topic> fromWireId(String id) {
        if (id == null) return Optional.empty();
        for (Topic t : values()) {
            if (t.wireId.equalsIgnoreCase(id.trim())) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /** Lenient JSON binding: unknown ids map to {@link #GENERAL}. */
    @JsonCreator
    public static Topic fromJson(String id) {
        return fromWireId(id).orElse(GENERAL);
    }
}
