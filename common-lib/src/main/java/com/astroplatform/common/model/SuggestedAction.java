package com.astroplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A follow-up chip offered to the user. The {@code id} comes back as the action id of the
 * next chat turn.
 */
public record SuggestedAction(
    @JsonProperty("id")    String id,
    @JsonProperty("label") String label
) {
    public static SuggestedAction of(String id, String label) {
        return new SuggestedAction(id, label);
    }
}
