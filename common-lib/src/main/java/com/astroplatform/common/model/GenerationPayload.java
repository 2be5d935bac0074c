package com.astroplatform.common.model;

import com.astroplatform.common.features.AstroFeatures;
import com.astroplatform.common.taxonomy.Topic;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Everything a text generator receives for one turn. The feature bundle is the only
 * astrological context the generator may use.
 */
public record GenerationPayload(
    @JsonProperty("mode")          Mode          mode,
    @JsonProperty("topic")         Topic         topic,
    @JsonProperty("userQuestion")  String        userQuestion,
    @JsonProperty("astroFeatures") AstroFeatures astroFeatures
) {}
