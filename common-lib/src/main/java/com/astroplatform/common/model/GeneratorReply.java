package com.astroplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured reply returned by a text generator.
 *
 * @param provider label of the generator that produced the reply ("primary", "secondary",
 *                 "fallback"); not part of the generator contract, filled by the chain
 */
public record GeneratorReply(
    @JsonProperty("rawText")  String       rawText,
    @JsonProperty("summary")  String       summary,
    @JsonProperty("reasons")  List<String> reasons,
    @JsonProperty("remedies") List<String> remedies,
    @JsonProperty("provider") String       provider
) {
    public GeneratorReply {
        reasons  = reasons  == null ? List.of() : List.copyOf(reasons);
        remedies = remedies == null ? List.of() : List.copyOf(remedies);
    }

    public GeneratorReply(String rawText, String summary, List<String> reasons, List<String> remedies) {
        this(rawText, summary, reasons, remedies, null);
    }

    public GeneratorReply withProvider(String provider) {
        return new GeneratorReply(rawText, summary, reasons, remedies, provider);
    }
}
