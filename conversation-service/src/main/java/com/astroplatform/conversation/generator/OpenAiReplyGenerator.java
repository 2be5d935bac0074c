package com.astroplatform.conversation.generator;

import com.astroplatform.common.exception.PipelineException;
import com.astroplatform.common.model.GenerationPayload;
import com.astroplatform.common.model.GeneratorReply;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Secondary generator: OpenAI-compatible chat completions.
 */
@Component
public class OpenAiReplyGenerator implements ReplyGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiReplyGenerator.class);

    private final WebClient    client;
    private final ObjectMapper objectMapper;

    @Value("${generator.secondary.api-key:}")
    private String apiKey;

    @Value("${generator.secondary.model:gpt-4o-mini}")
    private String model;

    @Value("${generator.secondary.max-tokens:800}")
    private int maxTokens;

    @Value("${generator.secondary.timeout:4000ms}")
    private Duration timeout;

    public OpenAiReplyGenerator(@Qualifier("secondaryGeneratorClient") WebClient client,
                                ObjectMapper objectMapper) {
        this.client       = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "secondary";
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public Mono<GeneratorReply> generate(GenerationPayload payload) {
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "temperature", 0.7,
            "max_tokens", maxTokens,
            "messages", List.of(
                Map.of("role", "system", "content", ReadingPromptBuilder.SYSTEM_PROMPT),
                Map.of("role", "user", "content", ReadingPromptBuilder.userPrompt(payload)))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                client.post()
                    .uri("/v1/chat/completions")
                    .header("Authorization", "Bearer " + apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class))
            .map(response -> {
                try {
                    JsonNode root = objectMapper.readTree(response);
                    return root.path("choices").get(0).path("message").path("content").asText();
                } catch (Exception e) {
                    throw new PipelineException("Generator", "Failed to extract text from completion response", e);
                }
            })
            .map(ReplyParser::parse)
            .doOnNext(r -> log.info("[Generator] secondary reply parsed model={} reasons={} remedies={}",
                                    model, r.reasons().size(), r.remedies().size()));
    }
}
