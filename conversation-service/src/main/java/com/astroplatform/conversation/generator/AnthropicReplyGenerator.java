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
 * Primary generator: Anthropic Messages API.
 *
 * <p>Non-blocking; the HTTP call is composed into the caller's {@code Mono} chain.
 * Failures surface as errors for {@link GeneratorChain} to absorb.
 */
@Component
public class AnthropicReplyGenerator implements ReplyGenerator {

    private static final Logger log = LoggerFactory.getLogger(AnthropicReplyGenerator.class);

    private final WebClient    client;
    private final ObjectMapper objectMapper;

    @Value("${generator.primary.api-key:}")
    private String apiKey;

    @Value("${generator.primary.model:claude-3-5-haiku-20241022}")
    private String model;

    @Value("${generator.primary.max-tokens:800}")
    private int maxTokens;

    @Value("${generator.primary.timeout:4000ms}")
    private Duration timeout;

    public AnthropicReplyGenerator(@Qualifier("primaryGeneratorClient") WebClient client,
                                   ObjectMapper objectMapper) {
        this.client       = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "primary";
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
        return Mono.fromCallable(() -> ReadingPromptBuilder.userPrompt(payload))
            .flatMap(this::callMessagesApi)
            .map(ReplyParser::parse)
            .doOnNext(r -> log.info("[Generator] primary reply parsed model={} reasons={} remedies={}",
                                    model, r.reasons().size(), r.remedies().size()));
    }

    private Mono<String> callMessagesApi(String prompt) {
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "system", ReadingPromptBuilder.SYSTEM_PROMPT,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                client.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class))
            .map(response -> {
                try {
                    JsonNode root = objectMapper.readTree(response);
                    return root.path("content").get(0).path("text").asText();
                } catch (Exception e) {
                    throw new PipelineException("Generator", "Failed to extract text from Anthropic response", e);
                }
            });
    }
}
