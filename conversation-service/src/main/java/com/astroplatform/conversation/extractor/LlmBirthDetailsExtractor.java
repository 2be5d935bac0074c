package com.astroplatform.conversation.extractor;

import com.astroplatform.common.extractor.BirthDetailsCandidate;
import com.astroplatform.common.model.BirthDetails;
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
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Secondary birth-details extractor backed by an OpenAI-compatible chat completions API.
 *
 * <p>Only consulted when the rule-based extractor could not produce accepted details.
 * Any failure (no key, timeout, HTTP error, malformed JSON, missing field) completes
 * empty; a miss here is never an error.
 */
@Component
public class LlmBirthDetailsExtractor {

    private static final Logger log = LoggerFactory.getLogger(LlmBirthDetailsExtractor.class);

    static final String SYSTEM_PROMPT = """
        Extract birth details ONLY. Return STRICT JSON with exactly these keys:
        {"dob": "YYYY-MM-DD", "tob": "HH:MM" (24-hour), "location": "city", "timezone": <UTC offset hours>}
        Use null for any value that is not stated. No prose, no markdown.""";

    private final WebClient    client;
    private final ObjectMapper objectMapper;

    @Value("${extractor.llm.api-key:}")
    private String apiKey;

    @Value("${extractor.llm.model:gpt-4-turbo}")
    private String model;

    @Value("${extractor.llm.timeout:3000ms}")
    private Duration timeout;

    public LlmBirthDetailsExtractor(@Qualifier("extractorClient") WebClient client,
                                    ObjectMapper objectMapper) {
        this.client       = client;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * @return a complete candidate, or empty when the model found nothing usable
     */
    public Mono<BirthDetailsCandidate> extract(String text) {
        if (!isEnabled()) {
            log.warn("[BirthExtractor] No extractor API key configured, skipping LLM extraction");
            return Mono.empty();
        }
        if (text == null || text.isBlank()) {
            return Mono.empty();
        }

        Map<String, Object> requestBody = Map.of(
            "model", model,
            "temperature", 0,
            "max_tokens", 120,
            "messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", text))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                client.post()
                    .uri("/v1/chat/completions")
                    .header("Authorization", "Bearer " + apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout))
            .flatMap(response -> Mono.justOrEmpty(parse(response)))
            .doOnNext(c -> log.info("[BirthExtractor] LLM extraction succeeded date={} time={} location={}",
                                    c.date(), c.time(), c.location()))
            .onErrorResume(e -> {
                log.warn("[BirthExtractor] LLM extraction failed reason={}", e.getMessage());
                return Mono.empty();
            });
    }

    /** Reads the completion content as the strict JSON object the prompt asks for. */
    BirthDetailsCandidate parse(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            String content = root.path("choices").path(0).path("message").path("content").asText("")
                .replace("```json", "")
                .replace("```", "")
                .trim();
            JsonNode json = objectMapper.readTree(content);

            String dob      = text(json, "dob");
            String tob      = text(json, "tob");
            String location = text(json, "location");
            if (dob == null || tob == null || location == null || !tob.matches("\\d{1,2}:\\d{2}")) {
                log.info("[BirthExtractor] LLM result incomplete, discarding");
                return null;
            }
            String[] hm = tob.split(":");
            int hour = Integer.parseInt(hm[0]);
            int minute = Integer.parseInt(hm[1]);
            if (hour > 23 || minute > 59) {
                return null;
            }
            double timezone = json.hasNonNull("timezone")
                ? json.path("timezone").asDouble(BirthDetails.DEFAULT_TIMEZONE)
                : BirthDetails.DEFAULT_TIMEZONE;

            return new BirthDetailsCandidate(LocalDate.parse(dob), String.format("%02d:%02d", hour, minute),
                location.trim(), timezone, 1.0, BirthDetailsCandidate.Source.LLM);
        } catch (Exception e) {
            log.warn("[BirthExtractor] Unparseable LLM response reason={}", e.getMessage());
            return null;
        }
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.path(field);
        if (node.isMissingNode() || node.isNull()) return null;
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
