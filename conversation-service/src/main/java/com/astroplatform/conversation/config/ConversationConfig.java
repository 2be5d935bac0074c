package com.astroplatform.conversation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class ConversationConfig {

    @Value("${generator.primary.base-url:https://api.anthropic.com}")
    private String primaryGeneratorUrl;

    @Value("${generator.secondary.base-url:https://api.openai.com}")
    private String secondaryGeneratorUrl;

    @Value("${extractor.llm.base-url:https://api.openai.com}")
    private String extractorUrl;

    @Bean
    public WebClient primaryGeneratorClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(primaryGeneratorUrl)
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Bean
    public WebClient secondaryGeneratorClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(secondaryGeneratorUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Bean
    public WebClient extractorClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(extractorUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
