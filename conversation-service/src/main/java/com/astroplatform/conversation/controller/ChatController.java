package com.astroplatform.conversation.controller;

import com.astroplatform.conversation.dto.ChatRequest;
import com.astroplatform.conversation.dto.ChatResponse;
import com.astroplatform.conversation.generator.GeneratorMetrics;
import com.astroplatform.conversation.service.ChatOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/chat")
public class ChatController {

    private final ChatOrchestrator chatOrchestrator;
    private final GeneratorMetrics generatorMetrics;

    public ChatController(ChatOrchestrator chatOrchestrator, GeneratorMetrics generatorMetrics) {
        this.chatOrchestrator = chatOrchestrator;
        this.generatorMetrics = generatorMetrics;
    }

    @PostMapping
    public Mono<ResponseEntity<ChatResponse>> chat(@RequestBody ChatRequest request) {
        return chatOrchestrator.handleTurn(request)
            .map(ResponseEntity::ok)
            .onErrorResume(IllegalArgumentException.class,
                e -> Mono.just(ResponseEntity.badRequest().build()));
    }

    @GetMapping("/generator-metrics")
    public ResponseEntity<Map<String, GeneratorMetrics.ProviderStats>> generatorMetrics() {
        return ResponseEntity.ok(generatorMetrics.snapshot());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
