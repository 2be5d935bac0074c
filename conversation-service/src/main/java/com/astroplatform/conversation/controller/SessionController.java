package com.astroplatform.conversation.controller;

import com.astroplatform.common.model.BirthDetails;
import com.astroplatform.common.model.ConversationState;
import com.astroplatform.conversation.dto.ChartSummary;
import com.astroplatform.conversation.service.ChatOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private final ChatOrchestrator chatOrchestrator;

    public SessionController(ChatOrchestrator chatOrchestrator) {
        this.chatOrchestrator = chatOrchestrator;
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<ConversationState> get(@PathVariable String sessionId) {
        return chatOrchestrator.snapshot(sessionId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping("/{sessionId}/birth-details")
    public Mono<ResponseEntity<ConversationState>> setBirthDetails(@PathVariable String sessionId,
                                                                   @RequestBody BirthDetails details) {
        return chatOrchestrator.setBirthDetails(sessionId, details)
            .map(ResponseEntity::ok)
            .onErrorResume(IllegalArgumentException.class,
                e -> Mono.just(ResponseEntity.badRequest().build()));
    }

    @DeleteMapping("/{sessionId}")
    public Mono<ResponseEntity<Void>> reset(@PathVariable String sessionId) {
        return chatOrchestrator.reset(sessionId)
            .map(removed -> removed
                ? ResponseEntity.noContent().<Void>build()
                : ResponseEntity.notFound().<Void>build());
    }

    @GetMapping("/{sessionId}/chart")
    public Mono<ResponseEntity<ChartSummary>> chart(@PathVariable String sessionId) {
        return chatOrchestrator.chartSummary(sessionId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .onErrorResume(e -> Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build()));
    }
}
