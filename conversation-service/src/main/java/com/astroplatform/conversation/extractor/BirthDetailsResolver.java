package com.astroplatform.conversation.extractor;

import com.astroplatform.common.extractor.BirthDetailsCandidate;
import com.astroplatform.common.extractor.BirthDetailsExtractor;
import com.astroplatform.common.model.BirthDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Two-stage birth-details extraction: rules first, the LLM only when the rules fall short.
 *
 * <p>An accepted rule result completes immediately and the LLM is never called.
 * An LLM result counts only when it carries every field. Completes empty when neither
 * stage produces complete details.
 */
@Service
public class BirthDetailsResolver {

    private static final Logger log = LoggerFactory.getLogger(BirthDetailsResolver.class);

    private final LlmBirthDetailsExtractor llmExtractor;

    public BirthDetailsResolver(LlmBirthDetailsExtractor llmExtractor) {
        this.llmExtractor = llmExtractor;
    }

    public Mono<BirthDetails> resolve(String message) {
        Optional<BirthDetailsCandidate> fast = BirthDetailsExtractor.extract(message);
        if (fast.isPresent() && fast.get().isAccepted()) {
            log.info("[BirthExtractor] Rules extracted all fields confidence={} skipping LLM",
                     fast.get().confidence());
            return Mono.justOrEmpty(fast.get().toBirthDetails());
        }

        log.info("[BirthExtractor] Rules incomplete confidence={} trying LLM",
                 fast.map(BirthDetailsCandidate::confidence).orElse(0.0));
        return llmExtractor.extract(message)
            .filter(BirthDetailsCandidate::isComplete)
            .flatMap(c -> Mono.justOrEmpty(c.toBirthDetails()));
    }
}
