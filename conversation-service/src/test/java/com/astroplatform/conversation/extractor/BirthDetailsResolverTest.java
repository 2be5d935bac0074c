package com.astroplatform.conversation.extractor;

import com.astroplatform.common.extractor.BirthDetailsCandidate;
import com.astroplatform.common.model.BirthDetails;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BirthDetailsResolverTest {

    /** Records calls instead of reaching the network. */
    private static final class FakeLlmExtractor extends LlmBirthDetailsExtractor {
        final AtomicInteger calls = new AtomicInteger();
        private final BirthDetailsCandidate answer;

        FakeLlmExtractor(BirthDetailsCandidate answer) {
            super(WebClient.create(), new ObjectMapper());
            this.answer = answer;
        }

        @Override
        public Mono<BirthDetailsCandidate> extract(String text) {
            calls.incrementAndGet();
            return Mono.justOrEmpty(answer);
        }
    }

    private static final BirthDetailsCandidate LLM_COMPLETE = new BirthDetailsCandidate(
        LocalDate.of(1992, 7, 4), "18:20", "Jaipur", 5.5, 1.0, BirthDetailsCandidate.Source.LLM);

    @Test
    @DisplayName("accepted rule result → LLM never called")
    void fastPath_skipsLlm() {
        FakeLlmExtractor llm = new FakeLlmExtractor(LLM_COMPLETE);
        BirthDetailsResolver resolver = new BirthDetailsResolver(llm);

        StepVerifier.create(resolver.resolve("Manu Pant, 10-10-1985, 10:47am, Dehradun"))
            .assertNext(d -> {
                assertEquals(LocalDate.of(1985, 10, 10), d.date());
                assertEquals("10:47", d.time());
                assertEquals("Dehradun", d.location());
            })
            .verifyComplete();
        assertEquals(0, llm.calls.get());
    }

    @Test
    @DisplayName("rules miss → complete LLM result used")
    void rulesMiss_llmUsed() {
        FakeLlmExtractor llm = new FakeLlmExtractor(LLM_COMPLETE);
        BirthDetailsResolver resolver = new BirthDetailsResolver(llm);

        StepVerifier.create(resolver.resolve("born on the fourth of july 92, evening, pink city"))
            .assertNext(d -> assertEquals(BirthDetails.of(LocalDate.of(1992, 7, 4), "18:20", "Jaipur"), d))
            .verifyComplete();
        assertEquals(1, llm.calls.get());
    }

    @Test
    @DisplayName("LLM result missing a field → nothing resolved")
    void incompleteLlm_discarded() {
        BirthDetailsCandidate partial = new BirthDetailsCandidate(
            LocalDate.of(1992, 7, 4), null, "Jaipur", 5.5, 0.7, BirthDetailsCandidate.Source.LLM);
        BirthDetailsResolver resolver = new BirthDetailsResolver(new FakeLlmExtractor(partial));

        StepVerifier.create(resolver.resolve("what about my career?")).verifyComplete();
    }

    @Test
    @DisplayName("both stages miss → empty, not an error")
    void bothMiss_empty() {
        BirthDetailsResolver resolver = new BirthDetailsResolver(new FakeLlmExtractor(null));

        StepVerifier.create(resolver.resolve("hello")).verifyComplete();
    }
}
