package com.astroplatform.conversation.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionTurnQueueTest {

    private final SessionTurnQueue queue = new SessionTurnQueue();

    private static Mono<String> step(List<String> events, String name, Duration delay) {
        return Mono.fromRunnable(() -> events.add(name + "-start"))
            .then(Mono.delay(delay))
            .then(Mono.fromCallable(() -> {
                events.add(name + "-end");
                return name;
            }));
    }

    @Test
    @DisplayName("same session → second turn starts only after the first ends")
    void sameSession_serialized() {
        List<String> events = Collections.synchronizedList(new ArrayList<>());

        Mono<String> first  = queue.submit("s-1", () -> step(events, "A", Duration.ofMillis(150)));
        Mono<String> second = queue.submit("s-1", () -> step(events, "B", Duration.ZERO));

        StepVerifier.create(Mono.zip(second, first))
            .assertNext(t -> {
                assertEquals("B", t.getT1());
                assertEquals("A", t.getT2());
            })
            .verifyComplete();

        assertEquals(List.of("A-start", "A-end", "B-start", "B-end"), events);
    }

    @Test
    @DisplayName("different sessions → no waiting on each other")
    void differentSessions_parallel() {
        List<String> events = Collections.synchronizedList(new ArrayList<>());

        Mono<String> slow = queue.submit("s-1", () -> step(events, "A", Duration.ofMillis(300)));
        Mono<String> fast = queue.submit("s-2", () -> step(events, "B", Duration.ZERO));

        StepVerifier.create(Mono.zip(slow, fast)).expectNextCount(1).verifyComplete();

        assertTrue(events.indexOf("B-end") < events.indexOf("A-end"),
            "s-2 should finish while s-1 is still running: " + events);
    }

    @Test
    @DisplayName("failed turn → next turn still runs")
    void failedTurn_doesNotBlockNext() {
        Mono<String> failing = queue.submit("s-1", () -> Mono.error(new IllegalStateException("boom")));
        Mono<String> next    = queue.submit("s-1", () -> Mono.just("ok"));

        StepVerifier.create(failing).expectError(IllegalStateException.class).verify();
        StepVerifier.create(next).expectNext("ok").verifyComplete();
    }

    @Test
    @DisplayName("turn is not invoked until subscribed")
    void lazy() {
        List<String> events = new ArrayList<>();
        Mono<String> turn = queue.submit("s-1", () -> {
            events.add("invoked");
            return Mono.just("x");
        });

        assertTrue(events.isEmpty());
        StepVerifier.create(turn).expectNext("x").verifyComplete();
        assertEquals(List.of("invoked"), events);
    }

    @Test
    @DisplayName("finished chain → removed from the map")
    void finishedChain_removed() {
        StepVerifier.create(queue.submit("s-1", () -> Mono.just(1))).expectNext(1).verifyComplete();
        StepVerifier.create(queue.submit("s-2", () -> Mono.just(2))).expectNext(2).verifyComplete();

        assertEquals(0, queue.activeSessions());
    }
}
