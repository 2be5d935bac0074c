package com.astroplatform.conversation.session;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Serializes work per session id without a lock.
 *
 * <p>Each session keeps the tail of its turn chain. A new turn is appended behind the
 * tail and only subscribes once the previous turn has terminated, successfully or not.
 * Different session ids never share a chain, so they run fully in parallel. A tail that
 * is still the latest when it terminates is removed from the map.
 */
@Component
public class SessionTurnQueue {

    private final ConcurrentHashMap<String, Mono<Object>> tails = new ConcurrentHashMap<>();

    /**
     * @param sessionId chain key
     * @param turn      deferred work for this turn; invoked only after the previous turn
     *                  for the same session has finished
     * @return the result of {@code turn}, emitted in submission order per session
     */
    @SuppressWarnings("unchecked")
    public <T> Mono<T> submit(String sessionId, Supplier<Mono<T>> turn) {
        AtomicReference<Mono<Object>> appended = new AtomicReference<>();
        tails.compute(sessionId, (id, previous) -> {
            Mono<Void> after = previous == null
                ? Mono.empty()
                : previous.onErrorResume(e -> Mono.empty()).then();
            Mono<Object> next = after
                .then(Mono.defer(turn).map(v -> (Object) v))
                .doFinally(signal -> tails.remove(id, appended.get()))
                .cache();
            appended.set(next);
            return next;
        });
        return (Mono<T>) appended.get();
    }

    /** Number of sessions with a turn in flight or queued. */
    public int activeSessions() {
        return tails.size();
    }
}
