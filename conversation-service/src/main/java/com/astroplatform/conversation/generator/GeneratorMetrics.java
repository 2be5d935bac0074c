package com.astroplatform.conversation.generator;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-provider counters for the generator chain.
 *
 * <p>{@code calls}: attempts started. {@code errors}: attempts that failed or timed out.
 * {@code fallbacks}: times the chain moved past this provider, whether it failed or was
 * disabled.
 */
@Component
public class GeneratorMetrics {

    public record ProviderStats(long calls, long errors, long fallbacks) {}

    private static final class Counters {
        final AtomicLong calls     = new AtomicLong();
        final AtomicLong errors    = new AtomicLong();
        final AtomicLong fallbacks = new AtomicLong();
    }

    private final ConcurrentHashMap<String, Counters> counters = new ConcurrentHashMap<>();

    public void recordCall(String provider) {
        counters(provider).calls.incrementAndGet();
    }

    public void recordError(String provider) {
        counters(provider).errors.incrementAndGet();
    }

    public void recordFallback(String provider) {
        counters(provider).fallbacks.incrementAndGet();
    }

    /** Point-in-time copy, ordered by provider name. */
    public Map<String, ProviderStats> snapshot() {
        Map<String, ProviderStats> out = new TreeMap<>();
        counters.forEach((name, c) ->
            out.put(name, new ProviderStats(c.calls.get(), c.errors.get(), c.fallbacks.get())));
        return out;
    }

    private Counters counters(String provider) {
        return counters.computeIfAbsent(provider, k -> new Counters());
    }
}
