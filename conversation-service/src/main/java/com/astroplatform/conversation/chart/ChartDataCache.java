package com.astroplatform.conversation.chart;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory chart cache, one entry per birth-details fingerprint.
 *
 * <p>Unlike a plain TTL cache, an expired entry is not evicted on read: it stays
 * available as the stale fallback when the refresh fails. Callers decide freshness
 * through {@link #isFresh}.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. No blocking calls.
 */
@Component
public class ChartDataCache {

    private static final Logger log = LoggerFactory.getLogger(ChartDataCache.class);

    private final ConcurrentHashMap<String, CachedChart> store = new ConcurrentHashMap<>();

    private final Clock    clock;
    private final Duration ttl;

    public ChartDataCache(Clock clock,
                          @Value("${astro.chart-cache.ttl:24h}") Duration ttl) {
        this.clock = clock;
        this.ttl   = ttl;
    }

    /** Cached entry regardless of age. */
    public Optional<CachedChart> get(String fingerprint) {
        return Optional.ofNullable(store.get(fingerprint));
    }

    public void put(String fingerprint, CachedChart entry) {
        store.put(fingerprint, entry);
        log.info("CACHE_REFRESH fingerprint={} ttlHours={} transitsFrom={} transitsTo={}",
                 fingerprint, ttl.toHours(), entry.transits().fromDate(), entry.transits().toDate());
    }

    /** Within the TTL and covering {@code [from, to]}. */
    public boolean isFresh(CachedChart entry, LocalDate from, LocalDate to) {
        return !isExpired(entry) && entry.transits().covers(from, to);
    }

    public boolean isExpired(CachedChart entry) {
        return clock.instant().isAfter(entry.fetchedAt().plus(ttl));
    }

    public int size() {
        return store.size();
    }
}
