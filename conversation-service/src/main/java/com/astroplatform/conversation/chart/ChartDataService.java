package com.astroplatform.conversation.chart;

import com.astroplatform.common.exception.PipelineException;
import com.astroplatform.common.model.BirthDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Read-through access to chart data backed by {@link ChartDataCache}.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Compute the required transit window: today minus {@code past-years}, today plus
 *       {@code future-years} (365.25-day years).</li>
 *   <li>Fresh entry covering the window → return it, no provider call.</li>
 *   <li>Missing, expired or too narrow → fetch profile and transits, store, return.</li>
 *   <li>Fetch failed with an entry present → log {@code CACHE_REFRESH_FAILED} and serve
 *       the stale entry. With no entry the error propagates.</li>
 * </ol>
 */
@Service
public class ChartDataService {

    private static final Logger log = LoggerFactory.getLogger(ChartDataService.class);

    private static final double DAYS_PER_YEAR = 365.25;

    private final ChartDataProvider provider;
    private final ChartDataCache    cache;
    private final Clock             clock;
    private final int               pastYears;
    private final int               futureYears;

    public ChartDataService(ChartDataProvider provider,
                            ChartDataCache cache,
                            Clock clock,
                            @Value("${astro.chart-cache.past-years:2}") int pastYears,
                            @Value("${astro.chart-cache.future-years:1}") int futureYears) {
        this.provider    = provider;
        this.cache       = cache;
        this.clock       = clock;
        this.pastYears   = pastYears;
        this.futureYears = futureYears;
    }

    public Mono<CachedChart> ensureChart(BirthDetails birthDetails) {
        if (!BirthDetails.isComplete(birthDetails)) {
            return Mono.error(new PipelineException("ChartData", "birth details incomplete"));
        }
        String key = birthDetails.fingerprint();

        return Mono.defer(() -> {
            LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
            LocalDate from  = today.minusDays(Math.round(pastYears * DAYS_PER_YEAR));
            LocalDate to    = today.plusDays(Math.round(futureYears * DAYS_PER_YEAR));

            Optional<CachedChart> cached = cache.get(key);
            if (cached.isPresent() && cache.isFresh(cached.get(), from, to)) {
                log.info("CACHE_HIT fingerprint={} fetchedAt={}", key, cached.get().fetchedAt());
                return Mono.just(cached.get());
            }

            if (cached.isPresent()) {
                log.info("CACHE_STALE fingerprint={} fetchedAt={} expired={}",
                         key, cached.get().fetchedAt(), cache.isExpired(cached.get()));
            } else {
                log.info("CACHE_MISS fingerprint={}", key);
            }

            return fetch(birthDetails, from, to)
                .doOnNext(fresh -> cache.put(key, fresh))
                .onErrorResume(e -> {
                    if (cached.isEmpty()) {
                        return Mono.error(e);
                    }
                    log.warn("CACHE_REFRESH_FAILED fingerprint={} servingStaleFrom={} reason={}",
                             key, cached.get().fetchedAt(), e.getMessage());
                    return Mono.just(cached.get());
                });
        });
    }

    /** Cached entry without triggering a fetch. */
    public Optional<CachedChart> peek(BirthDetails birthDetails) {
        return BirthDetails.isComplete(birthDetails)
            ? cache.get(birthDetails.fingerprint())
            : Optional.empty();
    }

    private Mono<CachedChart> fetch(BirthDetails birthDetails, LocalDate from, LocalDate to) {
        return Mono.zip(provider.fetchProfile(birthDetails),
                        provider.fetchTransits(birthDetails, from, to))
            .map(t -> new CachedChart(t.getT1(), t.getT2(), clock.instant()))
            .switchIfEmpty(Mono.error(new PipelineException("ChartData", "provider returned no data")));
    }
}
