package com.astroplatform.conversation.chart;

import com.astroplatform.common.chart.AstroProfile;
import com.astroplatform.common.chart.AstroTransits;
import com.astroplatform.common.model.BirthDetails;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * Strategy interface for the natal chart and transit source: a real ephemeris service
 * or the deterministic {@link StubChartDataProvider}.
 */
public interface ChartDataProvider {

    Mono<AstroProfile> fetchProfile(BirthDetails birthDetails);

    Mono<AstroTransits> fetchTransits(BirthDetails birthDetails, LocalDate from, LocalDate to);
}
