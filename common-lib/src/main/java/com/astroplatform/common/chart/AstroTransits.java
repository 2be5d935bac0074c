package com.astroplatform.common.chart;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Transit snapshot covering {@code [fromDate, toDate]}.
 */
public record AstroTransits(
    LocalDate          fromDate,
    LocalDate          toDate,
    Instant            computedAt,
    List<TransitEvent> events
) {
    public AstroTransits {
        events = events == null ? List.of() : List.copyOf(events);
    }

    /** True when this snapshot spans at least {@code [from, to]}. */
    public boolean covers(LocalDate from, LocalDate to) {
        return !fromDate.isAfter(from) && !toDate.isBefore(to);
    }
}
