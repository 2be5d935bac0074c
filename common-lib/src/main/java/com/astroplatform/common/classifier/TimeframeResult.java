package com.astroplatform.common.classifier;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Normalized time horizon of a question.
 *
 * @param value         number as phrased ("next 3 months" → 3)
 * @param horizonMonths horizon in months, always &gt;= 0; 12 when no phrase was found
 * @param description   human-readable form, e.g. "Next 3 months"
 */
public record TimeframeResult(
    @JsonProperty("type")          TimeframeType type,
    @JsonProperty("value")         int           value,
    @JsonProperty("horizonMonths") double        horizonMonths,
    @JsonProperty("description")   String        description
) {
    public static final double DEFAULT_HORIZON_MONTHS = 12;

    /** Days per month used for every months-to-days conversion. */
    public static final int DAYS_PER_MONTH = 30;

    public TimeframeResult {
        if (horizonMonths < 0) {
            throw new IllegalArgumentException("horizonMonths must be >= 0");
        }
    }

    public static TimeframeResult defaultHorizon() {
        return new TimeframeResult(TimeframeType.DEFAULT, 12, DEFAULT_HORIZON_MONTHS,
            "Next 12 months (default)");
    }

    static TimeframeResult of(TimeframeType type, int value, double horizonMonths) {
        return new TimeframeResult(type, value, horizonMonths, "Next " + value + " " + type.wireId());
    }

    @JsonIgnore
    public boolean isDefault() {
        return type == TimeframeType.DEFAULT;
    }

    /** End of the horizon: {@code now + horizonMonths × 30 days}. */
    public Instant filterDate(Instant now) {
        long days = (long) (horizonMonths * DAYS_PER_MONTH);
        return now.plus(days, ChronoUnit.DAYS);
    }

    /** Horizon length in whole days. */
    public long horizonDays() {
        return (long) (horizonMonths * DAYS_PER_MONTH);
    }
}
