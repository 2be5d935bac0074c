package com.astroplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.regex.Pattern;

/**
 * Birth data needed to cast a chart.
 *
 * <p>Immutable once accepted. A session replaces its birth details wholesale and never
 * patches a single field.
 *
 * @param time      24-hour clock time, {@code HH:mm}
 * @param latitude  nullable; city lookup is outside this pipeline
 * @param longitude nullable
 * @param timezone  UTC offset in hours, {@value #DEFAULT_TIMEZONE} (IST) when not given
 */
public record BirthDetails(
    @JsonProperty("date")      LocalDate date,
    @JsonProperty("time")      String    time,
    @JsonProperty("location")  String    location,
    @JsonProperty("latitude")  Double    latitude,
    @JsonProperty("longitude") Double    longitude,
    @JsonProperty("timezone")  Double    timezone
) {
    public static final double DEFAULT_TIMEZONE = 5.5;

    // H:mm or HH:mm, 00:00 to 23:59
    private static final Pattern CLOCK_TIME = Pattern.compile("([01]?\\d|2[0-3]):[0-5]\\d");

    public BirthDetails {
        if (timezone == null) {
            timezone = DEFAULT_TIMEZONE;
        }
    }

    public static BirthDetails of(LocalDate date, String time, String location) {
        return new BirthDetails(date, time, location, null, null, DEFAULT_TIMEZONE);
    }

    /** Date present, time a valid 24-hour clock reading, location non-blank. */
    @JsonIgnore
    public boolean isComplete() {
        return date != null
            && isClockTime(time)
            && location != null && !location.isBlank();
    }

    /** Null-safe completeness check used by the mode gate. */
    public static boolean isComplete(BirthDetails details) {
        return details != null && details.isComplete();
    }

    public static boolean isClockTime(String time) {
        return time != null && CLOCK_TIME.matcher(time.trim()).matches();
    }

    /** Stable key identifying the chart these details produce. */
    public String fingerprint() {
        return date + "|" + time + "|" + location.trim().toLowerCase() + "|" + timezone;
    }
}
