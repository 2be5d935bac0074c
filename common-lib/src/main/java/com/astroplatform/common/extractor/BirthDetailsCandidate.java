package com.astroplatform.common.extractor;

import com.astroplatform.common.model.BirthDetails;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Partial birth details pulled out of free text, with an accumulated confidence.
 * Any field may be null.
 *
 * @param confidence sum of per-field weights, 0.0 to 1.0
 * @param source     which extractor produced the candidate
 */
public record BirthDetailsCandidate(
    LocalDate date,
    String    time,
    String    location,
    Double    timezone,
    double    confidence,
    Source    source
) {
    public enum Source { RULES, LLM }

    public boolean isComplete() {
        return date != null
            && BirthDetails.isClockTime(time)
            && location != null && !location.isBlank();
    }

    /** Complete and at or above {@link BirthDetailsExtractor#ACCEPTANCE_THRESHOLD}. */
    public boolean isAccepted() {
        return isComplete() && confidence >= BirthDetailsExtractor.ACCEPTANCE_THRESHOLD;
    }

    /** Birth details when every field is present. */
    public Optional<BirthDetails> toBirthDetails() {
        if (!isComplete()) {
            return Optional.empty();
        }
        return Optional.of(new BirthDetails(date, time, location.trim(), null, null, timezone));
    }
}
