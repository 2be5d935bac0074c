package com.astroplatform.common.router;

import com.astroplatform.common.model.FocusArea;
import com.astroplatform.common.model.Mode;

/**
 * Output of {@link ModeRouter}.
 *
 * @param focus nullable; resolved only for {@link Mode#NORMAL_READING}, otherwise the
 *              focus already stored on the session is carried unchanged
 * @param firstReading true for the first reading after birth details became complete
 */
public record RoutingDecision(
    Mode      mode,
    FocusArea focus,
    boolean   firstReading
) {}
