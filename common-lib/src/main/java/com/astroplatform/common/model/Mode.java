package com.astroplatform.common.model;

/**
 * Conversation mode.
 *
 * <ul>
 *   <li>{@link #NEEDS_BIRTH_DETAILS}: date, time or location still missing</li>
 *   <li>{@link #NORMAL_READING}: birth details complete, readings are served</li>
 * </ul>
 */
public enum Mode {
    NEEDS_BIRTH_DETAILS,
    NORMAL_READING;

    /** The only mode consistent with the given birth details. */
    public static Mode forBirthDetails(BirthDetails details) {
        return BirthDetails.isComplete(details) ? NORMAL_READING : NEEDS_BIRTH_DETAILS;
    }
}
