package com.astroplatform.conversation.dto;

import com.astroplatform.common.model.BirthDetails;

/**
 * One chat turn as posted by the client.
 *
 * @param actionId     nullable; id of a suggested action the user tapped
 * @param birthDetails nullable; details collected by a form instead of free text
 */
public record ChatRequest(
    String       sessionId,
    String       message,
    String       actionId,
    BirthDetails birthDetails
) {}
