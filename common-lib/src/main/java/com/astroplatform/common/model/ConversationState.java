package com.astroplatform.common.model;

import com.astroplatform.common.taxonomy.Topic;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one chat session.
 *
 * <h3>Invariant</h3>
 * <p>{@code mode} is {@link Mode#NEEDS_BIRTH_DETAILS} if and only if {@code birthDetails}
 * is absent or incomplete. The canonical constructor rejects any other combination, and
 * every copy-factory that touches birth details recomputes the mode.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 *   <li>{@link #start} on the first message for a session id.</li>
 *   <li>One copy per turn: {@link #withMessageReceived}, optionally
 *       {@link #withBirthDetails}, then {@link #withRouting}.</li>
 *   <li>Dropped only by an explicit reset.</li>
 * </ol>
 *
 * <p>Nullable fields: {@code focus}, {@code activeTopic}, {@code birthDetails}.
 */
public record ConversationState(
    @JsonProperty("sessionId")             String       sessionId,
    @JsonProperty("mode")                  Mode         mode,
    @JsonProperty("focus")                 FocusArea    focus,
    @JsonProperty("activeTopic")           Topic        activeTopic,
    @JsonProperty("birthDetails")          BirthDetails birthDetails,
    @JsonProperty("hasDoneRetrospective")  boolean      hasDoneRetrospective,
    @JsonProperty("messageCount")          int          messageCount,
    @JsonProperty("createdAt")             Instant      createdAt,
    @JsonProperty("updatedAt")             Instant      updatedAt
) {
    public ConversationState {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(mode, "mode");
        if (mode != Mode.forBirthDetails(birthDetails)) {
            throw new IllegalArgumentException(
                "mode " + mode + " inconsistent with birth details for session " + sessionId);
        }
        if (messageCount < 0) {
            throw new IllegalArgumentException("messageCount must be >= 0");
        }
    }

    public static ConversationState start(String sessionId, Instant now) {
        return new ConversationState(
            sessionId, Mode.NEEDS_BIRTH_DETAILS,
            null, null, null,
            false, 0, now, now);
    }

    // ── copy-factories ────────────────────────────────────────────────────

    public ConversationState withMessageReceived(Instant now) {
        return new ConversationState(
            sessionId, mode, focus, activeTopic, birthDetails,
            hasDoneRetrospective, messageCount + 1, createdAt, now);
    }

    /** Replaces birth details wholesale and re-derives the mode. */
    public ConversationState withBirthDetails(BirthDetails details, Instant now) {
        return new ConversationState(
            sessionId, Mode.forBirthDetails(details), focus, activeTopic, details,
            hasDoneRetrospective, messageCount, createdAt, now);
    }

    /**
     * Applies a routing outcome. The mode must agree with the stored birth details;
     * the router guarantees this because the gate is evaluated on the same snapshot.
     */
    public ConversationState withRouting(Mode routedMode, FocusArea routedFocus, Topic topic, Instant now) {
        return new ConversationState(
            sessionId, routedMode, routedFocus, topic, birthDetails,
            hasDoneRetrospective, messageCount, createdAt, now);
    }

    public ConversationState withRetrospectiveDone(Instant now) {
        return new ConversationState(
            sessionId, mode, focus, activeTopic, birthDetails,
            true, messageCount, createdAt, now);
    }

    public boolean needsBirthDetails() {
        return mode == Mode.NEEDS_BIRTH_DETAILS;
    }
}
