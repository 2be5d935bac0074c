package com.astroplatform.conversation.session;

import com.astroplatform.common.model.ConversationState;

import java.time.Instant;
import java.util.Optional;

/**
 * Keyed store of {@link ConversationState} snapshots.
 *
 * <p>Implementations must be safe for concurrent use across sessions. Serializing turns
 * within one session is the job of {@link SessionTurnQueue}, not of the store.
 */
public interface SessionStore {

    Optional<ConversationState> get(String sessionId);

    /** Existing state, or a fresh {@link ConversationState#start} stored under the id. */
    ConversationState getOrCreate(String sessionId, Instant now);

    void put(ConversationState state);

    /** @return true when a session was removed */
    boolean delete(String sessionId);

    boolean exists(String sessionId);

    int count();
}
