package com.astroplatform.conversation.session;

import com.astroplatform.common.model.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide session store backed by a {@link ConcurrentHashMap}.
 *
 * <p>Values are immutable records; every mutation is a copy-factory followed by
 * {@link #put}. Sessions live until an explicit reset or process restart.
 */
@Component
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final ConcurrentHashMap<String, ConversationState> store = new ConcurrentHashMap<>();

    @Override
    public Optional<ConversationState> get(String sessionId) {
        return Optional.ofNullable(store.get(sessionId));
    }

    @Override
    public ConversationState getOrCreate(String sessionId, Instant now) {
        return store.computeIfAbsent(sessionId, id -> {
            log.info("SESSION_CREATED sessionId={}", id);
            return ConversationState.start(id, now);
        });
    }

    @Override
    public void put(ConversationState state) {
        store.put(state.sessionId(), state);
    }

    @Override
    public boolean delete(String sessionId) {
        boolean removed = store.remove(sessionId) != null;
        if (removed) {
            log.info("SESSION_DELETED sessionId={}", sessionId);
        }
        return removed;
    }

    @Override
    public boolean exists(String sessionId) {
        return store.containsKey(sessionId);
    }

    @Override
    public int count() {
        return store.size();
    }
}
