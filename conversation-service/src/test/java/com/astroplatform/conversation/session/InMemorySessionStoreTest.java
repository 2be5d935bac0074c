package com.astroplatform.conversation.session;

import com.astroplatform.common.model.BirthDetails;
import com.astroplatform.common.model.ConversationState;
import com.astroplatform.common.model.Mode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySessionStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    private final InMemorySessionStore store = new InMemorySessionStore();

    @Test
    @DisplayName("getOrCreate twice → same fresh state, one entry")
    void getOrCreate_idempotent() {
        ConversationState first  = store.getOrCreate("s-1", NOW);
        ConversationState second = store.getOrCreate("s-1", NOW.plusSeconds(60));

        assertSame(first, second);
        assertEquals(Mode.NEEDS_BIRTH_DETAILS, first.mode());
        assertEquals(1, store.count());
    }

    @Test
    @DisplayName("put replaces the snapshot wholesale")
    void put_replaces() {
        ConversationState start = store.getOrCreate("s-1", NOW);
        ConversationState updated = start.withBirthDetails(
            BirthDetails.of(LocalDate.of(1985, 10, 10), "10:47", "Dehradun"), NOW);

        store.put(updated);

        assertEquals(Mode.NORMAL_READING, store.get("s-1").orElseThrow().mode());
    }

    @Test
    @DisplayName("delete → true once, then false")
    void delete() {
        store.getOrCreate("s-1", NOW);

        assertTrue(store.delete("s-1"));
        assertFalse(store.delete("s-1"));
        assertFalse(store.exists("s-1"));
        assertTrue(store.get("s-1").isEmpty());
    }
}
