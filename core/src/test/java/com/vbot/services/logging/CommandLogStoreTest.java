package com.vbot.services.logging;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CommandLogStoreTest {
    private CommandLogStore store;

    @BeforeEach
    void setUp() {
        store = new CommandLogStore("jdbc:h2:mem:log_" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    }

    @Test
    void testCountsByOutcome() {
        store.insert(5, -100L, "#ping", CommandLogStore.SUCCESS, 12, null);
        store.insert(5, -100L, "#ping", CommandLogStore.SUCCESS, 8, null);
        store.insert(6, -100L, "/lock", CommandLogStore.DENIED, 0, null);
        store.insert(2, null, ".stats", CommandLogStore.FAILED, 30, "timeout");

        assertEquals(4, store.count());
        assertEquals(2, store.countByOutcome(CommandLogStore.SUCCESS));
        assertEquals(1, store.countByOutcome(CommandLogStore.DENIED));
        assertEquals(1, store.countByOutcome(CommandLogStore.FAILED));
    }

    @Test
    void testRecentIsNewestFirst() {
        store.insert(1, -100L, "#first", CommandLogStore.SUCCESS, 1, null);
        store.insert(1, -100L, "#second", CommandLogStore.FAILED, 2, "boom");
        store.insert(1, -100L, "#third", CommandLogStore.SUCCESS, 3, null);

        List<CommandLogStore.Entry> recent = store.recent(2);

        assertEquals(2, recent.size());
        assertEquals("#third", recent.get(0).command());
        assertEquals("#second", recent.get(1).command());
        assertEquals("boom", recent.get(1).error());
        assertNotNull(recent.get(0).createdAt());
    }

    @Test
    void testSchemaCreationIsRepeatable() {
        String url = "jdbc:h2:mem:log_" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1";
        new CommandLogStore(url).insert(1, null, "#a", CommandLogStore.SUCCESS, 0, null);
        assertEquals(1, new CommandLogStore(url).count(), "Reopening must keep existing rows");
    }
}
