package de.bsommerfeld.feedscout.db;

import de.bsommerfeld.feedscout.core.domain.SourceEntity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDedupStoreTest {

    private static final SourceEntity SOURCE = SourceEntity.handle("a");

    @Test
    void insertIfAbsent_shouldWriteOnlyOnce() {
        InMemoryDedupStore store = new InMemoryDedupStore();
        assertTrue(store.insertIfAbsent(SOURCE, "x", Instant.EPOCH));
        assertFalse(store.insertIfAbsent(SOURCE, "x", Instant.EPOCH));
        assertEquals(1, store.count(SOURCE));
    }

    @Test
    void load_shouldReturnDetachedSnapshot() {
        InMemoryDedupStore store = new InMemoryDedupStore();
        store.insertIfAbsent(SOURCE, "x", Instant.EPOCH);

        Set<String> snapshot = store.load(SOURCE);
        store.insertIfAbsent(SOURCE, "y", Instant.EPOCH);

        assertEquals(Set.of("x"), snapshot);
        assertEquals(Set.of("x", "y"), store.load(SOURCE));
    }

    @Test
    void load_shouldBeEmptyForUnknownEntity() {
        assertTrue(new InMemoryDedupStore().load(SourceEntity.category("bar")).isEmpty());
    }
}
