package de.bsommerfeld.feedscout.db;

import de.bsommerfeld.feedscout.core.domain.SourceEntity;

import java.time.Instant;
import java.util.Set;

/**
 * Durable memory of which items were already admitted for a source entity.
 *
 * <p>
 * Entries are append-only: this contract offers no way to delete or prune
 * them. Uniqueness holds on {@code (sourceEntity, itemId)} and inserting an
 * existing pair is a silent no-op.
 *
 * <p>
 * Neither operation throws on persistence failures. A failed read yields an
 * empty set and a failed write yields {@code false}; both are logged by the
 * implementation. A run therefore continues even when the store is broken,
 * at the cost of possibly re-discovering items next time.
 *
 * <p>
 * Implementations are safe for sequential runs against the same entity. They
 * do <strong>not</strong> coordinate multiple processes writing the same
 * entity concurrently; such runs may both admit the same item, and the
 * duplicate insert is tolerated.
 *
 * <ul>
 * <li>{@link SqlDedupStore}: SQLite, production</li>
 * <li>{@link InMemoryDedupStore}: TEST mode, dry runs and tests</li>
 * </ul>
 */
public interface DedupStore {

    /**
     * Returns every item id previously admitted for {@code source}. Unknown
     * entities and an absent store yield the empty set.
     */
    Set<String> load(SourceEntity source);

    /**
     * Records {@code itemId} for {@code source} unless already present.
     *
     * @param firstSeenAt when the item was first admitted
     * @return {@code true} if a new entry was written
     */
    boolean insertIfAbsent(SourceEntity source, String itemId, Instant firstSeenAt);

    /** Number of entries stored for {@code source}. */
    int count(SourceEntity source);
}
