/**
 * Deduplication store: the durable record of which items a source entity has
 * already yielded.
 *
 * <pre>
 *   PaginationController   ← reads one snapshot per run, inserts per admission
 *          │
 *          ▼
 *      DedupStore          ← interface (PROD ↔ TEST swap via Guice)
 *      ┌───┴───┐
 *      │       │
 *  SqlDedup  InMemory
 * </pre>
 *
 * <h2>Schema</h2>
 *
 * <pre>
 * dedup_entries
 *   id             INTEGER PK (surrogate)
 *   source_entity  TEXT      e.g. "handle:somebakery", "category:gym"
 *   item_id        TEXT      item URL
 *   first_seen_at  INTEGER   epoch millis of first admission
 *   UNIQUE (source_entity, item_id)
 * </pre>
 *
 * Rows are never updated or deleted.
 *
 * <h2>SQL File Inventory</h2>
 * <ul>
 * <li>{@code insert-dedup-entry.sql}: INSERT OR IGNORE one entry</li>
 * <li>{@code select-known-items.sql}: all item ids of one entity</li>
 * <li>{@code count-known-items.sql}: entry count of one entity</li>
 * </ul>
 */
package de.bsommerfeld.feedscout.db;
