package de.bsommerfeld.feedscout.db;

import com.google.inject.Singleton;
import de.bsommerfeld.feedscout.core.domain.SourceEntity;

import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent {@link DedupStore}. Bound in TEST mode and used for dry
 * runs, where the run must neither see nor leave any trace of earlier runs.
 */
@Singleton
public class InMemoryDedupStore implements DedupStore {

    private final Map<String, Map<String, Instant>> entries = new ConcurrentHashMap<>();

    @Override
    public Set<String> load(SourceEntity source) {
        Map<String, Instant> known = entries.get(source.key());
        return known == null ? new HashSet<>() : new HashSet<>(known.keySet());
    }

    @Override
    public boolean insertIfAbsent(SourceEntity source, String itemId, Instant firstSeenAt) {
        return entries.computeIfAbsent(source.key(), k -> new ConcurrentHashMap<>())
                .putIfAbsent(itemId, firstSeenAt) == null;
    }

    @Override
    public int count(SourceEntity source) {
        Map<String, Instant> known = entries.get(source.key());
        return known == null ? 0 : known.size();
    }
}
