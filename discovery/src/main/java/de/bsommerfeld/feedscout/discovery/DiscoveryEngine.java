package de.bsommerfeld.feedscout.discovery;

import com.google.inject.Singleton;
import de.bsommerfeld.feedscout.core.config.DiscoveryConfig;
import de.bsommerfeld.feedscout.core.event.ApplicationEventBus;
import de.bsommerfeld.feedscout.core.normalize.ContentNormalizer;
import de.bsommerfeld.feedscout.db.DedupStore;
import de.bsommerfeld.feedscout.db.InMemoryDedupStore;
import de.bsommerfeld.feedscout.discovery.collect.CollectorSession;
import de.bsommerfeld.feedscout.discovery.filter.AdmissionFilter;
import de.bsommerfeld.feedscout.discovery.filter.PinnedItemFilter;
import de.bsommerfeld.feedscout.discovery.filter.RecencyWindowFilter;
import de.bsommerfeld.feedscout.discovery.rank.RankingStrategy;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Instant;

/**
 * Creates {@link DiscoveryRun}s from a request and an open session.
 *
 * <p>
 * The engine itself holds no per-run state and can be shared. Everything a
 * run mutates (pagination state, seen set, worker pool) lives in the
 * {@link DiscoveryRun} it hands out.
 */
@Singleton
public class DiscoveryEngine {

    private final DedupStore store;
    private final ContentNormalizer normalizer;
    private final PinnedItemFilter pinnedFilter;
    private final DiscoveryConfig config;
    private final ApplicationEventBus eventBus;
    private final Clock clock;

    @Inject
    public DiscoveryEngine(DedupStore store, ContentNormalizer normalizer, PinnedItemFilter pinnedFilter,
            DiscoveryConfig config, ApplicationEventBus eventBus, Clock clock) {
        this.store = store;
        this.normalizer = normalizer;
        this.pinnedFilter = pinnedFilter;
        this.config = config;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Prepares a run without starting it. The returned handle can be
     * cancelled from another thread once {@link DiscoveryRun#execute()} is
     * running.
     */
    public DiscoveryRun prepare(DiscoveryRequest request, CollectorSession session) {
        DedupStore effectiveStore = request.dryRun() ? new InMemoryDedupStore() : store;
        return new DiscoveryRun(request, session, effectiveStore, normalizer, this, eventBus, clock,
                config.getFetchParallelism());
    }

    /** Prepares and executes a run on the calling thread. */
    public RunReport run(DiscoveryRequest request, CollectorSession session) {
        return prepare(request, session).execute();
    }

    /**
     * Chronological runs drop pinned items; engagement runs drop items
     * outside the recency window measured from {@code now}.
     */
    AdmissionFilter filterFor(DiscoveryRequest request, Instant now) {
        if (request.strategy() == RankingStrategy.ENGAGEMENT) {
            return new RecencyWindowFilter(now, request.maxAgeHours());
        }
        return pinnedFilter;
    }
}
