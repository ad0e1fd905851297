package de.bsommerfeld.feedscout.discovery;

import de.bsommerfeld.feedscout.core.domain.CandidateRef;
import de.bsommerfeld.feedscout.core.domain.ContentRecord;
import de.bsommerfeld.feedscout.core.event.ApplicationEventBus;
import de.bsommerfeld.feedscout.core.normalize.ContentNormalizer;
import de.bsommerfeld.feedscout.db.DedupStore;
import de.bsommerfeld.feedscout.discovery.collect.CollectorSession;
import de.bsommerfeld.feedscout.discovery.collect.DetailResolver;
import de.bsommerfeld.feedscout.discovery.collect.Resolution;
import de.bsommerfeld.feedscout.discovery.filter.AdmissionFilter;
import de.bsommerfeld.feedscout.discovery.output.RankedResultSet;
import de.bsommerfeld.feedscout.discovery.output.RunParameters;
import de.bsommerfeld.feedscout.discovery.paging.PaginationController;
import de.bsommerfeld.feedscout.discovery.paging.PaginationMode;
import de.bsommerfeld.feedscout.discovery.paging.PaginationResult;
import de.bsommerfeld.feedscout.discovery.rank.ResultSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One execution of the discovery pipeline:
 *
 * <pre>
 * Collector ──▶ PaginationController ──▶ DetailResolver (pool)
 *                     │                        │
 *                 DedupStore              RawFields
 *                                              │
 *                                   ContentNormalizer
 *                                              │
 *                     AdmissionFilter ──▶ ResultSelector ──▶ RankedResultSet
 * </pre>
 *
 * Details are fetched while paging is still in progress: every admitted
 * reference is dispatched to the pool the moment it is admitted. A run is
 * single-use.
 */
public class DiscoveryRun {

    private static final Logger LOG = LoggerFactory.getLogger(DiscoveryRun.class);

    private final DiscoveryRequest request;
    private final CollectorSession session;
    private final ContentNormalizer normalizer;
    private final DiscoveryEngine engine;
    private final Clock clock;
    private final int parallelism;
    private final PaginationController controller;

    DiscoveryRun(DiscoveryRequest request, CollectorSession session, DedupStore store,
            ContentNormalizer normalizer, DiscoveryEngine engine, ApplicationEventBus eventBus, Clock clock,
            int parallelism) {
        this.request = request;
        this.session = session;
        this.normalizer = normalizer;
        this.engine = engine;
        this.clock = clock;
        this.parallelism = parallelism;
        this.controller = new PaginationController(request.source(), store, request.paging(), eventBus, clock);
    }

    /**
     * Runs paging, detail resolution, normalization, filtering and ranking.
     * Always returns a report; an empty result set is a valid outcome.
     *
     * @throws IllegalStateException if this run was already executed
     */
    public RunReport execute() {
        LOG.info("Starting {} run for {}{}", request.strategy(), request.source(),
                request.dryRun() ? " (dry run)" : "");

        PaginationResult paging;
        List<Resolution> outcomes;
        try (DetailResolver resolver = new DetailResolver(session.detailFetcher(), parallelism)) {
            paging = controller.run(session.collector(), resolver::submit);
            LOG.info("Waiting for {} detail fetches", resolver.submitted());
            outcomes = resolver.awaitAll();
        }

        List<ContentRecord> records = new ArrayList<>();
        List<CandidateRef> unresolved = new ArrayList<>();
        for (Resolution outcome : outcomes) {
            if (!outcome.isResolved()) {
                unresolved.add(outcome.ref());
                continue;
            }
            try {
                records.add(normalizer.normalize(request.source(), outcome.ref(), outcome.fields()));
            } catch (RuntimeException e) {
                LOG.warn("Could not normalize {}", outcome.ref().id(), e);
                unresolved.add(outcome.ref());
            }
        }

        Instant now = clock.instant();
        AdmissionFilter filter = engine.filterFor(request, now);
        List<ContentRecord> survivors = filter.apply(records);
        int filteredOut = records.size() - survivors.size();
        List<ContentRecord> top = ResultSelector.select(survivors, request.strategy(), request.limit());

        RankedResultSet resultSet = new RankedResultSet(request.source(), now, request.strategy(),
                parameters(), top);
        LOG.info("Run for {} finished: {} admitted, {} unresolved, {} filtered, {} returned",
                request.source(), paging.admitted().size(), unresolved.size(), filteredOut, top.size());
        return new RunReport(resultSet, paging.state(), paging.rounds(), paging.admitted(), unresolved,
                filteredOut);
    }

    private RunParameters parameters() {
        boolean bounded = request.paging().mode() == PaginationMode.BOUNDED;
        return new RunParameters(
                request.paging().mode(),
                bounded ? request.paging().targetNewCount() : null,
                request.maxAgeHours(),
                request.limit(),
                request.hashtags().isEmpty() ? null : request.hashtags(),
                request.dryRun());
    }

    /** Stops paging before its next round; fetches already dispatched still complete. */
    public void cancel() {
        controller.cancel();
    }
}
