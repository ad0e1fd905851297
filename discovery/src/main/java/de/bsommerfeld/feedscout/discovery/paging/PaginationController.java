package de.bsommerfeld.feedscout.discovery.paging;

import de.bsommerfeld.feedscout.core.domain.CandidateRef;
import de.bsommerfeld.feedscout.core.domain.PaginationState;
import de.bsommerfeld.feedscout.core.domain.SourceEntity;
import de.bsommerfeld.feedscout.core.event.ApplicationEventBus;
import de.bsommerfeld.feedscout.core.event.DiscoveryEvents.PaginationFinishedEvent;
import de.bsommerfeld.feedscout.core.event.DiscoveryEvents.RoundCompletedEvent;
import de.bsommerfeld.feedscout.db.DedupStore;
import de.bsommerfeld.feedscout.discovery.collect.CollectionException;
import de.bsommerfeld.feedscout.discovery.collect.Collector;
import de.bsommerfeld.feedscout.discovery.collect.RoundContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives "request next page, observe delta, decide to continue" for one
 * source entity.
 *
 * <h3>Admission</h3>
 * The dedup store is read exactly once, when {@link #run} starts. A reference
 * is admitted when its id is neither in that snapshot nor in the in-run seen
 * set. Admission is immediate: the id enters the seen set, the store entry is
 * written and the {@link AdmissionListener} is notified before the next
 * reference of the same batch is looked at. Later rounds never re-query the
 * store.
 *
 * <h3>Stop rules</h3>
 * Checked after every round, highest priority first:
 * <ol>
 * <li>{@link PaginationMode#BOUNDED} and admitted &ge; target:
 * {@link PaginationState#STOPPING_TARGET_MET}</li>
 * <li>stagnant rounds &ge; stagnation limit:
 * {@link PaginationState#STOPPING_STAGNANT}</li>
 * <li>rounds &ge; round cap: {@link PaginationState#STOPPING_CAPPED}</li>
 * </ol>
 * A batch that fails with {@link CollectionException} (or any runtime
 * exception from the collector) counts as a round without new items.
 *
 * <h3>Cancellation</h3>
 * {@link #cancel()} may be called from any thread. It is observed before the
 * next round starts, so a round is never interrupted halfway through
 * admission and the store stays consistent.
 *
 * <p>
 * A controller runs once; create a new one per run.
 */
public class PaginationController {

    private static final Logger LOG = LoggerFactory.getLogger(PaginationController.class);

    private final SourceEntity source;
    private final DedupStore store;
    private final PaginationOptions options;
    private final ApplicationEventBus eventBus;
    private final Clock clock;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile PaginationState state = PaginationState.COLLECTING;

    public PaginationController(SourceEntity source, DedupStore store, PaginationOptions options,
            ApplicationEventBus eventBus, Clock clock) {
        this.source = source;
        this.store = store;
        this.options = options;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Pages through {@code collector} until a stop rule fires.
     *
     * @param listener notified for every admitted reference, in order
     * @return the terminal state and all admitted references
     * @throws IllegalStateException if this controller already ran
     */
    public PaginationResult run(Collector collector, AdmissionListener listener) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("PaginationController instances are single-use");
        }

        Set<String> known = store.load(source);
        Set<String> seen = new HashSet<>();
        List<CandidateRef> admitted = new ArrayList<>();
        LOG.info("Paging {} ({} mode, {} known items)", source, options.mode(), known.size());

        int round = 0;
        int stagnant = 0;
        PaginationState next = PaginationState.COLLECTING;

        while (!next.isTerminal()) {
            if (cancelled.get()) {
                next = PaginationState.STOPPING_CANCELLED;
                break;
            }
            round++;
            RoundContext context = new RoundContext(round, admitted.size(), stagnant);

            int delta = 0;
            for (CandidateRef ref : fetchBatch(collector, context)) {
                if (ref == null || known.contains(ref.id()) || !seen.add(ref.id())) {
                    continue;
                }
                CandidateRef stamped = ref.round() == round ? ref : new CandidateRef(ref.id(), round);
                admitted.add(stamped);
                store.insertIfAbsent(source, stamped.id(), clock.instant());
                listener.onAdmitted(stamped);
                delta++;
            }

            stagnant = delta > 0 ? 0 : stagnant + 1;
            if (delta > 0) {
                LOG.info("Round {}: +{} new (total {})", round, delta, admitted.size());
            } else {
                LOG.info("Round {}: 0 new (stagnant={})", round, stagnant);
            }
            post(new RoundCompletedEvent(source, round, delta, admitted.size(), stagnant));

            next = evaluateStop(options, admitted.size(), stagnant, round);
        }

        state = next;
        LOG.info("Paging {} finished: {} after {} rounds, {} new items", source, next, round, admitted.size());
        post(new PaginationFinishedEvent(source, next, round, admitted.size()));
        return new PaginationResult(next, admitted, round);
    }

    private List<CandidateRef> fetchBatch(Collector collector, RoundContext context) {
        try {
            List<CandidateRef> batch = collector.nextBatch(source, context);
            return batch == null ? List.of() : batch;
        } catch (CollectionException e) {
            LOG.warn("Round {}: batch request failed: {}", context.round(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Round {}: collector failed", context.round(), e);
        }
        return List.of();
    }

    /**
     * Applies the stop rules in priority order.
     *
     * @return the terminal state, or {@link PaginationState#COLLECTING} to
     *         continue
     */
    static PaginationState evaluateStop(PaginationOptions options, int totalAdmitted, int stagnant, int round) {
        if (options.mode() == PaginationMode.BOUNDED && totalAdmitted >= options.targetNewCount()) {
            return PaginationState.STOPPING_TARGET_MET;
        }
        if (stagnant >= options.stagnationLimit()) {
            return PaginationState.STOPPING_STAGNANT;
        }
        if (round >= options.roundCap()) {
            return PaginationState.STOPPING_CAPPED;
        }
        return PaginationState.COLLECTING;
    }

    private void post(Object event) {
        if (eventBus != null) {
            eventBus.post(event);
        }
    }

    /** Requests the run to stop before its next round. */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOG.info("Cancellation requested for {}", source);
        }
    }

    public PaginationState state() {
        return state;
    }
}
