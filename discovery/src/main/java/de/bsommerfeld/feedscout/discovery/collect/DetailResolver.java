package de.bsommerfeld.feedscout.discovery.collect;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.bsommerfeld.feedscout.core.domain.CandidateRef;
import de.bsommerfeld.feedscout.core.domain.RawFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Bounded worker pool resolving admitted candidates while paging continues.
 *
 * <h3>Ordering</h3>
 * Candidates are submitted in admission order and {@link #awaitAll()} returns
 * the outcomes in that same order, regardless of which fetch finished first.
 *
 * <h3>Failure isolation</h3>
 * A {@link DetailFetchException}, a runtime exception or a {@code null}
 * result from the fetcher marks only that candidate as unresolved.
 *
 * <h3>Lifecycle</h3>
 * One resolver serves one run. {@link #close()} stops the pool; fetches that
 * are still queued at that point are abandoned.
 */
public class DetailResolver implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DetailResolver.class);

    private final DetailFetcher fetcher;
    private final ExecutorService pool;
    private final List<CompletableFuture<Resolution>> pending = new ArrayList<>();

    public DetailResolver(DetailFetcher fetcher, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        this.fetcher = fetcher;
        this.pool = Executors.newFixedThreadPool(parallelism, new ThreadFactoryBuilder()
                .setNameFormat("detail-fetch-%d")
                .setDaemon(true)
                .build());
    }

    /** Dispatches the fetch for {@code ref}. Must be called from a single thread. */
    public void submit(CandidateRef ref) {
        pending.add(CompletableFuture.supplyAsync(() -> resolve(ref), pool));
    }

    private Resolution resolve(CandidateRef ref) {
        try {
            RawFields fields = fetcher.fetch(ref);
            if (fields == null) {
                LOG.warn("Detail fetcher returned nothing for {}", ref.id());
            }
            return new Resolution(ref, fields);
        } catch (DetailFetchException e) {
            LOG.warn("Could not resolve {}: {}", ref.id(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Detail fetcher failed for {}", ref.id(), e);
        }
        return new Resolution(ref, null);
    }

    /** Number of fetches dispatched so far. */
    public int submitted() {
        return pending.size();
    }

    /**
     * Blocks until every submitted fetch has completed and returns the
     * outcomes in submission order.
     */
    public List<Resolution> awaitAll() {
        List<Resolution> outcomes = new ArrayList<>(pending.size());
        for (CompletableFuture<Resolution> future : pending) {
            outcomes.add(future.join());
        }
        return outcomes;
    }

    @Override
    public void close() {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Detail fetch pool did not terminate in time.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
