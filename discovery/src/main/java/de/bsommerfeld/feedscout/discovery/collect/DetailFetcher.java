package de.bsommerfeld.feedscout.discovery.collect;

import de.bsommerfeld.feedscout.core.domain.CandidateRef;
import de.bsommerfeld.feedscout.core.domain.RawFields;

/**
 * Resolves a candidate reference to its raw fields. Called concurrently from
 * the detail worker pool when the configured parallelism exceeds one, so
 * implementations must be thread-safe in that case. Retry and backoff belong
 * here, not in the engine.
 */
public interface DetailFetcher {

    /**
     * @throws DetailFetchException if the item cannot be resolved
     */
    RawFields fetch(CandidateRef ref) throws DetailFetchException;
}
