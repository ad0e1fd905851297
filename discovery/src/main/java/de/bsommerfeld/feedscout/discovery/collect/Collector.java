package de.bsommerfeld.feedscout.discovery.collect;

import de.bsommerfeld.feedscout.core.domain.CandidateRef;
import de.bsommerfeld.feedscout.core.domain.SourceEntity;

import java.util.List;

/**
 * Paging side of a content source. Any mechanism (cursor API, offset pages,
 * an infinitely scrolling grid) can sit behind this interface.
 *
 * <p>
 * Batches may overlap: a scrolling grid typically returns everything that is
 * currently visible, including items already returned in earlier rounds. The
 * controller filters those out.
 */
public interface Collector {

    /**
     * Returns the next batch of candidate references, in source order.
     * An empty list means "nothing new visible yet", not necessarily that the
     * source is exhausted.
     *
     * @throws CollectionException if the batch could not be obtained
     */
    List<CandidateRef> nextBatch(SourceEntity source, RoundContext context) throws CollectionException;
}
