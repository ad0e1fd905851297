package de.bsommerfeld.feedscout.discovery.collect;

import de.bsommerfeld.feedscout.core.domain.CandidateRef;

/**
 * What a {@link Collector} knows about the run when asked for the next batch.
 *
 * @param round         1-based index of the round being requested
 * @param totalAdmitted items admitted in earlier rounds
 * @param stagnant      current streak of rounds without new items
 */
public record RoundContext(int round, int totalAdmitted, int stagnant) {

    /** Creates a reference stamped with this round. */
    public CandidateRef ref(String id) {
        return new CandidateRef(id, round);
    }
}
