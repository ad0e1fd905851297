package de.bsommerfeld.feedscout.core.event;

import de.bsommerfeld.feedscout.core.domain.PaginationState;
import de.bsommerfeld.feedscout.core.domain.SourceEntity;

/**
 * Progress events published while a discovery run is paging.
 */
public class DiscoveryEvents {

    /**
     * Fired after every paging round.
     *
     * @param delta         items newly admitted in this round
     * @param totalAdmitted items admitted so far in the run
     * @param stagnant      current streak of zero-delta rounds
     */
    public record RoundCompletedEvent(SourceEntity source, int round, int delta, int totalAdmitted,
            int stagnant) {
    }

    public record PaginationFinishedEvent(SourceEntity source, PaginationState state, int rounds,
            int totalAdmitted) {
    }
}
