package de.bsommerfeld.feedscout.discovery.paging;

import de.bsommerfeld.feedscout.core.domain.CandidateRef;
import de.bsommerfeld.feedscout.core.domain.PaginationState;

import java.util.List;

/**
 * @param state    terminal state the run ended in
 * @param admitted newly admitted references in admission order
 * @param rounds   number of rounds executed
 */
public record PaginationResult(PaginationState state, List<CandidateRef> admitted, int rounds) {

    public PaginationResult {
        admitted = List.copyOf(admitted);
    }
}
