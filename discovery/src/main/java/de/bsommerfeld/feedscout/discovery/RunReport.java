package de.bsommerfeld.feedscout.discovery;

import de.bsommerfeld.feedscout.core.domain.CandidateRef;
import de.bsommerfeld.feedscout.core.domain.PaginationState;
import de.bsommerfeld.feedscout.discovery.output.RankedResultSet;

import java.util.List;

/**
 * Result of a run plus the bookkeeping needed to explain it.
 *
 * @param resultSet   ranked output, possibly empty
 * @param state       terminal paging state
 * @param rounds      paging rounds executed
 * @param admitted    newly admitted references in admission order
 * @param unresolved  admitted references whose details could not be fetched
 * @param filteredOut resolved records rejected by the admission filter
 */
public record RunReport(
        RankedResultSet resultSet,
        PaginationState state,
        int rounds,
        List<CandidateRef> admitted,
        List<CandidateRef> unresolved,
        int filteredOut) {

    public RunReport {
        admitted = List.copyOf(admitted);
        unresolved = List.copyOf(unresolved);
    }
}
