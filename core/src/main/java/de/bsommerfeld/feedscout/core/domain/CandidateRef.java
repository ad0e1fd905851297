package de.bsommerfeld.feedscout.core.domain;

/**
 * Unresolved reference to a content item discovered while paging.
 * Lives only for the duration of a run.
 *
 * @param id    the item identifier, usually its absolute URL
 * @param round 1-based index of the paging round that surfaced it
 */
public record CandidateRef(String id, int round) {

    public CandidateRef {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Candidate id must not be blank");
        }
    }
}
