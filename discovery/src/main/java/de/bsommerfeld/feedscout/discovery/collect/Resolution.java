package de.bsommerfeld.feedscout.discovery.collect;

import de.bsommerfeld.feedscout.core.domain.CandidateRef;
import de.bsommerfeld.feedscout.core.domain.RawFields;

/**
 * Outcome of one detail fetch. {@code fields} is {@code null} when the
 * candidate could not be resolved.
 */
public record Resolution(CandidateRef ref, RawFields fields) {

    public boolean isResolved() {
        return fields != null;
    }
}
