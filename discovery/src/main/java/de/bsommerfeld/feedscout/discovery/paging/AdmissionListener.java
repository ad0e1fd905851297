package de.bsommerfeld.feedscout.discovery.paging;

import de.bsommerfeld.feedscout.core.domain.CandidateRef;

/**
 * Notified once per newly admitted reference, after it entered the in-run
 * seen set and the dedup store.
 */
@FunctionalInterface
public interface AdmissionListener {

    AdmissionListener NONE = ref -> {
    };

    void onAdmitted(CandidateRef ref);
}
