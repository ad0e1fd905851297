package de.bsommerfeld.feedscout.discovery.rank;

import de.bsommerfeld.feedscout.core.domain.ContentRecord;

import java.time.Instant;
import java.util.Comparator;

/**
 * Sort orders for admitted records.
 */
public enum RankingStrategy {

    /** Newest first. Records without timestamp sort last. */
    CHRONOLOGICAL(newestFirst()),

    /**
     * Highest engagement score first, recomputed from likes and comments;
     * ties go to the more recent record. Records without metrics score 0.
     */
    ENGAGEMENT(Comparator.comparingLong(ContentRecord::engagementScore).reversed()
            .thenComparing(newestFirst()));

    private final Comparator<ContentRecord> comparator;

    RankingStrategy(Comparator<ContentRecord> comparator) {
        this.comparator = comparator;
    }

    public Comparator<ContentRecord> comparator() {
        return comparator;
    }

    private static Comparator<ContentRecord> newestFirst() {
        return Comparator.comparing(ContentRecord::timestamp,
                Comparator.nullsLast(Comparator.<Instant>reverseOrder()));
    }
}
