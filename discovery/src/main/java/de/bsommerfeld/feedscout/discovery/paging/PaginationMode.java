package de.bsommerfeld.feedscout.discovery.paging;

/**
 * Whether a run may stop as soon as it collected enough new items.
 */
public enum PaginationMode {
    /** Stop once the target count of new items is reached. */
    BOUNDED,
    /** Ignore the target; page until stagnation or the round cap. */
    EXHAUSTIVE
}
