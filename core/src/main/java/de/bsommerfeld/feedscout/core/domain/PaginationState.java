package de.bsommerfeld.feedscout.core.domain;

/**
 * Lifecycle of a paging run. {@link #COLLECTING} is the only non-terminal
 * state; once a run leaves it, it never transitions again.
 */
public enum PaginationState {

    COLLECTING,
    /** Bounded run collected at least the requested number of new items. */
    STOPPING_TARGET_MET,
    /** Too many consecutive rounds produced nothing new. */
    STOPPING_STAGNANT,
    /** The round cap was reached. */
    STOPPING_CAPPED,
    /** The caller cancelled the run between two rounds. */
    STOPPING_CANCELLED;

    public boolean isTerminal() {
        return this != COLLECTING;
    }
}
