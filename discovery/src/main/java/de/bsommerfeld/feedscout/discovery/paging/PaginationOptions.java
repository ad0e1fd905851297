package de.bsommerfeld.feedscout.discovery.paging;

import java.util.Objects;

/**
 * Stop-rule parameters of one paging run.
 *
 * @param mode            bounded or exhaustive paging
 * @param targetNewCount  new items wanted; only consulted in
 *                        {@link PaginationMode#BOUNDED} mode
 * @param stagnationLimit consecutive zero-delta rounds that end the run
 * @param roundCap        maximum number of rounds
 */
public record PaginationOptions(PaginationMode mode, int targetNewCount, int stagnationLimit, int roundCap) {

    public static final int DEFAULT_STAGNATION_LIMIT = 5;
    public static final int DEFAULT_ROUND_CAP = 200;

    public PaginationOptions {
        Objects.requireNonNull(mode, "mode");
        if (stagnationLimit < 1) {
            throw new IllegalArgumentException("stagnationLimit must be at least 1, was " + stagnationLimit);
        }
        if (roundCap < 1) {
            throw new IllegalArgumentException("roundCap must be at least 1, was " + roundCap);
        }
    }

    public static PaginationOptions bounded(int targetNewCount) {
        return new PaginationOptions(PaginationMode.BOUNDED, targetNewCount, DEFAULT_STAGNATION_LIMIT,
                DEFAULT_ROUND_CAP);
    }

    public static PaginationOptions exhaustive() {
        return new PaginationOptions(PaginationMode.EXHAUSTIVE, 0, DEFAULT_STAGNATION_LIMIT, DEFAULT_ROUND_CAP);
    }

    public PaginationOptions withLimits(int stagnationLimit, int roundCap) {
        return new PaginationOptions(mode, targetNewCount, stagnationLimit, roundCap);
    }
}
