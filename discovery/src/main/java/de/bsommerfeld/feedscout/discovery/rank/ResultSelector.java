package de.bsommerfeld.feedscout.discovery.rank;

import de.bsommerfeld.feedscout.core.domain.ContentRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Sorts survivors by a strategy and keeps the top {@code n}.
 */
public final class ResultSelector {

    private ResultSelector() {
    }

    /**
     * Returns the first {@code min(n, records.size())} records in comparator
     * order. The sort is stable, never pads, and yields an empty list when
     * nothing survived or {@code n <= 0}. The input list is not modified.
     */
    public static List<ContentRecord> select(List<ContentRecord> records, RankingStrategy strategy, int n) {
        if (records == null || records.isEmpty() || n <= 0) {
            return List.of();
        }
        List<ContentRecord> sorted = new ArrayList<>(records);
        sorted.sort(strategy.comparator());
        return List.copyOf(sorted.subList(0, Math.min(n, sorted.size())));
    }
}
