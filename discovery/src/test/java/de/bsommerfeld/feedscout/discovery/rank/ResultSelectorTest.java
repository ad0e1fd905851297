package de.bsommerfeld.feedscout.discovery.rank;

import de.bsommerfeld.feedscout.core.domain.ContentKind;
import de.bsommerfeld.feedscout.core.domain.ContentRecord;
import de.bsommerfeld.feedscout.core.domain.Metrics;
import de.bsommerfeld.feedscout.core.domain.SourceEntity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultSelectorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void engagement_shouldRankByRecomputedScoreRegardlessOfInputOrder() {
        ContentRecord a = record("A", T0, new Metrics(100, 10));
        ContentRecord b = record("B", T0, new Metrics(50, 30));

        assertEquals(List.of("B", "A"), ids(ResultSelector.select(List.of(a, b), RankingStrategy.ENGAGEMENT, 10)));
        assertEquals(List.of("B", "A"), ids(ResultSelector.select(List.of(b, a), RankingStrategy.ENGAGEMENT, 10)));
    }

    @Test
    void engagement_shouldKeepHugeCountsOnTop() {
        ContentRecord small = record("small", T0, new Metrics(5, 1));
        ContentRecord huge = record("huge", T0, new Metrics(Long.MAX_VALUE / 2, Long.MAX_VALUE / 2));

        assertEquals(List.of("huge", "small"),
                ids(ResultSelector.select(List.of(small, huge), RankingStrategy.ENGAGEMENT, 2)));
    }

    @Test
    void engagement_shouldBreakTiesByRecency() {
        ContentRecord older = record("older", T0, new Metrics(10, 0));
        ContentRecord newer = record("newer", T0.plusSeconds(60), new Metrics(10, 0));
        ContentRecord undated = record("undated", null, new Metrics(10, 0));

        List<ContentRecord> ranked = ResultSelector.select(List.of(undated, older, newer),
                RankingStrategy.ENGAGEMENT, 10);

        assertEquals(List.of("newer", "older", "undated"), ids(ranked));
    }

    @Test
    void engagement_shouldScoreMissingMetricsAsZero() {
        ContentRecord none = record("none", T0.plusSeconds(3600), null);
        ContentRecord some = record("some", T0, new Metrics(1, 0));

        assertEquals(List.of("some", "none"),
                ids(ResultSelector.select(List.of(none, some), RankingStrategy.ENGAGEMENT, 10)));
    }

    @Test
    void chronological_shouldSortNewestFirstWithUndatedLast() {
        ContentRecord first = record("1", T0, null);
        ContentRecord second = record("2", T0.plusSeconds(10), null);
        ContentRecord undated = record("u", null, null);

        assertEquals(List.of("2", "1", "u"),
                ids(ResultSelector.select(List.of(undated, first, second), RankingStrategy.CHRONOLOGICAL, 10)));
    }

    @Test
    void select_shouldNeverPad() {
        List<ContentRecord> three = List.of(record("a", T0, null), record("b", T0, null), record("c", T0, null));

        assertEquals(3, ResultSelector.select(three, RankingStrategy.CHRONOLOGICAL, 5).size());
    }

    @Test
    void select_shouldTruncateToN() {
        List<ContentRecord> records = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            records.add(record("r" + i, T0.plusSeconds(i), null));
        }

        List<ContentRecord> top = ResultSelector.select(records, RankingStrategy.CHRONOLOGICAL, 3);

        assertEquals(List.of("r9", "r8", "r7"), ids(top));
    }

    @Test
    void select_shouldBeStableForEqualKeys() {
        List<ContentRecord> records = List.of(record("x", T0, null), record("y", T0, null), record("z", T0, null));

        assertEquals(List.of("x", "y", "z"), ids(ResultSelector.select(records, RankingStrategy.CHRONOLOGICAL, 3)));
    }

    @Test
    void select_shouldReturnEmptyForEmptyInputOrZeroN() {
        assertTrue(ResultSelector.select(List.of(), RankingStrategy.ENGAGEMENT, 5).isEmpty());
        assertTrue(ResultSelector.select(List.of(record("a", T0, null)), RankingStrategy.ENGAGEMENT, 0).isEmpty());
    }

    @Test
    void select_shouldNotModifyInput() {
        List<ContentRecord> input = new ArrayList<>(List.of(record("old", T0, null),
                record("new", T0.plusSeconds(5), null)));

        ResultSelector.select(input, RankingStrategy.CHRONOLOGICAL, 2);

        assertEquals(List.of("old", "new"), ids(input));
    }

    private static List<String> ids(List<ContentRecord> records) {
        return records.stream().map(ContentRecord::id).toList();
    }

    private static ContentRecord record(String id, Instant timestamp, Metrics metrics) {
        return new ContentRecord(id, SourceEntity.category("pizza"), null, timestamp,
                timestamp == null ? null : timestamp.toString(), "", ContentKind.REEL, metrics, null, null);
    }
}
