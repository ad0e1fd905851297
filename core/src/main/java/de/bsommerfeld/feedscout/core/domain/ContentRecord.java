package de.bsommerfeld.feedscout.core.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Canonical, normalized representation of one content item. Built once per
 * resolved candidate and never mutated afterwards.
 *
 * <p>
 * Absent values are {@code null}, never a substitute. In particular a record
 * whose timestamp could not be parsed keeps {@code timestamp == null}; the
 * admission filters decide what happens to it.
 *
 * @param id            item identifier (the URL it was discovered under)
 * @param sourceEntity  the entity whose run produced this record
 * @param shortcode     short item code extracted from the URL, or {@code null}
 * @param timestamp     parsed publication instant, or {@code null}
 * @param timestampText publication time in the exact lexical form the source
 *                      delivered, or {@code null}
 * @param rawText       cleaned caption/page text, never {@code null}
 * @param kind          item format
 * @param metrics       engagement counters, {@code null} when neither
 *                      counter could be read
 * @param hashtags      lower-cased hashtags, sorted
 * @param audioName     audio track name, or {@code null}
 */
public record ContentRecord(
        String id,
        SourceEntity sourceEntity,
        String shortcode,
        Instant timestamp,
        String timestampText,
        String rawText,
        ContentKind kind,
        Metrics metrics,
        Set<String> hashtags,
        String audioName) {

    public ContentRecord {
        rawText = rawText == null ? "" : rawText;
        kind = kind == null ? ContentKind.UNKNOWN : kind;
        hashtags = hashtags == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(hashtags));
    }

    /** Engagement score, {@code 0} when the record carries no metrics. */
    public long engagementScore() {
        return metrics == null ? 0 : metrics.engagementScore();
    }

    /**
     * Age relative to {@code now} in hours, rounded to two decimals. Negative
     * for timestamps in the future.
     *
     * @return the age, or {@code null} when the timestamp is absent
     */
    public Double ageHours(Instant now) {
        if (timestamp == null) {
            return null;
        }
        double hours = Duration.between(timestamp, now).toMillis() / 3_600_000d;
        return Math.round(hours * 100) / 100d;
    }
}
