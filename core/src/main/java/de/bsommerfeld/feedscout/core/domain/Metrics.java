package de.bsommerfeld.feedscout.core.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Engagement counters of a content item. The engagement score is derived
 * from the counters on every call and is never stored on its own.
 *
 * @param likes    like count, {@code 0} when only the comment count was known
 * @param comments comment count, {@code 0} when only the like count was known
 */
public record Metrics(long likes, long comments) {

    /** Weight of a single comment relative to a single like. */
    public static final int COMMENT_WEIGHT = 3;

    public Metrics {
        if (likes < 0 || comments < 0) {
            throw new IllegalArgumentException("Counts must not be negative");
        }
    }

    /** Saturates at {@link Long#MAX_VALUE} instead of overflowing. */
    @JsonProperty("engagementScore")
    public long engagementScore() {
        if (comments > (Long.MAX_VALUE - likes) / COMMENT_WEIGHT) {
            return Long.MAX_VALUE;
        }
        return likes + COMMENT_WEIGHT * comments;
    }
}
