package de.bsommerfeld.feedscout.discovery;

import de.bsommerfeld.feedscout.core.domain.SourceEntity;
import de.bsommerfeld.feedscout.discovery.paging.PaginationMode;
import de.bsommerfeld.feedscout.discovery.paging.PaginationOptions;
import de.bsommerfeld.feedscout.discovery.rank.RankingStrategy;

import java.util.List;
import java.util.Objects;

/**
 * Everything one run needs to know besides its collaborators.
 *
 * @param source      entity to page through
 * @param strategy    ranking strategy; also selects the admission filter
 * @param paging      stop-rule parameters
 * @param limit       maximum number of records in the result (N)
 * @param maxAgeHours recency window, required for
 *                    {@link RankingStrategy#ENGAGEMENT}
 * @param hashtags    hashtags to scan for category sources, empty otherwise
 * @param dryRun      bypass the persistent dedup store: start from an empty
 *                    snapshot and persist nothing
 */
public record DiscoveryRequest(
        SourceEntity source,
        RankingStrategy strategy,
        PaginationOptions paging,
        int limit,
        Integer maxAgeHours,
        List<String> hashtags,
        boolean dryRun) {

    public DiscoveryRequest {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(paging, "paging");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative, was " + limit);
        }
        if (strategy == RankingStrategy.ENGAGEMENT && maxAgeHours == null) {
            throw new IllegalArgumentException("Engagement ranking requires maxAgeHours");
        }
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
    }

    /**
     * Newest posts of a profile. In bounded mode the run stops once
     * {@code posts} new items were found; the result keeps the newest
     * {@code posts} non-pinned ones.
     */
    public static DiscoveryRequest profile(String handle, int posts, PaginationMode mode) {
        PaginationOptions paging = mode == PaginationMode.BOUNDED
                ? PaginationOptions.bounded(posts)
                : PaginationOptions.exhaustive();
        return new DiscoveryRequest(SourceEntity.handle(handle), RankingStrategy.CHRONOLOGICAL, paging, posts,
                null, List.of(), false);
    }

    /**
     * Most engaging recent items of a category, paged exhaustively and
     * restricted to the last {@code maxAgeHours} hours.
     */
    public static DiscoveryRequest trends(String category, int maxResults, int maxAgeHours) {
        return new DiscoveryRequest(SourceEntity.category(category), RankingStrategy.ENGAGEMENT,
                PaginationOptions.exhaustive(), maxResults, maxAgeHours, List.of(), false);
    }

    public DiscoveryRequest withPagingLimits(int stagnationLimit, int roundCap) {
        return new DiscoveryRequest(source, strategy, paging.withLimits(stagnationLimit, roundCap), limit,
                maxAgeHours, hashtags, dryRun);
    }

    public DiscoveryRequest withHashtags(List<String> hashtags) {
        return new DiscoveryRequest(source, strategy, paging, limit, maxAgeHours, hashtags, dryRun);
    }

    public DiscoveryRequest withDryRun(boolean dryRun) {
        return new DiscoveryRequest(source, strategy, paging, limit, maxAgeHours, hashtags, dryRun);
    }
}
