package de.bsommerfeld.feedscout.discovery.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import de.bsommerfeld.feedscout.discovery.paging.PaginationMode;

import java.util.List;

/**
 * Parameters a result set was produced with. Fields that do not apply to the
 * strategy are {@code null} and omitted from the JSON output.
 *
 * @param mode           paging mode
 * @param targetNewCount new items requested (bounded runs)
 * @param maxAgeHours    recency window (engagement runs)
 * @param limit          requested result size N
 * @param hashtagsUsed   hashtags scanned (category sources)
 * @param dryRun         whether the dedup store was bypassed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunParameters(
        PaginationMode mode,
        Integer targetNewCount,
        Integer maxAgeHours,
        int limit,
        List<String> hashtagsUsed,
        boolean dryRun) {

    public RunParameters {
        hashtagsUsed = hashtagsUsed == null ? null : List.copyOf(hashtagsUsed);
    }
}
