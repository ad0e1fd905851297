package de.bsommerfeld.feedscout.discovery.output;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.feedscout.core.domain.ContentRecord;
import de.bsommerfeld.feedscout.core.domain.SourceEntity;
import de.bsommerfeld.feedscout.discovery.rank.RankingStrategy;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final output of a run: the top records of one source entity, ordered by
 * {@code strategy}. Never longer than {@code params.limit()}; empty is a
 * valid result.
 */
public record RankedResultSet(
        SourceEntity sourceEntity,
        Instant generatedAt,
        RankingStrategy strategy,
        RunParameters params,
        List<ContentRecord> records) {

    public RankedResultSet {
        records = List.copyOf(records);
        if (records.size() > Math.max(params.limit(), 0)) {
            throw new IllegalArgumentException(
                    "Result set holds " + records.size() + " records but the limit is " + params.limit());
        }
    }

    /**
     * Age of each ranked record at {@code generatedAt}, keyed by record id in
     * ranking order. Only engagement results carry it; {@code generatedAt} is
     * the instant their recency window was measured from.
     */
    @JsonProperty("ageHours")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Map<String, Double> ageHours() {
        if (strategy != RankingStrategy.ENGAGEMENT) {
            return null;
        }
        Map<String, Double> ages = new LinkedHashMap<>();
        for (ContentRecord record : records) {
            ages.put(record.id(), record.ageHours(generatedAt));
        }
        return ages;
    }

    public int size() {
        return records.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return records.isEmpty();
    }
}
