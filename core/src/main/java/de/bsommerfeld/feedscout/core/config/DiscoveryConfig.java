package de.bsommerfeld.feedscout.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Paging and ranking defaults. Values are persisted in config.toml and
 * loaded at startup; setters only exist for tests and programmatic overrides.
 */
public class DiscoveryConfig {

    /** New items to collect per profile run (default: 30). */
    @JsonProperty("target-new-count")
    private int targetNewCount = 30;

    /** Consecutive rounds without new items before paging stops (default: 5). */
    @JsonProperty("stagnation-limit")
    private int stagnationLimit = 5;

    /** Hard upper bound on paging rounds per run (default: 200). */
    @JsonProperty("round-cap")
    private int roundCap = 200;

    /** Worker threads resolving item details (default: 4). */
    @JsonProperty("fetch-parallelism")
    private int fetchParallelism = 4;

    /** Items kept after ranking a trend run (default: 40). */
    @JsonProperty("trend-max-results")
    private int trendMaxResults = 40;

    /** Recency window for trend runs in hours (default: 72). */
    @JsonProperty("max-age-hours")
    private int maxAgeHours = 72;

    public int getTargetNewCount() {
        return targetNewCount;
    }

    public void setTargetNewCount(int targetNewCount) {
        this.targetNewCount = targetNewCount;
    }

    public int getStagnationLimit() {
        return stagnationLimit;
    }

    public void setStagnationLimit(int stagnationLimit) {
        this.stagnationLimit = stagnationLimit;
    }

    public int getRoundCap() {
        return roundCap;
    }

    public void setRoundCap(int roundCap) {
        this.roundCap = roundCap;
    }

    public int getFetchParallelism() {
        return fetchParallelism;
    }

    public void setFetchParallelism(int fetchParallelism) {
        this.fetchParallelism = fetchParallelism;
    }

    public int getTrendMaxResults() {
        return trendMaxResults;
    }

    public int getMaxAgeHours() {
        return maxAgeHours;
    }

    public void setMaxAgeHours(int maxAgeHours) {
        this.maxAgeHours = maxAgeHours;
    }
}
