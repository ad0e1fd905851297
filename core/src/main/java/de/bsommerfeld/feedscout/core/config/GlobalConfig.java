package de.bsommerfeld.feedscout.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Every section falls back to its defaults when
 * missing from the file.
 */
public class GlobalConfig {

    /** Paging and ranking settings. */
    @JsonProperty("discovery")
    private DiscoveryConfig discovery = new DiscoveryConfig();

    /** Text cleanup settings. */
    @JsonProperty("normalizer")
    private NormalizerConfig normalizer = new NormalizerConfig();

    /** Trend category presets. */
    @JsonProperty("topics")
    private TopicConfig topics = new TopicConfig();

    public DiscoveryConfig getDiscovery() {
        return discovery;
    }

    public NormalizerConfig getNormalizer() {
        return normalizer;
    }

    public TopicConfig getTopics() {
        return topics;
    }
}
