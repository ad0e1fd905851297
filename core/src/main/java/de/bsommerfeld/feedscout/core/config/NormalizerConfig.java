package de.bsommerfeld.feedscout.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Text cleanup rules applied to scraped page text.
 */
public class NormalizerConfig {

    /** Case-insensitive regular expressions removed from page text. */
    @JsonProperty("boilerplate-patterns")
    private List<String> boilerplatePatterns = List.of(
            "Sorry, we're having trouble playing this video\\.?",
            "Learn more",
            "Original audio",
            "View all [0-9]+ replies",
            "View replies",
            "See translation",
            "Hide all replies",
            "Meta.*",
            "Privacy.*",
            "Terms.*",
            "Instagram Lite.*",
            "Threads.*",
            "Follow [A-Za-z0-9_.]+");

    /** Footer markers; downstream text is cut at the first one found. */
    @JsonProperty("cut-markers")
    private List<String> cutMarkers = List.of(
            "More posts from",
            "About Blog Jobs Help",
            "Instagram from",
            "Uploading & Non-Users",
            "Privacy Terms",
            "Meta ©");

    /** Maximum characters handed to downstream consumers (default: 4000). */
    @JsonProperty("downstream-max-length")
    private int downstreamMaxLength = 4000;

    public List<String> getBoilerplatePatterns() {
        return boilerplatePatterns;
    }

    public void setBoilerplatePatterns(List<String> boilerplatePatterns) {
        this.boilerplatePatterns = boilerplatePatterns;
    }

    public List<String> getCutMarkers() {
        return cutMarkers;
    }

    public int getDownstreamMaxLength() {
        return downstreamMaxLength;
    }
}
