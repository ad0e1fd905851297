package de.bsommerfeld.feedscout.discovery.collect;

import com.google.inject.Singleton;
import de.bsommerfeld.feedscout.core.config.TopicConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves a business category to the hashtags a trend run scans.
 * Unknown categories fall back to the generic preset.
 */
@Singleton
public class TopicCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(TopicCatalog.class);

    private final Map<String, List<String>> presets;

    @Inject
    public TopicCatalog(TopicConfig config) {
        this.presets = Map.copyOf(config.getHashtags());
    }

    public List<String> hashtagsFor(String category) {
        String key = category == null ? "" : category.strip().toLowerCase(Locale.ROOT);
        List<String> tags = presets.get(key);
        if (tags != null && !tags.isEmpty()) {
            return List.copyOf(tags);
        }
        LOG.warn("Unknown category '{}', using generic hashtags.", category);
        return List.copyOf(presets.getOrDefault(TopicConfig.GENERIC_KEY, List.of()));
    }

    public boolean isKnown(String category) {
        return category != null && presets.containsKey(category.strip().toLowerCase(Locale.ROOT));
    }
}
