package de.bsommerfeld.feedscout.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDefaultsTest {

    @Test
    void discoveryConfig_shouldHaveDocumentedDefaults() {
        DiscoveryConfig config = new DiscoveryConfig();
        assertEquals(30, config.getTargetNewCount());
        assertEquals(5, config.getStagnationLimit());
        assertEquals(200, config.getRoundCap());
        assertEquals(4, config.getFetchParallelism());
        assertEquals(40, config.getTrendMaxResults());
        assertEquals(72, config.getMaxAgeHours());
    }

    @Test
    void normalizerConfig_shouldShipBoilerplateAndMarkers() {
        NormalizerConfig config = new NormalizerConfig();
        assertTrue(config.getBoilerplatePatterns().contains("Learn more"));
        assertTrue(config.getCutMarkers().contains("More posts from"));
        assertEquals(4000, config.getDownstreamMaxLength());
    }

    @Test
    void topicConfig_shouldContainGenericFallbackAndCategories() {
        TopicConfig config = new TopicConfig();
        assertTrue(config.getHashtags().containsKey(TopicConfig.GENERIC_KEY));
        assertTrue(config.getHashtags().containsKey("restaurant"));
        assertTrue(config.getHashtags().containsKey("fashion_store"));
        assertEquals(18, config.getHashtags().size());
    }

    @Test
    void globalConfig_shouldHaveAllSections() {
        GlobalConfig config = new GlobalConfig();
        assertNotNull(config.getDiscovery());
        assertNotNull(config.getNormalizer());
        assertNotNull(config.getTopics());
    }
}
