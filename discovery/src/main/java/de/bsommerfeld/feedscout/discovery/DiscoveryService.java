package de.bsommerfeld.feedscout.discovery;

import com.google.inject.Singleton;
import de.bsommerfeld.feedscout.core.config.DiscoveryConfig;
import de.bsommerfeld.feedscout.core.domain.SourceEntity;
import de.bsommerfeld.feedscout.discovery.collect.CollectionException;
import de.bsommerfeld.feedscout.discovery.collect.CollectorSession;
import de.bsommerfeld.feedscout.discovery.collect.CollectorSessionFactory;
import de.bsommerfeld.feedscout.discovery.collect.TopicCatalog;
import de.bsommerfeld.feedscout.discovery.paging.PaginationMode;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for embedding applications. Turns the two supported run kinds
 * into {@link DiscoveryRequest}s filled from {@link DiscoveryConfig}, opens a
 * {@link CollectorSession} for each run and closes it afterwards.
 */
@Singleton
public class DiscoveryService {

    private static final Logger LOG = LoggerFactory.getLogger(DiscoveryService.class);

    private final DiscoveryEngine engine;
    private final CollectorSessionFactory sessions;
    private final DiscoveryConfig config;
    private final TopicCatalog topics;

    @Inject
    public DiscoveryService(DiscoveryEngine engine, CollectorSessionFactory sessions, DiscoveryConfig config,
            TopicCatalog topics) {
        this.engine = engine;
        this.sessions = sessions;
        this.config = config;
        this.topics = topics;
    }

    /**
     * Newest posts of {@code handle}, at most {@code posts} of them. A
     * {@code null} post count uses the configured target.
     */
    public RunReport discoverProfile(String handle, Integer posts, PaginationMode mode, boolean dryRun)
            throws CollectionException {
        return run(profileRequest(handle, posts, mode).withDryRun(dryRun));
    }

    /** Most engaging recent items of {@code category}. */
    public RunReport discoverTrends(String category, boolean dryRun) throws CollectionException {
        return run(trendRequest(category).withDryRun(dryRun));
    }

    public DiscoveryRequest profileRequest(String handle, Integer posts, PaginationMode mode) {
        int count = posts != null ? posts : config.getTargetNewCount();
        return DiscoveryRequest.profile(handle, count, mode)
                .withPagingLimits(config.getStagnationLimit(), config.getRoundCap());
    }

    public DiscoveryRequest trendRequest(String category) {
        return DiscoveryRequest.trends(category, config.getTrendMaxResults(), config.getMaxAgeHours())
                .withPagingLimits(config.getStagnationLimit(), config.getRoundCap())
                .withHashtags(topics.hashtagsFor(category));
    }

    /**
     * Executes {@code request} inside a freshly opened session.
     *
     * @throws CollectionException if the session cannot be opened
     */
    public RunReport run(DiscoveryRequest request) throws CollectionException {
        SourceEntity source = request.source();
        LOG.info("Opening collector session for {}", source);
        try (CollectorSession session = sessions.open(request)) {
            return engine.run(request, session);
        }
    }
}
