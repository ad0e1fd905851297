package de.bsommerfeld.feedscout.discovery.synthetic;

import com.google.inject.Singleton;
import de.bsommerfeld.feedscout.discovery.DiscoveryRequest;
import de.bsommerfeld.feedscout.discovery.collect.Collector;
import de.bsommerfeld.feedscout.discovery.collect.CollectorSession;
import de.bsommerfeld.feedscout.discovery.collect.CollectorSessionFactory;
import de.bsommerfeld.feedscout.discovery.collect.DetailFetcher;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Offline stand-in for a real collector backend, bound in TEST mode.
 *
 * <p>
 * No browser and no network: every session serves a {@link SyntheticFeed}
 * derived from the requested source, so the full pipeline (paging, dedup,
 * detail pool, filters, ranking, output) runs unchanged.
 */
@Singleton
public class SyntheticSessionFactory implements CollectorSessionFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SyntheticSessionFactory.class);

    static final int FEED_SIZE = 60;

    private final Clock clock;

    @Inject
    public SyntheticSessionFactory(Clock clock) {
        this.clock = clock;
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Collectors are DISABLED         #");
        LOG.warn("#  Using Synthetic Feeds for all Sources              #");
        LOG.warn("#######################################################");
    }

    @Override
    public CollectorSession open(DiscoveryRequest request) {
        LOG.debug("[TEST] Opening synthetic session for {}", request.source());
        SyntheticFeed feed = new SyntheticFeed(request.source(), clock.instant(), FEED_SIZE, request.hashtags());
        return new CollectorSession() {
            @Override
            public Collector collector() {
                return feed;
            }

            @Override
            public DetailFetcher detailFetcher() {
                return feed;
            }

            @Override
            public void close() {
                LOG.debug("[TEST] Closing synthetic session for {}", request.source());
            }
        };
    }
}
