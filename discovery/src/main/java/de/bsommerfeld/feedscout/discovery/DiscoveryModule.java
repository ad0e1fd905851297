package de.bsommerfeld.feedscout.discovery;

import com.google.inject.AbstractModule;
import de.bsommerfeld.feedscout.core.config.ApplicationMode;
import de.bsommerfeld.feedscout.core.config.ConfigLoader;
import de.bsommerfeld.feedscout.core.config.DiscoveryConfig;
import de.bsommerfeld.feedscout.core.config.GlobalConfig;
import de.bsommerfeld.feedscout.core.config.NormalizerConfig;
import de.bsommerfeld.feedscout.core.config.TopicConfig;
import de.bsommerfeld.feedscout.core.util.StorageUtils;
import de.bsommerfeld.feedscout.db.DedupStore;
import de.bsommerfeld.feedscout.db.InMemoryDedupStore;
import de.bsommerfeld.feedscout.db.SqlDedupStore;
import de.bsommerfeld.feedscout.discovery.collect.CollectorSessionFactory;
import de.bsommerfeld.feedscout.discovery.synthetic.SyntheticSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice module wiring configuration, the dedup store and the collector
 * session factory.
 *
 * <p>
 * In {@link ApplicationMode#TEST} the store is in-memory and sessions are
 * synthetic, so nothing touches disk or network. In PROD the SQLite store is
 * bound and the embedding application supplies its own
 * {@link CollectorSessionFactory}.
 */
public class DiscoveryModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(DiscoveryModule.class);

    private final ApplicationMode mode;
    private final Path configPath;
    private final Class<? extends CollectorSessionFactory> sessionFactory;

    /** Uses {@link ApplicationMode#get()} and the default config location. */
    public DiscoveryModule(Class<? extends CollectorSessionFactory> sessionFactory) {
        this(ApplicationMode.get(), StorageUtils.getConfigFile(), sessionFactory);
    }

    /**
     * @param sessionFactory production session factory; ignored in TEST mode
     *                       and may then be {@code null}
     */
    public DiscoveryModule(ApplicationMode mode, Path configPath,
            Class<? extends CollectorSessionFactory> sessionFactory) {
        this.mode = mode;
        this.configPath = configPath;
        this.sessionFactory = sessionFactory;
    }

    @Override
    protected void configure() {
        GlobalConfig config;
        try {
            LOG.info("Loading Configuration from: {}", configPath.toAbsolutePath());
            config = ConfigLoader.load(configPath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load Application Configuration", e);
        }

        bind(GlobalConfig.class).toInstance(config);
        bind(DiscoveryConfig.class).toInstance(config.getDiscovery());
        bind(NormalizerConfig.class).toInstance(config.getNormalizer());
        bind(TopicConfig.class).toInstance(config.getTopics());
        bind(Clock.class).toInstance(Clock.systemUTC());

        LOG.info("Application Mode initialized: {}", mode);
        if (mode == ApplicationMode.TEST) {
            bind(DedupStore.class).to(InMemoryDedupStore.class);
            bind(CollectorSessionFactory.class).to(SyntheticSessionFactory.class);
        } else {
            if (sessionFactory == null) {
                throw new IllegalStateException("PROD mode requires a CollectorSessionFactory implementation");
            }
            bind(DedupStore.class).to(SqlDedupStore.class);
            bind(CollectorSessionFactory.class).to(sessionFactory);
        }
    }
}
