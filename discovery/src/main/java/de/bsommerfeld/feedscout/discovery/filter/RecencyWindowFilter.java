package de.bsommerfeld.feedscout.discovery.filter;

import de.bsommerfeld.feedscout.core.domain.ContentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Keeps only records published within the last {@code maxAgeHours} hours.
 *
 * <p>
 * The window is inclusive: a record exactly {@code maxAgeHours} old is kept.
 * Records without a timestamp have unknown age and are dropped. Timestamps
 * in the future (clock skew) have a negative age and are kept.
 */
public class RecencyWindowFilter implements AdmissionFilter {

    private static final Logger LOG = LoggerFactory.getLogger(RecencyWindowFilter.class);

    private final Instant now;
    private final Duration maxAge;

    public RecencyWindowFilter(Instant now, int maxAgeHours) {
        if (maxAgeHours < 0) {
            throw new IllegalArgumentException("maxAgeHours must not be negative, was " + maxAgeHours);
        }
        this.now = now;
        this.maxAge = Duration.ofHours(maxAgeHours);
    }

    @Override
    public boolean admits(ContentRecord record) {
        if (record.timestamp() == null) {
            LOG.debug("Skipping {}: no timestamp (unknown age)", record.id());
            return false;
        }
        Duration age = Duration.between(record.timestamp(), now);
        if (age.compareTo(maxAge) > 0) {
            LOG.debug("Skipping {}: too old ({}h > {}h)", record.id(), age.toHours(), maxAge.toHours());
            return false;
        }
        return true;
    }
}
