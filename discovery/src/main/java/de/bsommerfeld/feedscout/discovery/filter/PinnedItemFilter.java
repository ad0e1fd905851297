package de.bsommerfeld.feedscout.discovery.filter;

import de.bsommerfeld.feedscout.core.domain.ContentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * Excludes items that look pinned before a newest-first sort.
 *
 * <p>
 * Pinned items sit at the top of a profile grid regardless of age and tend
 * to carry a missing or non-UTC timestamp. The default detector therefore
 * treats every record as pinned unless its timestamp parsed and is written
 * in strict zero-offset form (ending in {@code Z}). This is a heuristic: a
 * genuine item published with an explicit offset is dropped as well. The
 * detector is pluggable so that better evidence can replace it without
 * touching the engine.
 */
public class PinnedItemFilter implements AdmissionFilter {

    private static final Logger LOG = LoggerFactory.getLogger(PinnedItemFilter.class);

    /** Pinned unless the timestamp is present and ends with {@code Z}. */
    public static final Predicate<ContentRecord> NON_UTC_TIMESTAMP = record -> record.timestamp() == null
            || record.timestampText() == null
            || !record.timestampText().endsWith("Z");

    private final Predicate<ContentRecord> pinnedDetector;

    public PinnedItemFilter() {
        this(NON_UTC_TIMESTAMP);
    }

    public PinnedItemFilter(Predicate<ContentRecord> pinnedDetector) {
        this.pinnedDetector = pinnedDetector;
    }

    @Override
    public boolean admits(ContentRecord record) {
        boolean pinned = pinnedDetector.test(record);
        if (pinned) {
            LOG.debug("Skipping likely pinned item {} (timestamp '{}')", record.id(), record.timestampText());
        }
        return !pinned;
    }
}
