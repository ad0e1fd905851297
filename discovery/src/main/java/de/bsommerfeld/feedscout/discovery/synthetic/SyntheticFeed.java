package de.bsommerfeld.feedscout.discovery.synthetic;

import de.bsommerfeld.feedscout.core.domain.CandidateRef;
import de.bsommerfeld.feedscout.core.domain.RawFields;
import de.bsommerfeld.feedscout.core.domain.SourceEntity;
import de.bsommerfeld.feedscout.discovery.collect.Collector;
import de.bsommerfeld.feedscout.discovery.collect.DetailFetchException;
import de.bsommerfeld.feedscout.discovery.collect.DetailFetcher;
import de.bsommerfeld.feedscout.discovery.collect.RoundContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Deterministic fake of a scrolling content grid.
 *
 * <h3>Grid behaviour</h3>
 * Each round reveals {@value #PAGE_SIZE} more items and returns everything
 * visible so far, like a real grid after one more scroll. Once all
 * {@code size} items are visible the batches stop growing, so paging ends
 * in stagnation unless a target is met first.
 *
 * <h3>Item shapes</h3>
 * Items are spaced three hours apart going back from {@code now}. The first
 * item imitates a pinned post: it is old and its timestamp carries a
 * {@code +02:00} offset instead of {@code Z}. Every third item is a reel.
 * Counters use the display formats seen in the wild ({@code "1.2K"},
 * {@code "12,345"}). The same source and seed always produce the same feed.
 */
public class SyntheticFeed implements Collector, DetailFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(SyntheticFeed.class);

    static final int PAGE_SIZE = 12;
    private static final Duration SPACING = Duration.ofHours(3);

    private final Map<String, RawFields> items = new LinkedHashMap<>();

    public SyntheticFeed(SourceEntity source, Instant now, int size, List<String> hashtags) {
        Random random = new Random(source.key().hashCode());
        String prefix = "SYN" + Integer.toHexString(source.key().hashCode() & 0xfffff).toUpperCase(Locale.ROOT);
        List<String> tags = hashtags == null || hashtags.isEmpty() ? List.of("synthetic") : hashtags;

        for (int i = 0; i < size; i++) {
            String type = i % 3 == 2 ? "reel" : "p";
            String url = "https://www.instagram.com/" + type + "/" + prefix + "x" + i + "/";
            String timestamp = i == 0
                    ? now.minus(Duration.ofDays(90)).atOffset(ZoneOffset.ofHours(2))
                            .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                    : DateTimeFormatter.ISO_INSTANT.format(now.minus(SPACING.multipliedBy(i)));
            long likes = random.nextInt(20_000);
            long comments = random.nextInt(500);
            String tag = tags.get(i % tags.size());
            tag = tag.startsWith("#") ? tag : "#" + tag;
            String caption = "Synthetic item " + i + " of " + source.name() + " " + tag;

            items.put(url, new RawFields(url, timestamp,
                    caption + "\nLog in\nSign up\n" + comments + " comments",
                    caption,
                    i % 3 == 2 ? "Original audio" : null,
                    formatCount(likes),
                    null));
        }
    }

    static String formatCount(long value) {
        if (value >= 10_000) {
            return String.format(Locale.ROOT, "%,d", value);
        }
        if (value >= 1_000) {
            return String.format(Locale.ROOT, "%.1fK", value / 1000.0);
        }
        return Long.toString(value);
    }

    @Override
    public List<CandidateRef> nextBatch(SourceEntity source, RoundContext context) {
        int visible = Math.min(context.round() * PAGE_SIZE, items.size());
        LOG.debug("[TEST] Round {}: {} items visible for {}", context.round(), visible, source);
        List<CandidateRef> batch = new ArrayList<>(visible);
        for (String id : items.keySet()) {
            if (batch.size() == visible) {
                break;
            }
            batch.add(context.ref(id));
        }
        return batch;
    }

    @Override
    public RawFields fetch(CandidateRef ref) throws DetailFetchException {
        RawFields fields = items.get(ref.id());
        if (fields == null) {
            throw new DetailFetchException("Unknown synthetic item " + ref.id());
        }
        return fields;
    }

    public int size() {
        return items.size();
    }
}
