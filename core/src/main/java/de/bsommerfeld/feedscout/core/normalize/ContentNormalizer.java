package de.bsommerfeld.feedscout.core.normalize;

import com.google.inject.Singleton;
import de.bsommerfeld.feedscout.core.config.NormalizerConfig;
import de.bsommerfeld.feedscout.core.domain.CandidateRef;
import de.bsommerfeld.feedscout.core.domain.ContentKind;
import de.bsommerfeld.feedscout.core.domain.ContentRecord;
import de.bsommerfeld.feedscout.core.domain.Metrics;
import de.bsommerfeld.feedscout.core.domain.RawFields;
import de.bsommerfeld.feedscout.core.domain.SourceEntity;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns raw scraped text into canonical values.
 *
 * <h3>Absent versus zero</h3>
 * Every parser in this class reports unparsable input as an empty
 * {@link Optional}/{@link OptionalLong}, never as {@code 0} or a fallback
 * instant. Callers must be able to tell "the page said 0 likes" apart from
 * "the like counter could not be read".
 *
 * <h3>Static versus instance methods</h3>
 * The parsers are pure static functions. Only {@link #cleanText} and
 * {@link #normalize} depend on configuration (boilerplate patterns, cut
 * markers, downstream length) and are therefore instance methods.
 */
@Singleton
public class ContentNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(ContentNormalizer.class);

    /** Appended by {@link #truncateForDownstream} after a hard cut. */
    public static final String TRUNCATION_MARKER = " ... [TRUNCATED]";

    private static final Pattern MANTISSA = Pattern.compile("\\d+(?:\\.\\d*)?|\\.\\d+");
    private static final Pattern HASHTAG = Pattern.compile("#\\w+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SHORTCODE = Pattern.compile("/(?:reel|p)/([^/?#]+)/");

    private final List<Pattern> boilerplate;
    private final List<String> cutMarkers;
    private final int downstreamMaxLength;

    @Inject
    public ContentNormalizer(NormalizerConfig config) {
        this.boilerplate = compile(config.getBoilerplatePatterns());
        this.cutMarkers = List.copyOf(config.getCutMarkers());
        this.downstreamMaxLength = config.getDownstreamMaxLength();
    }

    public ContentNormalizer() {
        this(new NormalizerConfig());
    }

    private static List<Pattern> compile(Collection<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        for (String pattern : patterns) {
            try {
                compiled.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                LOG.warn("Ignoring invalid boilerplate pattern '{}': {}", pattern, e.getDescription());
            }
        }
        return List.copyOf(compiled);
    }

    // =====================================================================
    // Counts
    // =====================================================================

    /**
     * Parses a displayed counter such as {@code "12,345"}, {@code "4.5M"} or
     * {@code "12k"}. Thousands separators are dropped, a trailing
     * case-insensitive {@code k}/{@code m} multiplies by 1,000/1,000,000, and
     * the product is truncated toward zero.
     *
     * @return the count, or empty for {@code null}, blank, unparsable or
     *         out-of-range text
     */
    public static OptionalLong parseCount(String text) {
        if (text == null) {
            return OptionalLong.empty();
        }
        String value = text.strip().toLowerCase(Locale.ROOT).replace(",", "");
        long multiplier = 1;
        if (value.endsWith("k")) {
            multiplier = 1_000;
            value = value.substring(0, value.length() - 1);
        } else if (value.endsWith("m")) {
            multiplier = 1_000_000;
            value = value.substring(0, value.length() - 1);
        }
        value = value.strip();
        // Double.parseDouble would also accept "NaN", "1e3" or "12d"
        if (!MANTISSA.matcher(value).matches()) {
            return OptionalLong.empty();
        }
        double product = Double.parseDouble(value) * multiplier;
        // a long cast would clamp silently
        if (!Double.isFinite(product) || product >= Long.MAX_VALUE) {
            LOG.debug("Count '{}' is out of range", text);
            return OptionalLong.empty();
        }
        return OptionalLong.of((long) product);
    }

    /**
     * Finds a counter directly followed by {@code label} in free text, e.g.
     * {@code extractLabeledCount("1,204 likes · 3 days ago", "likes")}
     * returns {@code 1204}. The label match is case-insensitive.
     */
    public static OptionalLong extractLabeledCount(String text, String label) {
        if (text == null || label == null || label.isBlank()) {
            return OptionalLong.empty();
        }
        Pattern pattern = Pattern.compile("([\\d.,]+[km]?)\\s+" + Pattern.quote(label.strip()),
                Pattern.CASE_INSENSITIVE);
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? parseCount(matcher.group(1)) : OptionalLong.empty();
    }

    // =====================================================================
    // Timestamps
    // =====================================================================

    /**
     * Parses an ISO-8601 date-time carrying either a {@code Z} suffix or an
     * explicit offset. Local date-times without zone information are
     * rejected because they cannot be placed on the timeline.
     *
     * @return the instant, or empty for missing or invalid text
     */
    public static Optional<Instant> parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(text.strip(), DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                    .toInstant());
        } catch (DateTimeParseException e) {
            LOG.debug("Unparsable timestamp '{}'", text);
            return Optional.empty();
        }
    }

    // =====================================================================
    // Text
    // =====================================================================

    /**
     * Returns all hashtags ({@code #} followed by word characters) in
     * lower case, deduplicated and sorted.
     */
    public static Set<String> extractHashtags(String text) {
        Set<String> tags = new TreeSet<>();
        if (text == null) {
            return tags;
        }
        Matcher matcher = HASHTAG.matcher(text);
        while (matcher.find()) {
            tags.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return tags;
    }

    /**
     * Removes configured boilerplate and collapses whitespace.
     *
     * <p>
     * The first pass runs on the raw text, so line-anchored patterns such as
     * {@code Privacy.*} only consume the rest of their own line. Removing one
     * phrase can join the halves of another into a fresh match
     * ({@code "Learn Learn more more"}), so the pass is repeated until the
     * text stops changing, which makes the method idempotent. After the first
     * pass every productive pass strictly shortens the text.
     */
    public String cleanText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String current = text;
        while (true) {
            String next = current;
            for (Pattern pattern : boilerplate) {
                next = pattern.matcher(next).replaceAll("");
            }
            next = collapse(next);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    /**
     * Prepares text for a size-limited downstream consumer using the
     * configured cut markers and maximum length.
     */
    public String truncateForDownstream(String text) {
        return truncateForDownstream(text, downstreamMaxLength, cutMarkers);
    }

    /**
     * Cuts {@code text} at the earliest occurrence of any cut marker. If the
     * remaining text is still longer than {@code maxLen} characters it is
     * hard-truncated and {@link #TRUNCATION_MARKER} is appended. The result
     * is stripped of surrounding whitespace.
     *
     * @return the shortened text, {@code ""} for {@code null} or empty input
     */
    public static String truncateForDownstream(String text, int maxLen, Collection<String> cutMarkers) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int cut = text.length();
        if (cutMarkers != null) {
            for (String marker : cutMarkers) {
                if (marker == null || marker.isEmpty()) {
                    continue;
                }
                int index = text.indexOf(marker);
                if (index >= 0 && index < cut) {
                    cut = index;
                }
            }
        }
        String result = text.substring(0, cut);
        if (maxLen >= 0 && result.length() > maxLen) {
            result = result.substring(0, maxLen) + TRUNCATION_MARKER;
        }
        return result.strip();
    }

    // =====================================================================
    // URLs
    // =====================================================================

    /** {@code /reel/} URLs are reels, {@code /p/} URLs are photos. */
    public static ContentKind detectKind(String url) {
        if (url == null) {
            return ContentKind.UNKNOWN;
        }
        if (url.contains("/reel/")) {
            return ContentKind.REEL;
        }
        if (url.contains("/p/")) {
            return ContentKind.PHOTO;
        }
        return ContentKind.UNKNOWN;
    }

    /**
     * Extracts the item code from {@code .../p/<code>/} or
     * {@code .../reel/<code>/}.
     */
    public static Optional<String> extractShortcode(String url) {
        if (url == null) {
            return Optional.empty();
        }
        Matcher matcher = SHORTCODE.matcher(url);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    // =====================================================================
    // Record assembly
    // =====================================================================

    /**
     * Builds the canonical record for a resolved candidate.
     *
     * <ul>
     * <li>The caption is preferred over the full page body as record text.</li>
     * <li>Counters come from the dedicated fields first and fall back to
     * {@code "<n> likes"}/{@code "<n> comments"} phrases in the body. If only
     * one counter is readable the other counts as {@code 0}; if neither is,
     * the record carries no metrics at all.</li>
     * <li>Hashtags are read from the uncleaned caption so that boilerplate
     * removal cannot eat them.</li>
     * </ul>
     */
    public ContentRecord normalize(SourceEntity source, CandidateRef ref, RawFields raw) {
        String url = raw.url() != null ? raw.url() : ref.id();
        String textSource = raw.captionText() != null && !raw.captionText().isBlank()
                ? raw.captionText()
                : raw.bodyText();

        OptionalLong likes = parseCount(raw.likesText());
        if (likes.isEmpty()) {
            likes = extractLabeledCount(raw.bodyText(), "likes");
        }
        OptionalLong comments = parseCount(raw.commentsText());
        if (comments.isEmpty()) {
            comments = extractLabeledCount(raw.bodyText(), "comments");
        }
        Metrics metrics = likes.isEmpty() && comments.isEmpty()
                ? null
                : new Metrics(likes.orElse(0), comments.orElse(0));

        String audio = cleanText(raw.audioName());
        String timestampText = raw.timestampText() == null ? null : raw.timestampText().strip();

        return new ContentRecord(
                ref.id(),
                source,
                extractShortcode(url).orElse(null),
                parseTimestamp(timestampText).orElse(null),
                timestampText,
                cleanText(textSource),
                detectKind(url),
                metrics,
                extractHashtags(textSource),
                audio.isEmpty() ? null : audio);
    }
}
