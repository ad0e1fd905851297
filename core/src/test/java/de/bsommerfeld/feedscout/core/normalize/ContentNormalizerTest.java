package de.bsommerfeld.feedscout.core.normalize;

import de.bsommerfeld.feedscout.core.domain.CandidateRef;
import de.bsommerfeld.feedscout.core.domain.ContentKind;
import de.bsommerfeld.feedscout.core.domain.ContentRecord;
import de.bsommerfeld.feedscout.core.domain.RawFields;
import de.bsommerfeld.feedscout.core.domain.SourceEntity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ContentNormalizerTest {

    private final ContentNormalizer normalizer = new ContentNormalizer();

    // -- Counts --

    @Test
    void parseCount_shouldHandleThousandsSeparators() {
        assertEquals(OptionalLong.of(12_345), ContentNormalizer.parseCount("12,345"));
    }

    @Test
    void parseCount_shouldApplySuffixMultipliers() {
        assertEquals(OptionalLong.of(4_500_000), ContentNormalizer.parseCount("4.5M"));
        assertEquals(OptionalLong.of(12_000), ContentNormalizer.parseCount("12k"));
        assertEquals(OptionalLong.of(1_200), ContentNormalizer.parseCount("1.2K"));
    }

    @Test
    void parseCount_shouldTrimAndTruncate() {
        assertEquals(OptionalLong.of(7), ContentNormalizer.parseCount("  7 "));
        assertEquals(OptionalLong.of(1_234), ContentNormalizer.parseCount("1.2345k"));
    }

    @Test
    void parseCount_shouldDropCommaBeforeSuffix() {
        assertEquals(OptionalLong.of(123_000), ContentNormalizer.parseCount("12,3K"));
    }

    @Test
    void parseCount_shouldReturnEmptyForUnparsableInput() {
        assertTrue(ContentNormalizer.parseCount(null).isEmpty());
        assertTrue(ContentNormalizer.parseCount("").isEmpty());
        assertTrue(ContentNormalizer.parseCount("   ").isEmpty());
        assertTrue(ContentNormalizer.parseCount("abc").isEmpty());
        assertTrue(ContentNormalizer.parseCount("k").isEmpty());
        assertTrue(ContentNormalizer.parseCount("NaN").isEmpty());
        assertTrue(ContentNormalizer.parseCount("1e3").isEmpty());
    }

    @Test
    void parseCount_shouldReturnEmptyForOutOfRangeCounts() {
        assertTrue(ContentNormalizer.parseCount("99999999999999999999").isEmpty());
        assertTrue(ContentNormalizer.parseCount("9,999,999,999,999,999,999").isEmpty());
        assertTrue(ContentNormalizer.parseCount("99999999999999m").isEmpty());
        assertEquals(OptionalLong.of(9_000_000_000_000_000_000L),
                ContentNormalizer.parseCount("9000000000000000000"));
    }

    @Test
    void parseCount_shouldDistinguishZeroFromAbsent() {
        assertEquals(OptionalLong.of(0), ContentNormalizer.parseCount("0"));
    }

    @Test
    void extractLabeledCount_shouldFindCounterBeforeLabel() {
        assertEquals(OptionalLong.of(1_204),
                ContentNormalizer.extractLabeledCount("1,204 likes · 3 days ago", "likes"));
        assertEquals(OptionalLong.of(45),
                ContentNormalizer.extractLabeledCount("View all\n45 Comments", "comments"));
        assertTrue(ContentNormalizer.extractLabeledCount("no numbers here", "likes").isEmpty());
    }

    // -- Timestamps --

    @Test
    void parseTimestamp_shouldAcceptZuluAndOffsetForms() {
        Instant expected = Instant.parse("2024-05-01T10:00:00Z");
        assertEquals(Optional.of(expected), ContentNormalizer.parseTimestamp("2024-05-01T10:00:00Z"));
        assertEquals(Optional.of(expected), ContentNormalizer.parseTimestamp("2024-05-01T12:00:00+02:00"));
        assertEquals(Optional.of(Instant.parse("2024-05-01T10:00:00.500Z")),
                ContentNormalizer.parseTimestamp("2024-05-01T10:00:00.500Z"));
    }

    @Test
    void parseTimestamp_shouldReturnEmptyForInvalidText() {
        assertTrue(ContentNormalizer.parseTimestamp(null).isEmpty());
        assertTrue(ContentNormalizer.parseTimestamp("").isEmpty());
        assertTrue(ContentNormalizer.parseTimestamp("yesterday").isEmpty());
        assertTrue(ContentNormalizer.parseTimestamp("2024-05-01T10:00:00").isEmpty(),
                "Local date-times carry no zone and must be rejected");
    }

    // -- Text --

    @Test
    void extractHashtags_shouldLowercaseDeduplicateAndSort() {
        assertEquals(List.of("#café", "#pizza"),
                List.copyOf(ContentNormalizer.extractHashtags("Great #Pizza and #pizza at the #Café!")));
    }

    @Test
    void extractHashtags_shouldCollapseCaseVariants() {
        assertEquals(Set.of("#food"), ContentNormalizer.extractHashtags("Love this #Food #food #FOOD!"));
    }

    @Test
    void extractHashtags_shouldReturnEmptyForNull() {
        assertTrue(ContentNormalizer.extractHashtags(null).isEmpty());
    }

    @Test
    void cleanText_shouldRemoveBoilerplateAndCollapseWhitespace() {
        assertEquals("Great food", normalizer.cleanText("Great   food  Learn more\n\nSee translation"));
    }

    @Test
    void cleanText_shouldKeepLineScopedPatternsOnTheirLine() {
        assertEquals("Tasty Burger", normalizer.cleanText("Tasty\nMeta Verified\nBurger"));
    }

    @Test
    void cleanText_shouldBeIdempotent() {
        String input = "Learn Learn more more  best  tacos\nPrivacy policy\n";
        String once = normalizer.cleanText(input);
        assertEquals(once, normalizer.cleanText(once));
        assertEquals("best tacos", once);
    }

    @Test
    void cleanText_shouldReturnEmptyForNull() {
        assertEquals("", normalizer.cleanText(null));
        assertEquals("", normalizer.cleanText(""));
    }

    @Test
    void truncateForDownstream_shouldCutAtEarliestMarker() {
        String text = "Caption text Privacy Terms footer More posts from someone";
        assertEquals("Caption text",
                ContentNormalizer.truncateForDownstream(text, 4000, List.of("More posts from", "Privacy Terms")));
    }

    @Test
    void truncateForDownstream_shouldHardTruncateLongText() {
        assertEquals("abcde ... [TRUNCATED]",
                ContentNormalizer.truncateForDownstream("abcdefghij", 5, List.of()));
        assertEquals("short", ContentNormalizer.truncateForDownstream("short", 5, List.of()));
    }

    @Test
    void truncateForDownstream_shouldNeverThrowOnEmptyInput() {
        assertEquals("", ContentNormalizer.truncateForDownstream(null, 10, List.of("x")));
        assertEquals("", ContentNormalizer.truncateForDownstream("", 10, null));
        assertEquals("", normalizer.truncateForDownstream(null));
    }

    // -- URLs --

    @Test
    void detectKind_shouldClassifyByPath() {
        assertEquals(ContentKind.REEL, ContentNormalizer.detectKind("https://www.instagram.com/reel/Cx1/"));
        assertEquals(ContentKind.PHOTO, ContentNormalizer.detectKind("https://www.instagram.com/p/Cx2/"));
        assertEquals(ContentKind.UNKNOWN, ContentNormalizer.detectKind("https://example.com/about"));
        assertEquals(ContentKind.UNKNOWN, ContentNormalizer.detectKind(null));
    }

    @Test
    void extractShortcode_shouldReadCodeFromPath() {
        assertEquals(Optional.of("Cx1"), ContentNormalizer.extractShortcode("https://www.instagram.com/reel/Cx1/"));
        assertEquals(Optional.of("AbC_9"),
                ContentNormalizer.extractShortcode("https://www.instagram.com/p/AbC_9/?img_index=1"));
        assertTrue(ContentNormalizer.extractShortcode("https://www.instagram.com/someone/").isEmpty());
    }

    // -- Record assembly --

    @Test
    void normalize_shouldBuildCompleteRecord() {
        String url = "https://www.instagram.com/reel/abc/";
        RawFields raw = new RawFields(url, "2024-05-01T10:00:00Z",
                "page text with 45 comments", "Best #Burger in town Learn more", "Original audio by dj",
                "1.2K", null);

        ContentRecord record = normalizer.normalize(SourceEntity.handle("grill"), new CandidateRef(url, 2), raw);

        assertEquals(url, record.id());
        assertEquals("abc", record.shortcode());
        assertEquals(ContentKind.REEL, record.kind());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), record.timestamp());
        assertEquals("2024-05-01T10:00:00Z", record.timestampText());
        assertEquals("Best #Burger in town", record.rawText());
        assertEquals(List.of("#burger"), List.copyOf(record.hashtags()));
        assertEquals(1_200, record.metrics().likes());
        assertEquals(45, record.metrics().comments());
        assertEquals(1_200 + 3 * 45, record.engagementScore());
    }

    @Test
    void normalize_shouldLeaveAbsentValuesAbsent() {
        String url = "https://www.instagram.com/p/xyz/";
        RawFields raw = new RawFields(url, "not a date", "just text");

        ContentRecord record = normalizer.normalize(SourceEntity.handle("grill"), new CandidateRef(url, 1), raw);

        assertNull(record.timestamp());
        assertEquals("not a date", record.timestampText());
        assertNull(record.metrics());
        assertEquals(0, record.engagementScore());
        assertNull(record.audioName());
        assertEquals("just text", record.rawText());
    }

    @Test
    void normalize_shouldTreatMissingCounterAsZeroWhenOtherIsKnown() {
        String url = "https://www.instagram.com/p/xyz/";
        RawFields raw = new RawFields(url, null, "", null, null, null, "12");

        ContentRecord record = normalizer.normalize(SourceEntity.handle("grill"), new CandidateRef(url, 1), raw);

        assertNotNull(record.metrics());
        assertEquals(0, record.metrics().likes());
        assertEquals(36, record.engagementScore());
    }

    @Test
    void normalize_shouldTreatOutOfRangeCounterAsUnreadable() {
        String url = "https://www.instagram.com/p/xyz/";
        RawFields raw = new RawFields(url, null, "", null, null, "5", "9,999,999,999,999,999,999");

        ContentRecord record = normalizer.normalize(SourceEntity.handle("grill"), new CandidateRef(url, 1), raw);

        assertEquals(0, record.metrics().comments());
        assertEquals(5, record.engagementScore());
    }
}
