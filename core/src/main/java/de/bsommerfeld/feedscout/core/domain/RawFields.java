package de.bsommerfeld.feedscout.core.domain;

/**
 * Unprocessed field values extracted for a single content item by a detail
 * fetcher. Every field may be {@code null} when the source did not expose it.
 *
 * @param url           canonical URL of the item
 * @param timestampText publication time as published by the source
 *                      (ISO-8601, ideally in {@code Z} form)
 * @param bodyText      full visible text of the item page
 * @param captionText   caption or article text, preferred over the body
 * @param audioName     name of the attached audio track, if any
 * @param likesText     like counter as displayed (e.g. {@code "12.3K"})
 * @param commentsText  comment counter as displayed
 */
public record RawFields(
        String url,
        String timestampText,
        String bodyText,
        String captionText,
        String audioName,
        String likesText,
        String commentsText) {

    /**
     * Convenience constructor for items where only a timestamp and page text
     * were captured, which is the usual case for profile grids.
     */
    public RawFields(String url, String timestampText, String bodyText) {
        this(url, timestampText, bodyText, null, null, null, null);
    }
}
