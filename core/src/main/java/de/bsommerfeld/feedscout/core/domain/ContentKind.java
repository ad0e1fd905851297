package de.bsommerfeld.feedscout.core.domain;

/**
 * Format of a content item as far as it can be told from its URL.
 */
public enum ContentKind {
    PHOTO,
    REEL,
    UNKNOWN
}
