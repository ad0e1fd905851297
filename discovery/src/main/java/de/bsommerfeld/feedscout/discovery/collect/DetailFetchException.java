package de.bsommerfeld.feedscout.discovery.collect;

/**
 * Thrown by a {@link DetailFetcher} when the fields of a single item could not
 * be obtained. Only that item is dropped; the run continues.
 */
public class DetailFetchException extends Exception {

    public DetailFetchException(String message) {
        super(message);
    }

    public DetailFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
