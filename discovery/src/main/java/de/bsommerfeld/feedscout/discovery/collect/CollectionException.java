package de.bsommerfeld.feedscout.discovery.collect;

/**
 * Thrown by a {@link Collector} when a batch could not be obtained. The
 * pagination controller treats it as a round without new items.
 */
public class CollectionException extends Exception {

    public CollectionException(String message) {
        super(message);
    }

    public CollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
