package de.bsommerfeld.feedscout.discovery.collect;

/**
 * Explicit handle on whatever long-lived resource a source needs (a browser
 * context, an authenticated HTTP client). Opened before a run, closed after
 * it; nothing outlives the session.
 */
public interface CollectorSession extends AutoCloseable {

    Collector collector();

    DetailFetcher detailFetcher();

    @Override
    void close();
}
