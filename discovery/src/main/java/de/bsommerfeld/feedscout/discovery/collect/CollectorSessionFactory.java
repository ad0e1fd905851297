package de.bsommerfeld.feedscout.discovery.collect;

import de.bsommerfeld.feedscout.discovery.DiscoveryRequest;

/**
 * Opens a {@link CollectorSession} for one run. Bound in Guice: the
 * embedding application supplies the production implementation, TEST mode
 * uses {@link de.bsommerfeld.feedscout.discovery.synthetic.SyntheticSessionFactory}.
 */
public interface CollectorSessionFactory {

    /**
     * @param request the run about to start, including the hashtags resolved
     *                for category sources
     * @throws CollectionException if the session cannot be established (for
     *                             example a failed login)
     */
    CollectorSession open(DiscoveryRequest request) throws CollectionException;
}
